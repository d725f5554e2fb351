import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AI に複数ゲームをプレイさせる実験のバッチ実行クラス
 *
 * 使い方: ExperimentRunner [height width mines games [seed]]
 */
public class ExperimentRunner {

    private static final Logger log = LoggerFactory.getLogger(ExperimentRunner.class);

    // ===========================================
    // 実験パラメータ (引数で上書き可能)
    // ===========================================
    private static final int HEIGHT = 8; // 盤面の高さ
    private static final int WIDTH = 8; // 盤面の幅
    private static final int MINES = 8; // 地雷数
    private static final int GAMES = 100; // ゲーム数

    // 出力ディレクトリ
    private static final String OUTPUT_DIR = "experiment_results/";

    // ===========================================
    // メイン処理
    // ===========================================
    public static void main(String[] args) {
        int height = HEIGHT;
        int width = WIDTH;
        int mines = MINES;
        int games = GAMES;
        Random random = new Random();

        if (args.length >= 4) {
            height = Integer.parseInt(args[0]);
            width = Integer.parseInt(args[1]);
            mines = Integer.parseInt(args[2]);
            games = Integer.parseInt(args[3]);
        }
        if (args.length >= 5) {
            random = new Random(Long.parseLong(args[4]));
        }

        System.out.println("=== 実験開始 ===");
        System.out.println("盤面サイズ: " + height + "x" + width);
        System.out.println("地雷数: " + mines);
        System.out.println("ゲーム数: " + games);
        System.out.println();

        new File(OUTPUT_DIR).mkdirs();

        List<ExperimentResult> results = runExperiment(height, width, mines, games, random);

        saveSummaryCSV(OUTPUT_DIR + "summary.csv", results);

        long wins = results.stream().filter(r -> r.won).count();
        System.out.println("\n=== 実験完了 ===");
        System.out.printf("勝率: %d/%d (%.1f%%)%n", wins, results.size(), 100.0 * wins / Math.max(1, results.size()));
        System.out.println("出力先: " + OUTPUT_DIR);
    }

    /**
     * 同じ条件で games 回プレイする
     */
    public static List<ExperimentResult> runExperiment(int height, int width, int mines, int games, Random random) {
        List<ExperimentResult> results = new ArrayList<>();
        for (int gameId = 1; gameId <= games; gameId++) {
            MinesweeperBoard board = new MinesweeperBoard(height, width, mines, random);
            MinesweeperAI ai = new MinesweeperAI(height, width, random);

            ExperimentResult result = playGame(board, ai, gameId);
            results.add(result);

            log.debug("Game {}: won={}, moves={}, random={}", gameId, result.won, result.moves, result.randomMoves);
        }
        return results;
    }

    // ===========================================
    // 1ゲームの実行
    // ===========================================

    /**
     * 勝つか, 地雷を開くか, 打つ手が無くなるまでプレイする.
     * 安全確定セルがあればそこを, 無ければランダムに開く.
     */
    public static ExperimentResult playGame(MinesweeperBoard board, MinesweeperAI ai, int gameId) {
        ExperimentResult result = new ExperimentResult();
        result.height = board.getHeight();
        result.width = board.getWidth();
        result.mineCount = board.getMineCount();
        result.gameId = gameId;

        while (!board.won()) {
            Cell move = ai.makeSafeMove();
            if (move != null) {
                result.safeMoves++;
            } else {
                move = ai.makeRandomMove();
                if (move == null) {
                    break; // 打つ手なし
                }
                result.randomMoves++;
            }
            result.moves++;

            if (board.isMine(move)) {
                result.hitMine = true;
                break;
            }

            ai.observe(move, board.nearbyMines(move));
            board.flag(ai.confirmedMines());
        }

        result.won = board.won();
        result.knownMines = ai.confirmedMines().size();
        result.knownSafes = ai.knowledgeBase().safes().size();
        result.sentences = ai.knowledgeBase().sentenceCount();
        return result;
    }

    // ===========================================
    // ファイル出力
    // ===========================================

    /**
     * サマリーCSVを出力
     */
    public static void saveSummaryCSV(String filename, List<ExperimentResult> results) {
        try (PrintWriter writer = new PrintWriter(new FileWriter(filename))) {
            writer.println(ExperimentResult.getCsvHeader());
            for (ExperimentResult r : results) {
                writer.println(r.toCsvRow());
            }
            log.info("Summary CSV saved: {}", filename);
        } catch (IOException e) {
            log.error("Failed to save summary CSV to {}", filename, e);
        }
    }
}
