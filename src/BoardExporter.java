import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AI が盤面について知っていることをCSV形式で出力するユーティリティクラス
 *
 * セルの表記:
 * 数字 = 開いたセル (周囲の地雷数), M = 地雷確定, S = 安全確定(未着手), . = 不明
 */
public class BoardExporter {

    private static final Logger log = LoggerFactory.getLogger(BoardExporter.class);

    /**
     * 1セル分の表記
     */
    static String symbol(MinesweeperBoard board, MinesweeperAI ai, Cell cell) {
        if (ai.hasMadeMove(cell))
            return String.valueOf(board.nearbyMines(cell));
        if (ai.confirmedMines().contains(cell))
            return "M";
        if (ai.confirmedSafe().contains(cell))
            return "S";
        return ".";
    }

    /**
     * 知識マップをCSVファイルに出力する
     *
     * @param filename 出力ファイル名
     * @param board    正解盤面 (開いたセルの数字の参照用)
     * @param ai       知識を持つプレイヤー
     */
    public static void exportToCSV(String filename, MinesweeperBoard board, MinesweeperAI ai) {
        try (PrintWriter writer = new PrintWriter(new FileWriter(filename))) {
            // ヘッダー行: メタデータ
            writer.println("# Minesweeper Knowledge Map");
            writer.println("# height=" + board.getHeight() + ", width=" + board.getWidth());
            writer.println();

            writer.println("[Knowledge]");
            for (int row = 0; row < board.getHeight(); row++) {
                writer.println(formatRow(board, ai, row, ","));
            }

            log.info("Knowledge map exported to: {}", filename);
        } catch (IOException e) {
            log.error("Failed to export knowledge map to {}", filename, e);
        }
    }

    /**
     * コンソール表示用
     */
    public static String render(MinesweeperBoard board, MinesweeperAI ai) {
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < board.getHeight(); row++) {
            sb.append(' ').append(formatRow(board, ai, row, " ")).append('\n');
        }
        return sb.toString();
    }

    private static String formatRow(MinesweeperBoard board, MinesweeperAI ai, int row, String separator) {
        StringBuilder sb = new StringBuilder();
        for (int col = 0; col < board.getWidth(); col++) {
            if (col > 0)
                sb.append(separator);
            sb.append(symbol(board, ai, new Cell(row, col)));
        }
        return sb.toString();
    }
}
