import java.util.Random;

public class Main {
    public static void main(String[] args) {
        int height = 8;
        int width = 8;
        int mines = 8;
        Random random = args.length > 0 ? new Random(Long.parseLong(args[0])) : new Random();

        MinesweeperBoard board = new MinesweeperBoard(height, width, mines, random);
        MinesweeperAI ai = new MinesweeperAI(height, width, random);

        System.out.println("===== 地雷配置 (正解) =====");
        System.out.print(board.render());

        int turn = 0;
        while (!board.won()) {
            turn++;
            Cell move = ai.makeSafeMove();
            String kind = "安全確定";
            if (move == null) {
                move = ai.makeRandomMove();
                kind = "ランダム";
                if (move == null) {
                    System.out.println("\n打つ手がありません.");
                    break;
                }
            }

            if (board.isMine(move)) {
                System.out.println("\nTurn " + turn + ": " + move + " (" + kind + ") → 地雷!");
                break;
            }

            ai.observe(move, board.nearbyMines(move));
            board.flag(ai.confirmedMines());

            System.out.println("\nTurn " + turn + ": " + move + " (" + kind + ")");
            System.out.print(BoardExporter.render(board, ai));
        }

        System.out.println(board.won() ? "\n✅ 全ての地雷を特定しました!" : "\n❌ ゲームオーバー");

        // 推論過程と最終的な知識をCSVで残す
        ai.exportLogToCSV("analysis_log.csv");
        BoardExporter.exportToCSV("knowledge_map.csv", board, ai);
    }
}
