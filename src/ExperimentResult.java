/**
 * 1ゲームの実験結果を保持するデータクラス
 */
public class ExperimentResult {
    // 識別情報
    public int height; // 盤面の高さ
    public int width; // 盤面の幅
    public int mineCount; // 地雷数
    public int gameId; // ゲームID

    // プレイ結果
    public boolean won; // 全地雷に旗を立てたか
    public boolean hitMine; // 地雷を開いて終わったか
    public int moves; // 開いたセル数
    public int safeMoves; // 安全確定セルから選んだ手の数
    public int randomMoves; // 推論できずランダムに選んだ手の数

    // 終了時の知識
    public int knownMines; // 地雷確定セル数
    public int knownSafes; // 安全確定セル数 (着手済みを含む)
    public int sentences; // 残っている文の数

    /**
     * CSVヘッダー行を生成
     */
    public static String getCsvHeader() {
        return "height,width,mine_count,game_id,won,hit_mine,moves,safe_moves,random_moves,"
                + "known_mines,known_safes,sentences";
    }

    /**
     * CSVデータ行を生成
     */
    public String toCsvRow() {
        StringBuilder sb = new StringBuilder();
        sb.append(height).append(",");
        sb.append(width).append(",");
        sb.append(mineCount).append(",");
        sb.append(gameId).append(",");
        sb.append(won).append(",");
        sb.append(hitMine).append(",");
        sb.append(moves).append(",");
        sb.append(safeMoves).append(",");
        sb.append(randomMoves).append(",");
        sb.append(knownMines).append(",");
        sb.append(knownSafes).append(",");
        sb.append(sentences);
        return sb.toString();
    }
}
