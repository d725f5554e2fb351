import java.util.ArrayList;
import java.util.List;

/**
 * 盤面上の1セルを表す座標 (row, col).
 * 不変(Immutable)オブジェクトとして扱う.
 */
public final class Cell implements Comparable<Cell> {
    private final int row;
    private final int col;

    public Cell(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    /** 盤面内チェック */
    public boolean inBoard(int height, int width) {
        return 0 <= row && row < height && 0 <= col && col < width;
    }

    /** 周囲8マスのうち盤面内のセルを返す (自身は含まない) */
    public List<Cell> neighbors(int height, int width) {
        List<Cell> res = new ArrayList<>();
        for (int dr = -1; dr <= 1; dr++) {
            for (int dc = -1; dc <= 1; dc++) {
                if (dr == 0 && dc == 0)
                    continue;

                Cell nb = new Cell(row + dr, col + dc);
                if (nb.inBoard(height, width)) {
                    res.add(nb);
                }
            }
        }
        return res;
    }

    // 行優先で比較 (表示・CSV出力の並び順用)
    @Override
    public int compareTo(Cell other) {
        if (row != other.row)
            return Integer.compare(row, other.row);
        return Integer.compare(col, other.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Cell that = (Cell) o;
        return row == that.row && col == that.col;
    }

    @Override
    public int hashCode() {
        return 31 * row + col;
    }

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}
