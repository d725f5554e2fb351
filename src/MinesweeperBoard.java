import java.util.Collections;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

/**
 * マインスイーパーの盤面 (正解を知っている側).
 * AI には {@link #nearbyMines(Cell)} の結果だけを渡す.
 */
public class MinesweeperBoard {

    private final int height;
    private final int width;
    private final Set<Cell> mines;
    private final Set<Cell> minesFound = new HashSet<>(); // プレイヤーが旗を立てたセル

    public MinesweeperBoard(int height, int width, int mineCount, Random random) {
        this(height, width, PuzzleGenerator.generateMines(height, width, mineCount, random));
    }

    /** 地雷配置を指定して作る (テスト・再現用) */
    public MinesweeperBoard(int height, int width, Set<Cell> mines) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Board size must be positive: " + height + "x" + width);
        }
        for (Cell m : mines) {
            if (!m.inBoard(height, width)) {
                throw new IllegalArgumentException("Mine out of board: " + m);
            }
        }
        this.height = height;
        this.width = width;
        this.mines = Set.copyOf(mines);
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public int getMineCount() {
        return mines.size();
    }

    public Set<Cell> getMines() {
        return mines;
    }

    public boolean isMine(Cell cell) {
        return mines.contains(cell);
    }

    /** 周囲8マスの地雷数 (自身は含まない) */
    public int nearbyMines(Cell cell) {
        int count = 0;
        for (Cell nb : cell.neighbors(height, width)) {
            if (mines.contains(nb))
                count++;
        }
        return count;
    }

    /** 旗を立てる (AIが地雷と確定したセル) */
    public void flag(Set<Cell> cells) {
        minesFound.addAll(cells);
    }

    public Set<Cell> getMinesFound() {
        return Collections.unmodifiableSet(minesFound);
    }

    /** 全ての地雷に旗が立っていれば勝ち */
    public boolean won() {
        return minesFound.equals(mines);
    }

    public String render() {
        return PuzzleGenerator.render(mines, height, width);
    }
}
