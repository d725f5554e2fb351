import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * ランダムな地雷配置を生成
 */
public class PuzzleGenerator {

    /**
     * height×width の盤面に mines 個の地雷をランダム配置する
     */
    public static Set<Cell> generateMines(int height, int width, int mines, Random random) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Board size must be positive: " + height + "x" + width);
        }
        if (mines < 0 || mines > height * width) {
            throw new IllegalArgumentException("Cannot place " + mines + " mines on " + height + "x" + width);
        }

        // 1. セル一覧を作成
        List<Cell> cells = new ArrayList<>();
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                cells.add(new Cell(r, c));
            }
        }

        // 2. シャッフル → 先頭 mines 個を地雷セルに
        Collections.shuffle(cells, random);
        return new HashSet<>(cells.subList(0, mines));
    }

    /**
     * 地雷配置をテキストで表す (X = 地雷)
     */
    public static String render(Set<Cell> mines, int height, int width) {
        StringBuilder sb = new StringBuilder();
        String border = "--".repeat(width) + "-\n";
        for (int r = 0; r < height; r++) {
            sb.append(border);
            for (int c = 0; c < width; c++) {
                sb.append(mines.contains(new Cell(r, c)) ? "|X" : "| ");
            }
            sb.append("|\n");
        }
        sb.append(border);
        return sb.toString();
    }
}
