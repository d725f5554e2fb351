import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 盤面についての論理的な「文」.
 * セル集合と, その中に含まれる地雷の数の組で表す.
 * 観測から作られたものも部分集合推論で派生したものも統一して扱う.
 *
 * 確定セルを除去するたびに内容が変わる可変オブジェクトなので,
 * HashSet のキーには使わないこと (KnowledgeBase はIDで管理する).
 */
public class Sentence {
    private final Set<Cell> cells; // 対象となる未確定セルの集合
    private int count; // cellsの中に含まれる地雷の総数

    public Sentence(Set<Cell> cells, int count) {
        this.cells = new HashSet<>(cells);
        this.count = count;
    }

    public Set<Cell> cells() {
        return Collections.unmodifiableSet(cells);
    }

    public int count() {
        return count;
    }

    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    public boolean contains(Cell cell) {
        return cells.contains(cell);
    }

    /** 0 <= count <= |cells| を満たすか */
    public boolean isConsistent() {
        return 0 <= count && count <= cells.size();
    }

    /**
     * 全セルが地雷と確定できる場合 (count == |cells|) にそのセル集合を返す.
     * 判定できない場合は空.
     */
    public Optional<Set<Cell>> knownMines() {
        if (count == cells.size()) {
            return Optional.of(Set.copyOf(cells));
        }
        return Optional.empty();
    }

    /**
     * 全セルが安全と確定できる場合 (count == 0) にそのセル集合を返す.
     */
    public Optional<Set<Cell>> knownSafes() {
        if (count == 0) {
            return Optional.of(Set.copyOf(cells));
        }
        return Optional.empty();
    }

    /** cellが地雷と確定した: 集合から除き, 地雷数を1減らす */
    public void markMine(Cell cell) {
        if (cells.remove(cell)) {
            count--;
        }
    }

    /** cellが安全と確定した: 集合から除く (地雷数はそのまま) */
    public void markSafe(Cell cell) {
        cells.remove(cell);
    }

    public boolean isSubsetOf(Sentence other) {
        return other.cells.containsAll(this.cells);
    }

    /**
     * 包含判定による派生.
     * other が this の部分集合のとき, 残りのセルに残りの地雷がある.
     * 例: {a,b,c}=2 - {a,b}=1 → {c}=1
     */
    public Sentence subtract(Sentence other) {
        Set<Cell> newCells = new HashSet<>(this.cells);
        newCells.removeAll(other.cells);
        return new Sentence(newCells, this.count - other.count);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Sentence that = (Sentence) o;
        return count == that.count && cells.equals(that.cells);
    }

    @Override
    public int hashCode() {
        int result = cells.hashCode();
        result = 31 * result + count;
        return result;
    }

    @Override
    public String toString() {
        String cellStr = cells.stream()
                .sorted()
                .map(Cell::toString)
                .collect(Collectors.joining(", ", "{", "}"));
        return String.format("%s = %d", cellStr, count);
    }
}
