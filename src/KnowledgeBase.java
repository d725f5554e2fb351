import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 1ゲーム分の知識ベース.
 * 既知の文 (Sentence) と, 着手済み / 安全確定 / 地雷確定 のセル集合を保持する.
 *
 * 不変条件:
 * - safes と mines は交わらない
 * - 生きている文は確定済みセルを含まない
 * - 生きている文は空でなく, 同値な文は2つ存在しない
 */
public class KnowledgeBase {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBase.class);

    // 文のプール (ID → Sentence). 挿入順を保持する
    private final Map<Integer, Sentence> sentences = new LinkedHashMap<>();
    private int sentenceIdCounter = 0;

    private final Set<Cell> movesMade = new HashSet<>();
    private final Set<Cell> safes = new HashSet<>();
    private final Set<Cell> mines = new HashSet<>();

    /** 着手済みとして記録する */
    public void recordMove(Cell cell) {
        movesMade.add(cell);
    }

    /**
     * cellを地雷として確定し, 全ての文に反映する.
     *
     * @return 新たに確定した場合 true
     */
    public boolean markMine(Cell cell) {
        if (safes.contains(cell)) {
            throw new InconsistentKnowledgeException("Cell " + cell + " is already known to be safe");
        }
        boolean added = mines.add(cell);
        for (Sentence s : snapshot()) {
            s.markMine(cell);
            requireConsistent(s);
        }
        return added;
    }

    /**
     * cellを安全として確定し, 全ての文に反映する.
     *
     * @return 新たに確定した場合 true
     */
    public boolean markSafe(Cell cell) {
        if (mines.contains(cell)) {
            throw new InconsistentKnowledgeException("Cell " + cell + " is already known to be a mine");
        }
        boolean added = safes.add(cell);
        for (Sentence s : snapshot()) {
            s.markSafe(cell);
            requireConsistent(s);
        }
        return added;
    }

    /**
     * 文のコピーを追加する. 確定済みセルは先に取り除く.
     * 空の文, 既に同値の文がある場合は捨てる.
     * 引数の文は変更しない.
     *
     * @return 追加した場合 true
     */
    public boolean addSentence(Sentence sentence) {
        Sentence copy = new Sentence(sentence.cells(), sentence.count());
        reduce(copy);
        requireConsistent(copy);
        if (copy.isEmpty() || contains(copy)) {
            return false;
        }
        int id = sentenceIdCounter++;
        sentences.put(id, copy);
        log.debug("Sentence #{} added: {}", id, copy);
        return true;
    }

    /** 確定済みのセルを文から取り除く (地雷なら地雷数も減らす) */
    public void reduce(Sentence sentence) {
        for (Cell cell : new ArrayList<>(sentence.cells())) {
            if (mines.contains(cell)) {
                sentence.markMine(cell);
            } else if (safes.contains(cell)) {
                sentence.markSafe(cell);
            }
        }
    }

    public boolean contains(Sentence sentence) {
        return sentences.containsValue(sentence);
    }

    /**
     * 空になった文と重複した文を削除する.
     * 確定セルの反映で文が変化するので, mark の後には毎回呼ぶこと.
     *
     * @return 削除した文の数
     */
    public int prune() {
        int removed = 0;
        List<Sentence> kept = new ArrayList<>();
        Iterator<Sentence> it = sentences.values().iterator();
        while (it.hasNext()) {
            Sentence s = it.next();
            if (s.isEmpty() || kept.contains(s)) {
                it.remove();
                removed++;
            } else {
                kept.add(s);
            }
        }
        return removed;
    }

    private static void requireConsistent(Sentence s) {
        if (!s.isConsistent()) {
            throw new InconsistentKnowledgeException("Contradictory sentence: " + s);
        }
    }

    // 反復中の変更を避けるためのコピー
    private List<Sentence> snapshot() {
        return new ArrayList<>(sentences.values());
    }

    // 推論エンジン用. 保持している文そのもの (書き換えは mark 経由のみ)
    List<Sentence> live() {
        return snapshot();
    }

    // --- 参照用 ---

    /** 保持している文のコピー */
    public List<Sentence> sentences() {
        List<Sentence> copies = new ArrayList<>();
        for (Sentence s : sentences.values()) {
            copies.add(new Sentence(s.cells(), s.count()));
        }
        return Collections.unmodifiableList(copies);
    }

    public int sentenceCount() {
        return sentences.size();
    }

    public Set<Cell> movesMade() {
        return Collections.unmodifiableSet(movesMade);
    }

    public Set<Cell> safes() {
        return Collections.unmodifiableSet(safes);
    }

    public Set<Cell> mines() {
        return Collections.unmodifiableSet(mines);
    }
}
