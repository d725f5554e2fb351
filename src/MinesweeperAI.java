import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * マインスイーパーのプレイヤー (推論エンジン).
 *
 * 開いたセルの数字を受け取るたびに知識ベースを更新し,
 * 推論できることが無くなるまで (不動点まで) 以下を繰り返す:
 * 1. 地雷数 == セル数 の文 → 全て地雷, 地雷数 == 0 の文 → 全て安全
 * 2. 包含判定: B ⊆ A なら (A - B) = A.count - B.count
 *
 * 推測はしない. 確率計算や全解探索も行わない.
 */
public class MinesweeperAI {

    private static final Logger log = LoggerFactory.getLogger(MinesweeperAI.class);

    private final int height;
    private final int width;
    private final Random random;

    private final KnowledgeBase knowledge;
    private final AnalysisLogger analysisLogger;

    public MinesweeperAI(int height, int width) {
        this(height, width, new Random());
    }

    public MinesweeperAI(int height, int width, Random random) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Board size must be positive: " + height + "x" + width);
        }
        this.height = height;
        this.width = width;
        this.random = random;
        this.knowledge = new KnowledgeBase();
        this.analysisLogger = new AnalysisLogger();
    }

    /**
     * 安全なセルを開いた結果, 周囲の地雷数が count だったことを知識に加える.
     *
     * 矛盾する観測値が与えられた場合は {@link InconsistentKnowledgeException} を投げる.
     * その後このインスタンスの知識は信用できない.
     */
    public void observe(Cell cell, int count) {
        if (!cell.inBoard(height, width)) {
            throw new IllegalArgumentException("Cell out of board: " + cell);
        }
        analysisLogger.startNewRound();

        // 1. 着手済み & 安全として記録
        knowledge.recordMove(cell);
        knowledge.markSafe(cell);
        knowledge.prune();

        // 2. 周囲セルから新しい文を作る
        Sentence observed = buildSentence(cell, count);
        log.debug("Observed {} = {} -> {}", cell, count, observed);

        propagate(observed);

        log.debug("Knowledge after {}: {} sentences, {} mines, {} safes",
                cell, knowledge.sentenceCount(), knowledge.mines().size(), knowledge.safes().size());
    }

    /**
     * 文を1つ知識に加え, 不動点まで推論を進める.
     */
    void propagate(Sentence sentence) {
        // 3. 未処理の文のキュー
        Deque<Sentence> pending = new ArrayDeque<>();
        pending.push(sentence);

        // 4. 新しい文が出なくなるまで繰り返す
        while (!pending.isEmpty()) {
            Sentence next = pending.pop();
            if (!knowledge.addSentence(next)) {
                continue; // 既知 or 空 → 新情報なし
            }

            inferSubsets(pending);
            saturate(pending);
        }
    }

    /**
     * 周囲8マスから文を作る.
     * 確定地雷は数字から差し引き, 確定安全セルは除外する.
     */
    private Sentence buildSentence(Cell cell, int count) {
        Set<Cell> unknown = new HashSet<>();
        int knownMineNeighbors = 0;

        for (Cell nb : cell.neighbors(height, width)) {
            if (knowledge.mines().contains(nb)) {
                knownMineNeighbors++;
            } else if (!knowledge.safes().contains(nb)) {
                unknown.add(nb);
            }
        }
        return new Sentence(unknown, count - knownMineNeighbors);
    }

    /**
     * 包含判定による派生.
     * 異なる2文 A, B (地雷数 > 0) で B ⊆ A のとき (A - B) を候補として pending に積む.
     */
    private void inferSubsets(Deque<Sentence> pending) {
        List<Sentence> pool = knowledge.live();

        for (Sentence a : pool) {
            for (Sentence b : pool) {
                if (a == b || a.count() == 0 || b.count() == 0)
                    continue;
                if (!b.isSubsetOf(a))
                    continue;

                Sentence diff = a.subtract(b);
                if (diff.isEmpty()) {
                    // 同じセル集合で地雷数が違う
                    if (diff.count() != 0) {
                        throw new InconsistentKnowledgeException(
                                "Sentences disagree on the same cells: " + a + " / " + b);
                    }
                    continue;
                }
                if (!pending.contains(diff) && !knowledge.contains(diff)) {
                    log.debug("Derived {} from {} - {}", diff, a, b);
                    pending.push(diff);
                }
            }
        }
    }

    /**
     * 確定できるセルを全て確定させる.
     * 新たな確定があれば包含判定をやり直し, 確定が出なくなるまで続ける.
     */
    private void saturate(Deque<Sentence> pending) {
        while (true) {
            int numMines = knowledge.mines().size();
            int numSafes = knowledge.safes().size();

            for (Sentence s : knowledge.live()) {
                // 同じ反復内の mark で s 自体が変化していることがある
                String source = s.toString();
                s.knownMines().ifPresent(cells -> {
                    for (Cell c : cells) {
                        if (knowledge.markMine(c)) {
                            analysisLogger.logStep(c, AnalysisLogger.MINE, source);
                            log.debug("Mine confirmed {} by {}", c, source);
                        }
                    }
                });
                s.knownSafes().ifPresent(cells -> {
                    for (Cell c : cells) {
                        if (knowledge.markSafe(c)) {
                            analysisLogger.logStep(c, AnalysisLogger.SAFE, source);
                            log.debug("Safe confirmed {} by {}", c, source);
                        }
                    }
                });
            }

            knowledge.prune();
            prunePending(pending);

            if (knowledge.mines().size() > numMines || knowledge.safes().size() > numSafes) {
                inferSubsets(pending);
            } else {
                break;
            }
        }
    }

    /**
     * 未処理キューの文にも確定セルを反映し, 空の文と重複を取り除く.
     */
    private void prunePending(Deque<Sentence> pending) {
        List<Sentence> kept = new ArrayList<>();
        for (Sentence s : pending) {
            knowledge.reduce(s);
            if (!s.isEmpty() && !kept.contains(s)) {
                kept.add(s);
            }
        }
        pending.clear();
        pending.addAll(kept);
    }

    // =========================================================================
    // 参照用
    // =========================================================================

    /** 安全と分かっていて, まだ開いていないセル */
    public Set<Cell> confirmedSafe() {
        Set<Cell> available = new HashSet<>(knowledge.safes());
        available.removeAll(knowledge.movesMade());
        return Collections.unmodifiableSet(available);
    }

    public Set<Cell> confirmedMines() {
        return knowledge.mines();
    }

    public boolean hasMadeMove(Cell cell) {
        return knowledge.movesMade().contains(cell);
    }

    public KnowledgeBase knowledgeBase() {
        return knowledge;
    }

    public AnalysisLogger getAnalysisLogger() {
        return analysisLogger;
    }

    /**
     * 解析ログをCSVに出力する
     */
    public void exportLogToCSV(String filename) {
        analysisLogger.exportToCSV(filename);
    }

    // =========================================================================
    // 着手の選択
    // =========================================================================

    /**
     * 安全と確定しているセルから1つ選ぶ. 無ければ null.
     * 知識ベースは変更しない.
     */
    public @Nullable Cell makeSafeMove() {
        List<Cell> available = new ArrayList<>(confirmedSafe());
        if (available.isEmpty()) {
            return null;
        }
        Collections.sort(available); // HashSet の順序に依存させない
        return available.get(random.nextInt(available.size()));
    }

    /**
     * 未着手かつ地雷確定でないセルからランダムに選ぶ. 無ければ null.
     */
    public @Nullable Cell makeRandomMove() {
        List<Cell> available = new ArrayList<>();
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                Cell cell = new Cell(r, c);
                if (!hasMadeMove(cell) && !knowledge.mines().contains(cell)) {
                    available.add(cell);
                }
            }
        }
        if (available.isEmpty()) {
            return null;
        }
        return available.get(random.nextInt(available.size()));
    }
}
