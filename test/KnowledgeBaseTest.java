import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KnowledgeBaseTest {

    private static final Cell A = new Cell(0, 0);
    private static final Cell B = new Cell(0, 1);
    private static final Cell C = new Cell(0, 2);

    @Test
    void shouldApplyMineToEverySentence() {
        KnowledgeBase kb = new KnowledgeBase();
        kb.addSentence(new Sentence(Set.of(A, B), 1));
        kb.addSentence(new Sentence(Set.of(A, B, C), 2));

        assertTrue(kb.markMine(A));

        assertEquals(Set.of(A), kb.mines());
        assertEquals(List.of(new Sentence(Set.of(B), 0), new Sentence(Set.of(B, C), 1)), kb.sentences());
    }

    @Test
    void shouldApplySafeToEverySentence() {
        KnowledgeBase kb = new KnowledgeBase();
        kb.addSentence(new Sentence(Set.of(A, B), 1));
        kb.addSentence(new Sentence(Set.of(B, C), 1));

        assertTrue(kb.markSafe(B));

        assertEquals(Set.of(B), kb.safes());
        assertEquals(List.of(new Sentence(Set.of(A), 1), new Sentence(Set.of(C), 1)), kb.sentences());
    }

    @Test
    void shouldBeIdempotentWhenMarkingTwice() {
        KnowledgeBase kb = new KnowledgeBase();
        kb.addSentence(new Sentence(Set.of(A, B, C), 2));

        kb.markMine(A);
        kb.markSafe(C);
        List<Sentence> once = kb.sentences();

        assertFalse(kb.markMine(A));
        assertFalse(kb.markSafe(C));

        assertEquals(once, kb.sentences());
        assertEquals(Set.of(A), kb.mines());
        assertEquals(Set.of(C), kb.safes());
    }

    @Test
    void shouldRejectDuplicateAndEmptySentences() {
        KnowledgeBase kb = new KnowledgeBase();

        assertTrue(kb.addSentence(new Sentence(Set.of(A, B), 1)));
        assertFalse(kb.addSentence(new Sentence(Set.of(B, A), 1)));
        assertFalse(kb.addSentence(new Sentence(Set.of(), 0)));

        assertEquals(1, kb.sentenceCount());
    }

    @Test
    void shouldStripResolvedCellsBeforeAdding() {
        KnowledgeBase kb = new KnowledgeBase();
        kb.markMine(A);
        kb.markSafe(B);

        assertTrue(kb.addSentence(new Sentence(Set.of(A, B, C), 2)));

        assertEquals(List.of(new Sentence(Set.of(C), 1)), kb.sentences());
    }

    @Test
    void shouldRejectSentenceThatBecomesEmptyOnceReduced() {
        KnowledgeBase kb = new KnowledgeBase();
        kb.markSafe(A);
        kb.markMine(B);

        assertFalse(kb.addSentence(new Sentence(Set.of(A, B), 1)));
        assertEquals(0, kb.sentenceCount());
    }

    @Test
    void shouldPruneEmptyAndDuplicateSentences() {
        KnowledgeBase kb = new KnowledgeBase();
        kb.addSentence(new Sentence(Set.of(A, B), 1));
        kb.addSentence(new Sentence(Set.of(A, C), 1));
        kb.addSentence(new Sentence(Set.of(C), 0));

        kb.markSafe(B);
        kb.markSafe(C);

        assertEquals(3, kb.sentenceCount());
        assertEquals(2, kb.prune());
        assertEquals(List.of(new Sentence(Set.of(A), 1)), kb.sentences());
    }

    @Test
    void shouldRecordMoves() {
        KnowledgeBase kb = new KnowledgeBase();
        kb.recordMove(A);
        kb.recordMove(A);

        assertEquals(Set.of(A), kb.movesMade());
    }

    @Test
    void shouldRefuseCellThatIsBothSafeAndMine() {
        KnowledgeBase kb = new KnowledgeBase();
        kb.markSafe(A);

        assertThrows(InconsistentKnowledgeException.class, () -> kb.markMine(A));
    }

    @Test
    void shouldDetectCountLeavingValidRange() {
        KnowledgeBase kb = new KnowledgeBase();
        kb.addSentence(new Sentence(Set.of(A, B), 2));

        assertThrows(InconsistentKnowledgeException.class, () -> kb.markSafe(A));
    }

    @Test
    void shouldRejectContradictorySentence() {
        KnowledgeBase kb = new KnowledgeBase();

        assertThrows(InconsistentKnowledgeException.class,
                () -> kb.addSentence(new Sentence(Set.of(A, B), 3)));
        assertThrows(InconsistentKnowledgeException.class,
                () -> kb.addSentence(new Sentence(Set.of(A, B), -1)));
    }

    @Test
    void shouldKeepOwnCopyOfAddedSentence() {
        KnowledgeBase kb = new KnowledgeBase();
        Sentence given = new Sentence(Set.of(A, B), 1);

        kb.addSentence(given);
        kb.markMine(A);

        assertEquals(new Sentence(Set.of(A, B), 1), given);
        assertEquals(List.of(new Sentence(Set.of(B), 0)), kb.sentences());
    }

    @Test
    void shouldLeaveRejectedSentenceUntouched() {
        KnowledgeBase kb = new KnowledgeBase();
        kb.markSafe(A);
        kb.markMine(B);
        Sentence given = new Sentence(Set.of(A, B), 1);

        assertFalse(kb.addSentence(given));

        assertEquals(new Sentence(Set.of(A, B), 1), given);
    }

    @Test
    void shouldNotExposeStoredSentences() {
        KnowledgeBase kb = new KnowledgeBase();
        kb.addSentence(new Sentence(Set.of(A, B), 1));
        kb.addSentence(new Sentence(Set.of(A, C), 1));

        List<Sentence> view = kb.sentences();
        view.get(0).markSafe(B);
        view.get(1).markSafe(C);

        assertEquals(0, kb.prune());
        assertEquals(2, kb.sentenceCount());
        assertEquals(List.of(new Sentence(Set.of(A, B), 1), new Sentence(Set.of(A, C), 1)), kb.sentences());
        assertTrue(kb.safes().isEmpty());
    }
}
