import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExperimentRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldFinishEveryGame() {
        List<ExperimentResult> results = ExperimentRunner.runExperiment(8, 8, 8, 50, new Random(2024));

        assertEquals(50, results.size());
        for (ExperimentResult r : results) {
            // 未確定の地雷が残る限りランダム手は尽きない
            assertTrue(r.won != r.hitMine);
            assertEquals(r.moves, r.safeMoves + r.randomMoves);
            if (r.won) {
                assertEquals(8, r.knownMines);
            }
        }
    }

    @Test
    void shouldWinBoardWithoutGuessingAfterFirstSafeZero() {
        // 地雷は右下だけ. (0,0) から開けば推論だけで解ける
        MinesweeperBoard board = new MinesweeperBoard(3, 3, Set.of(new Cell(2, 2)));
        MinesweeperAI ai = new MinesweeperAI(3, 3, new Random(0));
        ai.observe(new Cell(0, 0), board.nearbyMines(new Cell(0, 0)));

        ExperimentResult result = ExperimentRunner.playGame(board, ai, 1);

        assertTrue(result.won);
        assertFalse(result.hitMine);
        assertEquals(0, result.randomMoves);
        assertEquals(1, result.knownMines);
    }

    @Test
    void shouldWriteSummaryCsv() throws IOException {
        ExperimentResult r = new ExperimentResult();
        r.height = 3;
        r.width = 3;
        r.mineCount = 1;
        r.gameId = 1;
        r.won = true;
        r.moves = 8;
        r.safeMoves = 7;
        r.randomMoves = 1;
        r.knownMines = 1;
        r.knownSafes = 8;
        Path file = tempDir.resolve("summary.csv");

        ExperimentRunner.saveSummaryCSV(file.toString(), List.of(r));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(ExperimentResult.getCsvHeader(), lines.get(0));
        assertEquals("3,3,1,1,true,false,8,7,1,1,8,0", lines.get(1));
    }

    @Test
    void shouldExportAnalysisLogAndKnowledgeMap() throws IOException {
        MinesweeperBoard board = new MinesweeperBoard(3, 3, Set.of(new Cell(2, 2)));
        MinesweeperAI ai = new MinesweeperAI(3, 3);
        ai.observe(new Cell(0, 0), 0);

        Path log = tempDir.resolve("analysis_log.csv");
        Path map = tempDir.resolve("knowledge_map.csv");
        ai.exportLogToCSV(log.toString());
        BoardExporter.exportToCSV(map.toString(), board, ai);

        List<String> logLines = Files.readAllLines(log, StandardCharsets.UTF_8);
        assertEquals("Round,Step,Row,Col,Result,Sentence", logLines.get(0));
        assertEquals(4, logLines.size());
        assertTrue(logLines.get(1).startsWith("1,1,"));

        List<String> mapLines = Files.readAllLines(map, StandardCharsets.UTF_8);
        assertEquals("[Knowledge]", mapLines.get(3));
        assertEquals("0,S,.", mapLines.get(4));
        assertEquals("S,S,.", mapLines.get(5));
        assertEquals(".,.,.", mapLines.get(6));
    }
}
