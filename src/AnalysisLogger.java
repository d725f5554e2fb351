import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 推論の過程を記録し , CSVファイルに出力するクラス
 *
 * 1観測 (observe) を1ラウンドとし, ラウンド内で確定したセルを順に記録する.
 */
public class AnalysisLogger {

    private static final Logger log = LoggerFactory.getLogger(AnalysisLogger.class);

    public static final String MINE = "MINE";
    public static final String SAFE = "SAFE";

    // ログ1行分のデータ
    public static class LogEntry {
        private final int round;
        private final int step;
        private final Cell cell;
        private final String result; // "SAFE" or "MINE"
        private final String sentence; // 確定元の文

        LogEntry(int round, int step, Cell cell, String result, String sentence) {
            this.round = round;
            this.step = step;
            this.cell = cell;
            this.result = result;
            this.sentence = sentence;
        }

        public int getRound() {
            return round;
        }

        public int getStep() {
            return step;
        }

        public Cell getCell() {
            return cell;
        }

        public String getResult() {
            return result;
        }

        public String getSentence() {
            return sentence;
        }

        public String toCSVString() {
            // カンマを含む可能性のあるフィールドはダブルクォートで囲む
            return String.format("%d,%d,%d,%d,%s,\"%s\"",
                    round, step, cell.getRow(), cell.getCol(), result, sentence);
        }
    }

    private final List<LogEntry> logs;
    private int round;
    private int stepCounter;

    public AnalysisLogger() {
        this.logs = new ArrayList<>();
        this.round = 0;
        this.stepCounter = 0;
    }

    /**
     * 新しい観測の開始. ステップ番号は「ラウンド内連番」なのでリセットする.
     */
    public void startNewRound() {
        this.round++;
        this.stepCounter = 0;
    }

    /**
     * 確定ステップをログに記録する
     */
    public void logStep(Cell cell, String result, String sourceSentence) {
        this.stepCounter++;
        logs.add(new LogEntry(round, stepCounter, cell, result, sourceSentence));
    }

    public List<LogEntry> getEntries() {
        return Collections.unmodifiableList(logs);
    }

    /**
     * 蓄積されたログをCSVファイルに出力する
     */
    public void exportToCSV(String filename) {
        try (FileWriter writer = new FileWriter(filename)) {
            writer.write("Round,Step,Row,Col,Result,Sentence\n");

            for (LogEntry entry : logs) {
                writer.write(entry.toCSVString() + "\n");
            }

            log.info("Analysis log exported to: {}", filename);
        } catch (IOException e) {
            log.error("Failed to export analysis log to {}", filename, e);
        }
    }
}
