package com.enterprise.sheetrecovery.core.text;

import com.enterprise.sheetrecovery.core.model.DetectionResult;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Picks the field separator that splits the leading lines into the most, and most
 * consistent, columns.
 */
public class DelimiterDetector {

    public static final char DEFAULT_DELIMITER = ',';

    static final char[] CANDIDATES = {'\t', ',', ';', '|'};
    static final int SAMPLE_LINES = 10;
    /** Wide tables (more columns than this) get a fixed consistency instead of a measured one. */
    static final int WIDE_TABLE_COLUMNS = 10;
    static final double WIDE_TABLE_CONSISTENCY = 0.8;
    static final double MIN_CONSISTENCY = 0.5;

    public DetectionResult detect(String text) {
        List<String> sample = sampleLines(text);

        char best = DEFAULT_DELIMITER;
        double bestScore = 0;
        double totalScore = 0;
        for (char candidate : CANDIDATES) {
            double score = score(sample, candidate);
            totalScore += score;
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        double confidence = totalScore > 0 ? bestScore / totalScore : 0.0;
        return new DetectionResult(String.valueOf(best), confidence);
    }

    static double score(List<String> lines, char delimiter) {
        Pattern splitter = Pattern.compile(Pattern.quote(String.valueOf(delimiter)));
        List<Integer> counts = new ArrayList<>();
        for (String line : lines) {
            int columns = splitter.split(line, -1).length;
            if (columns > 1) {
                counts.add(columns);
            }
        }
        if (counts.isEmpty()) {
            return 0;
        }
        double avg = counts.stream().mapToInt(Integer::intValue).average().orElse(0);
        int max = counts.stream().mapToInt(Integer::intValue).max().orElse(0);
        int min = counts.stream().mapToInt(Integer::intValue).min().orElse(0);
        double consistency = max > WIDE_TABLE_COLUMNS
                ? WIDE_TABLE_CONSISTENCY
                : 1 - (max - min) / Math.max(avg, 1);
        return avg * Math.max(consistency, MIN_CONSISTENCY) * counts.size();
    }

    private static List<String> sampleLines(String text) {
        List<String> sample = new ArrayList<>(SAMPLE_LINES);
        for (String line : Lines.split(text)) {
            if (!line.isBlank()) {
                sample.add(line);
                if (sample.size() == SAMPLE_LINES) {
                    break;
                }
            }
        }
        return sample;
    }
}
