package com.essaycoach.utils;

import com.essaycoach.models.Dimension;
import com.essaycoach.models.DimensionScore;
import com.essaycoach.models.GradingResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Appends graded essays to a CSV report, one row per essay. The header is written
 * only when the file is new or empty.
 */
public class CsvReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(CsvReportWriter.class);

    public static final List<String> HEADER = List.of(
        "GradedAt", "PromptId", "OverallScore", "Grade",
        "GrammarScore", "VocabularyScore", "ContentScore",
        "WordCount", "LengthCompliant", "DegradedDimensions", "OverallFeedback");

    private final Path file;
    private final Clock clock;

    public CsvReportWriter(Path file) {
        this(file, Clock.systemUTC());
    }

    public CsvReportWriter(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    public Path getFile() {
        return file;
    }

    public synchronized void append(String promptId, GradingResult result) throws IOException {
        boolean fileExists = Files.exists(file) && Files.size(file) > 0;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
             CSVPrinter csvPrinter = new CSVPrinter(writer, CSVFormat.DEFAULT)) {

            if (!fileExists) {
                csvPrinter.printRecord(HEADER);
                logger.info("Created new CSV report with header: {}", file);
            }

            List<String> row = new ArrayList<>();
            row.add(Instant.now(clock).toString());
            row.add(promptId);
            row.add(String.format(Locale.ROOT, "%.1f", result.getOverallScore()));
            row.add(result.getGrade());
            row.add(formatScore(result.getGrammar()));
            row.add(formatScore(result.getVocabulary()));
            row.add(formatScore(result.getContent()));
            row.add(String.valueOf(result.getWordCount()));
            row.add(String.valueOf(result.isLengthCompliant()));
            row.add(degradedTags(result));
            row.add(result.getOverallFeedback() != null ? result.getOverallFeedback().replace("\n", " ") : "");
            csvPrinter.printRecord(row);
        }
        logger.debug("Appended result for prompt {} to {}", promptId, file);
    }

    private static String formatScore(DimensionScore score) {
        return score == null || !score.isAvailable() ? "" : String.format(Locale.ROOT, "%.1f", score.score());
    }

    /**
     * Degraded and unavailable dimensions, separated by ';'
     */
    private static String degradedTags(GradingResult result) {
        List<Dimension> flagged = new ArrayList<>(result.getDegradedDimensions());
        flagged.addAll(result.getUnavailableDimensions());
        return flagged.stream().sorted().map(Dimension::tag).collect(Collectors.joining(";"));
    }
}
