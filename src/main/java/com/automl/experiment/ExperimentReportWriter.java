package com.automl.experiment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Persists a finished run as {@code run-<timestamp>/trials.json} and {@code summary.json}.
 */
public class ExperimentReportWriter {
    private static final DateTimeFormatter RUN_ID_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMddHHmmss", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;

    public ExperimentReportWriter() {
        this(JsonMapper.builder()
                .findAndAddModules()
                .build());
    }

    ExperimentReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Path write(Path artifactsRoot, ExperimentSummary summary) throws IOException {
        Files.createDirectories(artifactsRoot);
        String runId = "run-" + RUN_ID_FORMATTER.format(Instant.now());
        Path runDirectory = artifactsRoot.resolve(runId);
        for (int suffix = 1; Files.exists(runDirectory); suffix++) {
            runDirectory = artifactsRoot.resolve(runId + "-" + suffix);
        }
        Files.createDirectories(runDirectory);

        objectMapper.writerWithDefaultPrettyPrinter().writeValue(runDirectory.resolve("trials.json").toFile(), summary.trials());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(
                runDirectory.resolve("summary.json").toFile(),
                new RunSummary(
                        summary.stopReason(),
                        summary.trials().size(),
                        summary.elapsedMilliseconds(),
                        summary.bestResult().trialId(),
                        summary.bestResult().metric(),
                        summary.bestResult().trialSettings().parameters(),
                        Instant.now()));
        return runDirectory;
    }

    public record RunSummary(
            StopReason stopReason,
            int completedTrials,
            long elapsedMilliseconds,
            int bestTrialId,
            double bestMetric,
            Map<String, Object> bestParameters,
            Instant finishedAt) {
    }
}
