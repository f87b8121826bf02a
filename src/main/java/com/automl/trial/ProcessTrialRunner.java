package com.automl.trial;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.automl.cancellation.CancellationToken;
import com.automl.cancellation.TrialCancelledException;
import com.automl.event.ExperimentEventChannel;
import com.automl.experiment.AutoMLExperimentSettings;

/**
 * Runs each trial as an external command. Parameters are handed over as {@code AUTOML_PARAM_*}
 * environment variables and the metric is read from the last {@code metric=<value>} line of stdout.
 */
public class ProcessTrialRunner implements TrialRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessTrialRunner.class);
    static final String SOURCE = "ProcessTrialRunner";
    private static final Pattern METRIC_LINE = Pattern.compile("^\\s*metric\\s*=\\s*(\\S+)\\s*$");
    private static final long POLL_INTERVAL_MS = 50;

    private final List<String> command;
    private final Path workingDirectory;
    private final AutoMLExperimentSettings settings;
    private final CancellationToken cancellationToken;
    private final ExperimentEventChannel channel;
    private final ProcessStarter processStarter;

    public ProcessTrialRunner(TrialRunnerContext context, List<String> command, Path workingDirectory) {
        this(context, command, workingDirectory, new DefaultProcessStarter());
    }

    ProcessTrialRunner(
            TrialRunnerContext context,
            List<String> command,
            Path workingDirectory,
            ProcessStarter processStarter) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("process runner requires a command");
        }
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
        this.settings = context.settings();
        this.cancellationToken = context.cancellationToken();
        this.channel = context.channel();
        this.processStarter = processStarter;
    }

    @Override
    public TrialResult run(TrialSettings trial) throws IOException, InterruptedException {
        cancellationToken.throwIfCancellationRequested();
        long start = System.nanoTime();
        Process process = processStarter.start(workingDirectory, environmentFor(trial), command);
        channel.info(SOURCE, trial.trialId(), "Started trial process " + command.get(0));

        CompletableFuture<String> stdoutFuture = readStream(process.getInputStream());
        CompletableFuture<String> stderrFuture = readStream(process.getErrorStream());

        try {
            while (!process.waitFor(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                if (cancellationToken.isCancellationRequested()) {
                    process.destroyForcibly();
                    log.info("trial.process.cancelled trialId={}", trial.trialId());
                    throw new TrialCancelledException("trial " + trial.trialId() + " cancelled");
                }
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }

        int exitCode = process.exitValue();
        String stdout = stdoutFuture.join();
        if (exitCode != 0) {
            throw new IOException("trial process exited with code " + exitCode + ": " + stderrFuture.join());
        }
        double metric = parseMetric(stdout);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        channel.info(SOURCE, trial.trialId(), "Trial process finished metric=" + metric);
        return new TrialResult(trial, elapsedMs, metric);
    }

    Map<String, String> environmentFor(TrialSettings trial) {
        Map<String, String> environment = new LinkedHashMap<>();
        environment.put("AUTOML_TRIAL_ID", Integer.toString(trial.trialId()));
        if (settings.datasetReference() != null) {
            environment.put("AUTOML_DATASET", settings.datasetReference());
        }
        if (settings.pipelineReference() != null) {
            environment.put("AUTOML_PIPELINE", settings.pipelineReference());
        }
        trial.parameters().forEach((name, value) -> environment.put(
                "AUTOML_PARAM_" + name.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_"),
                String.valueOf(value)));
        return environment;
    }

    static double parseMetric(String stdout) throws IOException {
        String[] lines = stdout.split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            Matcher matcher = METRIC_LINE.matcher(lines[i]);
            if (matcher.matches()) {
                try {
                    return Double.parseDouble(matcher.group(1));
                } catch (NumberFormatException e) {
                    throw new IOException("unparseable metric line: " + lines[i], e);
                }
            }
        }
        throw new IOException("trial process printed no metric=<value> line");
    }

    private CompletableFuture<String> readStream(InputStream inputStream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = inputStream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                log.debug("trial.process.stream.closed reason={}", e.getMessage());
                return "";
            }
        });
    }

    interface ProcessStarter {
        Process start(Path workingDirectory, Map<String, String> environment, List<String> command) throws IOException;
    }

    private static final class DefaultProcessStarter implements ProcessStarter {
        @Override
        public Process start(Path workingDirectory, Map<String, String> environment, List<String> command)
                throws IOException {
            ProcessBuilder builder = new ProcessBuilder(command)
                    .directory(workingDirectory == null ? null : workingDirectory.toFile());
            builder.environment().putAll(environment);
            return builder.start();
        }
    }

    @Override
    public String toString() {
        return "ProcessTrialRunner{" +
                "command=" + command +
                ", processStarter=" + processStarter.getClass().getSimpleName() +
                '}';
    }
}
