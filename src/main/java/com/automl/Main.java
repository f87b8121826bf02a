package com.automl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.automl.cancellation.CancellationTokenSource;
import com.automl.event.ExperimentEvent;
import com.automl.event.ExperimentEventType;
import com.automl.experiment.AutoMLExperiment;
import com.automl.experiment.ExperimentReportWriter;
import com.automl.experiment.ExperimentSummary;
import com.automl.runtime.AppConfig;
import com.automl.runtime.SearchSpaces;
import com.automl.runtime.TrialRunnerFactories;
import com.automl.trial.TrialResult;
import com.automl.trial.TrialRunnerFactory;
import com.automl.tuner.SearchSpace;
import com.automl.tuner.Tuner;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "automl-experiment",
        mixinStandardHelpOptions = true,
        version = "automl-experiment 0.1.0",
        description = "Runs a time-budgeted AutoML experiment and reports the best trial.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_INVALID_INPUT = 2;
    static final int EXIT_NO_TRIAL_COMPLETED = 3;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "automl.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "run")
    Mode mode;

    @Option(names = "--training-time", description = "Training budget in seconds (overrides config)")
    Integer trainingTimeInSeconds;

    @Option(names = "--max-trials", description = "Stop after this many completed trials, 0 for no cap (overrides config)")
    Integer maxTrials;

    @Option(names = "--cancel-after-ms", description = "Cancel the experiment after this many milliseconds", defaultValue = "0")
    long cancelAfterMs;

    @Option(names = "--artifact-dir", description = "Directory for run reports (overrides config)")
    Path artifactDir;

    @Option(names = "--seed", description = "Random search seed (overrides config)")
    Long seed;

    @Option(names = "--no-report", description = "Skip writing trials.json and summary.json")
    boolean noReport;

    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        run,
        describe
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        applyOverrides(config.getExperiment());
        AppConfig.ExperimentConfig experimentConfig = config.getExperiment();

        SearchSpace searchSpace;
        Tuner tuner;
        TrialRunnerFactory runnerFactory;
        try {
            searchSpace = SearchSpaces.fromConfig(config.getSearchSpace());
            tuner = SearchSpaces.tunerFor(experimentConfig, searchSpace);
            runnerFactory = TrialRunnerFactories.fromConfig(config.getRunner(), httpClient);
            if (experimentConfig.getTrainingTimeInSeconds() <= 0) {
                throw new IllegalArgumentException("experiment.trainingTimeInSeconds must be > 0");
            }
            if (experimentConfig.getMaxTrials() < 0) {
                throw new IllegalArgumentException("experiment.maxTrials must be >= 0");
            }
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration {}: {}", configPath, e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        log.info("Using config file: {}", configPath);
        log.info("Experiment budgetSeconds={} direction={} maxTrials={} tuner={} runner={} parameters={}",
                experimentConfig.getTrainingTimeInSeconds(),
                experimentConfig.getMetricDirection(),
                experimentConfig.getMaxTrials(),
                experimentConfig.getTuner(),
                config.getRunner().getType(),
                searchSpace.parameters().keySet());

        if (mode == Mode.describe) {
            searchSpace.parameters().forEach((name, parameter) -> System.out.printf("%s: %s%n", name, parameter));
            return 0;
        }

        AutoMLExperiment experiment = new AutoMLExperiment()
                .setTrainingTimeInSeconds(experimentConfig.getTrainingTimeInSeconds())
                .setMetricDirection(experimentConfig.getMetricDirection())
                .setMaxTrials(experimentConfig.getMaxTrials())
                .setTuner(tuner)
                .setTrialRunner(runnerFactory)
                .setDataset(experimentConfig.getDataset())
                .setPipeline(experimentConfig.getPipeline())
                .addListener(Main::printProgress);

        ExperimentSummary summary;
        try (CancellationTokenSource cancellation = new CancellationTokenSource()) {
            if (cancelAfterMs > 0) {
                cancellation.cancelAfter(Duration.ofMillis(cancelAfterMs));
            }
            summary = experiment.runWithSummary(cancellation.getToken());
        } catch (TimeoutException e) {
            log.error("No trial completed: {}", e.getMessage());
            return EXIT_NO_TRIAL_COMPLETED;
        }

        TrialResult best = summary.bestResult();
        log.info("Best trial id={} metric={} durationMs={} parameters={} stopReason={} trials={}",
                best.trialId(),
                best.metric(),
                best.durationInMilliseconds(),
                best.trialSettings().parameters(),
                summary.stopReason(),
                summary.trials().size());

        if (!noReport) {
            Path reportDir = new ExperimentReportWriter().write(Path.of(experimentConfig.getArtifactDir()), summary);
            log.info("Run report written to {}", reportDir);
        }
        return 0;
    }

    private void applyOverrides(AppConfig.ExperimentConfig experiment) {
        if (trainingTimeInSeconds != null) {
            experiment.setTrainingTimeInSeconds(trainingTimeInSeconds);
        }
        if (maxTrials != null) {
            experiment.setMaxTrials(maxTrials);
        }
        if (seed != null) {
            experiment.setSeed(seed);
        }
        if (artifactDir != null) {
            experiment.setArtifactDir(artifactDir.toString());
        }
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    private static void printProgress(ExperimentEvent event) {
        if (event.type() == ExperimentEventType.TRIAL_COMPLETED
                || event.type() == ExperimentEventType.BEST_TRIAL_UPDATED
                || event.type() == ExperimentEventType.TRIAL_FAILED) {
            System.out.println(event.message());
        }
    }
}
