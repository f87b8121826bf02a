package com.automl.experiment;

import java.util.Objects;
import java.util.concurrent.TimeoutException;

import com.automl.cancellation.CancellationToken;
import com.automl.event.ExperimentEventChannel;
import com.automl.event.ExperimentEventListener;
import com.automl.trial.TrialResult;
import com.automl.trial.TrialRunnerFactory;
import com.automl.tuner.RandomSearchTuner;
import com.automl.tuner.Tuner;

/**
 * Fluent entry point for configuring and running an experiment.
 *
 * <pre>{@code
 * TrialResult best = new AutoMLExperiment()
 *         .setTrainingTimeInSeconds(10)
 *         .setTrialRunner(context -> new SimulatedTrialRunner(context, Duration.ofSeconds(1)))
 *         .setTuner(new RandomSearchTuner(space, 1L))
 *         .run(source.getToken());
 * }</pre>
 */
public class AutoMLExperiment {
    private final ExperimentEventChannel channel;

    private int trainingTimeInSeconds;
    private MetricDirection metricDirection = MetricDirection.MAXIMIZE;
    private int maxTrials;
    private Tuner tuner = new RandomSearchTuner();
    private TrialRunnerFactory trialRunnerFactory;
    private String datasetReference;
    private String pipelineReference;

    public AutoMLExperiment() {
        this(new ExperimentEventChannel());
    }

    public AutoMLExperiment(ExperimentEventChannel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    public AutoMLExperiment setTrainingTimeInSeconds(int trainingTimeInSeconds) {
        if (trainingTimeInSeconds <= 0) {
            throw new IllegalArgumentException("trainingTimeInSeconds must be > 0");
        }
        this.trainingTimeInSeconds = trainingTimeInSeconds;
        return this;
    }

    public AutoMLExperiment setMaximizeMetric() {
        this.metricDirection = MetricDirection.MAXIMIZE;
        return this;
    }

    public AutoMLExperiment setMinimizeMetric() {
        this.metricDirection = MetricDirection.MINIMIZE;
        return this;
    }

    public AutoMLExperiment setMetricDirection(MetricDirection metricDirection) {
        this.metricDirection = Objects.requireNonNull(metricDirection, "metricDirection");
        return this;
    }

    /**
     * Stops after this many completed trials; 0 means no cap.
     */
    public AutoMLExperiment setMaxTrials(int maxTrials) {
        if (maxTrials < 0) {
            throw new IllegalArgumentException("maxTrials must be >= 0");
        }
        this.maxTrials = maxTrials;
        return this;
    }

    public AutoMLExperiment setTuner(Tuner tuner) {
        this.tuner = Objects.requireNonNull(tuner, "tuner");
        return this;
    }

    public AutoMLExperiment setTrialRunner(TrialRunnerFactory trialRunnerFactory) {
        this.trialRunnerFactory = Objects.requireNonNull(trialRunnerFactory, "trialRunnerFactory");
        return this;
    }

    public AutoMLExperiment setDataset(String datasetReference) {
        this.datasetReference = datasetReference;
        return this;
    }

    public AutoMLExperiment setPipeline(String pipelineReference) {
        this.pipelineReference = pipelineReference;
        return this;
    }

    public AutoMLExperiment addListener(ExperimentEventListener listener) {
        channel.subscribe(listener);
        return this;
    }

    public ExperimentEventChannel getChannel() {
        return channel;
    }

    public TrialResult run() throws TimeoutException, InterruptedException {
        return run(CancellationToken.NONE);
    }

    /**
     * Runs the experiment and returns the best completed trial. Cancelling the token after at least
     * one trial completed is not an error.
     *
     * @throws TimeoutException if no trial completed before the budget ran out or the token fired
     */
    public TrialResult run(CancellationToken cancellationToken) throws TimeoutException, InterruptedException {
        return runWithSummary(cancellationToken).bestResult();
    }

    public ExperimentSummary runWithSummary(CancellationToken cancellationToken)
            throws TimeoutException, InterruptedException {
        if (trainingTimeInSeconds <= 0) {
            throw new IllegalStateException("training time is not set");
        }
        if (trialRunnerFactory == null) {
            throw new IllegalStateException("trial runner is not set");
        }
        AutoMLExperimentSettings settings = new AutoMLExperimentSettings(
                trainingTimeInSeconds,
                cancellationToken,
                metricDirection,
                maxTrials,
                datasetReference,
                pipelineReference);
        return new ExperimentScheduler(channel).run(settings, tuner, trialRunnerFactory);
    }
}
