package com.automl.trial;

import java.time.Duration;
import java.util.function.ToDoubleFunction;

import com.automl.cancellation.CancellationToken;
import com.automl.cancellation.TrialCancelledException;
import com.automl.event.ExperimentEventChannel;

/**
 * Runner that stands in for real training: it waits a fixed time on the cancellation token and
 * scores the trial with a plain function.
 */
public class SimulatedTrialRunner implements TrialRunner {
    static final String SOURCE = "SimulatedTrialRunner";

    private final Duration trialDuration;
    private final CancellationToken cancellationToken;
    private final ExperimentEventChannel channel;
    private final ToDoubleFunction<TrialSettings> scoring;

    public SimulatedTrialRunner(TrialRunnerContext context, Duration trialDuration) {
        this(context, trialDuration, SimulatedTrialRunner::defaultScore);
    }

    public SimulatedTrialRunner(
            TrialRunnerContext context,
            Duration trialDuration,
            ToDoubleFunction<TrialSettings> scoring) {
        this.trialDuration = trialDuration;
        this.cancellationToken = context.cancellationToken();
        this.channel = context.channel();
        this.scoring = scoring;
    }

    @Override
    public TrialResult run(TrialSettings settings) throws InterruptedException {
        channel.info(SOURCE, settings.trialId(), "Update Running Trial");
        long start = System.nanoTime();
        if (cancellationToken.await(trialDuration)) {
            throw new TrialCancelledException("trial " + settings.trialId() + " cancelled");
        }
        cancellationToken.throwIfCancellationRequested();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        channel.info(SOURCE, settings.trialId(), "Update Completed Trial");
        return new TrialResult(settings, elapsedMs, scoring.applyAsDouble(settings));
    }

    static double defaultScore(TrialSettings settings) {
        return 1.0 + 0.01 * settings.trialId();
    }
}
