package com.automl.experiment;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.automl.cancellation.CancellationToken;
import com.automl.cancellation.CancellationTokenSource;
import com.automl.event.ExperimentEvent;
import com.automl.event.ExperimentEventChannel;
import com.automl.event.ExperimentEventType;
import com.automl.trial.TrialResult;
import com.automl.trial.TrialRunner;
import com.automl.trial.TrialRunnerContext;
import com.automl.trial.TrialRunnerFactory;
import com.automl.trial.TrialSettings;
import com.automl.tuner.Tuner;

/**
 * Control loop of an experiment: proposes trials, runs them one at a time and keeps the best
 * result until the budget runs out, the caller cancels or the search has nothing left to try.
 *
 * <p>Runners observe a token linked to the caller's token and cancelled at the deadline, so a
 * trial in flight when the budget expires is interrupted instead of overrunning it. The caller's
 * token itself is never cancelled here.
 */
public class ExperimentScheduler {
    private static final Logger log = LoggerFactory.getLogger(ExperimentScheduler.class);
    static final String SOURCE = "AutoMLExperiment";

    private final ExperimentEventChannel channel;

    public ExperimentScheduler(ExperimentEventChannel channel) {
        this.channel = channel;
    }

    /**
     * @throws TimeoutException if the run ended, by deadline, cancellation or otherwise, without a
     *             single completed trial
     * @throws InterruptedException if the calling thread was interrupted
     */
    public ExperimentSummary run(
            AutoMLExperimentSettings settings,
            Tuner tuner,
            TrialRunnerFactory runnerFactory) throws TimeoutException, InterruptedException {
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + TimeUnit.SECONDS.toNanos(settings.trainingTimeInSeconds());
        ExecutorService worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "automl-trial-worker");
            thread.setDaemon(true);
            return thread;
        });

        try (CancellationTokenSource runSource = CancellationTokenSource.createLinked(settings.cancellationToken())) {
            runSource.cancelAfter(Duration.ofSeconds(settings.trainingTimeInSeconds()));
            AutoMLExperimentSettings runSettings = settings.withCancellationToken(runSource.getToken());
            TrialRunner runner = runnerFactory.create(new TrialRunnerContext(runSettings, channel));

            log.info("experiment.start budgetSeconds={} direction={} maxTrials={}",
                    settings.trainingTimeInSeconds(),
                    settings.metricDirection(),
                    settings.maxTrials());
            channel.publish(ExperimentEventType.EXPERIMENT_STARTED, SOURCE, ExperimentEvent.NO_TRIAL,
                    "Start experiment budget=" + settings.trainingTimeInSeconds() + "s");

            List<TrialResult> history = new ArrayList<>();
            BestResultTracker tracker = new BestResultTracker(settings.metricDirection());
            StopReason stopReason = runLoop(runSettings, settings.cancellationToken(), deadlineNanos, tuner, runner,
                    worker, history, tracker);

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            Optional<TrialResult> best = tracker.best();
            if (best.isEmpty() && !history.isEmpty()) {
                // every completed trial reported NaN; the first one stands in as the result
                log.warn("experiment.unranked trials={} reason=no-comparable-metric", history.size());
                best = Optional.of(history.get(0));
            }
            log.info("experiment.stop reason={} trials={} elapsedMs={} bestTrialId={} bestMetric={}",
                    stopReason,
                    history.size(),
                    elapsedMs,
                    best.map(TrialResult::trialId).orElse(ExperimentEvent.NO_TRIAL),
                    best.map(TrialResult::metric).orElse(Double.NaN));
            channel.publish(ExperimentEventType.EXPERIMENT_FINISHED, SOURCE, ExperimentEvent.NO_TRIAL,
                    "Finish experiment reason=" + stopReason + " trials=" + history.size());

            if (best.isEmpty()) {
                throw new TimeoutException("Training time finished without completing a trial run (reason="
                        + stopReason + ")");
            }
            return new ExperimentSummary(best.get(), List.copyOf(history), stopReason, elapsedMs);
        } finally {
            worker.shutdownNow();
        }
    }

    private StopReason runLoop(
            AutoMLExperimentSettings runSettings,
            CancellationToken callerToken,
            long deadlineNanos,
            Tuner tuner,
            TrialRunner runner,
            ExecutorService worker,
            List<TrialResult> history,
            BestResultTracker tracker) throws InterruptedException {
        CancellationToken runToken = runSettings.cancellationToken();
        List<TrialResult> readOnlyHistory = Collections.unmodifiableList(history);

        while (true) {
            Optional<StopReason> stop = shouldStop(runSettings, callerToken, deadlineNanos, history.size());
            if (stop.isPresent()) {
                return stop.get();
            }

            Optional<TrialSettings> proposal = tuner.propose(readOnlyHistory);
            if (proposal.isEmpty()) {
                log.info("experiment.stop reason=search-space-exhausted trials={}", history.size());
                return StopReason.SEARCH_SPACE_EXHAUSTED;
            }
            TrialSettings trial = proposal.get();

            channel.publish(ExperimentEventType.TRIAL_RUNNING, SOURCE, trial.trialId(),
                    "Update Running Trial - Id: " + trial.trialId());
            if (runToken.isCancellationRequested()) {
                return cancellationReason(callerToken);
            }

            Optional<TrialResult> completed = dispatch(worker, runner, trial, runToken);
            if (completed.isEmpty()) {
                log.info("trial.cancelled trialId={}", trial.trialId());
                return cancellationReason(callerToken);
            }

            TrialResult result = completed.get();
            channel.publish(ExperimentEventType.TRIAL_COMPLETED, SOURCE, trial.trialId(),
                    "Update Completed Trial - Id: " + trial.trialId() + " - Metric: " + result.metric()
                            + " - Duration: " + result.durationInMilliseconds());
            history.add(result);
            if (tracker.offer(result)) {
                channel.publish(ExperimentEventType.BEST_TRIAL_UPDATED, SOURCE, trial.trialId(),
                        "Update Best Trial - Id: " + trial.trialId() + " - Metric: " + result.metric());
            }
            log.info("trial.completed trialId={} metric={} durationMs={}",
                    trial.trialId(),
                    result.metric(),
                    result.durationInMilliseconds());
        }
    }

    private Optional<StopReason> shouldStop(
            AutoMLExperimentSettings runSettings,
            CancellationToken callerToken,
            long deadlineNanos,
            int completedTrials) {
        if (callerToken.isCancellationRequested()) {
            log.info("experiment.stop reason=cancelled trials={}", completedTrials);
            return Optional.of(StopReason.CANCELLED);
        }
        if (runSettings.cancellationToken().isCancellationRequested() || System.nanoTime() - deadlineNanos >= 0) {
            log.info("experiment.stop reason=budget-exhausted trials={}", completedTrials);
            return Optional.of(StopReason.BUDGET_EXHAUSTED);
        }
        if (runSettings.maxTrials() > 0 && completedTrials >= runSettings.maxTrials()) {
            log.info("experiment.stop reason=max-trials trials={}", completedTrials);
            return Optional.of(StopReason.MAX_TRIALS_REACHED);
        }
        return Optional.empty();
    }

    private static StopReason cancellationReason(CancellationToken callerToken) {
        return callerToken.isCancellationRequested() ? StopReason.CANCELLED : StopReason.BUDGET_EXHAUSTED;
    }

    /**
     * Runs one trial on the worker thread. Returns empty when the trial was cut short by
     * cancellation; any other failure is rethrown.
     */
    private Optional<TrialResult> dispatch(
            ExecutorService worker,
            TrialRunner runner,
            TrialSettings trial,
            CancellationToken runToken) throws InterruptedException {
        Future<TrialResult> future = worker.submit(() -> runner.run(trial));
        try (CancellationToken.Registration ignored = runToken.register(() -> future.cancel(true))) {
            return Optional.of(future.get());
        } catch (CancellationException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (isCancellation(cause, runToken)) {
                return Optional.empty();
            }
            log.error("trial.failed trialId={} reason={}", trial.trialId(), cause.getMessage(), cause);
            channel.publish(ExperimentEventType.TRIAL_FAILED, SOURCE, trial.trialId(),
                    "Update Failed Trial - Id: " + trial.trialId() + " - Reason: " + cause.getMessage());
            throw propagate(trial, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    /**
     * A runner's cancellation or interruption only ends the run when the run token fired. Otherwise
     * it is an ordinary trial failure.
     */
    private static boolean isCancellation(Throwable cause, CancellationToken runToken) {
        return (cause instanceof CancellationException || cause instanceof InterruptedException)
                && runToken.isCancellationRequested();
    }

    private static RuntimeException propagate(TrialSettings trial, Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new TrialFailedException(trial.trialId(), cause);
    }
}
