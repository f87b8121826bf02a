package com.automl.experiment;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.automl.cancellation.CancellationTokenSource;
import com.automl.event.ExperimentEventType;
import com.automl.trial.SimulatedTrialRunner;
import com.automl.trial.TrialResult;
import com.automl.tuner.GridSearchTuner;
import com.automl.tuner.RandomSearchTuner;
import com.automl.tuner.SearchSpace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AutoMLExperimentTest {

    private static AutoMLExperiment experiment(int trainingTimeInSeconds, Duration trialDuration) {
        return new AutoMLExperiment()
                .setTrainingTimeInSeconds(trainingTimeInSeconds)
                .setTrialRunner(context -> new SimulatedTrialRunner(context, trialDuration))
                .setTuner(new RandomSearchTuner());
    }

    @Test
    void shouldThrowTimeoutWhenCancelledWhileTrialRunningAndNoneCompleted() {
        AutoMLExperiment experiment = experiment(1, Duration.ofSeconds(5));
        CancellationTokenSource cts = new CancellationTokenSource();
        experiment.addListener(event -> {
            if (event.message().contains("Update Running Trial")) {
                cts.cancel();
            }
        });

        assertThrows(TimeoutException.class, () -> experiment.run(cts.getToken()));
    }

    @Test
    void shouldThrowTimeoutWhenBudgetRunsOutBeforeFirstTrialCompletes() {
        AutoMLExperiment experiment = experiment(1, Duration.ofSeconds(5));
        List<Integer> completed = new CopyOnWriteArrayList<>();
        experiment.addListener(event -> {
            if (event.type() == ExperimentEventType.TRIAL_COMPLETED) {
                completed.add(event.trialId());
            }
        });

        long start = System.currentTimeMillis();
        assertThrows(TimeoutException.class, experiment::run);
        long elapsed = System.currentTimeMillis() - start;

        assertTrue(elapsed < 3000, "elapsed=" + elapsed);
        assertTrue(completed.isEmpty());
    }

    @Test
    void shouldReturnCurrentBestWhenCancelledAfterTrialCompleted() throws Exception {
        long start = System.currentTimeMillis();
        AutoMLExperiment experiment = experiment(10, Duration.ofSeconds(1));
        CancellationTokenSource cts = new CancellationTokenSource();
        experiment.addListener(event -> {
            if (event.message().contains("Update Completed Trial")) {
                cts.cancelAfter(Duration.ofMillis(100));
            }
        });

        ExperimentSummary summary = experiment.runWithSummary(cts.getToken());
        long elapsed = System.currentTimeMillis() - start;

        assertTrue(elapsed <= 2000, "elapsed=" + elapsed);
        assertTrue(cts.isCancellationRequested());
        assertTrue(summary.bestResult().metric() > 0);
        assertEquals(StopReason.CANCELLED, summary.stopReason());
    }

    @Test
    void shouldFinishTrainingWhenTimeIsUp() throws Exception {
        AutoMLExperiment experiment = experiment(5, Duration.ofSeconds(1));
        CancellationTokenSource cts = new CancellationTokenSource();
        cts.cancelAfter(Duration.ofSeconds(10));

        long start = System.currentTimeMillis();
        ExperimentSummary summary = experiment.runWithSummary(cts.getToken());
        long elapsed = System.currentTimeMillis() - start;
        cts.close();

        assertTrue(summary.bestResult().metric() > 0);
        assertFalse(cts.isCancellationRequested());
        assertEquals(StopReason.BUDGET_EXHAUSTED, summary.stopReason());
        assertTrue(summary.trials().size() >= 3, "trials=" + summary.trials().size());
        assertTrue(elapsed < 6500, "elapsed=" + elapsed);
    }

    @Test
    void shouldStopWhenGridIsExhaustedAndKeepLowestMetric() throws Exception {
        SearchSpace space = SearchSpace.builder()
                .choice("x", List.of(3.0, 1.0, 2.0, 1.0))
                .build();
        ExperimentSummary summary = new AutoMLExperiment()
                .setTrainingTimeInSeconds(30)
                .setMinimizeMetric()
                .setTuner(new GridSearchTuner(space, 1))
                .setTrialRunner(context -> settings -> new TrialResult(settings, 1, (Double) settings.parameters().get("x")))
                .runWithSummary(new CancellationTokenSource().getToken());

        assertEquals(StopReason.SEARCH_SPACE_EXHAUSTED, summary.stopReason());
        assertEquals(4, summary.trials().size());
        assertEquals(1, summary.bestResult().trialId());
        assertEquals(1.0, summary.bestResult().metric());
    }

    @Test
    void shouldStopAfterMaxTrials() throws Exception {
        ExperimentSummary summary = new AutoMLExperiment()
                .setTrainingTimeInSeconds(30)
                .setMaxTrials(3)
                .setTrialRunner(context -> settings -> new TrialResult(settings, 1, settings.trialId()))
                .runWithSummary(new CancellationTokenSource().getToken());

        assertEquals(StopReason.MAX_TRIALS_REACHED, summary.stopReason());
        assertEquals(3, summary.trials().size());
        assertEquals(2, summary.bestResult().trialId());
    }

    @Test
    void shouldEmitRunningCompletedAndBestEventsInOrder() throws Exception {
        List<String> events = new CopyOnWriteArrayList<>();
        new AutoMLExperiment()
                .setTrainingTimeInSeconds(30)
                .setMaxTrials(2)
                .setTrialRunner(context -> settings -> new TrialResult(settings, 1, 1.0))
                .addListener(event -> {
                    if (event.type() != ExperimentEventType.MESSAGE) {
                        events.add(event.type() + ":" + event.trialId());
                    }
                })
                .run();

        assertEquals(List.of(
                "EXPERIMENT_STARTED:-1",
                "TRIAL_RUNNING:0",
                "TRIAL_COMPLETED:0",
                "BEST_TRIAL_UPDATED:0",
                "TRIAL_RUNNING:1",
                "TRIAL_COMPLETED:1",
                "EXPERIMENT_FINISHED:-1"), events);
    }

    @Test
    void runtimeFailureShouldPropagateUnchanged() {
        IllegalStateException failure = new IllegalStateException("runner broke");
        AutoMLExperiment experiment = new AutoMLExperiment()
                .setTrainingTimeInSeconds(30)
                .setTrialRunner(context -> settings -> {
                    throw failure;
                });

        IllegalStateException thrown = assertThrows(IllegalStateException.class, experiment::run);

        assertSame(failure, thrown);
    }

    @Test
    void checkedFailureShouldBeWrapped() {
        List<String> failures = new CopyOnWriteArrayList<>();
        AutoMLExperiment experiment = new AutoMLExperiment()
                .setTrainingTimeInSeconds(30)
                .setTrialRunner(context -> settings -> {
                    throw new IOException("disk full");
                })
                .addListener(event -> {
                    if (event.type() == ExperimentEventType.TRIAL_FAILED) {
                        failures.add(event.message());
                    }
                });

        TrialFailedException thrown = assertThrows(TrialFailedException.class, experiment::run);

        assertInstanceOf(IOException.class, thrown.getCause());
        assertEquals(0, thrown.getTrialId());
        assertEquals(1, failures.size());
    }

    @Test
    void shouldReturnPromptlyEvenWhenRunnerIgnoresCancellation() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CancellationTokenSource cts = new CancellationTokenSource();
        AutoMLExperiment experiment = new AutoMLExperiment()
                .setTrainingTimeInSeconds(30)
                .setTrialRunner(context -> settings -> {
                    if (settings.trialId() > 0) {
                        cts.cancelAfter(Duration.ofMillis(100));
                        awaitIgnoringInterrupts(release);
                    }
                    return new TrialResult(settings, 1, 0.5);
                });

        long start = System.currentTimeMillis();
        TrialResult best = experiment.run(cts.getToken());
        long elapsed = System.currentTimeMillis() - start;
        release.countDown();

        assertEquals(0, best.trialId());
        assertTrue(elapsed < 2000, "elapsed=" + elapsed);
    }

    @Test
    void shouldRejectMissingRunner() {
        AutoMLExperiment experiment = new AutoMLExperiment().setTrainingTimeInSeconds(1);

        assertThrows(IllegalStateException.class, experiment::run);
        assertThrows(IllegalArgumentException.class, () -> experiment.setTrainingTimeInSeconds(0));
    }

    @Test
    void shouldThrowTimeoutWhenTokenAlreadyCancelled() {
        AtomicInteger runs = new AtomicInteger();
        CancellationTokenSource cts = new CancellationTokenSource();
        cts.cancel();
        AutoMLExperiment experiment = new AutoMLExperiment()
                .setTrainingTimeInSeconds(30)
                .setTrialRunner(context -> settings -> {
                    runs.incrementAndGet();
                    return new TrialResult(settings, 1, 1.0);
                });

        TimeoutException thrown = assertThrows(TimeoutException.class, () -> experiment.run(cts.getToken()));

        assertTrue(thrown.getMessage().contains("CANCELLED"), thrown.getMessage());
        assertEquals(0, runs.get());
    }

    @Test
    void shouldStopBeforeNextTrialWhenListenerCancelsOnCompletion() throws Exception {
        CancellationTokenSource cts = new CancellationTokenSource();
        ExperimentSummary summary = new AutoMLExperiment()
                .setTrainingTimeInSeconds(30)
                .setTrialRunner(context -> settings -> new TrialResult(settings, 1, 0.7))
                .addListener(event -> {
                    if (event.type() == ExperimentEventType.TRIAL_COMPLETED) {
                        cts.cancel();
                    }
                })
                .runWithSummary(cts.getToken());

        assertEquals(StopReason.CANCELLED, summary.stopReason());
        assertEquals(1, summary.trials().size());
        assertEquals(0, summary.bestResult().trialId());
    }

    @Test
    void cancellationExceptionWithoutCancelledTokenShouldPropagate() {
        CancellationException failure = new CancellationException("internal future cancelled");
        AutoMLExperiment experiment = new AutoMLExperiment()
                .setTrainingTimeInSeconds(30)
                .setTrialRunner(context -> settings -> {
                    throw failure;
                });

        long start = System.currentTimeMillis();
        CancellationException thrown = assertThrows(CancellationException.class, experiment::run);

        assertSame(failure, thrown);
        assertTrue(System.currentTimeMillis() - start < 5000);
    }

    @Test
    void shouldReturnFirstTrialWhenEveryMetricIsNaN() throws Exception {
        ExperimentSummary summary = new AutoMLExperiment()
                .setTrainingTimeInSeconds(30)
                .setMaxTrials(3)
                .setTrialRunner(context -> settings -> new TrialResult(settings, 1, Double.NaN))
                .runWithSummary(new CancellationTokenSource().getToken());

        assertEquals(StopReason.MAX_TRIALS_REACHED, summary.stopReason());
        assertEquals(3, summary.trials().size());
        assertEquals(0, summary.bestResult().trialId());
        assertTrue(Double.isNaN(summary.bestResult().metric()));
    }

    @Test
    void nanTrialShouldNotHideLaterRankedResult() throws Exception {
        TrialResult best = new AutoMLExperiment()
                .setTrainingTimeInSeconds(30)
                .setMaxTrials(3)
                .setTrialRunner(context -> settings -> new TrialResult(settings, 1,
                        settings.trialId() == 0 ? Double.NaN : settings.trialId()))
                .run();

        assertEquals(2, best.trialId());
    }

    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (latch.getCount() > 0 && System.nanoTime() < deadline) {
            try {
                latch.await(50, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                // keep waiting
            }
        }
    }
}
