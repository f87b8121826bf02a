package com.automl.trial;

/**
 * Executes one trial. Implementations watch the experiment's cancellation token during long work
 * and fail with {@link com.automl.cancellation.TrialCancelledException} rather than returning a
 * result for a trial that did not run to completion.
 */
@FunctionalInterface
public interface TrialRunner {
    TrialResult run(TrialSettings settings) throws Exception;
}
