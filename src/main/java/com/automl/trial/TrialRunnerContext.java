package com.automl.trial;

import com.automl.cancellation.CancellationToken;
import com.automl.event.ExperimentEventChannel;
import com.automl.experiment.AutoMLExperimentSettings;

/**
 * What a {@link TrialRunnerFactory} gets to build a runner for one experiment run. The settings
 * carry the run's token, which is cancelled at the deadline as well as on caller cancellation.
 */
public record TrialRunnerContext(AutoMLExperimentSettings settings, ExperimentEventChannel channel) {

    public CancellationToken cancellationToken() {
        return settings.cancellationToken();
    }
}
