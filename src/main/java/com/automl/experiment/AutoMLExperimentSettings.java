package com.automl.experiment;

import com.automl.cancellation.CancellationToken;

/**
 * Configuration shared by the scheduler and the trial runners for one run. Dataset and pipeline
 * references are opaque here and only passed through to runners.
 */
public record AutoMLExperimentSettings(
        int trainingTimeInSeconds,
        CancellationToken cancellationToken,
        MetricDirection metricDirection,
        int maxTrials,
        String datasetReference,
        String pipelineReference) {

    public AutoMLExperimentSettings {
        if (trainingTimeInSeconds <= 0) {
            throw new IllegalArgumentException("trainingTimeInSeconds must be > 0");
        }
        if (maxTrials < 0) {
            throw new IllegalArgumentException("maxTrials must be >= 0");
        }
        cancellationToken = cancellationToken == null ? CancellationToken.NONE : cancellationToken;
        metricDirection = metricDirection == null ? MetricDirection.MAXIMIZE : metricDirection;
    }

    public AutoMLExperimentSettings withCancellationToken(CancellationToken token) {
        return new AutoMLExperimentSettings(
                trainingTimeInSeconds,
                token,
                metricDirection,
                maxTrials,
                datasetReference,
                pipelineReference);
    }
}
