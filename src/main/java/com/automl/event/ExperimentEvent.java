package com.automl.event;

import java.time.Instant;

/**
 * One notification on an {@link ExperimentEventChannel}. {@code trialId} is {@link #NO_TRIAL}
 * for experiment-level events.
 */
public record ExperimentEvent(
        ExperimentEventType type,
        String source,
        int trialId,
        String message,
        Instant timestamp) {

    public static final int NO_TRIAL = -1;
}
