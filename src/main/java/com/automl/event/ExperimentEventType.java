package com.automl.event;

public enum ExperimentEventType {
    EXPERIMENT_STARTED,
    TRIAL_RUNNING,
    TRIAL_COMPLETED,
    TRIAL_FAILED,
    BEST_TRIAL_UPDATED,
    EXPERIMENT_FINISHED,
    MESSAGE
}
