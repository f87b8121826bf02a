package com.automl.experiment;

public enum StopReason {
    BUDGET_EXHAUSTED,
    CANCELLED,
    SEARCH_SPACE_EXHAUSTED,
    MAX_TRIALS_REACHED
}
