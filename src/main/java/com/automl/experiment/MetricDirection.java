package com.automl.experiment;

public enum MetricDirection {
    MAXIMIZE,
    MINIMIZE;

    /**
     * Strict comparison; equal metrics and NaN are never better.
     */
    public boolean isBetter(double candidate, double incumbent) {
        return this == MAXIMIZE ? candidate > incumbent : candidate < incumbent;
    }
}
