package com.automl.experiment;

import java.util.Optional;

import com.automl.trial.TrialResult;

/**
 * Keeps the best completed trial. Only a strictly better metric replaces the incumbent, so ties
 * keep the earlier trial and NaN metrics are never recorded.
 */
public class BestResultTracker {
    private final MetricDirection direction;
    private TrialResult best;

    public BestResultTracker(MetricDirection direction) {
        this.direction = direction;
    }

    public boolean offer(TrialResult result) {
        if (Double.isNaN(result.metric())) {
            return false;
        }
        if (best == null || direction.isBetter(result.metric(), best.metric())) {
            best = result;
            return true;
        }
        return false;
    }

    public Optional<TrialResult> best() {
        return Optional.ofNullable(best);
    }
}
