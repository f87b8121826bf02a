package com.automl.tuner;

import java.util.List;
import java.util.Optional;

import com.automl.trial.TrialResult;
import com.automl.trial.TrialSettings;

/**
 * Search strategy. Every proposal carries a trial id strictly greater than the previous one; an
 * empty proposal means the strategy has nothing left worth trying.
 */
@FunctionalInterface
public interface Tuner {
    Optional<TrialSettings> propose(List<TrialResult> history);
}
