package com.automl.experiment;

import java.util.List;

import com.automl.trial.TrialResult;

public record ExperimentSummary(
        TrialResult bestResult,
        List<TrialResult> trials,
        StopReason stopReason,
        long elapsedMilliseconds) {
}
