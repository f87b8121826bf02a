package com.automl.trial;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TrialResult(
        TrialSettings trialSettings,
        long durationInMilliseconds,
        double metric) {

    public int trialId() {
        return trialSettings.trialId();
    }
}
