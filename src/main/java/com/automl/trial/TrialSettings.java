package com.automl.trial;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A configuration proposed by a tuner. Parameter values are owned by the tuner that created them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrialSettings(int trialId, Map<String, Object> parameters) {

    public TrialSettings {
        if (trialId < 0) {
            throw new IllegalArgumentException("trialId must be >= 0");
        }
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static TrialSettings of(int trialId) {
        return new TrialSettings(trialId, Map.of());
    }
}
