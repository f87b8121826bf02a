package com.automl.tuner;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import com.automl.trial.TrialResult;
import com.automl.trial.TrialSettings;

/**
 * Samples every parameter independently and uniformly. Never runs out of proposals.
 */
public class RandomSearchTuner implements Tuner {
    private final SearchSpace searchSpace;
    private final Random random;
    private int nextTrialId;

    public RandomSearchTuner() {
        this(SearchSpace.empty(), 0L);
    }

    public RandomSearchTuner(SearchSpace searchSpace, long seed) {
        this.searchSpace = searchSpace;
        this.random = new Random(seed);
    }

    @Override
    public Optional<TrialSettings> propose(List<TrialResult> history) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        searchSpace.parameters().forEach((name, parameter) -> parameters.put(name, parameter.sample(random)));
        return Optional.of(new TrialSettings(nextTrialId++, parameters));
    }
}
