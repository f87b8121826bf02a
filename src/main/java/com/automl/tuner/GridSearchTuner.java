package com.automl.tuner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.automl.trial.TrialResult;
import com.automl.trial.TrialSettings;

/**
 * Walks the cartesian product of per-parameter grids, last parameter varying fastest, and reports
 * exhaustion once every combination was proposed.
 */
public class GridSearchTuner implements Tuner {
    private final List<String> names = new ArrayList<>();
    private final List<List<Object>> axes = new ArrayList<>();
    private final long totalCombinations;
    private long position;
    private int nextTrialId;

    public GridSearchTuner(SearchSpace searchSpace, int stepsPerParameter) {
        if (searchSpace.isEmpty()) {
            throw new IllegalArgumentException("grid search requires at least one parameter");
        }
        if (stepsPerParameter < 1) {
            throw new IllegalArgumentException("stepsPerParameter must be >= 1");
        }
        long combinations = 1;
        for (Map.Entry<String, SearchSpace.Parameter> entry : searchSpace.parameters().entrySet()) {
            List<Object> axis = entry.getValue().grid(stepsPerParameter);
            names.add(entry.getKey());
            axes.add(axis);
            combinations = Math.multiplyExact(combinations, axis.size());
        }
        this.totalCombinations = combinations;
    }

    public long totalCombinations() {
        return totalCombinations;
    }

    @Override
    public Optional<TrialSettings> propose(List<TrialResult> history) {
        if (position >= totalCombinations) {
            return Optional.empty();
        }
        long remainder = position++;
        Object[] values = new Object[axes.size()];
        for (int i = axes.size() - 1; i >= 0; i--) {
            List<Object> axis = axes.get(i);
            values[i] = axis.get((int) (remainder % axis.size()));
            remainder /= axis.size();
        }
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            parameters.put(names.get(i), values[i]);
        }
        return Optional.of(new TrialSettings(nextTrialId++, parameters));
    }
}
