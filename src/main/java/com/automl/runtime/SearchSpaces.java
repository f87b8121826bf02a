package com.automl.runtime;

import java.util.Locale;
import java.util.Map;

import com.automl.tuner.GridSearchTuner;
import com.automl.tuner.RandomSearchTuner;
import com.automl.tuner.SearchSpace;
import com.automl.tuner.Tuner;

public final class SearchSpaces {
    private SearchSpaces() {
    }

    public static SearchSpace fromConfig(Map<String, AppConfig.ParameterConfig> parameters) {
        SearchSpace.Builder builder = SearchSpace.builder();
        parameters.forEach((name, parameter) -> {
            String type = parameter.getType() == null ? "double" : parameter.getType().toLowerCase(Locale.ROOT);
            switch (type) {
                case "double" -> builder.add(name, new SearchSpace.UniformDouble(
                        required(name, "min", parameter.getMin()),
                        required(name, "max", parameter.getMax()),
                        parameter.isLogScale()));
                case "int" -> builder.uniformInt(
                        name,
                        (int) Math.round(required(name, "min", parameter.getMin())),
                        (int) Math.round(required(name, "max", parameter.getMax())));
                case "choice" -> builder.choice(name, parameter.getValues());
                default -> throw new IllegalArgumentException("Unknown parameter type '" + parameter.getType()
                        + "' for " + name + " (expected double, int or choice)");
            }
        });
        return builder.build();
    }

    public static Tuner tunerFor(AppConfig.ExperimentConfig experiment, SearchSpace searchSpace) {
        String tuner = experiment.getTuner() == null ? "random" : experiment.getTuner().toLowerCase(Locale.ROOT);
        return switch (tuner) {
            case "random" -> new RandomSearchTuner(searchSpace, experiment.getSeed());
            case "grid" -> new GridSearchTuner(searchSpace, experiment.getGridSteps());
            default -> throw new IllegalArgumentException("Unknown tuner '" + experiment.getTuner()
                    + "' (expected random or grid)");
        };
    }

    private static double required(String name, String field, Double value) {
        if (value == null) {
            throw new IllegalArgumentException("Parameter " + name + " requires '" + field + "'");
        }
        return value;
    }
}
