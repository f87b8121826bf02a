package com.automl.tuner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Named hyperparameters a tuner samples from, in declaration order.
 */
public final class SearchSpace {
    private final Map<String, Parameter> parameters;

    private SearchSpace(Map<String, Parameter> parameters) {
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static SearchSpace empty() {
        return new SearchSpace(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Parameter> parameters() {
        return parameters;
    }

    public boolean isEmpty() {
        return parameters.isEmpty();
    }

    public interface Parameter {
        Object sample(Random random);

        List<Object> grid(int steps);
    }

    public record UniformDouble(double min, double max, boolean logScale) implements Parameter {
        public UniformDouble {
            if (!(min <= max)) {
                throw new IllegalArgumentException("min must be <= max, got [" + min + ", " + max + "]");
            }
            if (logScale && min <= 0) {
                throw new IllegalArgumentException("log-scale range must be positive, got min=" + min);
            }
        }

        @Override
        public Object sample(Random random) {
            return fromUnit(random.nextDouble());
        }

        @Override
        public List<Object> grid(int steps) {
            if (steps <= 1 || min == max) {
                return List.of(fromUnit(0.5));
            }
            List<Object> values = new ArrayList<>(steps);
            for (int i = 0; i < steps; i++) {
                values.add(fromUnit(i / (double) (steps - 1)));
            }
            return values;
        }

        private double fromUnit(double u) {
            if (logScale) {
                double logMin = Math.log(min);
                return Math.exp(logMin + u * (Math.log(max) - logMin));
            }
            return min + u * (max - min);
        }
    }

    public record UniformInt(int min, int max) implements Parameter {
        public UniformInt {
            if (min > max) {
                throw new IllegalArgumentException("min must be <= max, got [" + min + ", " + max + "]");
            }
        }

        @Override
        public Object sample(Random random) {
            return (int) (min + random.nextLong(span()));
        }

        @Override
        public List<Object> grid(int steps) {
            if (span() <= steps) {
                List<Object> all = new ArrayList<>();
                for (long value = min; value <= max; value++) {
                    all.add((int) value);
                }
                return all;
            }
            if (steps <= 1) {
                return List.of((int) (((long) min + max) / 2));
            }
            Set<Object> values = new LinkedHashSet<>();
            for (int i = 0; i < steps; i++) {
                values.add((int) Math.round(min + ((long) max - min) * (i / (double) (steps - 1))));
            }
            return new ArrayList<>(values);
        }

        private long span() {
            return (long) max - min + 1;
        }
    }

    public record Choice(List<Object> values) implements Parameter {
        public Choice {
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("choice parameter needs at least one value");
            }
            values = List.copyOf(values);
        }

        @Override
        public Object sample(Random random) {
            return values.get(random.nextInt(values.size()));
        }

        @Override
        public List<Object> grid(int steps) {
            return values;
        }
    }

    public static final class Builder {
        private final Map<String, Parameter> parameters = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder uniformDouble(String name, double min, double max) {
            return add(name, new UniformDouble(min, max, false));
        }

        public Builder logUniformDouble(String name, double min, double max) {
            return add(name, new UniformDouble(min, max, true));
        }

        public Builder uniformInt(String name, int min, int max) {
            return add(name, new UniformInt(min, max));
        }

        public Builder choice(String name, List<?> values) {
            return add(name, new Choice(new ArrayList<>(values)));
        }

        public Builder add(String name, Parameter parameter) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("parameter name must not be blank");
            }
            if (parameters.putIfAbsent(name, parameter) != null) {
                throw new IllegalArgumentException("duplicate parameter " + name);
            }
            return this;
        }

        public SearchSpace build() {
            return new SearchSpace(parameters);
        }
    }
}
