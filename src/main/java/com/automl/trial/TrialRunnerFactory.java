package com.automl.trial;

@FunctionalInterface
public interface TrialRunnerFactory {
    TrialRunner create(TrialRunnerContext context);
}
