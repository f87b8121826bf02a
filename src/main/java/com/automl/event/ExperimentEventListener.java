package com.automl.event;

@FunctionalInterface
public interface ExperimentEventListener {
    void onEvent(ExperimentEvent event);
}
