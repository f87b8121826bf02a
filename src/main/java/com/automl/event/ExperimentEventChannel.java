package com.automl.event;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explicit event bus for one experiment. Listeners run synchronously on the publishing thread, in
 * publish order, and may cancel the experiment from inside {@link ExperimentEventListener#onEvent}.
 */
public class ExperimentEventChannel {
    private static final Logger log = LoggerFactory.getLogger(ExperimentEventChannel.class);

    private final List<ExperimentEventListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(ExperimentEventListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(ExperimentEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(ExperimentEventType type, String source, int trialId, String message) {
        ExperimentEvent event = new ExperimentEvent(type, source, trialId, message, Instant.now());
        log.debug("event type={} source={} trialId={} message={}", type, source, trialId, message);
        for (ExperimentEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("event.listener.failed type={} trialId={} reason={}", type, trialId, e.getMessage(), e);
            }
        }
    }

    /**
     * Free-form progress message, as emitted by trial runners.
     */
    public void info(String source, int trialId, String message) {
        publish(ExperimentEventType.MESSAGE, source, trialId, message);
    }
}
