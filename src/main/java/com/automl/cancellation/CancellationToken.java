package com.automl.cancellation;

import java.time.Duration;

/**
 * Read side of a cancellation signal. Obtained from a {@link CancellationTokenSource}; the flag is
 * never cached, every query observes the latest state.
 */
public final class CancellationToken {
    public static final CancellationToken NONE = new CancellationToken(null);

    private final CancellationTokenSource source;

    CancellationToken(CancellationTokenSource source) {
        this.source = source;
    }

    public boolean isCancellationRequested() {
        return source != null && source.isCancellationRequested();
    }

    public boolean canBeCancelled() {
        return source != null;
    }

    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new TrialCancelledException("cancellation requested");
        }
    }

    /**
     * Blocks until cancellation is requested or the timeout elapses.
     *
     * @return {@code true} if cancellation was requested
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (source == null) {
            Thread.sleep(timeout.toMillis());
            return false;
        }
        return source.awaitCancellation(timeout);
    }

    /**
     * Registers a callback run once on cancellation, on the cancelling thread. Runs immediately
     * when cancellation was already requested.
     */
    public Registration register(Runnable callback) {
        if (source == null) {
            return () -> {
            };
        }
        return source.register(callback);
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
