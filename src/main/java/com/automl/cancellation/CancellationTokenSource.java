package com.automl.cancellation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner side of a {@link CancellationToken}. {@link #cancel()} may be called from any thread,
 * including from a callback or event listener running on the thread that observes the token.
 */
public class CancellationTokenSource implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CancellationTokenSource.class);

    private static final ScheduledExecutorService TIMER = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "cancellation-timer");
        thread.setDaemon(true);
        return thread;
    });

    private final AtomicBoolean cancellationRequested = new AtomicBoolean(false);
    private final CountDownLatch cancelledLatch = new CountDownLatch(1);
    private final Object lock = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();
    private final List<CancellationToken.Registration> links = new ArrayList<>();
    private final CancellationToken token = new CancellationToken(this);

    private ScheduledFuture<?> pendingCancel;

    public CancellationToken getToken() {
        return token;
    }

    public boolean isCancellationRequested() {
        return cancellationRequested.get();
    }

    public void cancel() {
        if (!cancellationRequested.compareAndSet(false, true)) {
            return;
        }
        cancelledLatch.countDown();
        List<Runnable> toRun;
        synchronized (lock) {
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
            if (pendingCancel != null) {
                pendingCancel.cancel(false);
                pendingCancel = null;
            }
        }
        for (Runnable callback : toRun) {
            runCallback(callback);
        }
    }

    /**
     * Schedules {@link #cancel()} after the given delay, replacing any earlier schedule.
     */
    public void cancelAfter(Duration delay) {
        if (delay.isNegative()) {
            throw new IllegalArgumentException("cancellation delay must be >= 0");
        }
        synchronized (lock) {
            if (cancellationRequested.get()) {
                return;
            }
            if (pendingCancel != null) {
                pendingCancel.cancel(false);
            }
            pendingCancel = TIMER.schedule(this::cancel, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Creates a source that is cancelled as soon as any of the given tokens is cancelled.
     * Cancelling the linked source never cancels the originals.
     */
    public static CancellationTokenSource createLinked(CancellationToken... tokens) {
        CancellationTokenSource linked = new CancellationTokenSource();
        for (CancellationToken other : tokens) {
            CancellationToken.Registration registration = other.register(linked::cancel);
            synchronized (linked.lock) {
                linked.links.add(registration);
            }
        }
        return linked;
    }

    CancellationToken.Registration register(Runnable callback) {
        synchronized (lock) {
            if (!cancellationRequested.get()) {
                callbacks.add(callback);
                return () -> {
                    synchronized (lock) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        runCallback(callback);
        return () -> {
        };
    }

    boolean awaitCancellation(Duration timeout) throws InterruptedException {
        return cancelledLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        List<CancellationToken.Registration> toClose;
        synchronized (lock) {
            if (pendingCancel != null) {
                pendingCancel.cancel(false);
                pendingCancel = null;
            }
            toClose = new ArrayList<>(links);
            links.clear();
        }
        toClose.forEach(CancellationToken.Registration::close);
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("cancellation.callback.failed reason={}", e.getMessage(), e);
        }
    }
}
