package com.smurthy.ai.search.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation signal shared by every layer of a call.
 *
 * Each listener runs at most once: on the cancelling thread when it was
 * registered before {@link #cancel()}, or immediately on the registering
 * thread when the signal had already fired.
 */
public final class Cancellation {

    private static final Logger log = LoggerFactory.getLogger(Cancellation.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<Runnable> listeners = ConcurrentHashMap.newKeySet();

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            fire(listener);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers {@code action} to run on cancellation. Closing the returned
     * registration removes the action if it has not run yet.
     */
    public Registration onCancel(Runnable action) {
        listeners.add(action);
        if (cancelled.get()) {
            fire(action);
        }
        return () -> listeners.remove(action);
    }

    private void fire(Runnable listener) {
        if (!listeners.remove(listener)) {
            return;
        }
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed: {}", e.getMessage());
        }
    }

    /**
     * Handle of a registered listener, usable in try-with-resources.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        Registration NONE = () -> {
        };

        @Override
        void close();
    }
}
