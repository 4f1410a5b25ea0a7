package com.pathway.executioncontext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal for one participant session. Set when the session ends; anything suspended on the
 * session's behalf (e.g. a quota wait) registers a callback to be woken.
 */
public final class SessionCancellation {

    private static final Logger log = LoggerFactory.getLogger(SessionCancellation.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Cancels once; later calls are no-ops. Callbacks run on the calling thread. */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) return;
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed | error={}", e.getMessage(), e);
            }
        }
        callbacks.clear();
    }

    /**
     * Registers a callback; runs it immediately when already cancelled.
     *
     * @return handle that unregisters the callback
     */
    public Runnable onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }
}
