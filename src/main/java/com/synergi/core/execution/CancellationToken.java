package com.synergi.core.execution;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Cooperative cancellation signal.
 * <p>
 * A task owns one root token; each guarded call gets a {@link #child()} that is cancelled
 * with its parent and can also be cancelled on its own (for example when a deadline passes).
 * The first reason given wins.
 */
public final class CancellationToken {

    private final CancellationToken parent;
    private final CopyOnWriteArrayList<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile String reason;
    private Registration parentRegistration;

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public static CancellationToken create() {
        return new CancellationToken(null);
    }

    /**
     * Token that is cancelled whenever this one is. Call {@link #detach()} once it is no longer needed.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken(this);
        child.parentRegistration = onCancel(() -> child.cancel(reason()));
        return child;
    }

    public void cancel(String why) {
        synchronized (this) {
            if (reason != null) {
                return;
            }
            reason = why != null ? why : "cancelled";
        }
        for (Runnable callback : callbacks) {
            callback.run();
        }
        callbacks.clear();
    }

    public boolean isCancelled() {
        return reason != null || (parent != null && parent.isCancelled());
    }

    public String reason() {
        if (reason != null) {
            return reason;
        }
        return parent != null ? parent.reason() : null;
    }

    /**
     * @throws TaskCancelledException if this token or an ancestor is cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new TaskCancelledException(reason());
        }
    }

    /**
     * Runs {@code callback} on cancellation, or immediately if already cancelled.
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (reason != null && callbacks.remove(callback)) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Stops listening to the parent token.
     */
    public void detach() {
        if (parentRegistration != null) {
            parentRegistration.remove();
            parentRegistration = null;
        }
    }

    @FunctionalInterface
    public interface Registration {
        void remove();
    }
}
