package com.github.stormino.trackdl.model;

import com.github.stormino.trackdl.exception.DownloadCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a task's owner and the code doing the work.
 * Cancellation is advisory: workers observe it at their own check points.
 */
@Slf4j
public class CancellationSignal {

    public static final String DEFAULT_REASON = "Download was cancelled";

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> unlinkActions = new CopyOnWriteArrayList<>();
    private volatile String reason;

    /**
     * Signal that links itself to every given parent: cancelling any parent cancels it.
     * Null parents are ignored. Call {@link #unlink()} once the child is no longer used,
     * otherwise a long-lived parent keeps a listener for it.
     */
    public static CancellationSignal linkedTo(CancellationSignal... parents) {
        CancellationSignal child = new CancellationSignal();
        for (CancellationSignal parent : parents) {
            if (parent != null) {
                Runnable propagate = () -> child.cancel(parent.getReason());
                child.unlinkActions.add(() -> parent.removeListener(propagate));
                parent.onCancel(propagate);
            }
        }
        return child;
    }

    /**
     * Detach this signal from the parents it was linked to. Its own state is unchanged.
     */
    public void unlink() {
        for (Runnable action : unlinkActions) {
            if (unlinkActions.remove(action)) {
                action.run();
            }
        }
    }

    public boolean cancel() {
        return cancel(DEFAULT_REASON);
    }

    /**
     * @return true if this call cancelled the signal, false if it was already cancelled
     */
    public boolean cancel(String reason) {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        this.reason = reason != null ? reason : DEFAULT_REASON;
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                runListener(listener);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }

    /**
     * Registers a callback run once on cancellation. Runs immediately if already cancelled.
     */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            runListener(listener);
        }
    }

    public void removeListener(Runnable listener) {
        listeners.remove(listener);
    }

    /**
     * Listeners still waiting for cancellation.
     */
    public int getListenerCount() {
        return listeners.size();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new DownloadCancelledException(reason);
        }
    }

    private void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed: {}", e.getMessage(), e);
        }
    }
}
