package dev.agentsdk.claude.internal;

import dev.agentsdk.claude.hooks.AbortSignal;

import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An inbound control request being serviced by its own handler task.
 * <p>
 * Whoever wins {@link #claimResponse()} writes the single control response for
 * the request: the handler when it finishes, or the reading loop when the CLI
 * cancels the request first.
 */
final class InFlightRequest {

    private final String requestId;
    private final AbortSignal signal = new AbortSignal();
    private final AtomicBoolean responded = new AtomicBoolean(false);
    private Future<?> task;
    private boolean cancelled;

    InFlightRequest(String requestId) {
        this.requestId = requestId;
    }

    String getRequestId() {
        return requestId;
    }

    AbortSignal getSignal() {
        return signal;
    }

    boolean claimResponse() {
        return responded.compareAndSet(false, true);
    }

    synchronized void attach(Future<?> task) {
        this.task = task;
        if (cancelled) {
            task.cancel(true);
        }
    }

    /**
     * Aborts the signal and interrupts the handler task.
     */
    void cancel(String reason) {
        signal.abort(reason);
        synchronized (this) {
            cancelled = true;
            if (task != null) {
                task.cancel(true);
            }
        }
    }
}
