package dev.agentsdk.claude.hooks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal handed to hook, permission and tool callbacks.
 * <p>
 * The control protocol aborts the signal when the CLI cancels the request the
 * callback is servicing. Callbacks should check {@link #isAborted()} at their
 * own suspension points, or register a listener with {@link #onAbort(Runnable)}.
 *
 * <pre>{@code
 * HookCallback slowHook = (input, toolUseId, context) -> {
 *     AbortSignal signal = context.getSignal();
 *     return CompletableFuture.supplyAsync(() -> {
 *         for (String file : filesToScan) {
 *             signal.throwIfAborted();
 *             scan(file);
 *         }
 *         return Map.of();
 *     });
 * };
 * }</pre>
 */
public class AbortSignal {

    private static final Logger logger = LoggerFactory.getLogger(AbortSignal.class);

    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final List<Runnable> listeners = new ArrayList<>();
    private final CompletableFuture<Void> abortedFuture = new CompletableFuture<>();
    private volatile String reason;

    public boolean isAborted() {
        return aborted.get();
    }

    @Nullable
    public String getReason() {
        return reason;
    }

    /**
     * Registers a listener run once when the signal is aborted.
     * Runs immediately if the signal has already been aborted.
     */
    public void onAbort(Runnable listener) {
        synchronized (listeners) {
            if (!aborted.get()) {
                listeners.add(listener);
                return;
            }
        }
        runListener(listener);
    }

    /**
     * Returns a future completed when the signal is aborted.
     */
    public CompletableFuture<Void> asCompletableFuture() {
        return abortedFuture;
    }

    /**
     * Aborts the signal. Only the first call has any effect.
     *
     * @param reason reason recorded on the signal
     */
    public void abort(@Nullable String reason) {
        List<Runnable> toNotify;
        synchronized (listeners) {
            if (!aborted.compareAndSet(false, true)) {
                return;
            }
            this.reason = reason;
            toNotify = new ArrayList<>(listeners);
            listeners.clear();
        }
        toNotify.forEach(this::runListener);
        abortedFuture.complete(null);
    }

    public void abort() {
        abort(null);
    }

    /**
     * @throws CancellationException if the signal has been aborted
     */
    public void throwIfAborted() {
        if (aborted.get()) {
            throw new CancellationException(reason != null ? reason : "Operation aborted");
        }
    }

    public static AbortSignal aborted(String reason) {
        AbortSignal signal = new AbortSignal();
        signal.abort(reason);
        return signal;
    }

    private void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            logger.warn("Abort listener failed", e);
        }
    }
}
