package dev.agentsdk.claude.internal;

import dev.agentsdk.claude.exceptions.CLIConnectionException;
import dev.agentsdk.claude.exceptions.ClaudeSDKException;
import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * FIFO of data messages between the reading loop and the consumer.
 * <p>
 * {@link #finish(Throwable)} appends at most one error entry followed by the end
 * sentinel, exactly once. Once the consumer reaches the sentinel every further
 * {@link #take()} returns {@code null} without blocking.
 */
public final class MessageQueue {

    private static final Entry END = new Entry(null, null);

    private final BlockingQueue<Entry> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private volatile boolean drained;

    /**
     * Enqueues a data message.
     *
     * @return {@code false} if the queue has already been finished
     */
    public boolean offer(JsonNode message) {
        if (finished.get()) {
            return false;
        }
        return queue.add(new Entry(message, null));
    }

    /**
     * Ends the queue; {@code error}, if present, is raised to the consumer just before the end.
     *
     * @return {@code false} if the queue had already been finished
     */
    public boolean finish(@Nullable Throwable error) {
        if (!finished.compareAndSet(false, true)) {
            return false;
        }
        if (error != null) {
            queue.add(new Entry(null, error));
        }
        queue.add(END);
        return true;
    }

    public boolean isFinished() {
        return finished.get();
    }

    /**
     * Takes the next message, blocking until one is available.
     *
     * @return the next message, or {@code null} once the end sentinel has been reached
     * @throws ClaudeSDKException the error the reading loop terminated with
     */
    @Nullable
    public JsonNode take() throws InterruptedException {
        if (drained) {
            return null;
        }
        Entry entry = queue.take();
        if (entry == END) {
            drained = true;
            return null;
        }
        if (entry.error != null) {
            throw asSdkException(entry.error);
        }
        return entry.message;
    }

    /**
     * Ordered stream over the remaining messages, ending at the sentinel.
     * Interrupting the consuming thread fails the stream with {@link CLIConnectionException}.
     */
    public Stream<JsonNode> stream() {
        Spliterator<JsonNode> spliterator = new Spliterators.AbstractSpliterator<JsonNode>(
                Long.MAX_VALUE,
                Spliterator.ORDERED | Spliterator.NONNULL
        ) {
            @Override
            public boolean tryAdvance(Consumer<? super JsonNode> action) {
                try {
                    JsonNode message = take();
                    if (message == null) {
                        return false;
                    }
                    action.accept(message);
                    return true;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CLIConnectionException("Interrupted while waiting for messages", e);
                }
            }
        };
        return StreamSupport.stream(spliterator, false);
    }

    private static ClaudeSDKException asSdkException(Throwable error) {
        if (error instanceof ClaudeSDKException) {
            return (ClaudeSDKException) error;
        }
        return new CLIConnectionException("Fatal error reading CLI output: " + error.getMessage(), error);
    }

    private static final class Entry {
        @Nullable
        private final JsonNode message;
        @Nullable
        private final Throwable error;

        private Entry(@Nullable JsonNode message, @Nullable Throwable error) {
            this.message = message;
            this.error = error;
        }
    }
}
