package dev.agentsdk.claude.transport;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Transport layer for communication with Claude Code CLI.
 * <p>
 * Implementations may connect to a remote CLI instead of spawning one. Writes
 * from different threads must not interleave within a line.
 */
public interface Transport extends Closeable {

    /**
     * Connect to the CLI process.
     */
    CompletableFuture<Void> connect();

    /**
     * Write one line to the CLI input.
     *
     * @param line JSON text without the trailing newline
     */
    CompletableFuture<Void> write(String line);

    /**
     * Read decoded JSON messages from the CLI output.
     * <p>
     * The stream ends when the CLI closes its output; decoding or process
     * failures surface as exceptions thrown while iterating it.
     */
    Stream<JsonNode> readMessages();

    /**
     * Close the input side without shutting down the transport.
     */
    CompletableFuture<Void> endInput();

    /**
     * Check if the transport is ready.
     */
    boolean isReady();

    /**
     * Close the transport and cleanup resources.
     */
    @Override
    void close();
}
