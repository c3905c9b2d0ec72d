package dev.agentsdk.claude.client;

import dev.agentsdk.claude.exceptions.CLIConnectionException;
import dev.agentsdk.claude.internal.ControlProtocol;
import dev.agentsdk.claude.internal.QueryRunner;
import dev.agentsdk.claude.protocol.MessageParser;
import dev.agentsdk.claude.transport.SubprocessTransport;
import dev.agentsdk.claude.transport.Transport;
import dev.agentsdk.claude.types.messages.Message;
import dev.agentsdk.claude.types.messages.ResultMessage;
import dev.agentsdk.claude.types.options.ClaudeAgentOptions;
import dev.agentsdk.claude.types.options.PermissionMode;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Interactive client for bidirectional conversations with Claude Code.
 * <p>
 * Always runs the CLI in streaming mode, so permission callbacks, hooks and
 * in-process MCP servers are available for the whole session.
 *
 * <pre>{@code
 * try (ClaudeSDKClient client = new ClaudeSDKClient(options)) {
 *     client.connect().join();
 *     client.query("What is the capital of France?").join();
 *     client.receiveResponse().forEach(System.out::println);
 * }
 * }</pre>
 */
public final class ClaudeSDKClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ClaudeSDKClient.class);

    static final String CLIENT_ENTRYPOINT = "sdk-java-client";

    private final ClaudeAgentOptions originalOptions;
    @Nullable
    private final Transport customTransport;
    private final MessageParser parser = new MessageParser();
    private final AtomicBoolean connected = new AtomicBoolean(false);

    private ClaudeAgentOptions effectiveOptions;
    private ControlProtocol protocol;

    public ClaudeSDKClient() {
        this(ClaudeAgentOptions.builder().build(), null);
    }

    public ClaudeSDKClient(ClaudeAgentOptions options) {
        this(options, null);
    }

    public ClaudeSDKClient(ClaudeAgentOptions options, @Nullable Transport transport) {
        this.originalOptions = Objects.requireNonNull(options, "options");
        this.customTransport = transport;
    }

    /**
     * Connect to Claude without sending an initial prompt.
     */
    public synchronized CompletableFuture<Void> connect() {
        if (connected.get()) {
            return CompletableFuture.completedFuture(null);
        }

        ClaudeAgentOptions options = originalOptions;
        if (ClaudeAgentOptions.DEFAULT_ENTRYPOINT.equals(options.getEntrypoint())) {
            options = options.toBuilder().entrypoint(CLIENT_ENTRYPOINT).build();
        }
        effectiveOptions = QueryRunner.prepareStreamingOptions(options);
        Transport transport = customTransport != null ? customTransport : new SubprocessTransport(effectiveOptions);
        protocol = QueryRunner.newProtocol(transport, effectiveOptions);
        ControlProtocol current = protocol;

        return transport.connect()
                .thenCompose(ignored -> {
                    current.start();
                    return current.initialize(effectiveOptions.getInitializeTimeout());
                })
                .thenAccept(response -> {
                    connected.set(true);
                    logger.debug("Connected to Claude Code CLI");
                })
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        current.close();
                    }
                });
    }

    /**
     * Connect and immediately send an initial prompt.
     */
    public CompletableFuture<Void> connect(String prompt) {
        return connect().thenCompose(ignored -> query(prompt));
    }

    /**
     * Connect and stream initial prompt messages. Input stays open afterwards.
     */
    public CompletableFuture<Void> connect(Iterable<Map<String, Object>> prompts) {
        return connect().thenCompose(ignored -> query(prompts));
    }

    /**
     * Send a user message in the default session.
     */
    public CompletableFuture<Void> query(String prompt) {
        return query(prompt, "default");
    }

    /**
     * Send a user message with a custom session id.
     */
    public CompletableFuture<Void> query(String prompt, String sessionId) {
        ensureConnected();
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", "user");
        message.put("content", prompt);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", "user");
        data.put("message", message);
        data.put("parent_tool_use_id", null);
        data.put("session_id", sessionId);
        return protocol.sendMessage(data);
    }

    /**
     * Send a batch of prompt messages in the default session.
     */
    public CompletableFuture<Void> query(Iterable<Map<String, Object>> messages) {
        return query(messages, "default");
    }

    public CompletableFuture<Void> query(Iterable<Map<String, Object>> messages, String sessionId) {
        ensureConnected();
        List<Map<String, Object>> normalized = new ArrayList<>();
        for (Map<String, Object> message : messages) {
            if (message == null) {
                continue;
            }
            Map<String, Object> copy = new LinkedHashMap<>(message);
            copy.putIfAbsent("session_id", sessionId);
            normalized.add(copy);
        }
        CompletableFuture<Void> sent = CompletableFuture.completedFuture(null);
        for (Map<String, Object> message : normalized) {
            sent = sent.thenCompose(ignored -> protocol.sendMessage(message));
        }
        return sent;
    }

    /**
     * All messages from Claude, across turns, until the CLI output ends.
     */
    public Stream<Message> receiveMessages() {
        ensureConnected();
        return protocol.receiveMessages().map(parser::parse);
    }

    /**
     * Messages of the current turn, up to and including its {@link ResultMessage}.
     */
    public Stream<Message> receiveResponse() {
        Iterator<Message> messages = receiveMessages().iterator();
        Iterator<Message> untilResult = new Iterator<>() {
            private boolean done;

            @Override
            public boolean hasNext() {
                return !done && messages.hasNext();
            }

            @Override
            public Message next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Message message = messages.next();
                if (message instanceof ResultMessage) {
                    done = true;
                }
                return message;
            }
        };
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(untilResult, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /**
     * Interrupt the active conversation.
     */
    public CompletableFuture<Void> interrupt() {
        ensureConnected();
        return protocol.interrupt().thenAccept(ignored -> { });
    }

    public CompletableFuture<Void> setPermissionMode(PermissionMode mode) {
        ensureConnected();
        return protocol.setPermissionMode(mode).thenAccept(ignored -> { });
    }

    /**
     * @param model model name, or {@code null} for the default model
     */
    public CompletableFuture<Void> setModel(@Nullable String model) {
        ensureConnected();
        return protocol.setModel(model).thenAccept(ignored -> { });
    }

    /**
     * Restore files to their state at the given user message.
     * Requires {@code enableFileCheckpointing} in the options.
     */
    public CompletableFuture<Void> rewindFiles(String userMessageUuid) {
        ensureConnected();
        return protocol.rewindFiles(userMessageUuid).thenAccept(ignored -> { });
    }

    /**
     * Connection status of every MCP server known to the CLI.
     */
    public CompletableFuture<JsonNode> getMcpStatus() {
        ensureConnected();
        return protocol.getMcpStatus();
    }

    /**
     * Initialize response from the CLI, or {@code null} when not connected.
     */
    @Nullable
    public JsonNode getServerInfo() {
        ControlProtocol current = protocol;
        return current != null ? current.getInitializationResult() : null;
    }

    public boolean isConnected() {
        return connected.get();
    }

    private void ensureConnected() {
        if (!connected.get() || protocol == null) {
            throw new CLIConnectionException("Not connected. Call connect() first.");
        }
    }

    @Override
    public synchronized void close() {
        connected.set(false);
        if (protocol != null) {
            protocol.close();
            protocol = null;
        }
    }
}
