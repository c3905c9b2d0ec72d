package dev.agentsdk.claude.internal;

import dev.agentsdk.claude.exceptions.CLIConnectionException;
import dev.agentsdk.claude.exceptions.ClaudeSDKException;
import dev.agentsdk.claude.exceptions.ControlProtocolException;
import dev.agentsdk.claude.exceptions.ControlRequestFailedException;
import dev.agentsdk.claude.exceptions.ControlRequestTimeoutException;
import dev.agentsdk.claude.hooks.AbortSignal;
import dev.agentsdk.claude.hooks.HookDispatcher;
import dev.agentsdk.claude.hooks.HookMatcher;
import dev.agentsdk.claude.mcp.SdkMcpServer;
import dev.agentsdk.claude.transport.Transport;
import dev.agentsdk.claude.types.options.PermissionMode;
import dev.agentsdk.claude.types.permissions.PermissionContext;
import dev.agentsdk.claude.types.permissions.PermissionResult;
import dev.agentsdk.claude.types.permissions.PermissionUpdate;
import dev.agentsdk.claude.types.permissions.ToolPermissionCallback;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.type.MapType;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Control protocol multiplexer on top of a {@link Transport}.
 * <p>
 * A single reading loop classifies every inbound message: control responses
 * resolve pending outbound requests by id, control requests (permission checks,
 * hook callbacks, in-process MCP calls) each run in their own handler task,
 * cancel requests abort the named handler, and everything else is queued for
 * the consumer in arrival order.
 */
public final class ControlProtocol implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ControlProtocol.class);

    static final String CANCELLED = "Cancelled";

    private static final Duration DEFAULT_CONTROL_TIMEOUT = Duration.ofSeconds(60);
    private static final Duration DEFAULT_LONG_CONTROL_TIMEOUT = Duration.ofMinutes(10);

    private final Transport transport;
    private final boolean streamingMode;
    @Nullable
    private final ToolPermissionCallback canUseTool;
    private final HookDispatcher hookDispatcher;
    private final Map<String, SdkMcpServer> sdkMcpServers;
    private final Duration controlRequestTimeout;
    private final Duration longControlRequestTimeout;

    private final ObjectMapper mapper = new ObjectMapper();
    private final MapType mapType =
            mapper.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, Object.class);
    private final MessageQueue messageQueue = new MessageQueue();
    private final Map<String, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();
    private final Map<String, InFlightRequest> inflightRequests = new ConcurrentHashMap<>();
    private final AtomicLong requestCounter = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Object writeLock = new Object();
    private final CompletableFuture<Void> firstResult = new CompletableFuture<>();
    private final ExecutorService readerExecutor;
    private final ExecutorService handlerExecutor;

    private volatile boolean closed;
    private volatile boolean readerFinished;
    private volatile JsonNode initializationResult;

    @Builder
    private ControlProtocol(
            Transport transport,
            boolean streamingMode,
            @Nullable ToolPermissionCallback canUseTool,
            @Nullable Map<String, List<HookMatcher>> hooks,
            @Nullable Map<String, SdkMcpServer> sdkMcpServers,
            @Nullable Duration controlRequestTimeout,
            @Nullable Duration longControlRequestTimeout
    ) {
        this.transport = transport;
        this.streamingMode = streamingMode;
        this.canUseTool = canUseTool;
        this.sdkMcpServers = sdkMcpServers != null ? Map.copyOf(sdkMcpServers) : Collections.emptyMap();
        this.controlRequestTimeout = controlRequestTimeout != null ? controlRequestTimeout : DEFAULT_CONTROL_TIMEOUT;
        this.longControlRequestTimeout = longControlRequestTimeout != null
                ? longControlRequestTimeout
                : DEFAULT_LONG_CONTROL_TIMEOUT;
        this.readerExecutor = Executors.newSingleThreadExecutor(daemonThreads("claude-sdk-reader"));
        this.handlerExecutor = Executors.newCachedThreadPool(daemonThreads("claude-sdk-control"));
        this.hookDispatcher = new HookDispatcher(hooks, mapper, handlerExecutor);
    }

    /**
     * Start the reading loop. Subsequent calls do nothing.
     */
    public void start() {
        if (started.compareAndSet(false, true)) {
            readerExecutor.submit(this::readMessages);
        }
    }

    /**
     * Perform the initialize handshake, registering hook callbacks with the CLI.
     *
     * @return the CLI's initialize response, or {@code null} outside streaming mode
     */
    public CompletableFuture<JsonNode> initialize(Duration timeout) {
        if (!streamingMode) {
            return CompletableFuture.completedFuture(null);
        }
        ObjectNode request = mapper.createObjectNode();
        request.put("subtype", "initialize");
        ObjectNode hooksConfig = hookDispatcher.buildConfig();
        if (hooksConfig != null) {
            request.set("hooks", hooksConfig);
        } else {
            request.putNull("hooks");
        }
        return sendControlRequest(request, timeout).thenApply(response -> {
            initializationResult = response;
            return response;
        });
    }

    public CompletableFuture<JsonNode> initialize() {
        return initialize(controlRequestTimeout);
    }

    /**
     * Initialize response received from the CLI, or {@code null} before the handshake.
     */
    @Nullable
    public JsonNode getInitializationResult() {
        return initializationResult;
    }

    public CompletableFuture<JsonNode> interrupt() {
        return sendControlRequest(request("interrupt"), controlRequestTimeout);
    }

    public CompletableFuture<JsonNode> setPermissionMode(PermissionMode mode) {
        ObjectNode request = request("set_permission_mode");
        request.put("mode", mode.getValue());
        return sendControlRequest(request, controlRequestTimeout);
    }

    /**
     * @param model model name, or {@code null} for the default model
     */
    public CompletableFuture<JsonNode> setModel(@Nullable String model) {
        ObjectNode request = request("set_model");
        request.put("model", model);
        return sendControlRequest(request, controlRequestTimeout);
    }

    public CompletableFuture<JsonNode> getMcpStatus() {
        return sendControlRequest(request("mcp_status"), controlRequestTimeout);
    }

    /**
     * Restore files to their state at the given user message. Requires file checkpointing.
     */
    public CompletableFuture<JsonNode> rewindFiles(String userMessageUuid) {
        ObjectNode request = request("rewind_files");
        request.put("userMessageUuid", userMessageUuid);
        return sendControlRequest(request, longControlRequestTimeout);
    }

    public CompletableFuture<JsonNode> sendControlRequest(ObjectNode request) {
        return sendControlRequest(request, controlRequestTimeout);
    }

    /**
     * Send a control request and complete with the payload of its response.
     * <p>
     * The returned future fails with {@link ControlRequestTimeoutException} when no
     * response arrives in time, with {@link ControlRequestFailedException} when the
     * CLI answers with an error, and with {@link CLIConnectionException} when the
     * stream ends first.
     *
     * @throws ControlProtocolException outside streaming mode
     */
    public CompletableFuture<JsonNode> sendControlRequest(ObjectNode request, Duration timeout) {
        if (!streamingMode) {
            throw new ControlProtocolException("Control requests require streaming mode");
        }
        String subtype = request.path("subtype").asText("unknown");
        if (closed) {
            return CompletableFuture.failedFuture(new CLIConnectionException("Query is closed"));
        }
        if (readerFinished) {
            return CompletableFuture.failedFuture(new CLIConnectionException("CLI output has ended"));
        }

        String requestId = "req_" + requestCounter.incrementAndGet() + "_"
                + UUID.randomUUID().toString().substring(0, 8);
        CompletableFuture<JsonNode> pending = new CompletableFuture<>();
        pendingRequests.put(requestId, pending);
        if (readerFinished) {
            pendingRequests.remove(requestId);
            return CompletableFuture.failedFuture(new CLIConnectionException("CLI output has ended"));
        }

        ObjectNode envelope = mapper.createObjectNode();
        envelope.put("type", "control_request");
        envelope.put("request_id", requestId);
        envelope.set("request", request);
        try {
            writeLine(envelope);
        } catch (RuntimeException e) {
            pendingRequests.remove(requestId);
            return CompletableFuture.failedFuture(e);
        }
        logger.debug("Sent control request {} ({})", requestId, subtype);

        return pending.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error == null) {
                        JsonNode payload = response.get("response");
                        return payload != null && !payload.isNull() ? payload : mapper.createObjectNode();
                    }
                    pendingRequests.remove(requestId);
                    Throwable cause = unwrap(error);
                    if (cause instanceof TimeoutException) {
                        throw new ControlRequestTimeoutException(subtype, timeout);
                    }
                    throw cause instanceof RuntimeException
                            ? (RuntimeException) cause
                            : new CompletionException(cause);
                });
    }

    /**
     * Write a data message, such as a user message, to the CLI.
     */
    public CompletableFuture<Void> sendMessage(Map<String, Object> message) {
        try {
            writeLine(mapper.valueToTree(message));
            return CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Write every message, then close the input side.
     * <p>
     * When the CLI may still need to send control requests (permission checks,
     * hooks or in-process MCP servers), input stays open until the first result
     * message arrives or the control request timeout elapses.
     */
    public CompletableFuture<Void> streamInput(Iterable<Map<String, Object>> messages) {
        try {
            for (Map<String, Object> message : messages) {
                if (closed) {
                    break;
                }
                if (message != null) {
                    writeLine(mapper.valueToTree(message));
                }
            }
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (!needsOpenInput()) {
            return transport.endInput();
        }
        CompletableFuture<Void> resultOrTimeout = new CompletableFuture<>();
        firstResult.whenComplete((ignored, error) -> resultOrTimeout.complete(null));
        resultOrTimeout.completeOnTimeout(null, controlRequestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        return resultOrTimeout.thenCompose(ignored -> transport.endInput());
    }

    private boolean needsOpenInput() {
        return canUseTool != null || hookDispatcher.buildConfig() != null || !sdkMcpServers.isEmpty();
    }

    /**
     * Data messages in arrival order. The stream ends when the CLI output ends
     * or the query is closed, and throws the reading loop's error, if any, once.
     */
    public Stream<JsonNode> receiveMessages() {
        return messageQueue.stream();
    }

    int pendingRequestCount() {
        return pendingRequests.size();
    }

    boolean isPending(String requestId) {
        return pendingRequests.containsKey(requestId);
    }

    int inflightRequestCount() {
        return inflightRequests.size();
    }

    private void readMessages() {
        Throwable failure = null;
        try {
            Iterator<JsonNode> messages = transport.readMessages().iterator();
            while (!closed && messages.hasNext()) {
                route(messages.next());
            }
        } catch (RuntimeException e) {
            if (!closed) {
                failure = e;
                logger.error("Fatal error while reading CLI output", e);
            }
        } finally {
            ClaudeSDKException pendingError;
            if (failure instanceof ClaudeSDKException) {
                pendingError = (ClaudeSDKException) failure;
            } else if (failure != null) {
                pendingError = new CLIConnectionException("CLI stream failed: " + failure.getMessage(), failure);
            } else {
                pendingError = new CLIConnectionException("Connection closed before response");
            }
            readerFinished = true;
            failPendingRequests(pendingError);
            firstResult.complete(null);
            messageQueue.finish(failure);
            logger.debug("Reading loop finished");
        }
    }

    private void route(JsonNode message) {
        switch (InboundKind.of(message.path("type").asText(""))) {
            case CONTROL_RESPONSE:
                handleControlResponse(message);
                break;
            case CONTROL_REQUEST:
                handleControlRequest(message);
                break;
            case CONTROL_CANCEL_REQUEST:
                handleCancelRequest(message);
                break;
            default:
                if ("result".equals(message.path("type").asText())) {
                    firstResult.complete(null);
                }
                messageQueue.offer(message);
                break;
        }
    }

    private void handleControlResponse(JsonNode message) {
        JsonNode response = message.path("response");
        String requestId = requestId(response);
        CompletableFuture<JsonNode> pending = requestId != null ? pendingRequests.remove(requestId) : null;
        if (pending == null) {
            logger.debug("Ignoring control response for unknown request {}", requestId);
            return;
        }
        if ("error".equals(response.path("subtype").asText())) {
            pending.completeExceptionally(new ControlRequestFailedException(
                    requestId,
                    response.path("error").asText("Unknown control error")
            ));
        } else {
            pending.complete(response);
        }
    }

    private void handleControlRequest(JsonNode message) {
        String requestId = requestId(message);
        if (requestId == null) {
            logger.warn("Dropping control request without request id: {}", message);
            return;
        }
        JsonNode request = message.path("request");
        InFlightRequest inflight = new InFlightRequest(requestId);
        if (inflightRequests.putIfAbsent(requestId, inflight) != null) {
            logger.warn("Dropping duplicate control request {}", requestId);
            return;
        }
        try {
            inflight.attach(handlerExecutor.submit(() -> runHandler(inflight, request)));
        } catch (RejectedExecutionException e) {
            inflightRequests.remove(requestId, inflight);
            respondError(inflight, "Query is closed");
        }
    }

    private void handleCancelRequest(JsonNode message) {
        String requestId = requestId(message);
        InFlightRequest inflight = requestId != null ? inflightRequests.get(requestId) : null;
        if (inflight == null) {
            logger.debug("Ignoring cancel for unknown control request {}", requestId);
            return;
        }
        logger.debug("Cancelling control request {}", requestId);
        respondError(inflight, CANCELLED);
        inflight.cancel(CANCELLED);
        inflightRequests.remove(requestId, inflight);
    }

    private void runHandler(InFlightRequest inflight, JsonNode request) {
        try {
            Map<String, Object> response = dispatch(request, inflight.getSignal());
            respondSuccess(inflight, response);
        } catch (InterruptedException e) {
            respondError(inflight, CANCELLED);
            Thread.currentThread().interrupt();
        } catch (CancellationException e) {
            respondError(inflight, CANCELLED);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e);
            logger.warn("Control request {} failed", inflight.getRequestId(), cause);
            respondError(inflight, describe(cause));
        } catch (RuntimeException e) {
            logger.warn("Control request {} failed", inflight.getRequestId(), e);
            respondError(inflight, describe(e));
        } catch (Error e) {
            logger.error("Control request {} failed", inflight.getRequestId(), e);
            respondError(inflight, describe(e));
            throw e;
        } finally {
            inflightRequests.remove(inflight.getRequestId(), inflight);
        }
    }

    private Map<String, Object> dispatch(JsonNode request, AbortSignal signal)
            throws InterruptedException, ExecutionException {
        String subtype = request.path("subtype").asText(null);
        ControlSubtype kind = ControlSubtype.fromWire(subtype);
        if (kind == null) {
            throw new ControlProtocolException("Unsupported control request subtype: " + subtype);
        }
        switch (kind) {
            case CAN_USE_TOOL:
                return handlePermissionRequest(request, signal);
            case HOOK_CALLBACK:
                return hookDispatcher.dispatch(request, signal);
            case MCP_MESSAGE:
                return handleMcpMessage(request);
            default:
                throw new ControlProtocolException("Unsupported control request subtype: " + subtype);
        }
    }

    private Map<String, Object> handlePermissionRequest(JsonNode request, AbortSignal signal)
            throws InterruptedException, ExecutionException {
        if (canUseTool == null) {
            throw new ControlProtocolException("canUseTool callback is not provided");
        }
        String toolName = request.path("tool_name").asText("");
        Map<String, Object> toolInput = toMap(request.get("input"));
        List<Map<String, Object>> suggestions = new ArrayList<>();
        for (JsonNode suggestion : request.path("permission_suggestions")) {
            suggestions.add(toMap(suggestion));
        }

        CompletableFuture<PermissionResult> future =
                canUseTool.canUseTool(toolName, toolInput, new PermissionContext(signal, suggestions));
        PermissionResult result = future != null ? future.get() : null;

        Map<String, Object> response = new LinkedHashMap<>();
        if (result instanceof PermissionResult.Allow) {
            PermissionResult.Allow allow = (PermissionResult.Allow) result;
            response.put("behavior", "allow");
            response.put("updatedInput", allow.getUpdatedInput() != null ? allow.getUpdatedInput() : toolInput);
            List<PermissionUpdate> updates = allow.getUpdatedPermissions();
            if (updates != null && !updates.isEmpty()) {
                List<Map<String, Object>> updatePayload = new ArrayList<>();
                for (PermissionUpdate update : updates) {
                    updatePayload.add(update.toMap());
                }
                response.put("updatedPermissions", updatePayload);
            }
        } else if (result instanceof PermissionResult.Deny) {
            PermissionResult.Deny deny = (PermissionResult.Deny) result;
            response.put("behavior", "deny");
            response.put("message", deny.getMessage());
            if (deny.isInterrupt()) {
                response.put("interrupt", true);
            }
        } else {
            throw new IllegalStateException(
                    "Tool permission callback must return PermissionResult.Allow or PermissionResult.Deny, got "
                            + (result != null ? result.getClass().getName() : "null"));
        }
        return response;
    }

    private Map<String, Object> handleMcpMessage(JsonNode request) throws InterruptedException {
        String serverName = request.path("server_name").asText(null);
        JsonNode message = request.get("message");
        if (serverName == null || message == null || !message.isObject()) {
            throw new ControlProtocolException("Missing server_name or message for MCP request");
        }

        Map<String, Object> mcpResponse;
        SdkMcpServer server = sdkMcpServers.get(serverName);
        if (server == null) {
            Object id = message.hasNonNull("id") ? mapper.convertValue(message.get("id"), Object.class) : null;
            mcpResponse = SdkMcpServer.errorResponse(id, SdkMcpServer.METHOD_NOT_FOUND,
                    "Server '" + serverName + "' not found");
        } else {
            mcpResponse = server.handleMessage(message);
        }
        return Collections.singletonMap("mcp_response", mcpResponse);
    }

    private void respondSuccess(InFlightRequest inflight, Map<String, Object> payload) {
        if (!inflight.claimResponse()) {
            return;
        }
        ObjectNode inner = responseEnvelope(inflight.getRequestId(), "success");
        inner.set("response", mapper.valueToTree(payload));
        writeResponse(inner);
    }

    private void respondError(InFlightRequest inflight, String error) {
        if (!inflight.claimResponse()) {
            return;
        }
        ObjectNode inner = responseEnvelope(inflight.getRequestId(), "error");
        inner.put("error", error);
        writeResponse(inner);
    }

    private ObjectNode responseEnvelope(String requestId, String subtype) {
        ObjectNode inner = mapper.createObjectNode();
        inner.put("subtype", subtype);
        inner.put("request_id", requestId);
        inner.put("requestId", requestId);
        return inner;
    }

    private void writeResponse(ObjectNode inner) {
        ObjectNode envelope = mapper.createObjectNode();
        envelope.put("type", "control_response");
        envelope.set("response", inner);
        try {
            writeLine(envelope);
        } catch (RuntimeException e) {
            logger.error("Failed to write control response for {}", inner.path("request_id").asText(), e);
        }
    }

    private void writeLine(JsonNode payload) {
        String line;
        try {
            line = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ControlProtocolException("Failed to encode message: " + e.getOriginalMessage());
        }
        synchronized (writeLock) {
            try {
                transport.write(line).join();
            } catch (CompletionException e) {
                Throwable cause = unwrap(e);
                throw cause instanceof RuntimeException
                        ? (RuntimeException) cause
                        : new CLIConnectionException("Failed to write to CLI", cause);
            }
        }
    }

    private void failPendingRequests(ClaudeSDKException error) {
        for (String requestId : new ArrayList<>(pendingRequests.keySet())) {
            CompletableFuture<JsonNode> pending = pendingRequests.remove(requestId);
            if (pending != null) {
                pending.completeExceptionally(error);
            }
        }
    }

    private ObjectNode request(String subtype) {
        ObjectNode request = mapper.createObjectNode();
        request.put("subtype", subtype);
        return request;
    }

    private Map<String, Object> toMap(@Nullable JsonNode node) {
        if (node == null || !node.isObject()) {
            return new LinkedHashMap<>();
        }
        return mapper.convertValue(node, mapType);
    }

    @Nullable
    private static String requestId(JsonNode node) {
        JsonNode id = node.get("request_id");
        if (id == null || id.isNull()) {
            id = node.get("requestId");
        }
        return id != null && !id.isNull() ? id.asText() : null;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (InFlightRequest inflight : inflightRequests.values()) {
            inflight.cancel("Query closed");
        }
        inflightRequests.clear();
        readerExecutor.shutdownNow();
        handlerExecutor.shutdownNow();
        transport.close();
        failPendingRequests(new CLIConnectionException("Query closed"));
        firstResult.complete(null);
        messageQueue.finish(null);
    }

    /**
     * Inbound message kinds; anything unrecognized is a data message.
     */
    enum InboundKind {
        CONTROL_RESPONSE,
        CONTROL_REQUEST,
        CONTROL_CANCEL_REQUEST,
        DATA;

        static InboundKind of(String type) {
            switch (type) {
                case "control_response":
                    return CONTROL_RESPONSE;
                case "control_request":
                    return CONTROL_REQUEST;
                case "control_cancel_request":
                    return CONTROL_CANCEL_REQUEST;
                default:
                    return DATA;
            }
        }
    }

    /**
     * Control request subtypes the CLI may send to the SDK.
     */
    enum ControlSubtype {
        CAN_USE_TOOL("can_use_tool"),
        HOOK_CALLBACK("hook_callback"),
        MCP_MESSAGE("mcp_message");

        private final String wireName;

        ControlSubtype(String wireName) {
            this.wireName = wireName;
        }

        @Nullable
        static ControlSubtype fromWire(@Nullable String wireName) {
            for (ControlSubtype subtype : values()) {
                if (subtype.wireName.equals(wireName)) {
                    return subtype;
                }
            }
            return null;
        }
    }
}
