package dev.agentsdk.claude.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * In-memory transport: tests push CLI output with {@link #emit(String)} and
 * inspect what the SDK wrote with {@link #written()}.
 */
public class FakeTransport implements Transport {

    private static final Object END = new Object();

    private final ObjectMapper mapper = new ObjectMapper();
    private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
    private final List<JsonNode> written = new CopyOnWriteArrayList<>();
    private final Map<String, Function<JsonNode, JsonNode>> autoResponses = new ConcurrentHashMap<>();
    private volatile boolean connected;
    private volatile boolean inputEnded;
    private volatile boolean closed;

    /**
     * Answer every outbound control request of this subtype with a success response.
     */
    public FakeTransport respondTo(String subtype, Function<JsonNode, JsonNode> response) {
        autoResponses.put(subtype, response);
        return this;
    }

    public FakeTransport respondTo(String subtype) {
        return respondTo(subtype, request -> mapper.createObjectNode());
    }

    public void emit(String json) {
        try {
            emit(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    public void emit(JsonNode message) {
        inbound.add(message);
    }

    public void emitEnd() {
        inbound.add(END);
    }

    public void fail(RuntimeException error) {
        inbound.add(error);
    }

    public List<JsonNode> written() {
        return written;
    }

    public List<JsonNode> writtenOfType(String type) {
        return written.stream()
                .filter(message -> type.equals(message.path("type").asText()))
                .collect(Collectors.toList());
    }

    /**
     * Control responses the SDK wrote for the given inbound request id.
     */
    public List<JsonNode> responsesFor(String requestId) {
        return writtenOfType("control_response").stream()
                .map(message -> message.path("response"))
                .filter(response -> requestId.equals(response.path("request_id").asText()))
                .collect(Collectors.toList());
    }

    public List<JsonNode> controlRequests(String subtype) {
        return writtenOfType("control_request").stream()
                .filter(message -> subtype.equals(message.path("request").path("subtype").asText()))
                .collect(Collectors.toList());
    }

    public boolean isInputEnded() {
        return inputEnded;
    }

    public boolean isClosed() {
        return closed;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    @Override
    public CompletableFuture<Void> connect() {
        connected = true;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> write(String line) {
        JsonNode message;
        try {
            message = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
        written.add(message);
        autoRespond(message);
        return CompletableFuture.completedFuture(null);
    }

    private void autoRespond(JsonNode message) {
        if (!"control_request".equals(message.path("type").asText())) {
            return;
        }
        Function<JsonNode, JsonNode> responder = autoResponses.get(message.path("request").path("subtype").asText());
        if (responder == null) {
            return;
        }
        ObjectNode inner = mapper.createObjectNode();
        inner.put("subtype", "success");
        inner.put("request_id", message.path("request_id").asText());
        inner.set("response", responder.apply(message.path("request")));
        ObjectNode envelope = mapper.createObjectNode();
        envelope.put("type", "control_response");
        envelope.set("response", inner);
        emit(envelope);
    }

    @Override
    public Stream<JsonNode> readMessages() {
        Spliterator<JsonNode> spliterator = new Spliterators.AbstractSpliterator<JsonNode>(
                Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
            @Override
            public boolean tryAdvance(Consumer<? super JsonNode> action) {
                Object next;
                try {
                    next = inbound.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
                if (next == END) {
                    return false;
                }
                if (next instanceof RuntimeException) {
                    throw (RuntimeException) next;
                }
                action.accept((JsonNode) next);
                return true;
            }
        };
        return StreamSupport.stream(spliterator, false);
    }

    @Override
    public CompletableFuture<Void> endInput() {
        inputEnded = true;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public boolean isReady() {
        return connected && !closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            inbound.add(END);
        }
    }
}
