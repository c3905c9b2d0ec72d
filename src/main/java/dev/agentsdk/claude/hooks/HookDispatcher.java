package dev.agentsdk.claude.hooks;

import dev.agentsdk.claude.exceptions.ControlProtocolException;
import dev.agentsdk.claude.exceptions.HookCallbackTimeoutException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.type.MapType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Registers hook callbacks for the initialize handshake and invokes them on
 * {@code hook_callback} control requests.
 * <p>
 * Callback ids are generated once, when {@link #buildConfig()} runs; the
 * registrations never change afterwards.
 */
public final class HookDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(HookDispatcher.class);

    private static final Map<String, String> WIRE_KEYS = Map.of(
            "async_", "async",
            "continue_", "continue",
            "hook_specific_output", "hookSpecificOutput",
            "suppress_output", "suppressOutput",
            "stop_reason", "stopReason",
            "system_message", "systemMessage",
            "async_timeout", "asyncTimeout"
    );

    private final Map<String, List<HookMatcher>> hooks;
    private final ObjectMapper mapper;
    private final MapType mapType;
    private final ExecutorService executor;
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();
    private ObjectNode config;
    private int nextCallbackId;

    public HookDispatcher(@Nullable Map<String, List<HookMatcher>> hooks, ObjectMapper mapper) {
        this(hooks, mapper, Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "claude-sdk-hook");
            thread.setDaemon(true);
            return thread;
        }));
    }

    /**
     * @param executor runs callbacks that have a matcher timeout, so the whole invocation can be timed out
     */
    public HookDispatcher(
            @Nullable Map<String, List<HookMatcher>> hooks,
            ObjectMapper mapper,
            ExecutorService executor
    ) {
        this.hooks = hooks != null ? hooks : Collections.emptyMap();
        this.mapper = mapper;
        this.mapType = mapper.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, Object.class);
        this.executor = executor;
    }

    /**
     * Builds the {@code hooks} section of the initialize request, assigning an id
     * to every callback.
     *
     * @return the hooks configuration, or {@code null} when no hooks are configured
     */
    @Nullable
    public synchronized ObjectNode buildConfig() {
        if (config != null) {
            return config.size() > 0 ? config : null;
        }
        config = mapper.createObjectNode();
        for (Map.Entry<String, List<HookMatcher>> entry : hooks.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                continue;
            }
            ArrayNode matchers = mapper.createArrayNode();
            for (HookMatcher matcher : entry.getValue()) {
                if (matcher == null) {
                    continue;
                }
                ObjectNode matcherNode = mapper.createObjectNode();
                matcherNode.put("matcher", matcher.getMatcher());
                ArrayNode callbackIds = matcherNode.putArray("hookCallbackIds");
                for (HookCallback callback : matcher.getHooks()) {
                    String callbackId = "hook_" + nextCallbackId++;
                    registrations.put(callbackId, new Registration(callback, matcher.getTimeout()));
                    callbackIds.add(callbackId);
                }
                if (matcher.getTimeout() != null) {
                    matcherNode.put("timeout", matcher.getTimeout().toMillis() / 1000.0);
                }
                matchers.add(matcherNode);
            }
            config.set(entry.getKey(), matchers);
        }
        logger.debug("Registered {} hook callbacks", registrations.size());
        return config.size() > 0 ? config : null;
    }

    public boolean hasCallback(String callbackId) {
        return registrations.containsKey(callbackId);
    }

    /**
     * Invokes the callback named by a {@code hook_callback} request and returns its
     * output in wire shape.
     *
     * @throws ControlProtocolException     if the callback id is unknown
     * @throws HookCallbackTimeoutException if the callback outlives its matcher timeout
     * @throws ExecutionException           if the callback completed exceptionally
     */
    public Map<String, Object> dispatch(JsonNode request, AbortSignal signal)
            throws InterruptedException, ExecutionException {
        String callbackId = request.path("callback_id").asText(null);
        Registration registration = callbackId != null ? registrations.get(callbackId) : null;
        if (registration == null) {
            throw new ControlProtocolException("No hook callback found for ID: " + callbackId);
        }

        JsonNode inputNode = request.get("input");
        Map<String, Object> rawInput = inputNode != null && inputNode.isObject()
                ? mapper.convertValue(inputNode, mapType)
                : new LinkedHashMap<>();
        HookInput input = parseInput(rawInput);
        JsonNode toolUseNode = request.get("tool_use_id");
        String toolUseId = toolUseNode != null && !toolUseNode.isNull() ? toolUseNode.asText() : null;

        HookContext context = new HookContext(signal);
        if (registration.timeout == null) {
            return toWire(await(registration.callback.call(input, toolUseId, context)));
        }

        Future<Object> invocation = executor.submit(
                () -> await(registration.callback.call(input, toolUseId, context)));
        Object output;
        try {
            output = invocation.get(registration.timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            invocation.cancel(true);
            throw new HookCallbackTimeoutException(callbackId, registration.timeout);
        } catch (InterruptedException e) {
            invocation.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            // the worker rethrows the callback future's own ExecutionException
            if (e.getCause() instanceof ExecutionException) {
                throw (ExecutionException) e.getCause();
            }
            throw e;
        }
        return toWire(output);
    }

    @Nullable
    private static Object await(@Nullable CompletableFuture<?> future)
            throws InterruptedException, ExecutionException {
        return future != null ? future.get() : null;
    }

    /**
     * Maps a raw hook input onto its typed shape; unknown events keep the base shape.
     */
    public HookInput parseInput(Map<String, Object> rawInput) {
        Object eventName = rawInput.get("hook_event_name");
        HookEvent event = HookEvent.fromValue(eventName != null ? eventName.toString() : null);
        HookInput input = mapper.convertValue(rawInput, inputType(event));
        input.setRawInput(rawInput);
        return input;
    }

    /**
     * Converts a callback result to the map sent back to the CLI.
     */
    public Map<String, Object> toWire(@Nullable Object output) {
        if (output == null) {
            return Collections.emptyMap();
        }
        if (!(output instanceof Map<?, ?>)) {
            return mapper.convertValue(output, mapType);
        }
        Map<String, Object> converted = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) output).entrySet()) {
            String key = String.valueOf(entry.getKey());
            converted.put(WIRE_KEYS.getOrDefault(key, key), toWireValue(entry.getValue()));
        }
        return converted;
    }

    private Object toWireValue(@Nullable Object value) {
        if (value == null
                || value instanceof Map<?, ?>
                || value instanceof Collection<?>
                || value instanceof CharSequence
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof Enum<?>
                || value instanceof JsonNode) {
            return value;
        }
        return mapper.convertValue(value, mapType);
    }

    private static Class<? extends HookInput> inputType(@Nullable HookEvent event) {
        if (event == null) {
            return HookInput.class;
        }
        switch (event) {
            case PRE_TOOL_USE:
                return PreToolUseHookInput.class;
            case POST_TOOL_USE:
                return PostToolUseHookInput.class;
            case POST_TOOL_USE_FAILURE:
                return PostToolUseFailureHookInput.class;
            case USER_PROMPT_SUBMIT:
                return UserPromptSubmitHookInput.class;
            case STOP:
                return StopHookInput.class;
            case SUBAGENT_STOP:
                return SubagentStopHookInput.class;
            case SUBAGENT_START:
                return SubagentStartHookInput.class;
            case NOTIFICATION:
                return NotificationHookInput.class;
            case PERMISSION_REQUEST:
                return PermissionRequestHookInput.class;
            case PRE_COMPACT:
                return PreCompactHookInput.class;
            default:
                return HookInput.class;
        }
    }

    private static final class Registration {
        private final HookCallback callback;
        @Nullable
        private final Duration timeout;

        private Registration(HookCallback callback, @Nullable Duration timeout) {
            this.callback = callback;
            this.timeout = timeout;
        }
    }
}
