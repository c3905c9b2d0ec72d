package dev.agentsdk.claude.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.MapType;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * In-process MCP server.
 * <p>
 * Answers the JSON-RPC messages the CLI routes through {@code mcp_message}
 * control requests, backed by name-keyed tool and prompt registries and a
 * URI-keyed resource registry. Registries are fixed at construction.
 *
 * <pre>{@code
 * SdkMcpServer calculator = SdkMcpServer.builder()
 *     .name("calculator")
 *     .version("2.0.0")
 *     .tool(addTool)
 *     .build();
 *
 * ClaudeAgentOptions options = ClaudeAgentOptions.builder()
 *     .mcpServer("calc", calculator)
 *     .allowedTool("mcp__calc__add")
 *     .build();
 * }</pre>
 */
@Getter
public class SdkMcpServer {

    private static final Logger logger = LoggerFactory.getLogger(SdkMcpServer.class);

    public static final String PROTOCOL_VERSION = "2024-11-05";
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INTERNAL_ERROR = -32603;

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final MapType MAP_TYPE =
            MAPPER.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, Object.class);

    private final String name;
    private final String version;
    private final Map<String, SdkMcpTool> tools;
    private final Map<String, SdkMcpResource> resources;
    private final Map<String, SdkMcpPrompt> prompts;

    @Builder
    private SdkMcpServer(
            String name,
            @Nullable String version,
            @Singular List<SdkMcpTool> tools,
            @Singular List<SdkMcpResource> resources,
            @Singular List<SdkMcpPrompt> prompts
    ) {
        this.name = name;
        this.version = version != null ? version : "1.0.0";
        this.tools = index(tools, SdkMcpTool::getName, "tool");
        this.resources = index(resources, SdkMcpResource::getUri, "resource");
        this.prompts = index(prompts, SdkMcpPrompt::getName, "prompt");
    }

    /**
     * JSON-RPC methods this server answers.
     */
    enum McpMethod {
        INITIALIZE("initialize"),
        TOOLS_LIST("tools/list"),
        TOOLS_CALL("tools/call"),
        RESOURCES_LIST("resources/list"),
        RESOURCES_READ("resources/read"),
        PROMPTS_LIST("prompts/list"),
        PROMPTS_GET("prompts/get"),
        NOTIFICATIONS_INITIALIZED("notifications/initialized");

        private final String wireName;

        McpMethod(String wireName) {
            this.wireName = wireName;
        }

        @Nullable
        static McpMethod fromWireName(@Nullable String wireName) {
            for (McpMethod method : values()) {
                if (method.wireName.equals(wireName)) {
                    return method;
                }
            }
            return null;
        }
    }

    /**
     * Configuration passed to the CLI in {@code --mcp-config}; the instance itself stays in-process.
     */
    public Map<String, Object> toCliConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("type", "sdk");
        config.put("name", name);
        return config;
    }

    /**
     * Handles one JSON-RPC message and returns the JSON-RPC response.
     * <p>
     * Lookup failures and handler errors become JSON-RPC error objects; only
     * interruption of the calling thread escapes.
     */
    public Map<String, Object> handleMessage(JsonNode message) throws InterruptedException {
        String methodName = message.path("method").asText(null);
        Object id = message.hasNonNull("id") ? MAPPER.convertValue(message.get("id"), Object.class) : null;
        JsonNode params = message.path("params");

        McpMethod method = McpMethod.fromWireName(methodName);
        if (method == null) {
            return errorResponse(id, METHOD_NOT_FOUND, "Method '" + methodName + "' not found");
        }
        try {
            switch (method) {
                case INITIALIZE:
                    return result(id, initializeResult());
                case TOOLS_LIST:
                    return result(id, Map.of("tools", listTools()));
                case TOOLS_CALL:
                    return result(id, callTool(requiredText(params, "name", method), arguments(params)));
                case RESOURCES_LIST:
                    return result(id, Map.of("resources", listResources()));
                case RESOURCES_READ:
                    return result(id, readResource(requiredText(params, "uri", method)));
                case PROMPTS_LIST:
                    return result(id, Map.of("prompts", listPrompts()));
                case PROMPTS_GET:
                    return result(id, getPrompt(requiredText(params, "name", method), arguments(params)));
                case NOTIFICATIONS_INITIALIZED:
                    return result(null, Collections.emptyMap());
                default:
                    return errorResponse(id, METHOD_NOT_FOUND, "Method '" + methodName + "' not found");
            }
        } catch (RuntimeException e) {
            logger.warn("MCP server '{}' failed to handle {}", name, methodName, e);
            return errorResponse(id, INTERNAL_ERROR, e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    public List<Map<String, Object>> listTools() {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (SdkMcpTool tool : tools.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", tool.getName());
            entry.put("description", tool.getDescription());
            entry.put("inputSchema", tool.toSchema());
            if (tool.getAnnotations() != null) {
                entry.put("annotations", MAPPER.convertValue(tool.getAnnotations(), MAP_TYPE));
            }
            entries.add(entry);
        }
        return entries;
    }

    /**
     * Runs a tool and returns its result unchanged apart from exposing an
     * {@code is_error} flag under the wire name {@code isError} as well.
     *
     * @throws McpToolException if the tool is unknown or returns no {@code content} list
     */
    public Map<String, Object> callTool(String toolName, Map<String, Object> arguments)
            throws InterruptedException {
        SdkMcpTool tool = tools.get(toolName);
        if (tool == null) {
            throw new McpToolException("Tool '" + toolName + "' not found");
        }
        Map<String, Object> result = await(tool.getHandler().handle(arguments));
        requireList(result, "content", "Tool '" + toolName + "'");

        Map<String, Object> response = new LinkedHashMap<>(result);
        if (response.containsKey("is_error") && !response.containsKey("isError")) {
            response.put("isError", response.get("is_error"));
        }
        return response;
    }

    public List<Map<String, Object>> listResources() {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (SdkMcpResource resource : resources.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("uri", resource.getUri());
            entry.put("name", resource.getName());
            putIfNotNull(entry, "description", resource.getDescription());
            putIfNotNull(entry, "mimeType", resource.getMimeType());
            entries.add(entry);
        }
        return entries;
    }

    /**
     * @throws McpToolException if the resource is unknown or returns no {@code contents} list
     */
    public Map<String, Object> readResource(String uri) throws InterruptedException {
        SdkMcpResource resource = resources.get(uri);
        if (resource == null) {
            throw new McpToolException("Resource '" + uri + "' not found");
        }
        Map<String, Object> result = await(resource.getReader().read());
        requireList(result, "contents", "Resource '" + uri + "'");
        return result;
    }

    public List<Map<String, Object>> listPrompts() {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (SdkMcpPrompt prompt : prompts.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", prompt.getName());
            putIfNotNull(entry, "description", prompt.getDescription());
            putIfNotNull(entry, "arguments", prompt.getArguments());
            entries.add(entry);
        }
        return entries;
    }

    /**
     * @throws McpToolException if the prompt is unknown or returns no {@code messages} list
     */
    public Map<String, Object> getPrompt(String promptName, Map<String, Object> arguments)
            throws InterruptedException {
        SdkMcpPrompt prompt = prompts.get(promptName);
        if (prompt == null) {
            throw new McpToolException("Prompt '" + promptName + "' not found");
        }
        Map<String, Object> result = await(prompt.getGenerator().generate(arguments));
        requireList(result, "messages", "Prompt '" + promptName + "'");
        return result;
    }

    private Map<String, Object> initializeResult() {
        Map<String, Object> capabilities = new LinkedHashMap<>();
        if (!tools.isEmpty()) {
            capabilities.put("tools", Collections.emptyMap());
        }
        if (!resources.isEmpty()) {
            capabilities.put("resources", Collections.emptyMap());
        }
        if (!prompts.isEmpty()) {
            capabilities.put("prompts", Collections.emptyMap());
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", PROTOCOL_VERSION);
        result.put("capabilities", capabilities);
        result.put("serverInfo", Map.of("name", name, "version", version));
        return result;
    }

    private static Map<String, Object> await(@Nullable CompletableFuture<Map<String, Object>> future)
            throws InterruptedException {
        if (future == null) {
            return null;
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new McpToolException(cause.getMessage() != null ? cause.getMessage() : cause.toString(), cause);
        }
    }

    private static void requireList(@Nullable Map<String, Object> result, String key, String owner) {
        if (result == null || !(result.get(key) instanceof Collection<?>)) {
            throw new McpToolException(owner + " must return a result with a '" + key + "' list");
        }
    }

    private static String requiredText(JsonNode params, String field, McpMethod method) {
        JsonNode value = params.get(field);
        if (value == null || value.isNull()) {
            throw new McpToolException("Missing " + field + " parameter for " + method.wireName);
        }
        return value.asText();
    }

    private static Map<String, Object> arguments(JsonNode params) {
        JsonNode arguments = params.get("arguments");
        if (arguments == null || !arguments.isObject()) {
            return new LinkedHashMap<>();
        }
        return MAPPER.convertValue(arguments, MAP_TYPE);
    }

    private static Map<String, Object> result(@Nullable Object id, Object result) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", "2.0");
        if (id != null) {
            response.put("id", id);
        }
        response.put("result", result);
        return response;
    }

    /**
     * Builds a JSON-RPC error response.
     */
    public static Map<String, Object> errorResponse(@Nullable Object id, int code, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", "2.0");
        response.put("id", id);
        response.put("error", Map.of("code", code, "message", message));
        return response;
    }

    private static void putIfNotNull(Map<String, Object> target, String key, @Nullable Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    private static <T> Map<String, T> index(
            List<T> items,
            Function<T, String> key,
            String kind
    ) {
        Map<String, T> indexed = new LinkedHashMap<>();
        for (T item : items) {
            if (indexed.putIfAbsent(key.apply(item), item) != null) {
                throw new IllegalArgumentException("Duplicate " + kind + ": " + key.apply(item));
            }
        }
        return Collections.unmodifiableMap(indexed);
    }
}
