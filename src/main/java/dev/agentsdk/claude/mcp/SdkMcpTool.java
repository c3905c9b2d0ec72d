package dev.agentsdk.claude.mcp;

import lombok.Builder;
import lombok.Getter;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Definition for an SDK MCP tool that runs in-process.
 * <p>
 * The input schema is either a complete JSON schema ({@code type} and
 * {@code properties} present) or a simple map from parameter name to type,
 * given as a JSON type name ({@code "string"}, {@code "number"}, ...) or a Java
 * class. Simple schemas are expanded to an object schema with every parameter
 * required.
 *
 * <pre>{@code
 * SdkMcpTool add = SdkMcpTool.builder()
 *     .name("add")
 *     .description("Add two numbers")
 *     .inputSchema(Map.of("a", Double.class, "b", Double.class))
 *     .handler(args -> CompletableFuture.completedFuture(Map.of(
 *         "content", List.of(Map.of("type", "text", "text", "Sum: " + sum(args))))))
 *     .build();
 * }</pre>
 */
@Getter
@Builder
public class SdkMcpTool {

    private final String name;
    private final String description;
    @Nullable
    private final Map<String, Object> inputSchema;
    private final ToolHandler handler;
    @Nullable
    private final ToolAnnotations annotations;

    /**
     * Handler invoked when Claude calls this tool.
     * <p>
     * The result must contain a {@code content} list; an {@code is_error} or
     * {@code isError} flag and {@code structuredContent} are passed through.
     */
    @FunctionalInterface
    public interface ToolHandler {
        CompletableFuture<Map<String, Object>> handle(Map<String, Object> arguments);
    }

    public Map<String, Object> toSchema() {
        if (inputSchema == null || inputSchema.isEmpty()) {
            return objectSchema(Collections.emptyMap());
        }
        if (inputSchema.containsKey("type") && inputSchema.containsKey("properties")) {
            return inputSchema;
        }
        return objectSchema(inputSchema);
    }

    private static Map<String, Object> objectSchema(Map<String, Object> definition) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : definition.entrySet()) {
            properties.put(entry.getKey(), Collections.singletonMap("type", jsonType(entry.getValue())));
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", new ArrayList<>(properties.keySet()));
        return schema;
    }

    private static String jsonType(@Nullable Object type) {
        if (type instanceof Class<?>) {
            Class<?> cls = (Class<?>) type;
            if (cls == Integer.class || cls == int.class || cls == Long.class || cls == long.class) {
                return "integer";
            }
            if (cls == Double.class || cls == double.class || cls == Float.class || cls == float.class
                    || cls == Number.class) {
                return "number";
            }
            if (cls == Boolean.class || cls == boolean.class) {
                return "boolean";
            }
            return "string";
        }
        if (type instanceof String) {
            switch ((String) type) {
                case "integer":
                case "number":
                case "boolean":
                    return (String) type;
                case "float":
                    return "number";
                default:
                    return "string";
            }
        }
        return "string";
    }
}
