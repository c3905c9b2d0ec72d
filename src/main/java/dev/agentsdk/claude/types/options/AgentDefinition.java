package dev.agentsdk.claude.types.options;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Custom subagent passed to the CLI with {@code --agents}.
 */
@Getter
@Builder
public final class AgentDefinition {

    private final String description;
    private final String prompt;
    @Singular
    private final List<String> tools;
    /** {@code sonnet}, {@code opus}, {@code haiku} or {@code inherit}. */
    @Nullable
    private final String model;

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("description", description);
        result.put("prompt", prompt);
        if (!tools.isEmpty()) {
            result.put("tools", tools);
        }
        if (model != null) {
            result.put("model", model);
        }
        return result;
    }
}
