package dev.agentsdk.claude.hooks;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * Input for {@code PreToolUse}, fired before a tool runs.
 */
@Getter
public class PreToolUseHookInput extends HookInput {

    @JsonProperty("tool_name")
    @Nullable
    private String toolName;

    @JsonProperty("tool_input")
    @Nullable
    private Map<String, Object> toolInput;
}
