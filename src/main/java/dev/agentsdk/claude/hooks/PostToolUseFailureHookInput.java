package dev.agentsdk.claude.hooks;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * Input for {@code PostToolUseFailure}, fired after a tool failed.
 */
@Getter
public class PostToolUseFailureHookInput extends HookInput {

    @JsonProperty("tool_name")
    @Nullable
    private String toolName;

    @JsonProperty("tool_input")
    @Nullable
    private Map<String, Object> toolInput;

    @JsonProperty("tool_use_id")
    @Nullable
    private String toolUseId;

    @JsonProperty("error")
    @Nullable
    private String error;

    @JsonProperty("is_interrupt")
    @Nullable
    private Boolean interrupt;
}
