package dev.agentsdk.claude.hooks;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import javax.annotation.Nullable;

/**
 * Input for {@code PreCompact}; {@code trigger} is {@code manual} or {@code auto}.
 */
@Getter
public class PreCompactHookInput extends HookInput {

    @JsonProperty("trigger")
    @Nullable
    private String trigger;

    @JsonProperty("custom_instructions")
    @Nullable
    private String customInstructions;
}
