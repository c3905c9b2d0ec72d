package dev.agentsdk.claude.hooks;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import javax.annotation.Nullable;

/**
 * PostToolUse output: adds context for Claude after a tool ran.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PostToolUseHookSpecificOutput implements HookSpecificOutput {

    @JsonProperty("hookEventName")
    private final String hookEventName = "PostToolUse";

    @JsonProperty("additionalContext")
    @Nullable
    private final String additionalContext;
}
