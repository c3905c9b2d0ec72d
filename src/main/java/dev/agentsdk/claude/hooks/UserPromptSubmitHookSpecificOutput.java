package dev.agentsdk.claude.hooks;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import javax.annotation.Nullable;

/**
 * UserPromptSubmit output: adds context alongside the submitted prompt.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserPromptSubmitHookSpecificOutput implements HookSpecificOutput {

    @JsonProperty("hookEventName")
    private final String hookEventName = "UserPromptSubmit";

    @JsonProperty("additionalContext")
    @Nullable
    private final String additionalContext;
}
