package dev.agentsdk.claude.hooks;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import javax.annotation.Nullable;

/**
 * SessionStart output: context loaded at the start of a session.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionStartHookSpecificOutput implements HookSpecificOutput {

    @JsonProperty("hookEventName")
    private final String hookEventName = "SessionStart";

    @JsonProperty("additionalContext")
    @Nullable
    private final String additionalContext;
}
