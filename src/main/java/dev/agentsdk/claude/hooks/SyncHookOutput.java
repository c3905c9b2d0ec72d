package dev.agentsdk.claude.hooks;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import javax.annotation.Nullable;

/**
 * Synchronous hook output controlling how the CLI proceeds.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncHookOutput {

    /** {@code false} stops Claude after the hook. */
    @JsonProperty("continue")
    @Nullable
    private final Boolean continueExecution;

    @JsonProperty("suppressOutput")
    @Nullable
    private final Boolean suppressOutput;

    /** Shown to the user when {@code continue} is {@code false}. */
    @JsonProperty("stopReason")
    @Nullable
    private final String stopReason;

    /** {@code block} to block the action. */
    @JsonProperty("decision")
    @Nullable
    private final String decision;

    @JsonProperty("systemMessage")
    @Nullable
    private final String systemMessage;

    @JsonProperty("reason")
    @Nullable
    private final String reason;

    @JsonProperty("hookSpecificOutput")
    @Nullable
    private final HookSpecificOutput hookSpecificOutput;
}
