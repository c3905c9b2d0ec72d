package dev.agentsdk.claude.hooks;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * PreToolUse output: can allow, deny or escalate the pending tool call.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PreToolUseHookSpecificOutput implements HookSpecificOutput {

    @JsonProperty("hookEventName")
    private final String hookEventName = "PreToolUse";

    /** {@code allow}, {@code deny} or {@code ask}. */
    @JsonProperty("permissionDecision")
    @Nullable
    private final String permissionDecision;

    @JsonProperty("permissionDecisionReason")
    @Nullable
    private final String permissionDecisionReason;

    /** Replaces the tool input before the tool runs. */
    @JsonProperty("updatedInput")
    @Nullable
    private final Map<String, Object> updatedInput;
}
