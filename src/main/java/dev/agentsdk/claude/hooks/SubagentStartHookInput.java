package dev.agentsdk.claude.hooks;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import javax.annotation.Nullable;

/**
 * Input for {@code SubagentStart}.
 */
@Getter
public class SubagentStartHookInput extends HookInput {

    @JsonProperty("agent_id")
    @Nullable
    private String agentId;

    @JsonProperty("agent_type")
    @Nullable
    private String agentType;
}
