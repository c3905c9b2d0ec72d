package dev.agentsdk.claude.hooks;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import javax.annotation.Nullable;

/**
 * Input for {@code SubagentStop}.
 */
@Getter
public class SubagentStopHookInput extends HookInput {

    @JsonProperty("stop_hook_active")
    @Nullable
    private Boolean stopHookActive;

    @JsonProperty("agent_id")
    @Nullable
    private String agentId;

    @JsonProperty("agent_transcript_path")
    @Nullable
    private String agentTranscriptPath;

    @JsonProperty("agent_type")
    @Nullable
    private String agentType;
}
