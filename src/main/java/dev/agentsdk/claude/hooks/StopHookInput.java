package dev.agentsdk.claude.hooks;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import javax.annotation.Nullable;

/**
 * Input for {@code Stop}.
 */
@Getter
public class StopHookInput extends HookInput {

    @JsonProperty("stop_hook_active")
    @Nullable
    private Boolean stopHookActive;
}
