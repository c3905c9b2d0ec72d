package dev.agentsdk.claude.hooks;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import javax.annotation.Nullable;

/**
 * Input for {@code UserPromptSubmit}.
 */
@Getter
public class UserPromptSubmitHookInput extends HookInput {

    @JsonProperty("prompt")
    @Nullable
    private String prompt;
}
