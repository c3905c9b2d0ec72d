package dev.agentsdk.claude.types.content;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Extended thinking emitted by the model before its answer.
 */
@Data
@AllArgsConstructor
public final class ThinkingBlock implements ContentBlock {
    @JsonProperty("thinking")
    private final String thinking;

    @JsonProperty("signature")
    private final String signature;

    @Override
    public String getType() {
        return "thinking";
    }
}
