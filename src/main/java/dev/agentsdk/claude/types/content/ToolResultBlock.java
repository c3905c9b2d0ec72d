package dev.agentsdk.claude.types.content;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Result of a tool call. Plain string content is wrapped in a one-element list.
 */
@Data
@AllArgsConstructor
public final class ToolResultBlock implements ContentBlock {
    @JsonProperty("tool_use_id")
    private final String toolUseId;

    @JsonProperty("content")
    private final List<Object> content;

    @JsonProperty("is_error")
    private final Boolean isError;

    @Override
    public String getType() {
        return "tool_result";
    }
}
