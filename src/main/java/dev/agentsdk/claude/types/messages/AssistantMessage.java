package dev.agentsdk.claude.types.messages;

import dev.agentsdk.claude.types.content.ContentBlock;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public final class AssistantMessage implements Message {
    @JsonProperty("content")
    private final List<ContentBlock> content;

    @JsonProperty("model")
    private final String model;

    @JsonProperty("parent_tool_use_id")
    private final String parentToolUseId;

    /** One of authentication_failed, billing_error, rate_limit, invalid_request, server_error, unknown. */
    @JsonProperty("error")
    private final String error;

    @Override
    public String getType() {
        return "assistant";
    }
}
