package dev.agentsdk.claude.types.messages;

import dev.agentsdk.claude.types.content.ContentBlock;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * User turn echoed by the CLI. Carries either content blocks or plain text.
 */
@Data
@AllArgsConstructor
public final class UserMessage implements Message {
    @JsonProperty("content")
    private final List<ContentBlock> content;

    @JsonProperty("text")
    private final String text;

    @JsonProperty("uuid")
    private final String uuid;

    @JsonProperty("parent_tool_use_id")
    private final String parentToolUseId;

    @Override
    public String getType() {
        return "user";
    }
}
