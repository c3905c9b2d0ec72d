package dev.agentsdk.claude.protocol;

import dev.agentsdk.claude.exceptions.MessageParseException;
import dev.agentsdk.claude.types.content.ContentBlock;
import dev.agentsdk.claude.types.content.TextBlock;
import dev.agentsdk.claude.types.content.ThinkingBlock;
import dev.agentsdk.claude.types.content.ToolResultBlock;
import dev.agentsdk.claude.types.content.ToolUseBlock;
import dev.agentsdk.claude.types.messages.AssistantMessage;
import dev.agentsdk.claude.types.messages.Message;
import dev.agentsdk.claude.types.messages.ResultMessage;
import dev.agentsdk.claude.types.messages.StreamEvent;
import dev.agentsdk.claude.types.messages.SystemMessage;
import dev.agentsdk.claude.types.messages.UserMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.CollectionType;
import com.fasterxml.jackson.databind.type.MapType;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for CLI JSON messages.
 */
public class MessageParser {

    private final ObjectMapper objectMapper;
    private final MapType mapType;
    private final CollectionType listType;

    public MessageParser() {
        this(new ObjectMapper());
    }

    public MessageParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.mapType = objectMapper.getTypeFactory()
                .constructMapType(LinkedHashMap.class, String.class, Object.class);
        this.listType = objectMapper.getTypeFactory().constructCollectionType(ArrayList.class, Object.class);
    }

    /**
     * Parse a JSON line into a Message object.
     */
    public Message parse(String jsonLine) {
        JsonNode root;
        try {
            root = objectMapper.readTree(jsonLine);
        } catch (JsonProcessingException e) {
            throw new MessageParseException("Failed to parse message", jsonLine, e);
        }
        return parse(root);
    }

    /**
     * Parse a decoded data message.
     *
     * @throws MessageParseException for unknown types or missing required fields
     */
    public Message parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MessageParseException("Invalid message data type", String.valueOf(root));
        }
        JsonNode typeNode = root.get("type");
        if (typeNode == null || typeNode.isNull()) {
            throw new MessageParseException("Message missing 'type' field", root.toString());
        }
        String type = typeNode.asText();
        switch (type) {
            case "user":
                return parseUserMessage(root);
            case "assistant":
                return parseAssistantMessage(root);
            case "system":
                return parseSystemMessage(root);
            case "result":
                return parseResultMessage(root);
            case "stream_event":
                return parseStreamEvent(root);
            default:
                throw new MessageParseException("Unknown message type: " + type, root.toString());
        }
    }

    private UserMessage parseUserMessage(JsonNode root) {
        JsonNode contentNode = root.path("message").get("content");
        if (contentNode == null || contentNode.isNull()) {
            throw new MessageParseException("Missing content in user message", root.toString());
        }
        if (contentNode.isArray()) {
            return new UserMessage(parseContent(contentNode, root), null, text(root, "uuid"),
                    text(root, "parent_tool_use_id"));
        }
        return new UserMessage(null, contentNode.asText(), text(root, "uuid"), text(root, "parent_tool_use_id"));
    }

    private AssistantMessage parseAssistantMessage(JsonNode root) {
        JsonNode messageNode = root.path("message");
        JsonNode contentNode = messageNode.get("content");
        if (contentNode == null || !contentNode.isArray()) {
            throw new MessageParseException("Missing content in assistant message", root.toString());
        }
        return new AssistantMessage(
                parseContent(contentNode, root),
                text(messageNode, "model"),
                text(root, "parent_tool_use_id"),
                text(root, "error")
        );
    }

    private SystemMessage parseSystemMessage(JsonNode root) {
        return new SystemMessage(text(root, "subtype"), objectMapper.convertValue(root, mapType));
    }

    private ResultMessage parseResultMessage(JsonNode root) {
        return new ResultMessage(
                text(root, "subtype"),
                root.path("duration_ms").asLong(),
                root.path("duration_api_ms").asLong(),
                root.path("is_error").asBoolean(),
                root.path("num_turns").asInt(),
                text(root, "session_id"),
                root.hasNonNull("total_cost_usd") ? root.get("total_cost_usd").asDouble() : null,
                map(root.get("usage")),
                text(root, "result"),
                root.hasNonNull("structured_output")
                        ? objectMapper.convertValue(root.get("structured_output"), Object.class)
                        : null
        );
    }

    private StreamEvent parseStreamEvent(JsonNode root) {
        return new StreamEvent(
                text(root, "uuid"),
                text(root, "session_id"),
                map(root.get("event")),
                text(root, "parent_tool_use_id")
        );
    }

    private List<ContentBlock> parseContent(JsonNode contentNode, JsonNode root) {
        List<ContentBlock> content = new ArrayList<>();
        for (JsonNode blockNode : contentNode) {
            content.add(parseContentBlock(blockNode, root));
        }
        return content;
    }

    private ContentBlock parseContentBlock(JsonNode blockNode, JsonNode root) {
        String type = blockNode.path("type").asText();
        switch (type) {
            case "text":
                return new TextBlock(blockNode.path("text").asText());
            case "thinking":
                return new ThinkingBlock(blockNode.path("thinking").asText(), text(blockNode, "signature"));
            case "tool_use":
                return new ToolUseBlock(text(blockNode, "id"), text(blockNode, "name"), map(blockNode.get("input")));
            case "tool_result": {
                List<Object> content = null;
                JsonNode contentNode = blockNode.get("content");
                if (contentNode != null && contentNode.isArray()) {
                    content = objectMapper.convertValue(contentNode, listType);
                } else if (contentNode != null && contentNode.isTextual()) {
                    content = new ArrayList<>();
                    content.add(contentNode.asText());
                }
                Boolean isError = blockNode.hasNonNull("is_error") ? blockNode.get("is_error").asBoolean() : null;
                return new ToolResultBlock(text(blockNode, "tool_use_id"), content, isError);
            }
            default:
                throw new MessageParseException("Unknown content block type: " + type, root.toString());
        }
    }

    @Nullable
    private Map<String, Object> map(@Nullable JsonNode node) {
        return node != null && node.isObject() ? objectMapper.convertValue(node, mapType) : null;
    }

    @Nullable
    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
