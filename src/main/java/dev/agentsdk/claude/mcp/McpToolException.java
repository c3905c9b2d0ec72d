package dev.agentsdk.claude.mcp;

import dev.agentsdk.claude.exceptions.ClaudeSDKException;

/**
 * Raised by the in-process MCP server for unknown tools, resources or prompts,
 * and for handlers that return a malformed result.
 */
public class McpToolException extends ClaudeSDKException {

    public McpToolException(String message) {
        super(message);
    }

    public McpToolException(String message, Throwable cause) {
        super(message, cause);
    }
}
