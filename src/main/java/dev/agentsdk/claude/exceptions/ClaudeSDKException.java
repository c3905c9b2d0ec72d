package dev.agentsdk.claude.exceptions;

/**
 * Base exception for all Claude Agent SDK errors.
 */
public class ClaudeSDKException extends RuntimeException {

    public ClaudeSDKException(String message) {
        super(message);
    }

    public ClaudeSDKException(String message, Throwable cause) {
        super(message, cause);
    }
}
