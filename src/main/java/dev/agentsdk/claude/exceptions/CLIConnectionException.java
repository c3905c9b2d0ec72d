package dev.agentsdk.claude.exceptions;

/**
 * Raised when the CLI cannot be reached or the connection to it was lost.
 */
public class CLIConnectionException extends ClaudeSDKException {

    public CLIConnectionException(String message) {
        super(message);
    }

    public CLIConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
