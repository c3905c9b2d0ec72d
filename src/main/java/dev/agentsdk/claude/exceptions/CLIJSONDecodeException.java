package dev.agentsdk.claude.exceptions;

/**
 * Raised when the CLI output cannot be decoded as JSON.
 */
public class CLIJSONDecodeException extends ClaudeSDKException {

    private static final int PREVIEW_LENGTH = 100;

    private final String line;

    public CLIJSONDecodeException(String line, Throwable cause) {
        super("Failed to decode JSON: " + preview(line), cause);
        this.line = line;
    }

    public String getLine() {
        return line;
    }

    private static String preview(String line) {
        if (line == null) {
            return "";
        }
        return line.length() > PREVIEW_LENGTH ? line.substring(0, PREVIEW_LENGTH) + "..." : line;
    }
}
