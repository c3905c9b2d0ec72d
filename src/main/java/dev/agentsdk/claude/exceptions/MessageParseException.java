package dev.agentsdk.claude.exceptions;

/**
 * Raised when a data message cannot be mapped onto a typed message.
 */
public class MessageParseException extends ClaudeSDKException {

    private final String data;

    public MessageParseException(String message, String data) {
        super(message);
        this.data = data;
    }

    public MessageParseException(String message, String data, Throwable cause) {
        super(message, cause);
        this.data = data;
    }

    public String getData() {
        return data;
    }
}
