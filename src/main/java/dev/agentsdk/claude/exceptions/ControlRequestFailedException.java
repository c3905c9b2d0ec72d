package dev.agentsdk.claude.exceptions;

/**
 * Raised when the CLI answers a control request with an error response.
 */
public class ControlRequestFailedException extends ClaudeSDKException {

    private final String requestId;

    public ControlRequestFailedException(String requestId, String error) {
        super(error);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
