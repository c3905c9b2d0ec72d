package dev.agentsdk.claude.exceptions;

import java.time.Duration;

/**
 * Raised when an outbound control request receives no response within its timeout.
 */
public class ControlRequestTimeoutException extends ClaudeSDKException {

    private final String subtype;
    private final Duration timeout;

    public ControlRequestTimeoutException(String subtype, Duration timeout) {
        super("Control request timeout: " + subtype + " (no response after " + timeout.toMillis() + " ms)");
        this.subtype = subtype;
        this.timeout = timeout;
    }

    public String getSubtype() {
        return subtype;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
