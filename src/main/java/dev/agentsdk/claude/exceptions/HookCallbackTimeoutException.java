package dev.agentsdk.claude.exceptions;

import java.time.Duration;

/**
 * Raised when a hook callback does not complete within its matcher's timeout.
 */
public class HookCallbackTimeoutException extends ClaudeSDKException {

    private final String callbackId;

    public HookCallbackTimeoutException(String callbackId, Duration timeout) {
        super("Hook callback " + callbackId + " timed out after " + timeout.toMillis() + " ms");
        this.callbackId = callbackId;
    }

    public String getCallbackId() {
        return callbackId;
    }
}
