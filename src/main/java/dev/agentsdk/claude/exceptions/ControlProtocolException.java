package dev.agentsdk.claude.exceptions;

/**
 * Raised on control protocol violations: unknown subtypes, unknown callback ids,
 * malformed envelopes or control requests issued outside streaming mode.
 */
public class ControlProtocolException extends ClaudeSDKException {

    public ControlProtocolException(String message) {
        super(message);
    }
}
