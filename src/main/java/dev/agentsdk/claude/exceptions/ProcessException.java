package dev.agentsdk.claude.exceptions;

import javax.annotation.Nullable;

/**
 * Raised when the CLI process exits unsuccessfully.
 */
public class ProcessException extends ClaudeSDKException {

    @Nullable
    private final Integer exitCode;
    @Nullable
    private final String stderr;

    public ProcessException(String message, @Nullable Integer exitCode, @Nullable String stderr) {
        super(format(message, exitCode, stderr));
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    @Nullable
    public Integer getExitCode() {
        return exitCode;
    }

    @Nullable
    public String getStderr() {
        return stderr;
    }

    private static String format(String message, @Nullable Integer exitCode, @Nullable String stderr) {
        StringBuilder sb = new StringBuilder(message);
        if (exitCode != null) {
            sb.append(" (exit code: ").append(exitCode).append(')');
        }
        if (stderr != null) {
            sb.append("\nError output: ").append(stderr);
        }
        return sb.toString();
    }
}
