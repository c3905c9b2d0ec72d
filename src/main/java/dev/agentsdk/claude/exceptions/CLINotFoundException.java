package dev.agentsdk.claude.exceptions;

import javax.annotation.Nullable;

/**
 * Raised when the Claude Code CLI binary cannot be located.
 */
public class CLINotFoundException extends CLIConnectionException {

    @Nullable
    private final String cliPath;

    public CLINotFoundException(String message) {
        this(message, null, null);
    }

    public CLINotFoundException(String message, @Nullable String cliPath, @Nullable Throwable cause) {
        super(cliPath != null ? message + ": " + cliPath : message, cause);
        this.cliPath = cliPath;
    }

    @Nullable
    public String getCliPath() {
        return cliPath;
    }
}
