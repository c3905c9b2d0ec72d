package dev.agentsdk.claude.transport;

import dev.agentsdk.claude.exceptions.CLINotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Locates the Claude Code CLI executable.
 */
public final class CLIFinder {

    private static final Logger logger = LoggerFactory.getLogger(CLIFinder.class);

    static final String INSTALL_HINT = "Claude Code not found. Install with:\n"
            + "  npm install -g @anthropic-ai/claude-code\n"
            + "\nIf already installed locally, try:\n"
            + "  export PATH=\"$HOME/node_modules/.bin:$PATH\"\n"
            + "\nOr provide the path via ClaudeAgentOptions.builder().cliPath(...)";

    private CLIFinder() {
    }

    /**
     * Search {@code PATH}, then the usual install locations.
     *
     * @throws CLINotFoundException if no executable is found
     */
    public static String findCLI() {
        return findCLI(System.getenv("PATH"), System.getProperty("user.home"));
    }

    static String findCLI(@Nullable String pathVariable, String home) {
        String executable = isWindows() ? "claude.exe" : "claude";
        if (pathVariable != null) {
            for (String dir : pathVariable.split(File.pathSeparator)) {
                if (dir.isEmpty()) {
                    continue;
                }
                Path candidate = Paths.get(dir, executable);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return candidate.toString();
                }
            }
        }
        for (Path candidate : wellKnownLocations(home)) {
            if (Files.isRegularFile(candidate)) {
                logger.debug("Using Claude Code CLI at {}", candidate);
                return candidate.toString();
            }
        }
        throw new CLINotFoundException(INSTALL_HINT);
    }

    static List<Path> wellKnownLocations(String home) {
        List<Path> locations = new ArrayList<>();
        locations.add(Paths.get(home, ".claude", "local", "claude"));
        locations.add(Paths.get(home, ".npm-global", "bin", "claude"));
        locations.add(Paths.get("/usr/local/bin/claude"));
        locations.add(Paths.get(home, ".local", "bin", "claude"));
        locations.add(Paths.get(home, "node_modules", ".bin", "claude"));
        locations.add(Paths.get(home, ".yarn", "bin", "claude"));
        return locations;
    }

    private static boolean isWindows() {
        return System.getProperty("os.name").toLowerCase().contains("win");
    }
}
