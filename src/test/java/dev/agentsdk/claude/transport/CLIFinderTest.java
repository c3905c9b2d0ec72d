package dev.agentsdk.claude.transport;

import dev.agentsdk.claude.exceptions.CLINotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

@DisabledOnOs(OS.WINDOWS)
class CLIFinderTest {

    @TempDir
    Path tempDir;

    @Test
    void findsExecutableOnPath() throws Exception {
        Path bin = Files.createDirectories(tempDir.resolve("bin"));
        Path cli = Files.createFile(bin.resolve("claude"));
        assertThat(cli.toFile().setExecutable(true)).isTrue();

        String found = CLIFinder.findCLI(bin.toString(), tempDir.resolve("home").toString());

        assertThat(found).isEqualTo(cli.toString());
    }

    @Test
    void fallsBackToLocalInstall() throws Exception {
        Path home = tempDir.resolve("home");
        Path local = Files.createDirectories(home.resolve(".claude/local")).resolve("claude");
        Files.createFile(local);

        String found = CLIFinder.findCLI(tempDir.resolve("empty").toString(), home.toString());

        assertThat(found).isEqualTo(local.toString());
    }

    @Test
    void reportsInstallHintWhenMissing() {
        // /usr/local/bin/claude may exist on a developer machine
        assumeFalse(Files.exists(Path.of("/usr/local/bin/claude")));

        assertThatThrownBy(() -> CLIFinder.findCLI(tempDir.toString(), tempDir.resolve("home").toString()))
                .isInstanceOf(CLINotFoundException.class)
                .hasMessageContaining("npm install -g @anthropic-ai/claude-code");
    }
}
