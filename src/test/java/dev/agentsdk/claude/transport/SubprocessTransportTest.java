package dev.agentsdk.claude.transport;

import dev.agentsdk.claude.mcp.SdkMcpServer;
import dev.agentsdk.claude.types.options.AgentDefinition;
import dev.agentsdk.claude.types.options.ClaudeAgentOptions;
import dev.agentsdk.claude.types.options.PermissionMode;
import dev.agentsdk.claude.types.options.SettingSource;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SubprocessTransportTest {

    private static ClaudeAgentOptions.ClaudeAgentOptionsBuilder options() {
        return ClaudeAgentOptions.builder().cliPath(Path.of("/opt/claude/bin/claude"));
    }

    private static String valueAfter(List<String> cmd, String flag) {
        int index = cmd.indexOf(flag);
        assertThat(index).as("flag %s", flag).isGreaterThanOrEqualTo(0);
        return cmd.get(index + 1);
    }

    @Test
    void oneShotCommandPassesPromptAfterSeparator() {
        List<String> cmd = new SubprocessTransport("--help me", options().build()).buildCommand();

        assertThat(cmd.get(0)).isEqualTo("/opt/claude/bin/claude");
        assertThat(cmd.subList(cmd.size() - 3, cmd.size())).containsExactly("--print", "--", "--help me");
        assertThat(cmd).doesNotContain("--input-format");
        assertThat(valueAfter(cmd, "--output-format")).isEqualTo("stream-json");
    }

    @Test
    void streamingCommandUsesStreamJsonInput() {
        List<String> cmd = new SubprocessTransport(options().build()).buildCommand();

        assertThat(valueAfter(cmd, "--input-format")).isEqualTo("stream-json");
        assertThat(cmd).doesNotContain("--print");
    }

    @Test
    void emptySystemPromptAndSettingSourcesAreAlwaysSent() {
        List<String> cmd = new SubprocessTransport(options().build()).buildCommand();

        assertThat(valueAfter(cmd, "--system-prompt")).isEmpty();
        assertThat(valueAfter(cmd, "--setting-sources")).isEmpty();
    }

    @Test
    void optionsMapToFlags() {
        ClaudeAgentOptions options = options()
                .allowedTool("Read")
                .allowedTool("Bash")
                .disallowedTool("Write")
                .maxTurns(3)
                .model("claude-sonnet")
                .permissionMode(PermissionMode.ACCEPT_EDITS)
                .permissionPromptToolName("stdio")
                .settingSource(SettingSource.USER)
                .settingSource(SettingSource.PROJECT)
                .enableFileCheckpointing(true)
                .continueConversation(true)
                .extraArg("debug-to-stderr", null)
                .extraArg("replay-user-messages", "true")
                .build();

        List<String> cmd = new SubprocessTransport(options).buildCommand();

        assertThat(valueAfter(cmd, "--allowedTools")).isEqualTo("Read,Bash");
        assertThat(valueAfter(cmd, "--disallowedTools")).isEqualTo("Write");
        assertThat(valueAfter(cmd, "--max-turns")).isEqualTo("3");
        assertThat(valueAfter(cmd, "--model")).isEqualTo("claude-sonnet");
        assertThat(valueAfter(cmd, "--permission-mode")).isEqualTo("acceptEdits");
        assertThat(valueAfter(cmd, "--permission-prompt-tool")).isEqualTo("stdio");
        assertThat(valueAfter(cmd, "--setting-sources")).isEqualTo("user,project");
        assertThat(valueAfter(cmd, "--replay-user-messages")).isEqualTo("true");
        assertThat(cmd).contains("--enable-file-checkpointing", "--continue", "--debug-to-stderr");
    }

    @Test
    void sdkServersAreSentWithoutInstance() {
        SdkMcpServer calculator = SdkMcpServer.builder().name("calculator").build();
        ClaudeAgentOptions options = options()
                .mcpServer("calc", calculator)
                .mcpServer("remote", Map.of("type", "http", "url", "https://example.com/mcp"))
                .build();

        String config = valueAfter(new SubprocessTransport(options).buildCommand(), "--mcp-config");

        assertThat(config).contains("\"calc\":{\"type\":\"sdk\",\"name\":\"calculator\"}");
        assertThat(config).contains("\"url\":\"https://example.com/mcp\"");
    }

    @Test
    void sanitizingDropsInstanceKey() {
        Map<String, Object> sanitized = SubprocessTransport.sanitizeMcpServers(
                Map.of("calc", Map.of("type", "sdk", "name", "calc", "instance", new Object())));

        assertThat(sanitized.get("calc")).isEqualTo(Map.of("type", "sdk", "name", "calc"));
    }

    @Test
    void agentsAreSerializedInline() {
        ClaudeAgentOptions options = options()
                .agent("reviewer", AgentDefinition.builder()
                        .description("Reviews code")
                        .prompt("You review code")
                        .tool("Read")
                        .model("sonnet")
                        .build())
                .build();

        String agents = valueAfter(new SubprocessTransport(options).buildCommand(), "--agents");

        assertThat(agents).isEqualTo("{\"reviewer\":{\"description\":\"Reviews code\","
                + "\"prompt\":\"You review code\",\"tools\":[\"Read\"],\"model\":\"sonnet\"}}");
    }

    @Test
    void versionHelpers() {
        assertThat(SubprocessTransport.extractSemanticVersion("2.0.14 (Claude Code)")).isEqualTo("2.0.14");
        assertThat(SubprocessTransport.extractSemanticVersion("unknown")).isNull();
        assertThat(SubprocessTransport.compareVersions("2.0.14", "2.0.0")).isPositive();
        assertThat(SubprocessTransport.compareVersions("1.9.99", "2.0.0")).isNegative();
        assertThat(SubprocessTransport.compareVersions("2.0.0", "2.0.0")).isZero();
    }
}
