package dev.agentsdk.claude.internal;

import dev.agentsdk.claude.hooks.HookEvent;
import dev.agentsdk.claude.hooks.HookMatcher;
import dev.agentsdk.claude.mcp.SdkMcpServer;
import dev.agentsdk.claude.transport.FakeTransport;
import dev.agentsdk.claude.types.messages.AssistantMessage;
import dev.agentsdk.claude.types.messages.Message;
import dev.agentsdk.claude.types.messages.ResultMessage;
import dev.agentsdk.claude.types.options.ClaudeAgentOptions;
import dev.agentsdk.claude.types.permissions.PermissionResult;
import dev.agentsdk.claude.types.permissions.ToolPermissionCallback;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryRunnerTest {

    private static final ToolPermissionCallback ALLOW_ALL =
            (toolName, input, context) -> CompletableFuture.completedFuture(PermissionResult.allow());

    private final QueryRunner runner = new QueryRunner();

    @Test
    void oneShotPromptParsesMessagesAndClosesTransport() {
        FakeTransport transport = new FakeTransport();
        transport.emit("{\"type\":\"assistant\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"4\"}]}}");
        transport.emit("{\"type\":\"result\",\"subtype\":\"success\",\"is_error\":false,\"num_turns\":1}");
        transport.emitEnd();

        List<Message> messages;
        try (Stream<Message> stream = runner.runPrompt("What is 2 + 2?", null, transport)) {
            messages = stream.collect(Collectors.toList());
        }

        assertThat(messages).hasSize(2);
        assertThat(messages.get(1)).isInstanceOf(ResultMessage.class);
        assertThat(transport.written()).isEmpty();
        assertThat(transport.isClosed()).isTrue();
    }

    @Test
    void oneShotPromptRejectsPermissionCallback() {
        ClaudeAgentOptions options = ClaudeAgentOptions.builder().canUseTool(ALLOW_ALL).build();

        assertThatThrownBy(() -> runner.runPrompt("hi", options, new FakeTransport()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("streaming mode");
    }

    @Test
    void oneShotPromptRejectsHooks() {
        ClaudeAgentOptions options = ClaudeAgentOptions.builder()
                .hookEvent(HookEvent.STOP, List.of(new HookMatcher(null,
                        List.of((input, toolUseId, context) -> CompletableFuture.completedFuture(Map.of())))))
                .build();

        assertThatThrownBy(() -> runner.runPrompt("hi", options, new FakeTransport()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Hooks require streaming mode");
    }

    @Test
    void streamedPromptsInitializeThenWriteMessages() {
        FakeTransport transport = new FakeTransport().respondTo("initialize");
        List<Map<String, Object>> prompts = List.of(
                Map.of("type", "user", "message", Map.of("role", "user", "content", "Hello")));

        List<Message> messages;
        try (Stream<Message> stream = runner.streamPrompt(prompts, null, transport)) {
            transport.emit("{\"type\":\"assistant\",\"message\":{\"content\":[]}}");
            transport.emitEnd();
            messages = stream.collect(Collectors.toList());
        }

        assertThat(transport.written().get(0).path("request").path("subtype").asText()).isEqualTo("initialize");
        assertThat(transport.writtenOfType("user")).hasSize(1);
        assertThat(transport.isInputEnded()).isTrue();
        assertThat(messages).singleElement().isInstanceOf(AssistantMessage.class);
        assertThat(transport.isClosed()).isTrue();
    }

    @Test
    void permissionCallbackRoutesThroughStdio() {
        ClaudeAgentOptions prepared = QueryRunner.prepareStreamingOptions(
                ClaudeAgentOptions.builder().canUseTool(ALLOW_ALL).build());

        assertThat(prepared.getPermissionPromptToolName()).isEqualTo("stdio");
    }

    @Test
    void optionsWithoutCallbackAreUnchanged() {
        ClaudeAgentOptions options = ClaudeAgentOptions.builder().permissionPromptToolName("mcp__auth__check").build();

        assertThat(QueryRunner.prepareStreamingOptions(options)).isSameAs(options);
    }

    @Test
    void permissionCallbackConflictsWithOtherPromptTool() {
        ClaudeAgentOptions options = ClaudeAgentOptions.builder()
                .canUseTool(ALLOW_ALL)
                .permissionPromptToolName("mcp__auth__check")
                .build();

        assertThatThrownBy(() -> QueryRunner.prepareStreamingOptions(options))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void onlySdkServersAreServedInProcess() {
        SdkMcpServer calculator = SdkMcpServer.builder().name("calculator").build();
        ClaudeAgentOptions options = ClaudeAgentOptions.builder()
                .mcpServer("calc", calculator)
                .mcpServer("remote", Map.of("type", "http", "url", "https://example.com/mcp"))
                .build();

        assertThat(QueryRunner.sdkMcpServers(options)).containsOnlyKeys("calc").containsValue(calculator);
    }
}
