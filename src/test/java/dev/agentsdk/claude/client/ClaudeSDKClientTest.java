package dev.agentsdk.claude.client;

import com.fasterxml.jackson.databind.JsonNode;
import dev.agentsdk.claude.exceptions.CLIConnectionException;
import dev.agentsdk.claude.transport.FakeTransport;
import dev.agentsdk.claude.types.messages.AssistantMessage;
import dev.agentsdk.claude.types.messages.Message;
import dev.agentsdk.claude.types.messages.ResultMessage;
import dev.agentsdk.claude.types.options.ClaudeAgentOptions;
import dev.agentsdk.claude.types.options.PermissionMode;
import dev.agentsdk.claude.types.permissions.PermissionResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClaudeSDKClientTest {

    private static final String ASSISTANT = "{\"type\":\"assistant\",\"message\":{\"model\":\"claude-sonnet\","
            + "\"content\":[{\"type\":\"text\",\"text\":\"Paris\"}]}}";
    private static final String RESULT = "{\"type\":\"result\",\"subtype\":\"success\",\"duration_ms\":10,"
            + "\"duration_api_ms\":8,\"is_error\":false,\"num_turns\":1,\"session_id\":\"default\"}";

    private FakeTransport transport;
    private ClaudeSDKClient client;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport()
                .respondTo("initialize", request -> {
                    try {
                        return transport.mapper().readTree("{\"commands\":[\"/help\"],\"output_style\":\"default\"}");
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                })
                .respondTo("interrupt")
                .respondTo("set_permission_mode")
                .respondTo("set_model")
                .respondTo("mcp_status", request -> transport.mapper().createObjectNode()
                        .set("mcpServers", transport.mapper().createArrayNode()));
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
    }

    private ClaudeSDKClient connected(ClaudeAgentOptions options) {
        client = new ClaudeSDKClient(options, transport);
        client.connect().orTimeout(5, TimeUnit.SECONDS).join();
        return client;
    }

    @Test
    void operationsRequireConnection() {
        client = new ClaudeSDKClient(ClaudeAgentOptions.builder().build(), transport);

        assertThat(client.isConnected()).isFalse();
        assertThat(client.getServerInfo()).isNull();
        assertThatThrownBy(() -> client.query("hi"))
                .isInstanceOf(CLIConnectionException.class)
                .hasMessage("Not connected. Call connect() first.");
        assertThatThrownBy(() -> client.interrupt()).isInstanceOf(CLIConnectionException.class);
    }

    @Test
    void connectInitializesAndExposesServerInfo() {
        connected(ClaudeAgentOptions.builder().build());

        assertThat(client.isConnected()).isTrue();
        assertThat(transport.controlRequests("initialize")).hasSize(1);
        assertThat(client.getServerInfo().path("commands").get(0).asText()).isEqualTo("/help");
    }

    @Test
    void queryWritesUserMessage() {
        connected(ClaudeAgentOptions.builder().build());

        client.query("What is the capital of France?", "geo").join();

        List<JsonNode> users = transport.writtenOfType("user");
        assertThat(users).hasSize(1);
        assertThat(users.get(0).path("message").path("role").asText()).isEqualTo("user");
        assertThat(users.get(0).path("message").path("content").asText())
                .isEqualTo("What is the capital of France?");
        assertThat(users.get(0).path("session_id").asText()).isEqualTo("geo");
        assertThat(users.get(0).get("parent_tool_use_id").isNull()).isTrue();
    }

    @Test
    void batchQueryKeepsExplicitSessionIds() {
        connected(ClaudeAgentOptions.builder().build());

        client.query(List.of(
                Map.of("type", "user", "message", Map.of("role", "user", "content", "one")),
                Map.of("type", "user", "message", Map.of("role", "user", "content", "two"), "session_id", "other")
        )).join();

        assertThat(transport.writtenOfType("user"))
                .extracting(node -> node.path("session_id").asText())
                .containsExactly("default", "other");
    }

    @Test
    void receiveResponseStopsAfterResult() {
        connected(ClaudeAgentOptions.builder().build());
        transport.emit(ASSISTANT);
        transport.emit(RESULT);
        transport.emit(ASSISTANT);

        List<Message> turn = client.receiveResponse().collect(Collectors.toList());
        List<Message> next = client.receiveMessages().limit(1).collect(Collectors.toList());

        assertThat(turn).hasSize(2);
        assertThat(turn.get(0)).isInstanceOf(AssistantMessage.class);
        assertThat(turn.get(1)).isInstanceOf(ResultMessage.class);
        assertThat(next.get(0)).isInstanceOf(AssistantMessage.class);
    }

    @Test
    void controlOperationsSendRequests() {
        connected(ClaudeAgentOptions.builder().build());

        client.interrupt().join();
        client.setPermissionMode(PermissionMode.ACCEPT_EDITS).join();
        client.setModel(null).join();
        JsonNode status = client.getMcpStatus().join();

        assertThat(transport.controlRequests("interrupt")).hasSize(1);
        assertThat(transport.controlRequests("set_permission_mode").get(0).path("request").path("mode").asText())
                .isEqualTo("acceptEdits");
        assertThat(transport.controlRequests("set_model").get(0).path("request").get("model").isNull()).isTrue();
        assertThat(status.path("mcpServers").isArray()).isTrue();
    }

    @Test
    void permissionCallbackCannotBeCombinedWithPromptTool() {
        ClaudeAgentOptions options = ClaudeAgentOptions.builder()
                .canUseTool((toolName, input, context) -> CompletableFuture.completedFuture(PermissionResult.allow()))
                .permissionPromptToolName("mcp__auth__check")
                .build();
        client = new ClaudeSDKClient(options, transport);

        assertThatThrownBy(() -> client.connect())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("permissionPromptToolName");
        assertThat(transport.controlRequests("initialize")).isEmpty();
    }

    @Test
    void closeStopsTransport() {
        connected(ClaudeAgentOptions.builder().build());

        client.close();

        assertThat(client.isConnected()).isFalse();
        assertThat(transport.isClosed()).isTrue();
        assertThatThrownBy(() -> client.receiveMessages()).isInstanceOf(CLIConnectionException.class);
    }
}
