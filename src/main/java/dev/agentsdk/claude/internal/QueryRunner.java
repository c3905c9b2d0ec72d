package dev.agentsdk.claude.internal;

import dev.agentsdk.claude.mcp.SdkMcpServer;
import dev.agentsdk.claude.protocol.MessageParser;
import dev.agentsdk.claude.transport.SubprocessTransport;
import dev.agentsdk.claude.transport.Transport;
import dev.agentsdk.claude.types.messages.Message;
import dev.agentsdk.claude.types.options.ClaudeAgentOptions;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Runs one-shot and streamed-prompt queries.
 * <p>
 * The caller is responsible for closing the returned streams to release the CLI process.
 */
public final class QueryRunner {

    /** Permission prompt tool name that routes permission checks through the control protocol. */
    public static final String STDIO_PERMISSION_TOOL = "stdio";

    private final MessageParser parser = new MessageParser();

    /**
     * Run a single prompt passed on the command line; no control protocol is involved.
     */
    public Stream<Message> runPrompt(String prompt, @Nullable ClaudeAgentOptions options,
                                     @Nullable Transport customTransport) {
        Objects.requireNonNull(prompt, "prompt");
        ClaudeAgentOptions safeOptions = options != null ? options : ClaudeAgentOptions.builder().build();
        if (safeOptions.getCanUseTool() != null) {
            throw new IllegalArgumentException("canUseTool callback requires streaming mode");
        }
        if (!safeOptions.resolvedHooks().isEmpty()) {
            throw new IllegalArgumentException("Hooks require streaming mode");
        }

        Transport transport = customTransport != null
                ? customTransport
                : new SubprocessTransport(prompt, safeOptions);
        try {
            transport.connect().join();
            return transport.readMessages()
                    .map(parser::parse)
                    .onClose(transport::close);
        } catch (RuntimeException e) {
            transport.close();
            throw e;
        }
    }

    /**
     * Stream prompt messages over the control protocol, serving permission checks,
     * hooks and in-process MCP servers while the conversation runs.
     */
    public Stream<Message> streamPrompt(
            Iterable<Map<String, Object>> prompts,
            @Nullable ClaudeAgentOptions options,
            @Nullable Transport customTransport
    ) {
        Objects.requireNonNull(prompts, "prompts");

        ClaudeAgentOptions safeOptions = options != null ? options : ClaudeAgentOptions.builder().build();
        ClaudeAgentOptions effectiveOptions = prepareStreamingOptions(safeOptions);
        Transport transport = customTransport != null
                ? customTransport
                : new SubprocessTransport(effectiveOptions);

        ControlProtocol protocol = newProtocol(transport, effectiveOptions);
        try {
            transport.connect().join();
            protocol.start();
            protocol.initialize(effectiveOptions.getInitializeTimeout()).join();
        } catch (RuntimeException e) {
            protocol.close();
            throw e;
        }

        protocol.streamInput(prompts);
        return protocol.receiveMessages()
                .map(parser::parse)
                .onClose(protocol::close);
    }

    /**
     * Create a streaming-mode protocol configured from the options.
     */
    public static ControlProtocol newProtocol(Transport transport, ClaudeAgentOptions options) {
        return ControlProtocol.builder()
                .transport(transport)
                .streamingMode(true)
                .canUseTool(options.getCanUseTool())
                .hooks(options.resolvedHooks())
                .sdkMcpServers(sdkMcpServers(options))
                .controlRequestTimeout(options.getControlRequestTimeout())
                .longControlRequestTimeout(options.getLongControlRequestTimeout())
                .build();
    }

    /**
     * Route permission checks through the control protocol when a callback is set.
     *
     * @throws IllegalArgumentException if a callback is combined with another permission prompt tool
     */
    public static ClaudeAgentOptions prepareStreamingOptions(ClaudeAgentOptions options) {
        if (options.getCanUseTool() == null
                || STDIO_PERMISSION_TOOL.equals(options.getPermissionPromptToolName())) {
            return options;
        }
        if (options.getPermissionPromptToolName() != null) {
            throw new IllegalArgumentException(
                    "canUseTool callback cannot be used with permissionPromptToolName");
        }
        return options.toBuilder()
                .permissionPromptToolName(STDIO_PERMISSION_TOOL)
                .build();
    }

    public static Map<String, SdkMcpServer> sdkMcpServers(ClaudeAgentOptions options) {
        Map<String, SdkMcpServer> servers = new LinkedHashMap<>();
        options.getMcpServers().forEach((name, value) -> {
            if (value instanceof SdkMcpServer) {
                servers.put(name, (SdkMcpServer) value);
            }
        });
        return servers;
    }
}
