package dev.agentsdk.claude;

import dev.agentsdk.claude.internal.QueryRunner;
import dev.agentsdk.claude.transport.SubprocessTransport;
import dev.agentsdk.claude.transport.Transport;
import dev.agentsdk.claude.types.messages.Message;
import dev.agentsdk.claude.types.options.ClaudeAgentOptions;

import java.util.Map;
import java.util.stream.Stream;

/**
 * Main entry point for Claude Agent SDK.
 * <p>
 * Provides static methods for one-shot queries to Claude Code. Close the
 * returned stream, for example with try-with-resources, to stop the CLI.
 * <p>
 * Example:
 * <pre>{@code
 * ClaudeAgentOptions options = ClaudeAgentOptions.builder()
 *     .allowedTool("Read")
 *     .maxTurns(5)
 *     .build();
 *
 * try (Stream<Message> messages = ClaudeAgentSdk.query("Analyze this codebase", options)) {
 *     messages.forEach(System.out::println);
 * }
 * }</pre>
 */
public final class ClaudeAgentSdk {

    private static final QueryRunner QUERY_RUNNER = new QueryRunner();

    private ClaudeAgentSdk() {
    }

    /**
     * Query Claude with a simple prompt and default options.
     */
    public static Stream<Message> query(String prompt) {
        return query(prompt, ClaudeAgentOptions.builder().build());
    }

    /**
     * Query Claude with a prompt and custom options.
     */
    public static Stream<Message> query(String prompt, ClaudeAgentOptions options) {
        return QUERY_RUNNER.runPrompt(prompt, options, null);
    }

    /**
     * Query Claude with a prompt over a custom transport.
     */
    public static Stream<Message> query(String prompt, ClaudeAgentOptions options, Transport transport) {
        return QUERY_RUNNER.runPrompt(prompt, options, transport);
    }

    /**
     * Stream a series of prompt messages using the control protocol.
     *
     * @param prompts prompt messages matching the CLI stream-json input schema
     */
    public static Stream<Message> query(Iterable<Map<String, Object>> prompts) {
        return query(prompts, ClaudeAgentOptions.builder().build());
    }

    public static Stream<Message> query(Iterable<Map<String, Object>> prompts, ClaudeAgentOptions options) {
        return query(prompts, options, null);
    }

    /**
     * Stream prompts with an optional custom transport, such as a remote CLI.
     */
    public static Stream<Message> query(
            Iterable<Map<String, Object>> prompts,
            ClaudeAgentOptions options,
            Transport transport
    ) {
        return QUERY_RUNNER.streamPrompt(prompts, options, transport);
    }

    /**
     * Get SDK version.
     */
    public static String getVersion() {
        return SubprocessTransport.SDK_VERSION;
    }
}
