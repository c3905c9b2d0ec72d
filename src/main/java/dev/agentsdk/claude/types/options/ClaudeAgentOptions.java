package dev.agentsdk.claude.types.options;

import dev.agentsdk.claude.hooks.HookEvent;
import dev.agentsdk.claude.hooks.HookMatcher;
import dev.agentsdk.claude.types.permissions.ToolPermissionCallback;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Configuration options for Claude Agent SDK.
 * Use {@link #builder()} to create instances.
 */
@Getter
@Builder(toBuilder = true)
public class ClaudeAgentOptions {

    public static final String DEFAULT_ENTRYPOINT = "sdk-java";

    private final String systemPrompt;

    @Singular
    private final List<String> allowedTools;

    @Singular
    private final List<String> disallowedTools;

    private final Integer maxTurns;
    private final Double maxBudgetUsd;
    private final String model;
    private final String fallbackModel;
    private final PermissionMode permissionMode;
    private final String permissionPromptToolName;
    private final ToolPermissionCallback canUseTool;

    @Singular("hook")
    private final Map<String, List<HookMatcher>> hooks;

    @Singular("hookEvent")
    private final Map<HookEvent, List<HookMatcher>> typedHooks;

    private final Path cliPath;
    private final Path cwd;

    /** External server configs as maps, or {@link dev.agentsdk.claude.mcp.SdkMcpServer} instances. */
    @Singular("mcpServer")
    private final Map<String, Object> mcpServers;

    @Singular("envVar")
    private final Map<String, String> env;

    @Singular
    private final List<Path> addDirs;

    @Builder.Default
    private final boolean continueConversation = false;

    private final String resume;
    private final String settings;

    @Singular
    private final List<SettingSource> settingSources;

    private final Integer maxThinkingTokens;

    @Singular("extraArg")
    private final Map<String, String> extraArgs;

    @Builder.Default
    private final boolean includePartialMessages = false;

    @Builder.Default
    private final boolean forkSession = false;

    @Builder.Default
    private final boolean enableFileCheckpointing = false;

    private final String user;
    private final Integer maxBufferSize;

    @Singular("agent")
    private final Map<String, AgentDefinition> agents;

    private final Consumer<String> stderr;

    /** Reported to the CLI as {@code CLAUDE_CODE_ENTRYPOINT}. */
    @Builder.Default
    private final String entrypoint = DEFAULT_ENTRYPOINT;

    /** Timeout for short control requests such as interrupt or set_model. */
    @Builder.Default
    private final Duration controlRequestTimeout = Duration.ofSeconds(60);

    @Builder.Default
    private final Duration initializeTimeout = Duration.ofSeconds(60);

    /** Timeout for control requests that accompany long agent turns, such as rewind_files. */
    @Builder.Default
    private final Duration longControlRequestTimeout = Duration.ofMinutes(10);

    /**
     * Merge typed and untyped hooks for transport consumption.
     */
    public Map<String, List<HookMatcher>> resolvedHooks() {
        Map<String, List<HookMatcher>> resolved = new LinkedHashMap<>();
        if (hooks != null) {
            resolved.putAll(hooks);
        }
        if (typedHooks != null) {
            typedHooks.forEach((event, matchers) ->
                    resolved.merge(event.getValue(), matchers, (existing, incoming) -> {
                        List<HookMatcher> merged = new ArrayList<>(existing);
                        merged.addAll(incoming);
                        return merged;
                    }));
        }
        return resolved;
    }
}
