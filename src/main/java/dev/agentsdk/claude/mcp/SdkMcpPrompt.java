package dev.agentsdk.claude.mcp;

import lombok.Builder;
import lombok.Getter;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Prompt template served by an in-process MCP server.
 */
@Getter
@Builder
public class SdkMcpPrompt {

    private final String name;
    @Nullable
    private final String description;
    /** Argument definitions, e.g. {@code {name, description, required}}. */
    @Nullable
    private final List<Map<String, Object>> arguments;
    private final PromptGenerator generator;

    /**
     * Renders the prompt; the result must contain a {@code messages} list.
     */
    @FunctionalInterface
    public interface PromptGenerator {
        CompletableFuture<Map<String, Object>> generate(Map<String, Object> arguments);
    }
}
