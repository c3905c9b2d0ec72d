package dev.agentsdk.claude.mcp;

import lombok.Builder;
import lombok.Getter;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Readable data source served by an in-process MCP server, keyed by URI.
 */
@Getter
@Builder
public class SdkMcpResource {

    private final String uri;
    private final String name;
    @Nullable
    private final String description;
    @Nullable
    private final String mimeType;
    private final ResourceReader reader;

    /**
     * Produces the resource content; the result must contain a {@code contents} list.
     */
    @FunctionalInterface
    public interface ResourceReader {
        CompletableFuture<Map<String, Object>> read();
    }
}
