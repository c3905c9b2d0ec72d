package dev.agentsdk.claude.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import javax.annotation.Nullable;

/**
 * Presentation hints for a tool. Clients must not rely on them for security decisions.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolAnnotations {

    @JsonProperty("title")
    @Nullable
    private final String title;

    @JsonProperty("readOnlyHint")
    @Nullable
    private final Boolean readOnlyHint;

    @JsonProperty("destructiveHint")
    @Nullable
    private final Boolean destructiveHint;

    @JsonProperty("idempotentHint")
    @Nullable
    private final Boolean idempotentHint;

    @JsonProperty("openWorldHint")
    @Nullable
    private final Boolean openWorldHint;
}
