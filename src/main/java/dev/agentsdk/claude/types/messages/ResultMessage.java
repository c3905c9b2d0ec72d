package dev.agentsdk.claude.types.messages;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

/**
 * Final message of a turn, with cost and usage.
 */
@Data
@AllArgsConstructor
public final class ResultMessage implements Message {
    @JsonProperty("subtype")
    private final String subtype;

    @JsonProperty("duration_ms")
    private final long durationMs;

    @JsonProperty("duration_api_ms")
    private final long durationApiMs;

    @JsonProperty("is_error")
    private final boolean isError;

    @JsonProperty("num_turns")
    private final int numTurns;

    @JsonProperty("session_id")
    private final String sessionId;

    @JsonProperty("total_cost_usd")
    private final Double totalCostUsd;

    @JsonProperty("usage")
    private final Map<String, Object> usage;

    @JsonProperty("result")
    private final String result;

    @JsonProperty("structured_output")
    private final Object structuredOutput;

    @Override
    public String getType() {
        return "result";
    }
}
