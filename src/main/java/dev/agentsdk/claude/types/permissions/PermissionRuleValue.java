package dev.agentsdk.claude.types.permissions;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import javax.annotation.Nullable;

/**
 * A permission rule: a tool name with optional rule content, e.g. {@code Bash} / {@code npm test:*}.
 */
@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PermissionRuleValue {
    @JsonProperty("toolName")
    private final String toolName;
    @JsonProperty("ruleContent")
    @Nullable
    private final String ruleContent;
}
