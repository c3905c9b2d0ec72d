package dev.agentsdk.claude.hooks;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * Input for {@code PermissionRequest}, fired when the CLI is about to ask for tool permission.
 */
@Getter
public class PermissionRequestHookInput extends HookInput {

    @JsonProperty("tool_name")
    @Nullable
    private String toolName;

    @JsonProperty("tool_input")
    @Nullable
    private Map<String, Object> toolInput;

    @JsonProperty("permission_suggestions")
    @Nullable
    private List<Map<String, Object>> permissionSuggestions;
}
