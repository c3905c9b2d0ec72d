package dev.agentsdk.claude.types.permissions;

import dev.agentsdk.claude.types.options.PermissionMode;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Permission update returned to the CLI alongside an allow decision.
 */
@Getter
@Builder
public final class PermissionUpdate {

    /**
     * Update kinds understood by the CLI.
     */
    public enum Type {
        ADD_RULES("addRules"),
        REPLACE_RULES("replaceRules"),
        REMOVE_RULES("removeRules"),
        SET_MODE("setMode"),
        ADD_DIRECTORIES("addDirectories"),
        REMOVE_DIRECTORIES("removeDirectories");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    private final Type type;
    @Singular
    private final List<PermissionRuleValue> rules;
    /** {@code allow}, {@code deny} or {@code ask}; applies to rule updates. */
    @Nullable
    private final String behavior;
    @Nullable
    private final PermissionMode mode;
    @Singular
    private final List<String> directories;
    /** {@code userSettings}, {@code projectSettings}, {@code localSettings} or {@code session}. */
    @Nullable
    private final String destination;

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("type", type.getValue());
        if (destination != null) {
            result.put("destination", destination);
        }
        switch (type) {
            case ADD_RULES:
            case REPLACE_RULES:
            case REMOVE_RULES:
                List<Map<String, Object>> ruleMaps = new ArrayList<>();
                for (PermissionRuleValue rule : rules) {
                    Map<String, Object> ruleMap = new LinkedHashMap<>();
                    ruleMap.put("toolName", rule.getToolName());
                    ruleMap.put("ruleContent", rule.getRuleContent());
                    ruleMaps.add(ruleMap);
                }
                result.put("rules", ruleMaps);
                if (behavior != null) {
                    result.put("behavior", behavior);
                }
                break;
            case SET_MODE:
                if (mode != null) {
                    result.put("mode", mode.getValue());
                }
                break;
            case ADD_DIRECTORIES:
            case REMOVE_DIRECTORIES:
                result.put("directories", new ArrayList<>(directories));
                break;
            default:
                break;
        }
        return result;
    }
}
