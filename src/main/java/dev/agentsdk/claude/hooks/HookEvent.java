package dev.agentsdk.claude.hooks;

import javax.annotation.Nullable;

/**
 * Hook events exposed by the CLI.
 */
public enum HookEvent {
    PRE_TOOL_USE("PreToolUse"),
    POST_TOOL_USE("PostToolUse"),
    POST_TOOL_USE_FAILURE("PostToolUseFailure"),
    USER_PROMPT_SUBMIT("UserPromptSubmit"),
    STOP("Stop"),
    SUBAGENT_STOP("SubagentStop"),
    SUBAGENT_START("SubagentStart"),
    NOTIFICATION("Notification"),
    PERMISSION_REQUEST("PermissionRequest"),
    PRE_COMPACT("PreCompact"),
    SESSION_START("SessionStart"),
    SESSION_END("SessionEnd");

    private final String value;

    HookEvent(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Nullable
    public static HookEvent fromValue(@Nullable String value) {
        for (HookEvent event : values()) {
            if (event.value.equals(value)) {
                return event;
            }
        }
        return null;
    }
}
