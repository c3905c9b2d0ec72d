package dev.agentsdk.claude.hooks;

/**
 * Event-specific part of a hook output, sent as {@code hookSpecificOutput}.
 */
public interface HookSpecificOutput {

    String getHookEventName();
}
