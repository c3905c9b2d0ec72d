package dev.agentsdk.claude.types.permissions;

import dev.agentsdk.claude.hooks.AbortSignal;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Context provided to permission callbacks.
 */
@Data
@AllArgsConstructor
public final class PermissionContext {
    /** Aborted when the CLI cancels the permission request. */
    private final AbortSignal signal;
    /** Permission updates the CLI suggests, as sent on the wire. */
    private final List<Map<String, Object>> suggestions;
}
