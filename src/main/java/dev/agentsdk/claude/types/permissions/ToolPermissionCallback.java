package dev.agentsdk.claude.types.permissions;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Decides whether Claude may run a tool. Invoked for {@code can_use_tool} control requests.
 */
@FunctionalInterface
public interface ToolPermissionCallback {

    CompletableFuture<PermissionResult> canUseTool(
            String toolName,
            Map<String, Object> input,
            PermissionContext context
    );
}
