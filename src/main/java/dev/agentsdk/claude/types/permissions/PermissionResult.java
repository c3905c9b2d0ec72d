package dev.agentsdk.claude.types.permissions;

import lombok.AllArgsConstructor;
import lombok.Data;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of a permission check.
 */
public interface PermissionResult {

    static Allow allow() {
        return new Allow(null, Collections.emptyList());
    }

    static Allow allow(Map<String, Object> updatedInput) {
        return new Allow(updatedInput, Collections.emptyList());
    }

    static Allow allow(Map<String, Object> updatedInput, List<PermissionUpdate> updates) {
        return new Allow(updatedInput, updates);
    }

    static Deny deny(String message) {
        return new Deny(message, false);
    }

    static Deny deny(String message, boolean interrupt) {
        return new Deny(message, interrupt);
    }

    /**
     * Permission granted. A {@code null} updated input keeps the original tool input.
     */
    @Data
    @AllArgsConstructor
    final class Allow implements PermissionResult {
        @Nullable
        private final Map<String, Object> updatedInput;
        @Nullable
        private final List<PermissionUpdate> updatedPermissions;
    }

    /**
     * Permission denied; {@code interrupt} also stops the current turn.
     */
    @Data
    @AllArgsConstructor
    final class Deny implements PermissionResult {
        private final String message;
        private final boolean interrupt;
    }
}
