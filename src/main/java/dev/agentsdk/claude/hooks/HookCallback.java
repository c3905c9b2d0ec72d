package dev.agentsdk.claude.hooks;

import javax.annotation.Nullable;
import java.util.concurrent.CompletableFuture;

/**
 * Callback invoked by the CLI at a hook point.
 * <p>
 * The future may complete with a {@link java.util.Map} (keys such as
 * {@code continue_} or {@code hook_specific_output} are renamed to their wire
 * spelling), any Jackson-serializable output object such as
 * {@link SyncHookOutput}, or {@code null} for an empty output.
 */
@FunctionalInterface
public interface HookCallback {

    CompletableFuture<?> call(HookInput input, @Nullable String toolUseId, HookContext context);
}
