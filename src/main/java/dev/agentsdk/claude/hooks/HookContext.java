package dev.agentsdk.claude.hooks;

/**
 * Context passed to hook callbacks.
 */
public class HookContext {

    private final AbortSignal signal;

    public HookContext(AbortSignal signal) {
        this.signal = signal;
    }

    public HookContext() {
        this(new AbortSignal());
    }

    /**
     * Signal aborted when the CLI cancels the hook request.
     */
    public AbortSignal getSignal() {
        return signal;
    }
}
