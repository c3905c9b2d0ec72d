package dev.agentsdk.claude.hooks;

import lombok.Getter;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Binds hook callbacks to a tool-name matcher for one hook event.
 */
@Getter
public final class HookMatcher {

    /** Tool name pattern, e.g. {@code "Bash"} or {@code "Write|Edit"}; {@code null} matches everything. */
    @Nullable
    private final String matcher;
    private final List<HookCallback> hooks;
    /** Upper bound for each callback of this matcher; {@code null} means unbounded. */
    @Nullable
    private final Duration timeout;

    public HookMatcher(@Nullable String matcher, List<HookCallback> hooks) {
        this(matcher, hooks, null);
    }

    public HookMatcher(@Nullable String matcher, List<HookCallback> hooks, @Nullable Duration timeout) {
        this.matcher = matcher;
        this.hooks = List.copyOf(Objects.requireNonNull(hooks, "hooks"));
        this.timeout = timeout;
    }
}
