package dev.agentsdk.claude.hooks;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import javax.annotation.Nullable;

/**
 * Tells the CLI the hook keeps running in the background.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AsyncHookOutput {

    @JsonProperty("async")
    private final boolean async = true;

    /** Milliseconds the CLI waits for the background work. */
    @JsonProperty("asyncTimeout")
    @Nullable
    private final Integer asyncTimeout;

    public AsyncHookOutput(@Nullable Integer asyncTimeout) {
        this.asyncTimeout = asyncTimeout;
    }

    public AsyncHookOutput() {
        this(null);
    }
}
