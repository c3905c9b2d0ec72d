package dev.agentsdk.claude.hooks;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Map;

/**
 * Input passed to a hook callback.
 * <p>
 * Every event carries these base fields. Known events are delivered as one of the
 * subclasses; events this SDK does not know yet arrive as a plain {@code HookInput},
 * with the full payload still available through {@link #getRawInput()}.
 */
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class HookInput {

    @JsonProperty("hook_event_name")
    @Nullable
    private String hookEventName;

    @JsonProperty("session_id")
    @Nullable
    private String sessionId;

    @JsonProperty("transcript_path")
    @Nullable
    private String transcriptPath;

    @JsonProperty("cwd")
    @Nullable
    private String cwd;

    @JsonProperty("permission_mode")
    @Nullable
    private String permissionMode;

    @JsonIgnore
    private Map<String, Object> rawInput = Collections.emptyMap();

    void setRawInput(Map<String, Object> rawInput) {
        this.rawInput = Collections.unmodifiableMap(rawInput);
    }

    /**
     * Event of this input, or {@code null} if the CLI sent an event this SDK does not know.
     */
    @JsonIgnore
    @Nullable
    public HookEvent getEvent() {
        return HookEvent.fromValue(hookEventName);
    }
}
