package dev.agentsdk.claude.hooks;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import javax.annotation.Nullable;

/**
 * Input for {@code Notification}.
 */
@Getter
public class NotificationHookInput extends HookInput {

    @JsonProperty("message")
    @Nullable
    private String message;

    @JsonProperty("title")
    @Nullable
    private String title;

    @JsonProperty("notification_type")
    @Nullable
    private String notificationType;
}
