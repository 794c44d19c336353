package com.guardrails.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Where notifications for a policy go. The destination is opaque to the engine
 * (a webhook parameter name, a channel id); the sink resolves it.
 */
public record NotificationRoute(
    @JsonProperty("destination") @JsonAlias("slack_webhook_ssm_param")
    String destination,

    @JsonProperty("channel_hint") @JsonAlias("channelHint")
    String channelHint,

    @JsonProperty("mention_users") @JsonAlias({"mentions", "mentionUsers"})
    List<String> mentions
) {
    public NotificationRoute {
        mentions = mentions == null ? List.of() : List.copyOf(mentions);
    }

    public static NotificationRoute to(String destination) {
        return new NotificationRoute(destination, null, List.of());
    }
}
