package com.acme.chat.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** Notification published to a channel's topic after a message is stored. */
public record MessageEvent(
    @JsonProperty("type") String type,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("data") Payload data,
    @JsonProperty("channel_id") String channelId) {

  public static final String TYPE_MESSAGE = "message";

  public static MessageEvent messageCreated(Message message, Instant at) {
    return new MessageEvent(
        TYPE_MESSAGE, at, new Payload(message, message.channelId()), message.channelId());
  }

  public record Payload(
      @JsonProperty("message") Message message, @JsonProperty("channel_id") String channelId) {}
}
