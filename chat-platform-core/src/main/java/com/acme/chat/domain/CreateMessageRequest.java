package com.acme.chat.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Wire shape of a send-message request. */
public record CreateMessageRequest(
    @JsonProperty("channel_id") String channelId,
    @JsonProperty("user_id") String userId,
    @JsonProperty("content") String content,
    @JsonProperty("idempotency_key") String idempotencyKey,
    @JsonProperty("message_type") String messageType) {

  public static final String DEFAULT_MESSAGE_TYPE = "text";

  public CreateMessageRequest(String channelId, String userId, String content, String idempotencyKey) {
    this(channelId, userId, content, idempotencyKey, null);
  }

  /** Message type to persist, {@code "text"} when the caller left it blank. */
  public String effectiveMessageType() {
    return messageType == null || messageType.isBlank() ? DEFAULT_MESSAGE_TYPE : messageType;
  }

  /** Idempotency key to persist; a blank key is treated as no key. */
  public String effectiveIdempotencyKey() {
    return idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey;
  }
}
