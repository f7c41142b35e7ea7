package com.acme.chat.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * A stored channel message. Immutable once created: the core never edits or deletes messages.
 * The idempotency key stays server-side and is never serialized.
 */
public record Message(
    @JsonProperty("id") String id,
    @JsonProperty("channel_id") String channelId,
    @JsonProperty("user_id") String userId,
    @JsonProperty("content") String content,
    @JsonProperty("message_type") String messageType,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonIgnore String idempotencyKey) {}
