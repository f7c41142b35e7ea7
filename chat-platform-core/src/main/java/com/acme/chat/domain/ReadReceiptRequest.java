package com.acme.chat.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ReadReceiptRequest(
    @JsonProperty("channel_id") String channelId,
    @JsonProperty("user_id") String userId,
    @JsonProperty("message_id") String messageId) {}
