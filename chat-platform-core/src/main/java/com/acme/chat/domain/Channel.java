package com.acme.chat.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** A chat channel. The owning shard is derived from {@code id} and never stored. */
public record Channel(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("type") String type,
    @JsonProperty("created_by") String createdBy,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt) {}
