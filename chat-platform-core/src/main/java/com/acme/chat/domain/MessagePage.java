package com.acme.chat.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One page of channel history.
 *
 * <p>{@code total} is the unfiltered number of messages in the channel. It is not scoped to the
 * cursor or since filter that produced {@code messages}, so it does not bound what remains to be
 * paged in a filtered read.
 */
public record MessagePage(
    @JsonProperty("messages") List<Message> messages,
    @JsonProperty("next_cursor") @JsonInclude(JsonInclude.Include.NON_NULL) String nextCursor,
    @JsonProperty("has_more") boolean hasMore,
    @JsonProperty("total") int total) {

  public MessagePage {
    messages = List.copyOf(messages);
  }
}
