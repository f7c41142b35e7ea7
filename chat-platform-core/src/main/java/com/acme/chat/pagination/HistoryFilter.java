package com.acme.chat.pagination;

import com.acme.chat.core.InvalidArgumentException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * The single positioning rule of a history read.
 *
 * <p>{@link Kind#LATEST} and {@link Kind#BEFORE} scroll backward through history (newest first)
 * and are the only kinds that produce a continuation cursor. {@link Kind#SINCE} and {@link
 * Kind#SINCE_MESSAGE} are catch-up reads returning messages strictly after a point, oldest first.
 */
public record HistoryFilter(Kind kind, Instant at, String messageId) {

  public enum Kind {
    LATEST,
    BEFORE,
    SINCE,
    SINCE_MESSAGE
  }

  /** Earliest instant a timestamp column can be compared against. */
  public static final Instant MIN_POSITION = LocalDateTime.MIN.toInstant(ZoneOffset.UTC);

  /** Latest instant a timestamp column can be compared against. */
  public static final Instant MAX_POSITION = LocalDateTime.MAX.toInstant(ZoneOffset.UTC);

  public HistoryFilter {
    Objects.requireNonNull(kind, "kind");
  }

  public static HistoryFilter latest() {
    return new HistoryFilter(Kind.LATEST, null, null);
  }

  /** Continue newest-first paging below a decoded cursor position. */
  public static HistoryFilter before(Instant cursorTime) {
    return new HistoryFilter(Kind.BEFORE, Objects.requireNonNull(cursorTime, "cursorTime"), null);
  }

  /**
   * Catch-up read strictly after {@code since}.
   *
   * @throws InvalidArgumentException if the instant is outside the storable range
   */
  public static HistoryFilter since(Instant since) {
    Objects.requireNonNull(since, "since");
    return new HistoryFilter(Kind.SINCE, requireStorable(since), null);
  }

  /** Reject instants that have no UTC date-time representation. */
  public static Instant requireStorable(Instant at) {
    if (at.isBefore(MIN_POSITION) || at.isAfter(MAX_POSITION)) {
      throw new InvalidArgumentException("since is out of range: " + at);
    }
    return at;
  }

  public static HistoryFilter sinceMessage(String messageId) {
    return new HistoryFilter(
        Kind.SINCE_MESSAGE, null, Objects.requireNonNull(messageId, "messageId"));
  }

  public boolean ascending() {
    return kind == Kind.SINCE || kind == Kind.SINCE_MESSAGE;
  }

  public boolean issuesCursor() {
    return !ascending();
  }
}
