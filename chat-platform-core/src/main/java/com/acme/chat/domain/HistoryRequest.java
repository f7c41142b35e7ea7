package com.acme.chat.domain;

import com.acme.chat.core.InvalidArgumentException;
import com.acme.chat.pagination.CursorCodec;
import com.acme.chat.pagination.HistoryFilter;
import java.time.Instant;

/**
 * A history read. At most one of {@code cursor}, {@code since} and {@code sinceId} may be set;
 * none of them means "newest page first".
 */
public record HistoryRequest(
    String channelId, String userId, String cursor, int limit, Instant since, String sinceId) {

  public static HistoryRequest latest(String channelId, String userId, int limit) {
    return new HistoryRequest(channelId, userId, null, limit, null, null);
  }

  public static HistoryRequest withCursor(String channelId, String userId, String cursor, int limit) {
    return new HistoryRequest(channelId, userId, cursor, limit, null, null);
  }

  public static HistoryRequest since(String channelId, String userId, Instant since, int limit) {
    return new HistoryRequest(channelId, userId, null, limit, since, null);
  }

  public static HistoryRequest sinceMessage(String channelId, String userId, String sinceId, int limit) {
    return new HistoryRequest(channelId, userId, null, limit, null, sinceId);
  }

  /**
   * Check what can be checked without the store: at most one filter is set and a {@code since}
   * instant is within the storable range. The cursor is not decoded here.
   *
   * @throws InvalidArgumentException if more than one filter is set or {@code since} is out of range
   */
  public void validateFilters() {
    boolean hasCursor = cursor != null && !cursor.isEmpty();
    boolean hasSinceId = sinceId != null && !sinceId.isEmpty();
    int filters = (hasCursor ? 1 : 0) + (since != null ? 1 : 0) + (hasSinceId ? 1 : 0);
    if (filters > 1) {
      throw new InvalidArgumentException("cursor, since and since_id are mutually exclusive");
    }
    if (since != null) {
      HistoryFilter.requireStorable(since);
    }
  }

  /**
   * Resolve the single filter this request asks for.
   *
   * @throws InvalidArgumentException if the filters are invalid or the cursor does not decode
   */
  public HistoryFilter toFilter() {
    validateFilters();
    if (since != null) {
      return HistoryFilter.since(since);
    }
    if (sinceId != null && !sinceId.isEmpty()) {
      return HistoryFilter.sinceMessage(sinceId);
    }
    if (cursor != null && !cursor.isEmpty()) {
      return HistoryFilter.before(CursorCodec.decode(cursor));
    }
    return HistoryFilter.latest();
  }
}
