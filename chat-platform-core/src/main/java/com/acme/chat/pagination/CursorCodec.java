package com.acme.chat.pagination;

import com.acme.chat.core.InvalidArgumentException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

/**
 * Opaque continuation tokens for newest-first pagination.
 *
 * <p>A token is the URL-safe base64 encoding of the decimal epoch-nanosecond creation time of the
 * last message on the previous page. Only plain (unfiltered) pages carry one.
 */
public final class CursorCodec {

  private static final long NANOS_PER_SECOND = 1_000_000_000L;

  private CursorCodec() {}

  public static String encode(Instant createdAt) {
    long nanos =
        Math.addExact(
            Math.multiplyExact(createdAt.getEpochSecond(), NANOS_PER_SECOND), createdAt.getNano());
    return Base64.getUrlEncoder()
        .encodeToString(Long.toString(nanos).getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Decode a token produced by {@link #encode(Instant)}.
   *
   * @throws InvalidArgumentException if the token is empty, not base64 or not a nanosecond count
   */
  public static Instant decode(String cursor) {
    if (cursor == null || cursor.isEmpty()) {
      throw new InvalidArgumentException("invalid cursor: empty");
    }
    String decoded;
    try {
      decoded = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new InvalidArgumentException("invalid cursor encoding", e);
    }
    try {
      long nanos = Long.parseLong(decoded);
      return Instant.ofEpochSecond(
          Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
    } catch (NumberFormatException e) {
      throw new InvalidArgumentException("invalid cursor timestamp", e);
    }
  }
}
