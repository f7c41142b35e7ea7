package com.acme.chat.pagination;

/**
 * Page size policy for history reads. Bad sizes fall back to the default instead of failing, so a
 * misbehaving client still gets a page.
 */
public final class PageLimits {

  public static final int DEFAULT_LIMIT = 50;
  public static final int MAX_LIMIT = 100;

  private PageLimits() {}

  /** Returns {@code requested} when it lies in [1, 100], otherwise {@link #DEFAULT_LIMIT}. */
  public static int clamp(int requested) {
    if (requested <= 0 || requested > MAX_LIMIT) {
      return DEFAULT_LIMIT;
    }
    return requested;
  }
}
