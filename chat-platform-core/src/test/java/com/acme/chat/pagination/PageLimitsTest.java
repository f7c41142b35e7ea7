package com.acme.chat.pagination;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PageLimitsTest {

  @ParameterizedTest(name = "limit {0} falls back to the default")
  @ValueSource(ints = {0, -5, 101, 1000, Integer.MIN_VALUE, Integer.MAX_VALUE})
  void testOutOfRangeFallsBackToDefault(int requested) {
    assertThat(PageLimits.clamp(requested)).isEqualTo(PageLimits.DEFAULT_LIMIT).isEqualTo(50);
  }

  @ParameterizedTest(name = "limit {0} is honored")
  @ValueSource(ints = {1, 2, 50, 99, 100})
  void testInRangeIsHonored(int requested) {
    assertThat(PageLimits.clamp(requested)).isEqualTo(requested);
  }
}
