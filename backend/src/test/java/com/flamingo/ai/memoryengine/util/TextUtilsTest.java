package com.flamingo.ai.memoryengine.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TextUtilsTest {

  @Test
  @DisplayName("truncate should append an ellipsis only when shortened")
  void truncateShouldAppendEllipsis() {
    assertThat(TextUtils.truncate("I like tea", 20)).isEqualTo("I like tea");
    assertThat(TextUtils.truncate("I like tea", 6)).isEqualTo("I like...");
    assertThat(TextUtils.truncate(null, 6)).isEmpty();
  }

  @Test
  @DisplayName("normalizeForComparison should ignore case and padding")
  void normalizeShouldIgnoreCaseAndPadding() {
    assertThat(TextUtils.normalizeForComparison("  I Own A Bike "))
        .isEqualTo(TextUtils.normalizeForComparison("i own a bike"));
  }

  @Test
  @DisplayName("sha256Hex should be stable and distinguish texts")
  void sha256HexShouldBeStable() {
    assertThat(TextUtils.sha256Hex("abc"))
        .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    assertThat(TextUtils.sha256Hex("abd")).isNotEqualTo(TextUtils.sha256Hex("abc"));
  }
}
