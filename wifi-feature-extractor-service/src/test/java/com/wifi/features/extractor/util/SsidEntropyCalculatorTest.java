// wifi-feature-extractor-service/src/test/java/com/wifi/features/extractor/util/SsidEntropyCalculatorTest.java

package com.wifi.features.extractor.util;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class SsidEntropyCalculatorTest {

  private static double log2(double value) {
    return Math.log(value) / Math.log(2.0);
  }

  @Test
  void shouldComputeShannonEntropyOfSsid() {
    // 13 symbols: o, f and e appear twice, seven others once
    double expected = 7.0 / 13 * log2(13) + 3 * (2.0 / 13) * log2(13.0 / 2);

    assertThat(SsidEntropyCalculator.entropy("CoffeeShop_5G")).isCloseTo(expected, within(1e-9));
    assertThat(SsidEntropyCalculator.entropy("CoffeeShop_5G")).isCloseTo(3.2389, within(1e-4));
  }

  @Test
  void shouldReturnZeroForEmptyOrMissingSsid() {
    assertThat(SsidEntropyCalculator.entropy(null)).isZero();
    assertThat(SsidEntropyCalculator.entropy("")).isZero();
  }

  @Test
  void shouldReturnZeroForSingleRepeatedSymbol() {
    assertThat(SsidEntropyCalculator.entropy("aaaaaaaa")).isZero();
    assertThat(SsidEntropyCalculator.entropy("😀😀")).isZero();
  }

  @Test
  void shouldGiveOneBitForTwoEquallyLikelySymbols() {
    assertThat(SsidEntropyCalculator.entropy("abab")).isCloseTo(1.0, within(1e-12));
  }

  @Test
  void shouldBeInvariantUnderPermutation() {
    assertThat(SsidEntropyCalculator.entropy("Guest-Net"))
        .isCloseTo(SsidEntropyCalculator.entropy("teN-tseuG"), within(1e-12));
  }

  @Test
  void shouldReachLog2OfLengthWhenAllSymbolsDistinct() {
    assertThat(SsidEntropyCalculator.entropy("abcdefgh")).isCloseTo(3.0, within(1e-12));
  }
}
