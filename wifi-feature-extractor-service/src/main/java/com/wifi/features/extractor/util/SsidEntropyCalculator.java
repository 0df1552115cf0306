package com.wifi.features.extractor.util;

import java.util.HashMap;
import java.util.Map;

/**
 * Shannon entropy of short text labels such as SSIDs.
 *
 * <p>The entropy is computed over Unicode code points, so a character outside the Basic
 * Multilingual Plane (an emoji, for instance) counts as one symbol rather than two UTF-16 units.
 *
 * <p>H(s) = -&Sigma; p(c) log2 p(c), where p(c) is the relative frequency of code point c in s.
 * The result is in bits per symbol, 0.0 for empty or single-symbol strings and at most log2(n)
 * for n distinct symbols.
 */
public final class SsidEntropyCalculator {

  private static final double LN_2 = Math.log(2.0);

  private SsidEntropyCalculator() {}

  /**
   * Computes the base-2 Shannon entropy of a string's code point distribution.
   *
   * @param text the label, may be null
   * @return entropy in bits, never negative, 0.0 for null or empty input
   */
  public static double entropy(String text) {
    if (text == null || text.isEmpty()) {
      return 0.0;
    }

    Map<Integer, Integer> frequencies = new HashMap<>();
    text.codePoints().forEach(codePoint -> frequencies.merge(codePoint, 1, Integer::sum));

    if (frequencies.size() == 1) {
      return 0.0;
    }

    double length = frequencies.values().stream().mapToInt(Integer::intValue).sum();
    double entropy = 0.0;
    for (int count : frequencies.values()) {
      double probability = count / length;
      entropy -= probability * (Math.log(probability) / LN_2);
    }
    return entropy;
  }
}
