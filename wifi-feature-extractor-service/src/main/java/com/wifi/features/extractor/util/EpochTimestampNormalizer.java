package com.wifi.features.extractor.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts Kismet epoch-second values into UTC instants.
 *
 * <p>Conversion is best effort: a missing, non-numeric, non-finite or out-of-range value yields the
 * caller-supplied fallback instead of an exception, so a malformed timestamp never costs an
 * otherwise valid device record. Fractional seconds are kept to microsecond precision.
 */
public final class EpochTimestampNormalizer {

  private static final Logger logger = LoggerFactory.getLogger(EpochTimestampNormalizer.class);

  private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1_000_000_000L);
  private static final int MICRO_SCALE = 6;

  private EpochTimestampNormalizer() {}

  /**
   * Normalizes a JSON epoch-seconds value.
   *
   * @param value numeric or numeric-text node, may be null
   * @param fallback instant returned when the value cannot be converted
   * @return the corresponding UTC instant, or {@code fallback}
   */
  public static Instant normalize(JsonNode value, Instant fallback) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return fallback;
    }
    if (value.isFloatingPointNumber() && !Double.isFinite(value.doubleValue())) {
      return fallback;
    }
    if (value.isNumber()) {
      return fromEpochSeconds(value.decimalValue(), value, fallback);
    }
    if (value.isTextual()) {
      return normalize(value.asText(), fallback);
    }
    logger.debug("Ignoring non-scalar epoch value {}", value);
    return fallback;
  }

  /**
   * Normalizes an epoch-seconds value given as numeric text.
   *
   * @param text the raw text, may be null
   * @param fallback instant returned when the text cannot be converted
   * @return the corresponding UTC instant, or {@code fallback}
   */
  public static Instant normalize(String text, Instant fallback) {
    if (text == null || text.isBlank()) {
      return fallback;
    }
    String trimmed = text.trim();
    try {
      return fromEpochSeconds(new BigDecimal(trimmed), trimmed, fallback);
    } catch (NumberFormatException e) {
      logger.debug("Unparsable epoch value '{}', using fallback", trimmed);
      return fallback;
    }
  }

  /**
   * Tells whether an epoch value counts as reported. Kismet uses 0 for "never seen", so JSON null,
   * missing nodes and numeric zero are all treated as absent.
   *
   * @param value the raw JSON value, may be null
   * @return true if the value should be converted
   */
  public static boolean isPresent(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return false;
    }
    if (value.isNumber()) {
      return value.doubleValue() != 0.0;
    }
    if (value.isTextual()) {
      return !value.asText().isBlank();
    }
    return true;
  }

  private static Instant fromEpochSeconds(BigDecimal seconds, Object raw, Instant fallback) {
    try {
      BigDecimal rounded = seconds.setScale(MICRO_SCALE, RoundingMode.HALF_UP);
      BigDecimal wholeSeconds = rounded.setScale(0, RoundingMode.FLOOR);
      long nanos = rounded.subtract(wholeSeconds).multiply(NANOS_PER_SECOND).longValueExact();
      return Instant.ofEpochSecond(wholeSeconds.longValueExact(), nanos);
    } catch (ArithmeticException | DateTimeException e) {
      logger.debug("Epoch value {} out of range, using fallback", raw);
      return fallback;
    }
  }
}
