// wifi-feature-extractor-service/src/test/java/com/wifi/features/extractor/util/EpochTimestampNormalizerTest.java

package com.wifi.features.extractor.util;

import static org.assertj.core.api.Assertions.*;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;

class EpochTimestampNormalizerTest {

  private static final Instant FALLBACK = Instant.parse("2024-01-01T00:00:00Z");

  @Test
  void shouldConvertWholeEpochSeconds() {
    assertThat(EpochTimestampNormalizer.normalize(LongNode.valueOf(1700000000L), FALLBACK))
        .isEqualTo(Instant.parse("2023-11-14T22:13:20Z"));
  }

  @Test
  void shouldKeepMicrosecondPrecision() {
    Instant result =
        EpochTimestampNormalizer.normalize(DoubleNode.valueOf(1700000000.123456), FALLBACK);

    assertThat(result).isEqualTo(Instant.parse("2023-11-14T22:13:20.123456Z"));
  }

  @Test
  void shouldParseNumericText() {
    assertThat(EpochTimestampNormalizer.normalize(TextNode.valueOf(" 1700000000.5 "), FALLBACK))
        .isEqualTo(Instant.parse("2023-11-14T22:13:20.500Z"));
    assertThat(EpochTimestampNormalizer.normalize("1700000000", FALLBACK))
        .isEqualTo(Instant.parse("2023-11-14T22:13:20Z"));
  }

  @Test
  void shouldReturnFallbackForUnusableValues() {
    assertThat(EpochTimestampNormalizer.normalize((String) null, FALLBACK)).isEqualTo(FALLBACK);
    assertThat(EpochTimestampNormalizer.normalize(NullNode.getInstance(), FALLBACK))
        .isEqualTo(FALLBACK);
    assertThat(EpochTimestampNormalizer.normalize(MissingNode.getInstance(), FALLBACK))
        .isEqualTo(FALLBACK);
    assertThat(EpochTimestampNormalizer.normalize(TextNode.valueOf("yesterday"), FALLBACK))
        .isEqualTo(FALLBACK);
    assertThat(EpochTimestampNormalizer.normalize(DoubleNode.valueOf(Double.NaN), FALLBACK))
        .isEqualTo(FALLBACK);
    assertThat(EpochTimestampNormalizer.normalize("  ", FALLBACK)).isEqualTo(FALLBACK);
    assertThat(
            EpochTimestampNormalizer.normalize(JsonNodeFactory.instance.objectNode(), FALLBACK))
        .isEqualTo(FALLBACK);
  }

  @Test
  void shouldReturnFallbackWhenOutOfInstantRange() {
    assertThat(EpochTimestampNormalizer.normalize(TextNode.valueOf("1e300"), FALLBACK))
        .isEqualTo(FALLBACK);
  }

  @Test
  void shouldTreatZeroAndNullAsNotReported() {
    assertThat(EpochTimestampNormalizer.isPresent(IntNode.valueOf(0))).isFalse();
    assertThat(EpochTimestampNormalizer.isPresent(DoubleNode.valueOf(0.0))).isFalse();
    assertThat(EpochTimestampNormalizer.isPresent(NullNode.getInstance())).isFalse();
    assertThat(EpochTimestampNormalizer.isPresent(null)).isFalse();
    assertThat(EpochTimestampNormalizer.isPresent(TextNode.valueOf(" "))).isFalse();
    assertThat(EpochTimestampNormalizer.isPresent(IntNode.valueOf(1700000000))).isTrue();
  }
}
