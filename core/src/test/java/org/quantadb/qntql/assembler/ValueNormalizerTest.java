/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */


package org.quantadb.qntql.assembler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.quantadb.qntql.catalog.model.AttributeDefinition;

class ValueNormalizerTest {

  private static final AttributeDefinition INT = AttributeDefinition.scalar("int");

  private static final AttributeDefinition DECIMAL = AttributeDefinition.scalar("decimal");

  private static final AttributeDefinition DATE = AttributeDefinition.scalar("date");

  private static final AttributeDefinition TIMESTAMP = AttributeDefinition.scalar("timestamp");

  private static final AttributeDefinition METRIC = AttributeDefinition.metric("hours");

  @Test
  void testIntegralValuesBecomeLong() {
    assertEquals(7L, ValueNormalizer.normalize(7, INT));
    assertEquals(7L, ValueNormalizer.normalize(7.0, INT));
    assertEquals(7L, ValueNormalizer.normalize(" 7 ", INT));
  }

  @Test
  void testDecimalKeepsPrecision() {
    assertEquals(new BigDecimal("12.50"), ValueNormalizer.normalize("12.50", DECIMAL));
    assertEquals(BigDecimal.valueOf(3), ValueNormalizer.normalize(3L, DECIMAL));
  }

  @Test
  void testUnparsableValueIsReturnedUnchanged() {
    assertEquals("many", ValueNormalizer.normalize("many", INT));
  }

  @Test
  void testDatesFromEveryBackendForm() {
    LocalDate expected = LocalDate.of(2025, 3, 1);

    assertEquals(expected, ValueNormalizer.normalize("2025-03-01", DATE));
    assertEquals(expected, ValueNormalizer.normalize(java.sql.Date.valueOf(expected), DATE));
    assertEquals(expected, ValueNormalizer.normalize("2025-03-01T23:00:00Z", DATE));
  }

  @Test
  void testTimestampsFromEveryBackendForm() {
    Instant expected = Instant.parse("2025-03-01T10:15:00Z");

    assertEquals(expected, ValueNormalizer.normalize("2025-03-01T10:15:00Z", TIMESTAMP));
    assertEquals(expected, ValueNormalizer.normalize("2025-03-01T12:15:00+02:00", TIMESTAMP));
    assertEquals(expected, ValueNormalizer.normalize("2025-03-01 10:15:00", TIMESTAMP));
    assertEquals(expected, ValueNormalizer.normalize(expected.toEpochMilli(), TIMESTAMP));
    assertEquals(expected, ValueNormalizer.normalize(Timestamp.from(expected), TIMESTAMP));
    assertEquals(
        expected,
        ValueNormalizer.normalize(OffsetDateTime.parse("2025-03-01T12:15:00+02:00"), TIMESTAMP));
  }

  @Test
  void testMetricTakesTheLatestSample() {
    List<Object> samples =
        List.of(
            Map.of("_time", "2025-03-01T00:00:00Z", "_value", 4),
            Map.of("_time", "2025-03-03T00:00:00Z", "_value", 9.5),
            Map.of("_time", "2025-03-02T00:00:00Z", "_value", 1));

    assertEquals(9.5, ValueNormalizer.normalize(samples, METRIC));
    assertEquals(2.0, ValueNormalizer.normalize(Map.of("value", 2), METRIC));
    assertEquals(3.0, ValueNormalizer.normalize(3, METRIC));
    assertNull(ValueNormalizer.latestSample(List.of()));
  }

  @Test
  void testGenericNormalizationIsRecursive() {
    Object normalized =
        ValueNormalizer.normalizeGeneric(
            Map.of("n", 1, "big", BigInteger.TEN, "list", List.of((short) 2, 1.5f)));

    assertEquals(
        Map.of("n", 1L, "big", BigDecimal.TEN, "list", List.of(2L, 1.5d)), normalized);
  }

  @Test
  void testRenderingUsesIsoStrings() {
    Object rendered =
        ValueNormalizer.render(
            Map.of(
                "due", LocalDate.of(2025, 3, 1),
                "at", List.of(Instant.parse("2025-03-01T10:15:00Z"))));

    assertEquals(Map.of("due", "2025-03-01", "at", List.of("2025-03-01T10:15:00Z")), rendered);
  }
}
