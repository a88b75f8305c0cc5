/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.assembler;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.quantadb.qntql.catalog.model.AttributeDefinition;
import org.quantadb.qntql.catalog.model.ScalarType;

/**
 * Brings values returned by different backends to one representation, and renders them for the
 * response. Static and stateless.
 *
 * <ul>
 *   <li>DATE attributes: {@link LocalDate}
 *   <li>TIMESTAMP attributes: {@link Instant}
 *   <li>integral numbers: {@link Long}; DECIMAL: {@link BigDecimal}; DOUBLE and FLOAT: {@link
 *       Double}
 *   <li>metric attributes: the latest sample as a {@link Double}
 * </ul>
 */
@Log4j2
public final class ValueNormalizer {

  private static final List<String> SAMPLE_TIME_KEYS = List.of("_time", "time", "timestamp");

  private static final List<String> SAMPLE_VALUE_KEYS = List.of("_value", "value");

  private ValueNormalizer() {}

  /** Normalizes a value read for the given attribute. */
  public static Object normalize(Object value, AttributeDefinition definition) {
    if (value == null || definition == null) {
      return normalizeGeneric(value);
    }
    switch (definition.type()) {
      case METRIC:
        return latestSample(value);
      case RELATION:
        return normalizeGeneric(value);
      case SCALAR:
        ScalarType type = definition.scalarType();
        return type == null ? normalizeGeneric(value) : normalizeScalar(value, type);
      default:
        return normalizeGeneric(value);
    }
  }

  /** Normalizes a value whose attribute type is unknown: numbers and nested structures only. */
  public static Object normalizeGeneric(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger) {
      return new BigDecimal((BigInteger) value);
    }
    if (value instanceof Float) {
      return ((Float) value).doubleValue();
    }
    if (value instanceof Timestamp) {
      return ((Timestamp) value).toInstant();
    }
    if (value instanceof java.sql.Date) {
      return ((java.sql.Date) value).toLocalDate();
    }
    if (value instanceof Date) {
      return ((Date) value).toInstant();
    }
    if (value instanceof Map) {
      Map<String, Object> normalized = new LinkedHashMap<>();
      ((Map<?, ?>) value)
          .forEach((key, nested) -> normalized.put(String.valueOf(key), normalizeGeneric(nested)));
      return normalized;
    }
    if (value instanceof Collection) {
      List<Object> normalized = new ArrayList<>();
      ((Collection<?>) value).forEach(nested -> normalized.add(normalizeGeneric(nested)));
      return normalized;
    }
    return value;
  }

  static Object normalizeScalar(Object value, ScalarType type) {
    switch (type.getFamily()) {
      case INTEGRAL:
        if (value instanceof Number) {
          return ((Number) value).longValue();
        }
        return parseOr(value, () -> Long.parseLong(value.toString().trim()));
      case FRACTIONAL:
        if (type == ScalarType.DECIMAL) {
          return toBigDecimal(value);
        }
        if (value instanceof Number) {
          return ((Number) value).doubleValue();
        }
        return parseOr(value, () -> Double.parseDouble(value.toString().trim()));
      case BOOLEAN:
        return value instanceof String ? Boolean.parseBoolean((String) value) : value;
      case DATE:
        return normalizeDate(value);
      case TIMESTAMP:
        return normalizeTimestamp(value);
      default:
        return value instanceof String ? value : value.toString();
    }
  }

  /** Date value as {@link LocalDate}; timestamps are truncated to their UTC date. */
  public static Object normalizeDate(Object value) {
    if (value instanceof LocalDate) {
      return value;
    }
    if (value instanceof java.sql.Date) {
      return ((java.sql.Date) value).toLocalDate();
    }
    Object timestamp = normalizeTimestamp(value);
    if (timestamp instanceof Instant) {
      return ((Instant) timestamp).atOffset(ZoneOffset.UTC).toLocalDate();
    }
    return parseOr(value, () -> LocalDate.parse(value.toString().trim()));
  }

  /**
   * Timestamp value as {@link Instant}. Accepts instants, offset and local date-times (read as
   * UTC), epoch milliseconds and ISO-8601 strings with or without an offset.
   */
  public static Object normalizeTimestamp(Object value) {
    if (value instanceof Instant) {
      return value;
    } else if (value instanceof Timestamp) {
      return ((Timestamp) value).toInstant();
    } else if (value instanceof Date) {
      return ((Date) value).toInstant();
    } else if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).toInstant();
    } else if (value instanceof ZonedDateTime) {
      return ((ZonedDateTime) value).toInstant();
    } else if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
    } else if (value instanceof LocalDate) {
      return ((LocalDate) value).atStartOfDay(ZoneOffset.UTC).toInstant();
    } else if (value instanceof Number) {
      return Instant.ofEpochMilli(((Number) value).longValue());
    }
    String text = value.toString().trim();
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException e) {
      // fall through to the offset-less and date-only forms
    }
    try {
      return OffsetDateTime.parse(text).toInstant();
    } catch (DateTimeParseException e) {
      // fall through
    }
    try {
      return LocalDateTime.parse(text.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      // fall through
    }
    return parseOr(value, () -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());
  }

  /**
   * Latest sample of a metric value. Accepts a bare number, a single sample map, or a list of
   * numbers or sample maps; sample maps carry {@code _time}/{@code time} and
   * {@code _value}/{@code value}.
   */
  public static Double latestSample(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof Map) {
      return toDouble(firstPresent((Map<?, ?>) value, SAMPLE_VALUE_KEYS));
    }
    if (value instanceof Collection) {
      Object latest = null;
      Instant latestTime = null;
      for (Object sample : (Collection<?>) value) {
        if (sample instanceof Map) {
          Object time = firstPresent((Map<?, ?>) sample, SAMPLE_TIME_KEYS);
          Object instant = time == null ? null : normalizeTimestamp(time);
          if (latest == null
              || (instant instanceof Instant
                  && (latestTime == null || ((Instant) instant).isAfter(latestTime)))) {
            latest = firstPresent((Map<?, ?>) sample, SAMPLE_VALUE_KEYS);
            latestTime = instant instanceof Instant ? (Instant) instant : latestTime;
          }
        } else if (sample != null) {
          latest = sample;
        }
      }
      return toDouble(latest);
    }
    return toDouble(value);
  }

  /**
   * Response rendering: temporal values become ISO-8601 strings, nested structures are rendered
   * recursively, everything else is returned as is.
   */
  public static Object render(Object value) {
    if (value instanceof LocalDate || value instanceof Instant) {
      return value.toString();
    }
    if (value instanceof Map) {
      Map<String, Object> rendered = new LinkedHashMap<>();
      ((Map<?, ?>) value)
          .forEach((key, nested) -> rendered.put(String.valueOf(key), render(nested)));
      return rendered;
    }
    if (value instanceof Collection) {
      List<Object> rendered = new ArrayList<>();
      ((Collection<?>) value).forEach(nested -> rendered.add(render(nested)));
      return rendered;
    }
    return value;
  }

  static BigDecimal toBigDecimal(Object value) {
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    if (value instanceof Long || value instanceof Integer) {
      return BigDecimal.valueOf(((Number) value).longValue());
    }
    return new BigDecimal(value.toString().trim());
  }

  private static Double toDouble(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    Object parsed = parseOr(value, () -> Double.parseDouble(value.toString().trim()));
    return parsed instanceof Double ? (Double) parsed : null;
  }

  private static Object firstPresent(Map<?, ?> map, List<String> keys) {
    for (String key : keys) {
      if (map.containsKey(key)) {
        return map.get(key);
      }
    }
    return null;
  }

  private static Object parseOr(Object value, Parser parser) {
    try {
      return parser.parse();
    } catch (RuntimeException e) {
      log.warn("Could not normalize value '{}': {}", value, e.getMessage());
      return value;
    }
  }

  @FunctionalInterface
  private interface Parser {
    Object parse();
  }
}
