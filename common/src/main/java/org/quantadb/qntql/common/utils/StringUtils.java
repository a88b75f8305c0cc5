/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.common.utils;

import java.util.Locale;

public class StringUtils {

  private StringUtils() {}

  /**
   * Format with {@link Locale#ROOT} so generated native queries and messages never depend on the
   * default locale of the JVM.
   */
  public static String format(final String format, Object... args) {
    return String.format(Locale.ROOT, format, args);
  }

  /**
   * Wraps an identifier in the given quote character, doubling any embedded quote.
   *
   * @param identifier raw identifier
   * @param quote quote character, e.g. {@code "} for SQL or {@code `} for Cypher
   * @return quoted identifier
   */
  public static String quoteIdentifier(String identifier, char quote) {
    String q = String.valueOf(quote);
    return q + identifier.replace(q, q + q) + q;
  }

  /** Escapes {@code %}, {@code _} and the escape character itself for a SQL LIKE pattern. */
  public static String escapeLikePattern(String text) {
    StringBuilder builder = new StringBuilder(text.length() + 8);
    for (char c : text.toCharArray()) {
      if (c == '%' || c == '_' || c == '\\') {
        builder.append('\\');
      }
      builder.append(c);
    }
    return builder.toString();
  }

  /** Escapes regular-expression metacharacters so the text matches literally. */
  public static String escapeRegex(String text) {
    StringBuilder builder = new StringBuilder(text.length() + 8);
    for (char c : text.toCharArray()) {
      if ("\\^$.|?*+()[]{}".indexOf(c) >= 0) {
        builder.append('\\');
      }
      builder.append(c);
    }
    return builder.toString();
  }
}
