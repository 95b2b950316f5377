/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.apphub.timestore.util;

import org.apache.calcite.sql.SqlDialect;
import org.apache.calcite.sql.dialect.PostgresqlSqlDialect;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Quoting and sanitizing of identifiers and literals embedded in DuckDB SQL.
 *
 * <p>DuckDB follows PostgreSQL quoting rules for identifiers, so the Calcite
 * PostgreSQL dialect does the identifier quoting. String literals are
 * escaped here because the dialect renders non-ASCII text as unicode
 * escapes DuckDB does not accept.
 */
public final class SqlIdentifiers {
  private static final SqlDialect DIALECT = PostgresqlSqlDialect.DEFAULT;

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS", Locale.ROOT)
          .withZone(ZoneOffset.UTC);

  private SqlIdentifiers() {
    // Utility class should not be instantiated
  }

  /** Quotes an identifier, doubling embedded quote characters. */
  public static String quote(String identifier) {
    return DIALECT.quoteIdentifier(identifier);
  }

  /** Quotes and joins the parts of a qualified name. */
  public static String qualify(String... parts) {
    StringBuilder buf = new StringBuilder();
    for (String part : parts) {
      if (buf.length() > 0) {
        buf.append('.');
      }
      buf.append(quote(part));
    }
    return buf.toString();
  }

  /** Renders a string literal, or {@code NULL}. */
  public static String literal(@Nullable String value) {
    if (value == null) {
      return "NULL";
    }
    return "'" + value.replace("'", "''") + "'";
  }

  /** Renders a UTC {@code TIMESTAMP} literal with microsecond precision. */
  public static String timestampLiteral(Instant instant) {
    return "TIMESTAMP '" + TIMESTAMP_FORMAT.format(instant) + "'";
  }

  /**
   * Turns arbitrary text into a plain identifier: non-alphanumerics become
   * underscores, runs of underscores collapse, leading and trailing
   * underscores are stripped and names starting with a digit get a
   * {@code _} prefix. Lower-cases the result.
   *
   * @param value Raw text such as a dataset slug
   * @param fallback Value returned when nothing usable remains
   * @return Sanitized identifier
   */
  public static String sanitize(String value, String fallback) {
    String sanitized = value.toLowerCase(Locale.ROOT)
        .replaceAll("[^a-z0-9_]", "_")
        .replaceAll("_+", "_")
        .replaceAll("^_+|_+$", "");
    if (sanitized.isEmpty()) {
      return fallback;
    }
    if (Character.isDigit(sanitized.charAt(0))) {
      sanitized = "_" + sanitized;
    }
    return sanitized;
  }
}
