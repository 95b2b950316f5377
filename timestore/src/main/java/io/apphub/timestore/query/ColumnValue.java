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
package io.apphub.timestore.query;

import com.fasterxml.jackson.annotation.JsonValue;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Date;
import java.util.Objects;

/**
 * A single value in a query result row: a string, number, boolean,
 * timestamp or null.
 *
 * <p>Values serialize to JSON as plain scalars. Timestamps become ISO-8601
 * UTC strings; integers outside the range a double represents exactly are
 * kept as strings; NaN and infinities become null.
 */
public final class ColumnValue {

  /** Kind of value held. */
  public enum Kind {
    NULL, STRING, NUMBER, BOOLEAN, TIMESTAMP
  }

  private static final long MAX_SAFE_INTEGER = (1L << 53) - 1;

  private static final ColumnValue NULL = new ColumnValue(Kind.NULL, null);
  private static final ColumnValue TRUE = new ColumnValue(Kind.BOOLEAN, Boolean.TRUE);
  private static final ColumnValue FALSE = new ColumnValue(Kind.BOOLEAN, Boolean.FALSE);

  /** Orders nulls first, then by kind, then by value. */
  public static final Comparator<ColumnValue> ORDER = new Comparator<ColumnValue>() {
    @Override public int compare(ColumnValue a, ColumnValue b) {
      if (a.kind != b.kind) {
        return a.kind.compareTo(b.kind);
      }
      switch (a.kind) {
      case NULL:
        return 0;
      case NUMBER:
        return a.decimal().compareTo(b.decimal());
      case BOOLEAN:
        return Boolean.compare((Boolean) a.value, (Boolean) b.value);
      case TIMESTAMP:
        return ((Instant) a.value).compareTo((Instant) b.value);
      default:
        return ((String) a.value).compareTo((String) b.value);
      }
    }
  };

  private final Kind kind;
  private final @Nullable Object value;

  private ColumnValue(Kind kind, @Nullable Object value) {
    this.kind = kind;
    this.value = value;
  }

  public static ColumnValue ofNull() {
    return NULL;
  }

  public static ColumnValue of(@Nullable String value) {
    return value == null ? NULL : new ColumnValue(Kind.STRING, value);
  }

  public static ColumnValue of(boolean value) {
    return value ? TRUE : FALSE;
  }

  public static ColumnValue of(@Nullable Instant value) {
    return value == null ? NULL : new ColumnValue(Kind.TIMESTAMP, value);
  }

  /**
   * Wraps a number. Non-finite doubles become null and integers beyond
   * 2^53 become strings.
   */
  public static ColumnValue of(@Nullable Number value) {
    if (value == null) {
      return NULL;
    }
    if (value instanceof Double || value instanceof Float) {
      double d = value.doubleValue();
      return Double.isFinite(d) ? new ColumnValue(Kind.NUMBER, d) : NULL;
    }
    if (value instanceof BigInteger) {
      BigInteger big = (BigInteger) value;
      if (big.bitLength() < 63 && Math.abs(big.longValue()) <= MAX_SAFE_INTEGER) {
        return new ColumnValue(Kind.NUMBER, big.longValue());
      }
      return new ColumnValue(Kind.STRING, big.toString());
    }
    if (value instanceof BigDecimal) {
      return new ColumnValue(Kind.NUMBER, value);
    }
    long l = value.longValue();
    if (Math.abs(l) > MAX_SAFE_INTEGER) {
      return new ColumnValue(Kind.STRING, Long.toString(l));
    }
    return new ColumnValue(Kind.NUMBER, l);
  }

  /**
   * Converts a raw JDBC or JSON value into a column value.
   *
   * <p>DuckDB hands {@code TIMESTAMP} values over as wall-clock UTC
   * {@link Timestamp}s, so they are read back through their local date-time.
   */
  public static ColumnValue from(@Nullable Object raw) {
    if (raw == null) {
      return NULL;
    }
    if (raw instanceof ColumnValue) {
      return (ColumnValue) raw;
    }
    if (raw instanceof Boolean) {
      return of(((Boolean) raw).booleanValue());
    }
    if (raw instanceof Number) {
      return of((Number) raw);
    }
    if (raw instanceof Timestamp) {
      return of(((Timestamp) raw).toLocalDateTime().toInstant(ZoneOffset.UTC));
    }
    if (raw instanceof LocalDateTime) {
      return of(((LocalDateTime) raw).toInstant(ZoneOffset.UTC));
    }
    if (raw instanceof OffsetDateTime) {
      return of(((OffsetDateTime) raw).toInstant());
    }
    if (raw instanceof ZonedDateTime) {
      return of(((ZonedDateTime) raw).toInstant());
    }
    if (raw instanceof Instant) {
      return of((Instant) raw);
    }
    if (raw instanceof LocalDate) {
      return of(((LocalDate) raw).atStartOfDay().toInstant(ZoneOffset.UTC));
    }
    if (raw instanceof java.sql.Date) {
      return of(((java.sql.Date) raw).toLocalDate().atStartOfDay().toInstant(ZoneOffset.UTC));
    }
    if (raw instanceof Date) {
      return of(((Date) raw).toInstant());
    }
    return of(raw.toString());
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isNull() {
    return kind == Kind.NULL;
  }

  public @Nullable Object getValue() {
    return value;
  }

  public double asDouble() {
    if (kind == Kind.NUMBER) {
      return ((Number) value).doubleValue();
    }
    if (kind == Kind.STRING) {
      return Double.parseDouble((String) value);
    }
    throw new IllegalStateException("Not a number: " + this);
  }

  public long asLong() {
    if (kind == Kind.NUMBER) {
      return ((Number) value).longValue();
    }
    if (kind == Kind.STRING) {
      return Long.parseLong((String) value);
    }
    throw new IllegalStateException("Not a number: " + this);
  }

  public boolean asBoolean() {
    if (kind != Kind.BOOLEAN) {
      throw new IllegalStateException("Not a boolean: " + this);
    }
    return (Boolean) value;
  }

  /**
   * Returns the value as an instant; ISO-8601 strings are parsed.
   *
   * @return The instant, or null if the value is not a timestamp
   */
  public @Nullable Instant asInstant() {
    if (kind == Kind.TIMESTAMP) {
      return (Instant) value;
    }
    if (kind == Kind.STRING) {
      try {
        return Instant.parse((String) value);
      } catch (DateTimeParseException e) {
        return null;
      }
    }
    return null;
  }

  /** Textual form; timestamps render as ISO-8601, null as {@code null}. */
  public @Nullable String asString() {
    switch (kind) {
    case NULL:
      return null;
    case TIMESTAMP:
      return DateTimeFormatter.ISO_INSTANT.format((Instant) value);
    case NUMBER:
      if (value instanceof BigDecimal) {
        return ((BigDecimal) value).toPlainString();
      }
      return value.toString();
    default:
      return value.toString();
    }
  }

  /** Value as it appears in JSON output. */
  @JsonValue
  public @Nullable Object toJson() {
    switch (kind) {
    case NULL:
      return null;
    case TIMESTAMP:
      return asString();
    default:
      return value;
    }
  }

  private BigDecimal decimal() {
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    if (value instanceof Double) {
      return BigDecimal.valueOf((Double) value);
    }
    return BigDecimal.valueOf(((Number) value).longValue());
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnValue)) {
      return false;
    }
    ColumnValue that = (ColumnValue) o;
    if (kind != that.kind) {
      return false;
    }
    if (kind == Kind.NUMBER) {
      return decimal().compareTo(that.decimal()) == 0;
    }
    return Objects.equals(value, that.value);
  }

  @Override public int hashCode() {
    if (kind == Kind.NUMBER) {
      return decimal().stripTrailingZeros().hashCode();
    }
    return Objects.hash(kind, value);
  }

  @Override public String toString() {
    return kind == Kind.STRING ? "'" + value + "'" : String.valueOf(asString());
  }
}
