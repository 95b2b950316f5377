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
package io.apphub.timestore.query.filter;

import io.apphub.timestore.query.ColumnValue;
import io.apphub.timestore.util.SqlIdentifiers;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.Arrays;

/**
 * Timestamp predicate. Accepts timestamp values, ISO-8601 strings and
 * epoch milliseconds.
 */
public final class TimestampPredicate extends RangePredicate<Instant> {

  private TimestampPredicate(Builder<Instant, TimestampPredicate> builder) {
    super(builder);
  }

  public static Builder<Instant, TimestampPredicate> builder() {
    return new Builder<Instant, TimestampPredicate>() {
      @Override public TimestampPredicate build() {
        return new TimestampPredicate(this);
      }
    };
  }

  public static TimestampPredicate eq(Instant value) {
    return builder().eq(value).build();
  }

  public static TimestampPredicate in(Instant... values) {
    return builder().in(Arrays.asList(values)).build();
  }

  @Override protected @Nullable Instant coerce(ColumnValue value) {
    if (value.getKind() == ColumnValue.Kind.NUMBER) {
      return Instant.ofEpochMilli(value.asLong());
    }
    return value.asInstant();
  }

  @Override protected String literal(Instant value) {
    return SqlIdentifiers.timestampLiteral(value);
  }
}
