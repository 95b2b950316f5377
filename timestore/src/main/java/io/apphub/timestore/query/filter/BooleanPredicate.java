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

import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * Boolean predicate, for column filters only. Strings {@code true/1/yes/y}
 * and {@code false/0/no/n} and non-zero numbers are read as booleans.
 */
public final class BooleanPredicate extends RangePredicate<Boolean> {
  private static final Set<String> TRUE_TOKENS = ImmutableSet.of("true", "1", "yes", "y");
  private static final Set<String> FALSE_TOKENS = ImmutableSet.of("false", "0", "no", "n");

  private BooleanPredicate(Builder<Boolean, BooleanPredicate> builder) {
    super(builder);
  }

  public static Builder<Boolean, BooleanPredicate> builder() {
    return new Builder<Boolean, BooleanPredicate>() {
      @Override public BooleanPredicate build() {
        return new BooleanPredicate(this);
      }
    };
  }

  public static BooleanPredicate eq(boolean value) {
    return builder().eq(value).build();
  }

  public static BooleanPredicate in(Boolean... values) {
    return builder().in(Arrays.asList(values)).build();
  }

  /** Parses a boolean token, or returns null if it is not one. */
  public static @Nullable Boolean parse(@Nullable String text) {
    if (text == null) {
      return null;
    }
    String normalized = text.trim().toLowerCase(Locale.ROOT);
    if (TRUE_TOKENS.contains(normalized)) {
      return Boolean.TRUE;
    }
    if (FALSE_TOKENS.contains(normalized)) {
      return Boolean.FALSE;
    }
    return null;
  }

  @Override protected @Nullable Boolean coerce(ColumnValue value) {
    switch (value.getKind()) {
    case BOOLEAN:
      return value.asBoolean();
    case NUMBER:
      return value.asDouble() != 0d;
    case STRING:
      return parse(value.asString());
    default:
      return null;
    }
  }

  @Override protected String literal(Boolean value) {
    return value ? "TRUE" : "FALSE";
  }
}
