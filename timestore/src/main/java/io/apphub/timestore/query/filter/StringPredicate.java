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

import java.util.Arrays;

/**
 * String predicate. Numbers and booleans are compared by their text.
 */
public final class StringPredicate extends RangePredicate<String> {

  private StringPredicate(Builder<String, StringPredicate> builder) {
    super(builder);
  }

  public static Builder<String, StringPredicate> builder() {
    return new Builder<String, StringPredicate>() {
      @Override public StringPredicate build() {
        return new StringPredicate(this);
      }
    };
  }

  public static StringPredicate eq(String value) {
    return builder().eq(value).build();
  }

  public static StringPredicate in(String... values) {
    return builder().in(Arrays.asList(values)).build();
  }

  @Override protected @Nullable String coerce(ColumnValue value) {
    switch (value.getKind()) {
    case STRING:
    case NUMBER:
    case BOOLEAN:
      return value.asString();
    default:
      return null;
    }
  }

  @Override protected String literal(String value) {
    return SqlIdentifiers.literal(value);
  }
}
