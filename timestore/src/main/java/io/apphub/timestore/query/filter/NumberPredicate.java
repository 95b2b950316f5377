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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.Arrays;

/**
 * Numeric predicate. Numeric strings are parsed; anything else never
 * matches.
 */
public final class NumberPredicate extends RangePredicate<Double> {

  private NumberPredicate(Builder<Double, NumberPredicate> builder) {
    super(builder);
  }

  public static Builder<Double, NumberPredicate> builder() {
    return new Builder<Double, NumberPredicate>() {
      @Override public NumberPredicate build() {
        return new NumberPredicate(this);
      }
    };
  }

  public static NumberPredicate eq(double value) {
    return builder().eq(value).build();
  }

  public static NumberPredicate in(Double... values) {
    return builder().in(Arrays.asList(values)).build();
  }

  public static NumberPredicate between(double gte, double lt) {
    return builder().gte(gte).lt(lt).build();
  }

  @Override protected @Nullable Double coerce(ColumnValue value) {
    switch (value.getKind()) {
    case NUMBER:
      return value.asDouble();
    case STRING:
      try {
        double parsed = Double.parseDouble(value.asString().trim());
        return Double.isFinite(parsed) ? parsed : null;
      } catch (NumberFormatException e) {
        return null;
      }
    default:
      return null;
    }
  }

  @Override protected String literal(Double value) {
    return BigDecimal.valueOf(value).toPlainString();
  }
}
