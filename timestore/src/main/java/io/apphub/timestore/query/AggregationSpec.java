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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One aggregation of a downsampled query: a function, the column it reads,
 * the percentile fraction for {@link AggregationFunction#PERCENTILE}, and
 * an optional output alias.
 */
public final class AggregationSpec {
  private final AggregationFunction function;
  private final @Nullable String column;
  private final @Nullable Double percentile;
  private final @Nullable String alias;

  public AggregationSpec(AggregationFunction function, @Nullable String column,
      @Nullable Double percentile, @Nullable String alias) {
    this.function = Objects.requireNonNull(function, "function");
    this.column = column;
    this.percentile = percentile;
    this.alias = alias;
  }

  public static AggregationSpec of(AggregationFunction function, String column) {
    return new AggregationSpec(function, column, null, null);
  }

  public static AggregationSpec count() {
    return new AggregationSpec(AggregationFunction.COUNT, null, null, null);
  }

  public static AggregationSpec percentile(String column, double fraction) {
    return new AggregationSpec(AggregationFunction.PERCENTILE, column, fraction, null);
  }

  public AggregationSpec withAlias(@Nullable String alias) {
    return new AggregationSpec(function, column, percentile, alias);
  }

  public AggregationFunction getFunction() {
    return function;
  }

  public @Nullable String getColumn() {
    return column;
  }

  public @Nullable Double getPercentile() {
    return percentile;
  }

  public @Nullable String getAlias() {
    return alias;
  }

  /**
   * Output column name: the alias if given, otherwise {@code <fn>_<column>},
   * {@code count} for a row count, or {@code p<NN>_<column>} for percentiles.
   */
  public String resolveAlias() {
    if (alias != null && !alias.trim().isEmpty()) {
      return alias.trim();
    }
    if (column == null) {
      return function.getValue();
    }
    if (function == AggregationFunction.PERCENTILE && percentile != null) {
      String pct = BigDecimal.valueOf(percentile * 100d).stripTrailingZeros().toPlainString();
      return "p" + pct.replace('.', '_') + "_" + column;
    }
    return function.getValue() + "_" + column;
  }

  @Override public String toString() {
    return resolveAlias() + "=" + function.getValue() + "(" + (column == null ? "*" : column)
        + (percentile == null ? "" : ", " + percentile) + ")";
  }
}
