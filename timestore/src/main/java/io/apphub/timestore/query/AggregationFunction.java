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

import java.util.Locale;

/**
 * Aggregations available when downsampling.
 */
public enum AggregationFunction {
  AVG("avg", true),
  MIN("min", true),
  MAX("max", true),
  SUM("sum", true),
  MEDIAN("median", true),
  COUNT("count", false),
  COUNT_DISTINCT("count_distinct", true),
  PERCENTILE("percentile", true);

  private final String value;
  private final boolean columnRequired;

  AggregationFunction(String value, boolean columnRequired) {
    this.value = value;
    this.columnRequired = columnRequired;
  }

  public String getValue() {
    return value;
  }

  public boolean isColumnRequired() {
    return columnRequired;
  }

  /**
   * Parses a function name.
   *
   * @throws InvalidQueryException if the function is not supported
   */
  public static AggregationFunction of(String name) {
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (AggregationFunction function : values()) {
      if (function.value.equals(normalized)) {
        return function;
      }
    }
    throw new InvalidQueryException("Unsupported aggregation function: " + name);
  }
}
