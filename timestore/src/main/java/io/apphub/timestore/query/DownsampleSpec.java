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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Time-bucketed aggregation of raw rows: windows of {@code intervalSize}
 * {@code intervalUnit}s, each producing one row per distinct combination
 * of the requested non-timestamp columns.
 */
public final class DownsampleSpec {
  private final int intervalSize;
  private final IntervalUnit intervalUnit;
  private final List<AggregationSpec> aggregations;

  public DownsampleSpec(int intervalSize, IntervalUnit intervalUnit,
      List<AggregationSpec> aggregations) {
    this.intervalSize = intervalSize;
    this.intervalUnit = Objects.requireNonNull(intervalUnit, "intervalUnit");
    this.aggregations = ImmutableList.copyOf(aggregations);
  }

  public static DownsampleSpec of(int intervalSize, IntervalUnit intervalUnit,
      AggregationSpec... aggregations) {
    return new DownsampleSpec(intervalSize, intervalUnit, ImmutableList.copyOf(aggregations));
  }

  public int getIntervalSize() {
    return intervalSize;
  }

  public IntervalUnit getIntervalUnit() {
    return intervalUnit;
  }

  public List<AggregationSpec> getAggregations() {
    return aggregations;
  }

  @Override public String toString() {
    return intervalSize + " " + intervalUnit.getValue() + " " + aggregations;
  }
}
