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

import io.apphub.timestore.query.filter.QueryFilters;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * What a supplementary row source (staging, hot buffer) is asked for.
 */
public final class RowSourceRequest {
  private final String datasetSlug;
  private final Instant rangeStart;
  private final Instant rangeEnd;
  private final String timestampColumn;
  private final List<String> columns;
  private final QueryFilters filters;
  private final @Nullable Integer limit;

  public RowSourceRequest(String datasetSlug, Instant rangeStart, Instant rangeEnd,
      String timestampColumn, List<String> columns, QueryFilters filters,
      @Nullable Integer limit) {
    this.datasetSlug = datasetSlug;
    this.rangeStart = rangeStart;
    this.rangeEnd = rangeEnd;
    this.timestampColumn = timestampColumn;
    this.columns = ImmutableList.copyOf(columns);
    this.filters = filters;
    this.limit = limit;
  }

  static RowSourceRequest of(QueryPlan plan) {
    return new RowSourceRequest(plan.getDatasetSlug(), plan.getRangeStart(),
        plan.getRangeEnd(), plan.getTimestampColumn(), plan.getColumns(), plan.getFilters(),
        plan.getLimit());
  }

  public String getDatasetSlug() {
    return datasetSlug;
  }

  public Instant getRangeStart() {
    return rangeStart;
  }

  public Instant getRangeEnd() {
    return rangeEnd;
  }

  public String getTimestampColumn() {
    return timestampColumn;
  }

  /** Requested columns; empty means all. */
  public List<String> getColumns() {
    return columns;
  }

  public QueryFilters getFilters() {
    return filters;
  }

  public @Nullable Integer getLimit() {
    return limit;
  }
}
