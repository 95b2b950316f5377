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
 * A query against one dataset: an inclusive time range, and optionally
 * columns, filters, downsampling and a row limit.
 */
public final class QueryRequest {
  private final Instant rangeStart;
  private final Instant rangeEnd;
  private final @Nullable String timestampColumn;
  private final List<String> columns;
  private final QueryFilters filters;
  private final @Nullable DownsampleSpec downsample;
  private final @Nullable Integer limit;

  private QueryRequest(Builder builder) {
    if (builder.rangeStart == null || builder.rangeEnd == null) {
      throw new InvalidQueryException("Query time range requires both start and end");
    }
    this.rangeStart = builder.rangeStart;
    this.rangeEnd = builder.rangeEnd;
    this.timestampColumn = builder.timestampColumn;
    this.columns = ImmutableList.copyOf(builder.columns);
    this.filters = builder.filters;
    this.downsample = builder.downsample;
    this.limit = builder.limit;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Instant getRangeStart() {
    return rangeStart;
  }

  public Instant getRangeEnd() {
    return rangeEnd;
  }

  /** Timestamp column, or null for the configured default. */
  public @Nullable String getTimestampColumn() {
    return timestampColumn;
  }

  /** Requested columns; empty means all. */
  public List<String> getColumns() {
    return columns;
  }

  public QueryFilters getFilters() {
    return filters;
  }

  public @Nullable DownsampleSpec getDownsample() {
    return downsample;
  }

  public @Nullable Integer getLimit() {
    return limit;
  }

  /**
   * Builder for {@link QueryRequest}.
   */
  public static final class Builder {
    private @Nullable Instant rangeStart;
    private @Nullable Instant rangeEnd;
    private @Nullable String timestampColumn;
    private List<String> columns = ImmutableList.of();
    private QueryFilters filters = QueryFilters.none();
    private @Nullable DownsampleSpec downsample;
    private @Nullable Integer limit;

    private Builder() {
    }

    public Builder timeRange(Instant start, Instant end) {
      this.rangeStart = start;
      this.rangeEnd = end;
      return this;
    }

    public Builder timestampColumn(@Nullable String timestampColumn) {
      this.timestampColumn = timestampColumn;
      return this;
    }

    public Builder columns(List<String> columns) {
      this.columns = ImmutableList.copyOf(columns);
      return this;
    }

    public Builder columns(String... columns) {
      return columns(ImmutableList.copyOf(columns));
    }

    public Builder filters(QueryFilters filters) {
      this.filters = filters == null ? QueryFilters.none() : filters;
      return this;
    }

    public Builder downsample(@Nullable DownsampleSpec downsample) {
      this.downsample = downsample;
      return this;
    }

    public Builder limit(@Nullable Integer limit) {
      this.limit = limit;
      return this;
    }

    public QueryRequest build() {
      return new QueryRequest(this);
    }
  }
}
