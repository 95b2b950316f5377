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

import io.apphub.timestore.cache.Versioned;
import io.apphub.timestore.context.DatasetContext;
import io.apphub.timestore.context.SqlContext;
import io.apphub.timestore.metadata.DatasetRecord;
import io.apphub.timestore.partition.PartitionExecutionContext;
import io.apphub.timestore.query.filter.QueryFilters;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * A validated query against one dataset, bound to the context it was
 * planned against and to the partitions that survived pruning.
 *
 * <p>Created by {@link QueryPlanner}; consumed by {@link QueryExecutor}.
 */
public final class QueryPlan {
  private final DatasetRecord dataset;
  private final @Nullable DatasetContext datasetContext;
  private final Versioned<SqlContext> context;
  private final QueryMode mode;
  private final String timestampColumn;
  private final List<String> columns;
  private final Instant rangeStart;
  private final Instant rangeEnd;
  private final QueryFilters filters;
  private final @Nullable DownsampleSpec downsample;
  private final @Nullable Integer limit;
  private final List<PartitionExecutionContext> partitions;
  private final PartitionSelection partitionSelection;
  private final List<String> warnings;
  private final String executionBackend;

  QueryPlan(DatasetRecord dataset, @Nullable DatasetContext datasetContext,
      Versioned<SqlContext> context, String timestampColumn, List<String> columns,
      Instant rangeStart, Instant rangeEnd, QueryFilters filters,
      @Nullable DownsampleSpec downsample, @Nullable Integer limit,
      List<PartitionExecutionContext> partitions, PartitionSelection partitionSelection,
      List<String> warnings, String executionBackend) {
    this.dataset = dataset;
    this.datasetContext = datasetContext;
    this.context = context;
    this.mode = downsample == null ? QueryMode.RAW : QueryMode.DOWNSAMPLED;
    this.timestampColumn = timestampColumn;
    this.columns = ImmutableList.copyOf(columns);
    this.rangeStart = rangeStart;
    this.rangeEnd = rangeEnd;
    this.filters = filters;
    this.downsample = downsample;
    this.limit = limit;
    this.partitions = ImmutableList.copyOf(partitions);
    this.partitionSelection = partitionSelection;
    this.warnings = ImmutableList.copyOf(warnings);
    this.executionBackend = executionBackend;
  }

  public DatasetRecord getDataset() {
    return dataset;
  }

  public String getDatasetSlug() {
    return dataset.getSlug();
  }

  /** Context of the dataset, or null if the dataset is not queryable. */
  public @Nullable DatasetContext getDatasetContext() {
    return datasetContext;
  }

  public Versioned<SqlContext> getContext() {
    return context;
  }

  public QueryMode getMode() {
    return mode;
  }

  public String getTimestampColumn() {
    return timestampColumn;
  }

  /** Requested columns; empty means all. */
  public List<String> getColumns() {
    return columns;
  }

  public Instant getRangeStart() {
    return rangeStart;
  }

  public Instant getRangeEnd() {
    return rangeEnd;
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

  /** Partitions to read, in context order. */
  public List<PartitionExecutionContext> getPartitions() {
    return partitions;
  }

  public PartitionSelection getPartitionSelection() {
    return partitionSelection;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  public String getExecutionBackend() {
    return executionBackend;
  }

  @Override public String toString() {
    return "QueryPlan{dataset=" + dataset.getSlug() + ", mode=" + mode.getValue()
        + ", range=[" + rangeStart + ", " + rangeEnd + "], " + partitionSelection + "}";
  }
}
