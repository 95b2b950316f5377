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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Rows of an executed {@link QueryPlan}.
 *
 * <p>Rows are ordered by the timestamp column. Use
 * {@link ColumnValue#toJson()} for a stable serialized form.
 */
public final class QueryResult {
  private final List<Map<String, ColumnValue>> rows;
  private final List<String> columns;
  private final QueryMode mode;
  private final List<String> warnings;
  private final RowSourceBreakdown sources;
  private final @Nullable StreamingMetadata streaming;
  private final PartitionSelection partitionSelection;

  public QueryResult(List<Map<String, ColumnValue>> rows, List<String> columns, QueryMode mode,
      List<String> warnings, RowSourceBreakdown sources, @Nullable StreamingMetadata streaming,
      PartitionSelection partitionSelection) {
    this.rows = ImmutableList.copyOf(rows);
    this.columns = ImmutableList.copyOf(columns);
    this.mode = mode;
    this.warnings = ImmutableList.copyOf(warnings);
    this.sources = sources;
    this.streaming = streaming;
    this.partitionSelection = partitionSelection;
  }

  public List<Map<String, ColumnValue>> getRows() {
    return rows;
  }

  public List<String> getColumns() {
    return columns;
  }

  public QueryMode getMode() {
    return mode;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  public RowSourceBreakdown getSources() {
    return sources;
  }

  /** Hot buffer state, or null when streaming is not configured. */
  public @Nullable StreamingMetadata getStreaming() {
    return streaming;
  }

  public PartitionSelection getPartitionSelection() {
    return partitionSelection;
  }

  @Override public String toString() {
    return "QueryResult{mode=" + mode.getValue() + ", rows=" + rows.size() + ", columns="
        + columns + ", sources=" + sources + "}";
  }
}
