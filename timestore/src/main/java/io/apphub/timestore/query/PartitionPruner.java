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

import io.apphub.timestore.partition.PartitionExecutionContext;
import io.apphub.timestore.query.filter.FilterPredicate;
import io.apphub.timestore.query.filter.QueryFilters;

import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Selects the partitions a query has to read.
 *
 * <p>A partition is kept when its time bounds overlap the query range, its
 * partition key satisfies every partition-key predicate, and its column
 * statistics (when recorded) do not rule out any column predicate. A
 * partition missing a filtered key is pruned.
 */
public final class PartitionPruner {
  static final String COLUMN_STATISTICS = "columnStatistics";

  private PartitionPruner() {
    // Utility class should not be instantiated
  }

  /**
   * Prunes partitions.
   *
   * @param partitions Candidate partitions
   * @param rangeStart Inclusive start of the query range
   * @param rangeEnd Inclusive end of the query range
   * @param filters Partition-key and column predicates
   * @return Kept partitions in input order, and the selection summary
   */
  public static Result select(List<PartitionExecutionContext> partitions, Instant rangeStart,
      Instant rangeEnd, QueryFilters filters) {
    ImmutableList.Builder<PartitionExecutionContext> kept = ImmutableList.builder();
    int byTime = 0;
    int byKey = 0;
    int byStats = 0;
    for (PartitionExecutionContext partition : partitions) {
      if (!partition.overlaps(rangeStart, rangeEnd)) {
        byTime++;
      } else if (!matchesPartitionKey(partition, filters.getPartitionKeys())) {
        byKey++;
      } else if (!mayMatchStatistics(partition, filters.getColumns())) {
        byStats++;
      } else {
        kept.add(partition);
      }
    }
    List<PartitionExecutionContext> selected = kept.build();
    return new Result(selected,
        new PartitionSelection(partitions.size(), selected.size(), byTime, byKey, byStats));
  }

  static boolean matchesPartitionKey(PartitionExecutionContext partition,
      Map<String, FilterPredicate> predicates) {
    for (Map.Entry<String, FilterPredicate> entry : predicates.entrySet()) {
      Object value = partition.getPartitionKey().get(entry.getKey());
      if (value == null || !entry.getValue().matches(ColumnValue.from(value))) {
        return false;
      }
    }
    return true;
  }

  static boolean mayMatchStatistics(PartitionExecutionContext partition,
      Map<String, FilterPredicate> predicates) {
    if (predicates.isEmpty()) {
      return true;
    }
    Object statistics = partition.getPartition().getMetadata().get(COLUMN_STATISTICS);
    if (!(statistics instanceof Map)) {
      return true;
    }
    Map<?, ?> byColumn = (Map<?, ?>) statistics;
    for (Map.Entry<String, FilterPredicate> entry : predicates.entrySet()) {
      Object columnStats = byColumn.get(entry.getKey());
      if (!(columnStats instanceof Map)) {
        continue;
      }
      Map<?, ?> stats = (Map<?, ?>) columnStats;
      ColumnValue min = ColumnValue.from(stats.get("min"));
      ColumnValue max = ColumnValue.from(stats.get("max"));
      if (!entry.getValue().mayMatchRange(min, max)) {
        return false;
      }
    }
    return true;
  }

  /** Kept partitions and the selection summary. */
  public static final class Result {
    private final List<PartitionExecutionContext> partitions;
    private final PartitionSelection selection;

    Result(List<PartitionExecutionContext> partitions, PartitionSelection selection) {
      this.partitions = partitions;
      this.selection = selection;
    }

    public List<PartitionExecutionContext> getPartitions() {
      return partitions;
    }

    public PartitionSelection getSelection() {
      return selection;
    }
  }
}
