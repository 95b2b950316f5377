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

import io.apphub.timestore.TimestoreConfig;
import io.apphub.timestore.cache.ConnectionLease;
import io.apphub.timestore.cache.SqlContextCache;
import io.apphub.timestore.execution.DatasetAttachment;
import io.apphub.timestore.execution.EngineResult;
import io.apphub.timestore.partition.PartitionExecutionContext;
import io.apphub.timestore.query.filter.FilterPredicate;
import io.apphub.timestore.streaming.HotBuffer;
import io.apphub.timestore.streaming.HotBufferConfig;
import io.apphub.timestore.util.Warnings;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Executes {@link QueryPlan}s.
 *
 * <p>Published partitions are read through a lease on the cached engine
 * instance of the plan's context. Raw queries also merge rows that are
 * staged but not yet published, and rows held in the streaming hot buffer.
 * The result reports how many rows each source contributed.
 */
public class QueryExecutor {
  private static final Logger LOGGER = LoggerFactory.getLogger(QueryExecutor.class);

  private final SqlContextCache cache;
  private final TimestoreConfig config;
  private final @Nullable StagingRowSource stagingSource;
  private final @Nullable HotBufferRowSource hotBufferSource;

  public QueryExecutor(SqlContextCache cache) {
    this(cache, cache.getConfig(),
        cache.getConfig().getStagingDirectory() == null
            ? null : new StagingRowSource(cache.getConfig().getStagingDirectory()),
        null);
  }

  public QueryExecutor(SqlContextCache cache, TimestoreConfig config,
      @Nullable StagingRowSource stagingSource, @Nullable HotBufferRowSource hotBufferSource) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.config = Objects.requireNonNull(config, "config");
    this.stagingSource = stagingSource;
    this.hotBufferSource = hotBufferSource;
  }

  /**
   * Executes a plan.
   *
   * @param plan Plan built by {@link QueryPlanner}
   * @return Rows, columns and provenance
   * @throws QueryExecutionException if the engine fails, or the hot buffer is
   *     unavailable and configured to fail queries
   */
  public QueryResult execute(QueryPlan plan) {
    List<String> warnings = new ArrayList<>(plan.getWarnings());
    Published published = plan.getPartitions().isEmpty()
        ? Published.none() : readPublished(plan, warnings);

    if (plan.getMode() == QueryMode.DOWNSAMPLED) {
      List<String> columns = published.columns.isEmpty()
          ? downsampledColumns(plan) : published.columns;
      return new QueryResult(published.rows, columns, plan.getMode(),
          Warnings.dedupe(warnings),
          new RowSourceBreakdown(published.rows.size(), published.partitions, 0, 0), null,
          plan.getPartitionSelection());
    }

    RowSourceRequest request = RowSourceRequest.of(plan);
    List<Map<String, ColumnValue>> staged = ImmutableList.of();
    if (stagingSource != null) {
      StagingRowSource.Result result = stagingSource.fetch(request);
      staged = filterRows(result.getRows(), plan);
      warnings.addAll(result.getWarnings());
    }

    List<Map<String, ColumnValue>> buffered = ImmutableList.of();
    HotBuffer.Result bufferResult = null;
    if (hotBufferSource != null && hotBufferSource.isEnabled()) {
      bufferResult = hotBufferSource.fetch(request);
      if (bufferResult.getState() == HotBuffer.State.UNAVAILABLE) {
        HotBufferConfig bufferConfig = hotBufferSource.getHotBuffer().getConfig();
        if (bufferConfig.getFallbackMode() == HotBufferConfig.FallbackMode.ERROR) {
          throw new QueryExecutionException(
              "Streaming hot buffer is unavailable and fallback mode is set to error.");
        }
        warnings.add("Streaming hot buffer unavailable; served published partitions only.");
      } else {
        buffered = filterRows(bufferResult.getRows(), plan);
      }
    }

    List<Map<String, ColumnValue>> rows;
    int stagingRows;
    int hotBufferRows;
    int publishedRows;
    if (staged.isEmpty() && buffered.isEmpty()) {
      rows = published.rows;
      publishedRows = rows.size();
      stagingRows = 0;
      hotBufferRows = 0;
    } else {
      rows = mergeRows(plan, published.rows, staged, buffered);
      publishedRows = countFrom(rows, published.rows);
      stagingRows = countFrom(rows, staged);
      hotBufferRows = countFrom(rows, buffered);
    }

    List<String> baseColumns = published.columns.isEmpty()
        ? rawColumns(plan) : published.columns;
    StreamingMetadata streaming = bufferResult == null ? null
        : streamingMetadata(plan, bufferResult, hotBufferRows);
    LOGGER.debug("Query on {} returned {} rows (published {}, staging {}, hot buffer {})",
        plan.getDatasetSlug(), rows.size(), publishedRows, stagingRows, hotBufferRows);
    return new QueryResult(rows, mergeColumns(baseColumns, rows), plan.getMode(),
        Warnings.dedupe(warnings),
        new RowSourceBreakdown(publishedRows, published.partitions, stagingRows,
            hotBufferRows),
        streaming, plan.getPartitionSelection());
  }

  private Published readPublished(QueryPlan plan, List<String> warnings) {
    try (ConnectionLease lease = cache.createConnection(plan.getContext())) {
      Map<String, DatasetAttachment> byPartition = new HashMap<>();
      for (DatasetAttachment attachment : lease.getAttachments(plan.getDatasetSlug())) {
        byPartition.put(attachment.getPartitionId(), attachment);
      }
      List<DatasetAttachment> attachments = new ArrayList<>();
      for (PartitionExecutionContext partition : plan.getPartitions()) {
        DatasetAttachment attachment = byPartition.get(partition.getId());
        if (attachment == null) {
          warnings.add("Partition " + partition.getId() + " of dataset "
              + plan.getDatasetSlug() + " is unavailable and was excluded.");
        } else {
          attachments.add(attachment);
        }
      }
      if (attachments.isEmpty()) {
        LOGGER.warn("No selected partition of dataset {} could be attached",
            plan.getDatasetSlug());
        return Published.none();
      }
      String sql = QuerySqlBuilder.build(plan, attachments);
      LOGGER.debug("Executing query on {} over {} partitions:\n{}", plan.getDatasetSlug(),
          attachments.size(), sql);
      EngineResult result = lease.getConnection()
          .query(sql, config.getStatementTimeout().toMillis());
      return new Published(toRows(result), result.getColumnNames(), attachments.size());
    } catch (SQLException e) {
      throw new QueryExecutionException("Failed to execute query for dataset "
          + plan.getDatasetSlug() + ": " + e.getMessage(), e);
    }
  }

  static List<Map<String, ColumnValue>> toRows(EngineResult result) {
    List<String> names = result.getColumnNames();
    List<Map<String, ColumnValue>> rows = new ArrayList<>(result.getRows().size());
    for (List<Object> values : result.getRows()) {
      Map<String, ColumnValue> row = new LinkedHashMap<>();
      for (int i = 0; i < names.size(); i++) {
        row.put(names.get(i), ColumnValue.from(values.get(i)));
      }
      rows.add(row);
    }
    return rows;
  }

  /** Applies column predicates to rows that did not come from the engine. */
  static List<Map<String, ColumnValue>> filterRows(List<Map<String, ColumnValue>> rows,
      QueryPlan plan) {
    Map<String, FilterPredicate> predicates = plan.getFilters().getColumns();
    if (predicates.isEmpty()) {
      return rows;
    }
    List<Map<String, ColumnValue>> kept = new ArrayList<>();
    for (Map<String, ColumnValue> row : rows) {
      boolean matches = true;
      for (Map.Entry<String, FilterPredicate> entry : predicates.entrySet()) {
        ColumnValue value = row.get(entry.getKey());
        if (!entry.getValue().matches(value == null ? ColumnValue.ofNull() : value)) {
          matches = false;
          break;
        }
      }
      if (matches) {
        kept.add(row);
      }
    }
    return kept;
  }

  /**
   * Orders all rows by time, drops exact duplicates keeping the first, and
   * applies the limit. Rows without a timestamp go last.
   */
  static List<Map<String, ColumnValue>> mergeRows(QueryPlan plan,
      List<Map<String, ColumnValue>> published, List<Map<String, ColumnValue>> staged,
      List<Map<String, ColumnValue>> buffered) {
    final String ts = plan.getTimestampColumn();
    List<Map<String, ColumnValue>> all = new ArrayList<>(
        published.size() + staged.size() + buffered.size());
    all.addAll(published);
    all.addAll(staged);
    all.addAll(buffered);
    Collections.sort(all, Comparator.comparing(
        (Map<String, ColumnValue> row) -> timestampOf(row, ts),
        Comparator.nullsLast(Comparator.<Instant>naturalOrder())));
    Set<Map<String, ColumnValue>> seen = new HashSet<>();
    List<Map<String, ColumnValue>> merged = new ArrayList<>();
    for (Map<String, ColumnValue> row : all) {
      if (!seen.add(row)) {
        continue;
      }
      merged.add(row);
      if (plan.getLimit() != null && merged.size() >= plan.getLimit()) {
        break;
      }
    }
    return merged;
  }

  private static @Nullable Instant timestampOf(Map<String, ColumnValue> row, String column) {
    ColumnValue value = row.get(column);
    return value == null ? null : value.asInstant();
  }

  private static int countFrom(List<Map<String, ColumnValue>> rows,
      List<Map<String, ColumnValue>> source) {
    if (source.isEmpty()) {
      return 0;
    }
    Set<Map<String, ColumnValue>> identities =
        Collections.newSetFromMap(new IdentityHashMap<Map<String, ColumnValue>, Boolean>());
    identities.addAll(source);
    int count = 0;
    for (Map<String, ColumnValue> row : rows) {
      if (identities.contains(row)) {
        count++;
      }
    }
    return count;
  }

  /** Columns of an empty raw result: the requested ones, or the timestamp. */
  static List<String> rawColumns(QueryPlan plan) {
    if (plan.getColumns().isEmpty()) {
      return ImmutableList.of(plan.getTimestampColumn());
    }
    return plan.getColumns();
  }

  static List<String> downsampledColumns(QueryPlan plan) {
    List<String> columns = new ArrayList<>();
    columns.add(plan.getTimestampColumn());
    columns.addAll(QuerySqlBuilder.dimensionColumns(plan));
    DownsampleSpec downsample = Objects.requireNonNull(plan.getDownsample(), "downsample");
    for (AggregationSpec aggregation : downsample.getAggregations()) {
      columns.add(aggregation.resolveAlias());
    }
    return columns;
  }

  private static List<String> mergeColumns(List<String> base,
      List<Map<String, ColumnValue>> rows) {
    Set<String> columns = new LinkedHashSet<>(base);
    for (Map<String, ColumnValue> row : rows) {
      columns.addAll(row.keySet());
    }
    return ImmutableList.copyOf(columns);
  }

  private static StreamingMetadata streamingMetadata(QueryPlan plan, HotBuffer.Result result,
      int rows) {
    Instant latest = result.getLatestTimestamp();
    boolean fresh = latest != null && !latest.isBefore(plan.getRangeEnd());
    return new StreamingMetadata(true, result.getState(), rows, result.getWatermark(), latest,
        fresh);
  }

  /** Rows read from published partitions. */
  private static final class Published {
    final List<Map<String, ColumnValue>> rows;
    final List<String> columns;
    final int partitions;

    Published(List<Map<String, ColumnValue>> rows, List<String> columns, int partitions) {
      this.rows = rows;
      this.columns = columns;
      this.partitions = partitions;
    }

    static Published none() {
      return new Published(ImmutableList.<Map<String, ColumnValue>>of(),
          ImmutableList.<String>of(), 0);
    }
  }
}
