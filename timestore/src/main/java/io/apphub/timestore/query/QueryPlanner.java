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
import io.apphub.timestore.cache.SqlContextCache;
import io.apphub.timestore.cache.Versioned;
import io.apphub.timestore.context.DatasetContext;
import io.apphub.timestore.context.SqlContext;
import io.apphub.timestore.metadata.DatasetRecord;
import io.apphub.timestore.partition.PartitionExecutionContext;
import io.apphub.timestore.query.filter.BooleanPredicate;
import io.apphub.timestore.query.filter.FilterPredicate;
import io.apphub.timestore.util.Warnings;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a {@link QueryRequest} into a {@link QueryPlan}.
 *
 * <p>Planning resolves the dataset in the current {@link SqlContext},
 * validates the request and prunes partitions. It never touches the
 * execution engine, so every rejection happens before any partition is
 * attached.
 */
public class QueryPlanner {
  private static final Logger LOGGER = LoggerFactory.getLogger(QueryPlanner.class);

  private final SqlContextCache cache;
  private final TimestoreConfig config;

  public QueryPlanner(SqlContextCache cache) {
    this(cache, cache.getConfig());
  }

  public QueryPlanner(SqlContextCache cache, TimestoreConfig config) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Plans a query.
   *
   * @param datasetSlug Dataset to query
   * @param request Time range, columns, filters and downsampling
   * @return The plan; its partition list is empty when nothing matches
   * @throws DatasetNotFoundException if no dataset has this slug
   * @throws InvalidQueryException if the request is malformed
   */
  public QueryPlan buildPlan(String datasetSlug, QueryRequest request) {
    validateRange(request);
    String timestampColumn = request.getTimestampColumn() != null
        ? request.getTimestampColumn() : config.getDefaultTimestampColumn();
    if (request.getDownsample() != null) {
      validateDownsample(request.getDownsample());
    }
    validateFilters(request);

    Versioned<SqlContext> context = cache.loadContext();
    DatasetContext datasetContext = context.getValue().getDataset(datasetSlug);
    List<String> warnings = new ArrayList<>();
    if (datasetContext == null) {
      DatasetRecord dataset = cache.getMetadataStore().getDatasetBySlug(datasetSlug);
      if (dataset == null) {
        throw new DatasetNotFoundException(datasetSlug);
      }
      String backend = resolveExecutionBackend(dataset);
      for (String warning : context.getValue().getWarnings()) {
        if (warning.contains(datasetSlug)) {
          warnings.add(warning);
        }
      }
      warnings.add("Dataset " + datasetSlug + " has no queryable partitions.");
      LOGGER.debug("Dataset {} is not part of context {}; planning empty query", datasetSlug,
          context.getVersion());
      return new QueryPlan(dataset, null, context, timestampColumn, request.getColumns(),
          request.getRangeStart(), request.getRangeEnd(), request.getFilters(),
          request.getDownsample(), request.getLimit(),
          ImmutableList.<PartitionExecutionContext>of(), PartitionSelection.empty(),
          Warnings.dedupe(warnings), backend);
    }

    DatasetRecord dataset = datasetContext.getDataset();
    String backend = resolveExecutionBackend(dataset);
    warnings.addAll(datasetContext.getWarnings());
    PartitionPruner.Result pruned = PartitionPruner.select(datasetContext.getPartitions(),
        request.getRangeStart(), request.getRangeEnd(), request.getFilters());
    LOGGER.debug("Planned query on {}: {}", datasetSlug, pruned.getSelection());
    return new QueryPlan(dataset, datasetContext, context, timestampColumn,
        request.getColumns(), request.getRangeStart(), request.getRangeEnd(),
        request.getFilters(), request.getDownsample(), request.getLimit(),
        pruned.getPartitions(), pruned.getSelection(), Warnings.dedupe(warnings), backend);
  }

  private static void validateRange(QueryRequest request) {
    if (request.getRangeStart().isAfter(request.getRangeEnd())) {
      throw new InvalidQueryException("Query start time " + request.getRangeStart()
          + " is after end time " + request.getRangeEnd());
    }
    Integer limit = request.getLimit();
    if (limit != null && limit <= 0) {
      throw new InvalidQueryException("Query limit must be positive, got " + limit);
    }
  }

  static void validateDownsample(DownsampleSpec downsample) {
    if (downsample.getIntervalSize() < 1) {
      throw new InvalidQueryException("Downsample interval size must be at least 1, got "
          + downsample.getIntervalSize());
    }
    if (downsample.getAggregations().isEmpty()) {
      throw new InvalidQueryException("Downsample requires at least one aggregation");
    }
    Set<String> aliases = new HashSet<>();
    for (AggregationSpec aggregation : downsample.getAggregations()) {
      AggregationFunction function = aggregation.getFunction();
      if (function.isColumnRequired() && aggregation.getColumn() == null) {
        throw new InvalidQueryException("Aggregation " + function.getValue()
            + " requires a column");
      }
      if (function == AggregationFunction.PERCENTILE) {
        Double fraction = aggregation.getPercentile();
        if (fraction == null || fraction.isNaN() || fraction < 0d || fraction > 1d) {
          throw new InvalidQueryException(
              "Percentile aggregation requires a fraction between 0 and 1, got " + fraction);
        }
      }
      String alias = aggregation.resolveAlias();
      if (!aliases.add(alias)) {
        throw new InvalidQueryException("Duplicate aggregation alias: " + alias);
      }
    }
  }

  private static void validateFilters(QueryRequest request) {
    for (Map.Entry<String, FilterPredicate> entry
        : request.getFilters().getPartitionKeys().entrySet()) {
      if (entry.getValue() instanceof BooleanPredicate) {
        throw new InvalidQueryException("Boolean filters are not supported on partition key "
            + entry.getKey());
      }
    }
  }

  /**
   * Reads {@code metadata.execution.backend}; only DuckDB executes queries.
   */
  String resolveExecutionBackend(DatasetRecord dataset) {
    String backend = config.getDefaultExecutionBackend();
    Object execution = dataset.getMetadata().get("execution");
    if (execution instanceof Map) {
      Object override = ((Map<?, ?>) execution).get("backend");
      if (override != null && !override.toString().trim().isEmpty()) {
        backend = override.toString().trim();
      }
    }
    String normalized = backend.toLowerCase(Locale.ROOT);
    if (!"duckdb".equals(normalized)) {
      throw new InvalidQueryException("Unsupported query execution backend: " + backend);
    }
    return normalized;
  }
}
