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

import io.apphub.timestore.execution.DatasetAttachment;
import io.apphub.timestore.query.filter.FilterPredicate;
import io.apphub.timestore.util.SqlIdentifiers;

import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders the DuckDB query of a {@link QueryPlan}.
 *
 * <p>Each attached partition becomes a common table expression bounded by
 * the query range; a {@code dataset} expression unions them by column
 * name. Nothing is created on the leased connection.
 */
final class QuerySqlBuilder {
  static final String DATASET_CTE = "dataset";

  /** Origin of fixed-size windows. */
  static final String EPOCH_ORIGIN = "TIMESTAMP '1970-01-01 00:00:00'";
  /** Week windows start on Monday, the first one after the epoch. */
  static final String WEEK_ORIGIN = "TIMESTAMP '1970-01-05 00:00:00'";

  private QuerySqlBuilder() {
    // Utility class should not be instantiated
  }

  /**
   * Builds the statement.
   *
   * @param plan Plan to render
   * @param attachments Attached partitions among the plan's selection; not
   *     empty
   * @return SQL text
   */
  static String build(QueryPlan plan, List<DatasetAttachment> attachments) {
    if (attachments.isEmpty()) {
      throw new IllegalArgumentException("No attached partitions to query");
    }
    StringBuilder sql = new StringBuilder("WITH ");
    String ts = SqlIdentifiers.quote(plan.getTimestampColumn());
    List<String> selects = new ArrayList<>();
    for (int i = 0; i < attachments.size(); i++) {
      String cte = SqlIdentifiers.quote("p" + i);
      sql.append(cte).append(" AS (SELECT * FROM ")
          .append(attachments.get(i).getQualifiedTableName())
          .append(" WHERE ").append(timeBounds(ts, plan.getRangeStart(), plan.getRangeEnd()))
          .append("),\n");
      selects.add("SELECT * FROM " + cte);
    }
    sql.append(SqlIdentifiers.quote(DATASET_CTE)).append(" AS (")
        .append(String.join(" UNION ALL BY NAME ", selects)).append(")\n");

    if (plan.getDownsample() == null) {
      appendRaw(sql, plan, ts);
    } else {
      appendDownsampled(sql, plan, plan.getDownsample(), ts);
    }
    return sql.toString();
  }

  private static void appendRaw(StringBuilder sql, QueryPlan plan, String ts) {
    sql.append("SELECT ");
    List<String> projection = rawColumns(plan);
    if (projection.isEmpty()) {
      sql.append('*');
    } else {
      for (int i = 0; i < projection.size(); i++) {
        if (i > 0) {
          sql.append(", ");
        }
        sql.append(SqlIdentifiers.quote(projection.get(i)));
      }
    }
    sql.append(" FROM ").append(SqlIdentifiers.quote(DATASET_CTE));
    appendWhere(sql, plan);
    sql.append(" ORDER BY ").append(ts).append(" ASC");
    appendLimit(sql, plan);
  }

  private static void appendDownsampled(StringBuilder sql, QueryPlan plan,
      DownsampleSpec downsample, String ts) {
    List<String> dimensions = dimensionColumns(plan);
    sql.append("SELECT ").append(windowExpression(downsample, ts)).append(" AS ").append(ts);
    for (String dimension : dimensions) {
      sql.append(", ").append(SqlIdentifiers.quote(dimension));
    }
    for (AggregationSpec aggregation : downsample.getAggregations()) {
      sql.append(", ").append(aggregationExpression(aggregation))
          .append(" AS ").append(SqlIdentifiers.quote(aggregation.resolveAlias()));
    }
    sql.append(" FROM ").append(SqlIdentifiers.quote(DATASET_CTE));
    appendWhere(sql, plan);
    // Ordinals: the window alias shadows the source timestamp column.
    sql.append(" GROUP BY 1");
    for (int i = 0; i < dimensions.size(); i++) {
      sql.append(", ").append(i + 2);
    }
    sql.append(" ORDER BY 1 ASC");
    for (int i = 0; i < dimensions.size(); i++) {
      sql.append(", ").append(i + 2).append(" ASC");
    }
    appendLimit(sql, plan);
  }

  /** Requested columns with the timestamp column first; empty means all. */
  static List<String> rawColumns(QueryPlan plan) {
    if (plan.getColumns().isEmpty()) {
      return ImmutableList.of();
    }
    List<String> projection = new ArrayList<>();
    if (!plan.getColumns().contains(plan.getTimestampColumn())) {
      projection.add(plan.getTimestampColumn());
    }
    projection.addAll(plan.getColumns());
    return projection;
  }

  /** Requested non-timestamp columns, grouped alongside the window. */
  static List<String> dimensionColumns(QueryPlan plan) {
    List<String> dimensions = new ArrayList<>();
    for (String column : plan.getColumns()) {
      if (!column.equals(plan.getTimestampColumn())) {
        dimensions.add(column);
      }
    }
    return dimensions;
  }

  /**
   * Start of the window containing a row: exact unit truncation for single
   * units, epoch-anchored buckets otherwise.
   */
  static String windowExpression(DownsampleSpec downsample, String ts) {
    IntervalUnit unit = downsample.getIntervalUnit();
    int size = downsample.getIntervalSize();
    if (size == 1) {
      return "date_trunc(" + SqlIdentifiers.literal(unit.getValue()) + ", " + ts + ")";
    }
    String origin = unit == IntervalUnit.WEEK ? WEEK_ORIGIN : EPOCH_ORIGIN;
    return "time_bucket(INTERVAL '" + size + " " + unit.getValue() + "s', " + ts + ", "
        + origin + ")";
  }

  static String aggregationExpression(AggregationSpec aggregation) {
    String column = aggregation.getColumn() == null
        ? null : SqlIdentifiers.quote(aggregation.getColumn());
    switch (aggregation.getFunction()) {
    case AVG:
      return "avg(" + column + ")";
    case MIN:
      return "min(" + column + ")";
    case MAX:
      return "max(" + column + ")";
    case SUM:
      return "sum(" + column + ")";
    case MEDIAN:
      return "median(" + column + ")";
    case COUNT:
      return column == null ? "count(*)" : "count(" + column + ")";
    case COUNT_DISTINCT:
      return "count(DISTINCT " + column + ")";
    case PERCENTILE:
      return "quantile_disc(" + column + ", " + aggregation.getPercentile() + ")";
    default:
      throw new InvalidQueryException("Unsupported aggregation function: "
          + aggregation.getFunction().getValue());
    }
  }

  static String timeBounds(String ts, Instant start, Instant end) {
    return ts + " >= " + SqlIdentifiers.timestampLiteral(start) + " AND " + ts + " <= "
        + SqlIdentifiers.timestampLiteral(end);
  }

  private static void appendWhere(StringBuilder sql, QueryPlan plan) {
    Map<String, FilterPredicate> predicates = plan.getFilters().getColumns();
    if (predicates.isEmpty()) {
      return;
    }
    List<String> conditions = new ArrayList<>();
    for (Map.Entry<String, FilterPredicate> entry : predicates.entrySet()) {
      conditions.add("(" + entry.getValue().toSql(SqlIdentifiers.quote(entry.getKey())) + ")");
    }
    sql.append(" WHERE ").append(String.join(" AND ", conditions));
  }

  private static void appendLimit(StringBuilder sql, QueryPlan plan) {
    if (plan.getLimit() != null) {
      sql.append(" LIMIT ").append(plan.getLimit());
    }
  }
}
