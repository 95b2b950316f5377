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
package io.apphub.timestore.sql;

import io.apphub.timestore.TimestoreConfig;
import io.apphub.timestore.cache.ConnectionLease;
import io.apphub.timestore.cache.SqlContextCache;
import io.apphub.timestore.cache.Versioned;
import io.apphub.timestore.context.DatasetContext;
import io.apphub.timestore.context.SqlContext;
import io.apphub.timestore.execution.EngineResult;
import io.apphub.timestore.query.ColumnValue;
import io.apphub.timestore.query.QueryExecutionException;
import io.apphub.timestore.util.Warnings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs read-only SQL against the views of the current {@link SqlContext}.
 *
 * <p>Dataset views live in the {@code timestore} schema; the
 * {@code timestore_runtime} schema describes datasets, partitions and
 * columns.
 */
public class SqlReadService {
  private static final Logger LOGGER = LoggerFactory.getLogger(SqlReadService.class);

  private final SqlContextCache cache;
  private final TimestoreConfig config;

  public SqlReadService(SqlContextCache cache) {
    this(cache, cache.getConfig());
  }

  public SqlReadService(SqlContextCache cache, TimestoreConfig config) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.config = Objects.requireNonNull(config, "config");
  }

  /** Lists the dataset views of the current context. */
  public SqlSchema describeSchema() {
    SqlContext context = cache.loadContext().getValue();
    List<SqlSchemaTable> tables = new ArrayList<>();
    for (DatasetContext dataset : context.getDatasets()) {
      tables.add(
          new SqlSchemaTable(DatasetContext.VIEW_SCHEMA + "." + dataset.getViewName(),
              dataset.getSlug(), dataset.getDataset().getDescription(),
              dataset.getPartitionKeys(), dataset.getColumns()));
    }
    return new SqlSchema(tables, context.getWarnings(), context.getBuiltAt());
  }

  /**
   * Executes one read-only query.
   *
   * @param sql SELECT or WITH statement
   * @return Columns, rows and context warnings
   * @throws StatementRejectedException if the text is not a single query or
   *     is too long
   * @throws QueryExecutionException if the engine fails
   */
  public SqlQueryResult execute(String sql) {
    String statement = SqlStatements.normalize(sql, config.getMaxStatementLength());
    Versioned<SqlContext> context = cache.loadContext();
    try (ConnectionLease lease = cache.createConnection(context)) {
      LOGGER.debug("Executing SQL against context {}: {}", context.getVersion(), statement);
      EngineResult result = lease.getConnection()
          .query(statement, config.getStatementTimeout().toMillis());
      List<SqlQueryResult.Column> columns = new ArrayList<>();
      for (EngineResult.Column column : result.getColumns()) {
        columns.add(new SqlQueryResult.Column(column.getName(), column.getTypeName()));
      }
      List<Map<String, ColumnValue>> rows = new ArrayList<>(result.getRows().size());
      for (List<Object> values : result.getRows()) {
        Map<String, ColumnValue> row = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
          row.put(columns.get(i).getName(), ColumnValue.from(values.get(i)));
        }
        rows.add(row);
      }
      List<String> warnings = new ArrayList<>(context.getValue().getWarnings());
      warnings.addAll(lease.getWarnings());
      return new SqlQueryResult(columns, rows, Warnings.dedupe(warnings));
    } catch (SQLException e) {
      throw new QueryExecutionException("Failed to execute SQL query: " + e.getMessage(), e);
    }
  }
}
