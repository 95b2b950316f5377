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

import io.apphub.timestore.util.SqlIdentifiers;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Reads rows that were ingested into a dataset's staging database but not
 * yet flushed into a published partition.
 *
 * <p>Each dataset stages into {@code <stagingDirectory>/<slug>/staging.duckdb}.
 * The file's {@code staging.__ingestion_batches} table lists batches; rows
 * of a batch whose {@code flush_token} is still null are pending. The file
 * is opened read-only for every call, so ingestion keeps owning it.
 */
public class StagingRowSource {
  private static final Logger LOGGER = LoggerFactory.getLogger(StagingRowSource.class);

  static final String STAGING_FILE = "staging.duckdb";
  static final String STAGING_CATALOG = "staging";
  static final String STAGING_SCHEMA = "staging";
  static final String BATCHES_TABLE = "__ingestion_batches";
  static final String BATCH_ID_COLUMN = "__batch_id";

  private static final String READ_ONLY_PROPERTY = "duckdb.read_only";

  private final Path stagingDirectory;

  public StagingRowSource(Path stagingDirectory) {
    this.stagingDirectory = Objects.requireNonNull(stagingDirectory, "stagingDirectory");
  }

  /** Location of a dataset's staging database. */
  public Path stagingFile(String datasetSlug) {
    return stagingDirectory.resolve(SqlIdentifiers.sanitize(datasetSlug, "dataset"))
        .resolve(STAGING_FILE);
  }

  /**
   * Fetches pending rows inside the request's time range, ordered by time.
   * A table that cannot be read is skipped with a warning.
   *
   * @param request Dataset, range, columns and limit
   * @return Rows and warnings; empty if the dataset has no staging file
   * @throws QueryExecutionException if the staging database cannot be opened
   */
  public Result fetch(RowSourceRequest request) {
    Path file = stagingFile(request.getDatasetSlug());
    if (!Files.isRegularFile(file)) {
      return Result.empty();
    }
    Properties properties = new Properties();
    properties.setProperty(READ_ONLY_PROPERTY, "true");
    List<Map<String, ColumnValue>> rows = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    try (Connection connection =
             DriverManager.getConnection("jdbc:duckdb:" + file.toAbsolutePath(), properties)) {
      for (String table : pendingTables(connection)) {
        try {
          rows.addAll(readTable(connection, table, request));
        } catch (SQLException e) {
          LOGGER.warn("Skipped staging table {} for dataset {}: {}", table,
              request.getDatasetSlug(), e.getMessage());
          warnings.add("Skipped staging table " + table + " for dataset "
              + request.getDatasetSlug() + ": " + e.getMessage());
        }
      }
    } catch (SQLException e) {
      throw new QueryExecutionException("Failed to read staging data for dataset "
          + request.getDatasetSlug() + ": " + e.getMessage(), e);
    }
    LOGGER.debug("Read {} staged rows for dataset {}", rows.size(), request.getDatasetSlug());
    return new Result(rows, warnings);
  }

  private static List<String> pendingTables(Connection connection) throws SQLException {
    String sql = "SELECT DISTINCT table_name FROM "
        + SqlIdentifiers.qualify(STAGING_CATALOG, STAGING_SCHEMA, BATCHES_TABLE)
        + " WHERE flush_token IS NULL AND table_name IS NOT NULL ORDER BY table_name";
    List<String> tables = new ArrayList<>();
    try (PreparedStatement stmt = connection.prepareStatement(sql);
         ResultSet rs = stmt.executeQuery()) {
      while (rs.next()) {
        tables.add(rs.getString(1));
      }
    }
    return tables;
  }

  private static List<String> tableColumns(Connection connection, String table)
      throws SQLException {
    String sql = "SELECT column_name FROM duckdb_columns() WHERE database_name = ? "
        + "AND schema_name = ? AND table_name = ? ORDER BY column_index";
    List<String> columns = new ArrayList<>();
    try (PreparedStatement stmt = connection.prepareStatement(sql)) {
      stmt.setString(1, STAGING_CATALOG);
      stmt.setString(2, STAGING_SCHEMA);
      stmt.setString(3, table);
      try (ResultSet rs = stmt.executeQuery()) {
        while (rs.next()) {
          columns.add(rs.getString(1));
        }
      }
    }
    return columns;
  }

  /** Columns of a staging table to return for the request. */
  static List<String> projectColumns(List<String> tableColumns, RowSourceRequest request) {
    List<String> projected = new ArrayList<>();
    for (String column : tableColumns) {
      if (BATCH_ID_COLUMN.equals(column)) {
        continue;
      }
      if (request.getColumns().isEmpty()
          || request.getColumns().contains(column)
          || column.equals(request.getTimestampColumn())) {
        projected.add(column);
      }
    }
    return projected;
  }

  private static List<Map<String, ColumnValue>> readTable(Connection connection, String table,
      RowSourceRequest request) throws SQLException {
    List<String> columns = projectColumns(tableColumns(connection, table), request);
    if (columns.isEmpty()) {
      return ImmutableList.of();
    }
    StringBuilder sql = new StringBuilder("SELECT ");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        sql.append(", ");
      }
      sql.append("t.").append(SqlIdentifiers.quote(columns.get(i)));
    }
    String ts = "t." + SqlIdentifiers.quote(request.getTimestampColumn());
    sql.append(" FROM ")
        .append(SqlIdentifiers.qualify(STAGING_CATALOG, STAGING_SCHEMA, table)).append(" t")
        .append(" JOIN ")
        .append(SqlIdentifiers.qualify(STAGING_CATALOG, STAGING_SCHEMA, BATCHES_TABLE))
        .append(" b ON t.").append(SqlIdentifiers.quote(BATCH_ID_COLUMN))
        .append(" = b.batch_id")
        .append(" WHERE b.flush_token IS NULL AND b.table_name = ?")
        .append(" AND ").append(QuerySqlBuilder.timeBounds(ts, request.getRangeStart(),
            request.getRangeEnd()))
        .append(" ORDER BY ").append(ts);
    if (request.getLimit() != null) {
      sql.append(" LIMIT ?");
    }
    List<Map<String, ColumnValue>> rows = new ArrayList<>();
    try (PreparedStatement stmt = connection.prepareStatement(sql.toString())) {
      stmt.setString(1, table);
      if (request.getLimit() != null) {
        stmt.setInt(2, request.getLimit());
      }
      try (ResultSet rs = stmt.executeQuery()) {
        ResultSetMetaData metaData = rs.getMetaData();
        while (rs.next()) {
          Map<String, ColumnValue> row = new LinkedHashMap<>();
          for (int i = 1; i <= metaData.getColumnCount(); i++) {
            row.put(metaData.getColumnLabel(i), ColumnValue.from(rs.getObject(i)));
          }
          rows.add(row);
        }
      }
    }
    return rows;
  }

  /** Staged rows and the warnings raised while reading them. */
  public static final class Result {
    private final List<Map<String, ColumnValue>> rows;
    private final List<String> warnings;

    Result(List<Map<String, ColumnValue>> rows, List<String> warnings) {
      this.rows = ImmutableList.copyOf(rows);
      this.warnings = ImmutableList.copyOf(warnings);
    }

    static Result empty() {
      return new Result(ImmutableList.<Map<String, ColumnValue>>of(),
          ImmutableList.<String>of());
    }

    public List<Map<String, ColumnValue>> getRows() {
      return rows;
    }

    public List<String> getWarnings() {
      return warnings;
    }
  }
}
