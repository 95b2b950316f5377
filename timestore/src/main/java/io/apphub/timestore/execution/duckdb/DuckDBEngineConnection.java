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
package io.apphub.timestore.execution.duckdb;

import io.apphub.timestore.execution.EngineConnection;
import io.apphub.timestore.execution.EngineResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC-backed logical connection to a DuckDB instance.
 */
final class DuckDBEngineConnection implements EngineConnection {
  private static final Logger LOGGER = LoggerFactory.getLogger(DuckDBEngineConnection.class);

  private final Connection connection;

  DuckDBEngineConnection(Connection connection) {
    this.connection = connection;
  }

  @Override public void run(String sql, Object... params) throws SQLException {
    if (params.length == 0) {
      try (Statement stmt = connection.createStatement()) {
        stmt.execute(sql);
      }
      return;
    }
    try (PreparedStatement stmt = connection.prepareStatement(sql)) {
      for (int i = 0; i < params.length; i++) {
        stmt.setObject(i + 1, params[i]);
      }
      stmt.execute();
    }
  }

  @Override public EngineResult query(String sql, long timeoutMillis) throws SQLException {
    try (Statement stmt = connection.createStatement()) {
      if (timeoutMillis > 0) {
        applyTimeout(stmt, timeoutMillis);
      }
      try (ResultSet rs = stmt.executeQuery(sql)) {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<EngineResult.Column> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
          columns.add(
              new EngineResult.Column(metaData.getColumnLabel(i),
                  metaData.getColumnTypeName(i)));
        }
        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
          List<Object> row = new ArrayList<>(columnCount);
          for (int i = 1; i <= columnCount; i++) {
            row.add(rs.getObject(i));
          }
          rows.add(row);
        }
        return new EngineResult(columns, rows);
      }
    }
  }

  @Override public void close() throws SQLException {
    connection.close();
  }

  private static void applyTimeout(Statement stmt, long timeoutMillis) throws SQLException {
    try {
      stmt.setQueryTimeout(timeoutSeconds(timeoutMillis));
    } catch (SQLFeatureNotSupportedException e) {
      LOGGER.debug("DuckDB driver does not support query timeouts: {}", e.getMessage());
    }
  }

  /** Whole seconds for a JDBC query timeout, rounded up and at least one. */
  static int timeoutSeconds(long timeoutMillis) {
    long seconds = timeoutMillis / 1000L + (timeoutMillis % 1000L == 0 ? 0 : 1);
    return (int) Math.min(Integer.MAX_VALUE, Math.max(1L, seconds));
  }
}
