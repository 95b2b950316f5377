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

import io.apphub.timestore.execution.EngineInstance;
import io.apphub.timestore.execution.ExecutionEngine;
import io.apphub.timestore.util.SqlIdentifiers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * DuckDB-based execution engine.
 *
 * <p>Every {@link #open()} starts a private in-memory DuckDB database. The
 * connection that created it stays open for the life of the instance and
 * logical connections are duplicated from it, so all of them share the
 * attached partition files and views.
 */
public final class DuckDBExecutionEngine implements ExecutionEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(DuckDBExecutionEngine.class);

  public static final String ENGINE_TYPE = "duckdb";

  private static final String JDBC_URL = "jdbc:duckdb:";

  private final DuckDBSettings settings;

  public DuckDBExecutionEngine(DuckDBSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Check if DuckDB JDBC driver is available on the classpath.
   *
   * @return true if DuckDB is available, false otherwise
   */
  public static boolean isAvailable() {
    try {
      Class.forName("org.duckdb.DuckDBDriver");
      return true;
    } catch (ClassNotFoundException e) {
      LOGGER.debug("DuckDB JDBC driver not found on classpath: {}", e.getMessage());
      return false;
    }
  }

  @Override public String getEngineType() {
    return ENGINE_TYPE;
  }

  @Override public EngineInstance open() throws SQLException {
    if (!isAvailable()) {
      throw new SQLException("DuckDB JDBC driver is not on the classpath");
    }
    Connection root = DriverManager.getConnection(JDBC_URL);
    try {
      applySettings(root);
    } catch (SQLException e) {
      closeAfterFailure(root, e);
      throw e;
    }
    LOGGER.debug("Opened in-memory DuckDB instance");
    return new DuckDBEngineInstance(root);
  }

  private void applySettings(Connection connection) throws SQLException {
    try (Statement stmt = connection.createStatement()) {
      if (settings.getThreads() != null) {
        stmt.execute("SET threads TO " + settings.getThreads());
      }
      if (settings.getMemoryLimit() != null) {
        stmt.execute("SET memory_limit = " + SqlIdentifiers.literal(settings.getMemoryLimit()));
      }
      if (settings.getTempDirectory() != null) {
        stmt.execute("SET temp_directory = "
            + SqlIdentifiers.literal(settings.getTempDirectory()));
      }
      stmt.execute("SET preserve_insertion_order = " + settings.isPreserveInsertionOrder());
      stmt.execute("SET enable_progress_bar = false");
    }
  }

  private static void closeAfterFailure(Connection connection, SQLException cause) {
    try {
      connection.close();
    } catch (SQLException closeError) {
      cause.addSuppressed(closeError);
    }
  }
}
