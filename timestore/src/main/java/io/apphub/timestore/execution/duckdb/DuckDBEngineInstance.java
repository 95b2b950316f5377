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
import io.apphub.timestore.execution.EngineInstance;

import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An in-memory DuckDB database kept alive by its root connection.
 */
final class DuckDBEngineInstance implements EngineInstance {
  private static final Logger LOGGER = LoggerFactory.getLogger(DuckDBEngineInstance.class);

  private final Connection root;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  DuckDBEngineInstance(Connection root) {
    this.root = root;
  }

  @Override public EngineConnection connect() throws SQLException {
    if (closed.get()) {
      throw new SQLException("DuckDB instance is closed");
    }
    Connection connection = ((DuckDBConnection) root).duplicate();
    return new DuckDBEngineConnection(connection);
  }

  @Override public void close() throws SQLException {
    if (closed.compareAndSet(false, true)) {
      root.close();
      LOGGER.debug("Closed in-memory DuckDB instance");
    }
  }
}
