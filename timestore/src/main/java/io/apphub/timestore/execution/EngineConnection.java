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
package io.apphub.timestore.execution;

import java.sql.SQLException;

/**
 * A logical connection to an {@link EngineInstance}.
 */
public interface EngineConnection extends AutoCloseable {

  /**
   * Executes a statement that returns no rows.
   *
   * @param sql Statement text, with {@code ?} placeholders for {@code params}
   * @param params Positional parameters
   * @throws SQLException if the statement fails
   */
  void run(String sql, Object... params) throws SQLException;

  /**
   * Executes a query and materializes its result.
   *
   * @param sql Query text
   * @param timeoutMillis Statement timeout, or 0 for none
   * @return Columns and rows
   * @throws SQLException if the query fails or times out
   */
  EngineResult query(String sql, long timeoutMillis) throws SQLException;

  default EngineResult query(String sql) throws SQLException {
    return query(sql, 0L);
  }

  @Override void close() throws SQLException;
}
