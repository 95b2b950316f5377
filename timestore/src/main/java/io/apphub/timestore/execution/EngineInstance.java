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
 * One live database instance shared by several logical connections.
 */
public interface EngineInstance extends AutoCloseable {

  /**
   * Opens a new logical connection to this instance.
   *
   * @throws SQLException if the instance is closed or the connection fails
   */
  EngineConnection connect() throws SQLException;

  /** Tears the instance down. Connections obtained from it become unusable. */
  @Override void close() throws SQLException;
}
