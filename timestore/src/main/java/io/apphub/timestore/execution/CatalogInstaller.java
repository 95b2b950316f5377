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

import io.apphub.timestore.context.SqlContext;

import java.sql.SQLException;

/**
 * Exposes the datasets of a context inside a freshly opened engine
 * instance. Called once per connection-cache entry, before the first lease.
 */
public interface CatalogInstaller {

  /**
   * Installs views and inventory for a context.
   *
   * @param connection Connection to the instance being prepared
   * @param context Context to expose
   * @return Attached partitions per dataset and the warnings of partitions
   *     that could not be attached
   * @throws SQLException if setup fails; the instance is then discarded
   */
  RuntimeCatalog install(EngineConnection connection, SqlContext context) throws SQLException;
}
