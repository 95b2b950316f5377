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
package io.apphub.timestore.cache;

import io.apphub.timestore.context.DatasetContext;
import io.apphub.timestore.context.SqlContext;
import io.apphub.timestore.execution.CatalogInstaller;
import io.apphub.timestore.execution.DatasetAttachment;
import io.apphub.timestore.execution.EngineConnection;
import io.apphub.timestore.execution.RuntimeCatalog;

import com.google.common.collect.ImmutableList;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Catalog installer that issues one schema statement and one statement per
 * dataset view, so tests can see what an engine instance was prepared with.
 */
class RecordingCatalogInstaller implements CatalogInstaller {
  static final String SCHEMA_STATEMENT = "CREATE SCHEMA timestore";

  final AtomicInteger installs = new AtomicInteger();
  volatile List<String> warnings = ImmutableList.of();

  @Override public RuntimeCatalog install(EngineConnection connection, SqlContext context)
      throws SQLException {
    installs.incrementAndGet();
    connection.run(SCHEMA_STATEMENT);
    Map<String, List<DatasetAttachment>> attachments = new LinkedHashMap<>();
    for (DatasetContext dataset : context.getDatasets()) {
      connection.run("CREATE VIEW " + dataset.getQualifiedViewName());
      attachments.put(dataset.getSlug(), ImmutableList.<DatasetAttachment>of());
    }
    return new RuntimeCatalog(attachments, warnings);
  }
}
