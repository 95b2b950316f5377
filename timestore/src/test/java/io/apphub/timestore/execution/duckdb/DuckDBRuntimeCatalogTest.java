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

import io.apphub.timestore.TimestoreConfig;
import io.apphub.timestore.TimestoreFixtures;
import io.apphub.timestore.cache.SqlContextCache;
import io.apphub.timestore.context.SqlContext;
import io.apphub.timestore.execution.EngineConnection;
import io.apphub.timestore.execution.EngineInstance;
import io.apphub.timestore.execution.EngineResult;
import io.apphub.timestore.execution.RuntimeCatalog;
import io.apphub.timestore.metadata.ColumnInfo;
import io.apphub.timestore.metadata.ColumnType;
import io.apphub.timestore.metadata.InMemoryMetadataStore;
import io.apphub.timestore.storage.StorageDefaults;
import io.apphub.timestore.storage.StorageLocators;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static io.apphub.timestore.TimestoreFixtures.DAY_1;
import static io.apphub.timestore.TimestoreFixtures.DAY_2;
import static io.apphub.timestore.TimestoreFixtures.DAY_3;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for DuckDBRuntimeCatalog.
 */
@Tag("integration")
public class DuckDBRuntimeCatalogTest {
  @TempDir Path dataDir;

  private SqlContextCache cache;
  private EngineInstance instance;
  private EngineConnection connection;

  @BeforeEach void setUp() throws SQLException {
    TimestoreFixtures.writePartitionFile(dataDir.resolve("ds-1").resolve("p-1.duckdb"),
        new Instant[] {DAY_1, DAY_1.plusSeconds(60), DAY_1.plusSeconds(120)},
        new double[] {20.5, 21.0, 21.5});
    TimestoreFixtures.writePartitionFile(dataDir.resolve("ds-1").resolve("p-2.duckdb"),
        new Instant[] {DAY_2}, new double[] {18.0});

    InMemoryMetadataStore store = new InMemoryMetadataStore();
    store.putStorageTarget(TimestoreFixtures.localTarget(dataDir));
    TimestoreFixtures.publish(store, TimestoreFixtures.dataset("ds-1", "observatory"), 1,
        TimestoreFixtures.partition("p-1", "ds-1", DAY_1, DAY_2.minusSeconds(1)),
        TimestoreFixtures.partition("p-2", "ds-1", DAY_2, DAY_3.minusSeconds(1)),
        TimestoreFixtures.partition("p-3", "ds-1", DAY_3, DAY_3.plusSeconds(3600)));
    // Published, but its only file was never written.
    TimestoreFixtures.publish(store, TimestoreFixtures.dataset("ds-2", "drafts"), 1,
        TimestoreFixtures.partition("p-9", "ds-2", DAY_1, DAY_2));

    cache = SqlContextCache.create(TimestoreConfig.defaults(), store);
    instance = new DuckDBExecutionEngine(DuckDBSettings.defaults()).open();
    connection = instance.connect();
  }

  @AfterEach void tearDown() throws SQLException {
    connection.close();
    instance.close();
    cache.close();
  }

  private RuntimeCatalog install() throws SQLException {
    SqlContext context = cache.loadContext().getValue();
    return new DuckDBRuntimeCatalog(new StorageLocators(StorageDefaults.defaults()))
        .install(connection, context);
  }

  private List<Object> column(String sql) throws SQLException {
    List<Object> values = new ArrayList<>();
    for (List<Object> row : connection.query(sql).getRows()) {
      values.add(row.get(0));
    }
    return values;
  }

  private static boolean hasWarning(List<String> warnings, String prefix) {
    for (String warning : warnings) {
      if (warning.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  @Test void testDatasetViewUnionsAttachedPartitions() throws SQLException {
    RuntimeCatalog catalog = install();
    assertEquals(2, catalog.getAttachments("observatory").size());
    assertEquals("p_observatory_0", catalog.getAttachments("observatory").get(0).getAlias());
    assertEquals(ImmutableList.<Object>of(20.5, 21.0, 21.5, 18.0),
        column("SELECT temperature_c FROM timestore.observatory ORDER BY \"timestamp\""));
    assertEquals(ImmutableList.<Object>of(1L),
        column("SELECT count(*) FROM \"p_observatory_1\".\"records\""));
  }

  @Test void testMissingPartitionFileBecomesWarning() throws SQLException {
    RuntimeCatalog catalog = install();
    List<String> warnings = catalog.getWarnings();
    assertEquals(2, warnings.size(), warnings.toString());
    assertTrue(hasWarning(warnings, "Failed to attach partition p-3 for dataset observatory: "),
        warnings.toString());
    assertTrue(hasWarning(warnings, "Failed to attach partition p-9 for dataset drafts: "),
        warnings.toString());
  }

  @Test void testDatasetWithoutAttachmentsKeepsItsShape() throws SQLException {
    RuntimeCatalog catalog = install();
    assertTrue(catalog.getAttachments("drafts").isEmpty());
    EngineResult result = connection.query("SELECT * FROM timestore.drafts");
    assertTrue(result.getRows().isEmpty());
    assertEquals(ImmutableList.of("timestamp", "temperature_c"), result.getColumnNames());
  }

  @Test void testRuntimeTables() throws SQLException {
    install();
    assertEquals(ImmutableList.<Object>of("drafts", "observatory"),
        column("SELECT dataset_slug FROM timestore_runtime.datasets ORDER BY 1"));
    assertEquals(ImmutableList.<Object>of("p-1", "p-2", "p-3"),
        column("SELECT partition_id FROM timestore_runtime.partitions "
            + "WHERE dataset_slug = 'observatory' ORDER BY 1"));
    assertEquals(ImmutableList.<Object>of("DOUBLE", "TIMESTAMP"),
        column("SELECT data_type FROM timestore_runtime.columns "
            + "WHERE dataset_slug = 'observatory' ORDER BY column_name"));
    assertEquals(ImmutableList.<Object>of(1L),
        column("SELECT manifest_version FROM timestore_runtime.datasets "
            + "WHERE dataset_slug = 'observatory'"));
  }

  @Test void testEmptySelect() {
    assertEquals("SELECT 1 WHERE 1=0",
        DuckDBRuntimeCatalog.emptySelect(ImmutableList.<ColumnInfo>of()));
    assertEquals("SELECT CAST(NULL AS TIMESTAMP) AS \"ts\", CAST(NULL AS BIGINT) AS \"n\""
            + " WHERE 1=0",
        DuckDBRuntimeCatalog.emptySelect(ImmutableList.of(
            new ColumnInfo("ts", ColumnType.TIMESTAMP, null, null),
            new ColumnInfo("n", ColumnType.BIGINT, null, null))));
  }
}
