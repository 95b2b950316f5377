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
import io.apphub.timestore.TimestoreFixtures;
import io.apphub.timestore.cache.SqlContextCache;
import io.apphub.timestore.metadata.InMemoryMetadataStore;
import io.apphub.timestore.query.ColumnValue;
import io.apphub.timestore.query.QueryExecutionException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Map;

import static io.apphub.timestore.TimestoreFixtures.DAY_1;
import static io.apphub.timestore.TimestoreFixtures.DAY_2;
import static io.apphub.timestore.TimestoreFixtures.DAY_3;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for SqlReadService.
 */
@Tag("integration")
public class SqlReadServiceTest {
  @TempDir Path dataDir;

  private InMemoryMetadataStore store;
  private SqlContextCache cache;
  private SqlReadService service;

  @BeforeEach void setUp() throws SQLException {
    TimestoreFixtures.writePartitionFile(dataDir.resolve("ds-1").resolve("p-1.duckdb"),
        new Instant[] {DAY_1, DAY_1.plusSeconds(60)}, new double[] {20.0, 22.0});
    TimestoreFixtures.writePartitionFile(dataDir.resolve("ds-1").resolve("p-2.duckdb"),
        new Instant[] {DAY_2}, new double[] {30.0});

    store = new InMemoryMetadataStore();
    store.putStorageTarget(TimestoreFixtures.localTarget(dataDir));
    TimestoreFixtures.publish(store, TimestoreFixtures.dataset("ds-1", "observatory"), 1,
        TimestoreFixtures.partition("p-1", "ds-1", DAY_1, DAY_2.minusSeconds(1),
            ImmutableMap.of("site", "north")),
        TimestoreFixtures.partition("p-2", "ds-1", DAY_2, DAY_3.minusSeconds(1),
            ImmutableMap.of("site", "south")));
    cache = SqlContextCache.create(
        TimestoreConfig.builder().maxStatementLength(200).build(), store);
    service = new SqlReadService(cache);
  }

  @AfterEach void tearDown() {
    cache.close();
  }

  @Test void testDescribeSchema() {
    SqlSchema schema = service.describeSchema();
    assertEquals(1, schema.getTables().size());
    SqlSchemaTable table = schema.getTables().get(0);
    assertEquals("timestore.observatory", table.getName());
    assertEquals("observatory", table.getDatasetSlug());
    assertEquals(ImmutableList.of("site"), table.getPartitionKeys());
    assertEquals("timestamp", table.getColumns().get(0).getName());
    assertEquals("temperature_c", table.getColumns().get(1).getName());
    assertTrue(schema.getWarnings().isEmpty(), schema.getWarnings().toString());
  }

  @Test void testExecuteAggregatesAcrossPartitions() {
    SqlQueryResult result = service.execute(
        "SELECT count(*) AS n, max(temperature_c) AS hottest FROM timestore.observatory;");
    assertEquals("n", result.getColumns().get(0).getName());
    assertEquals("hottest", result.getColumns().get(1).getName());
    assertEquals(1, result.getRows().size());
    Map<String, ColumnValue> row = result.getRows().get(0);
    assertEquals(3L, row.get("n").asLong());
    assertEquals(30.0d, row.get("hottest").asDouble(), 1e-9);
    assertTrue(result.getWarnings().isEmpty(), result.getWarnings().toString());
  }

  @Test void testExecuteRuntimeCatalogQuery() {
    SqlQueryResult result = service.execute(
        "WITH p AS (SELECT * FROM timestore_runtime.partitions) "
            + "SELECT partition_id FROM p ORDER BY partition_id");
    assertEquals(2, result.getRows().size());
    assertEquals("p-1", result.getRows().get(0).get("partition_id").asString());
    assertEquals("p-2", result.getRows().get(1).get("partition_id").asString());
  }

  @Test void testRejectsStatements() {
    assertThrows(StatementRejectedException.class,
        () -> service.execute("DROP VIEW timestore.observatory"));
    assertThrows(StatementRejectedException.class,
        () -> service.execute("SELECT 1; SELECT 2"));
    assertThrows(StatementRejectedException.class, () -> service.execute("  ;  "));
    StringBuilder longQuery = new StringBuilder("SELECT 1");
    while (longQuery.length() <= 200) {
      longQuery.append(" + 1");
    }
    assertThrows(StatementRejectedException.class,
        () -> service.execute(longQuery.toString()));
  }

  @Test void testEngineFailure() {
    QueryExecutionException error = assertThrows(QueryExecutionException.class,
        () -> service.execute("SELECT missing_column FROM timestore.observatory"));
    assertTrue(error.getMessage().startsWith("Failed to execute SQL query: "),
        error.getMessage());
  }

  @Test void testAttachFailuresAreReportedAsWarnings() {
    TimestoreFixtures.publish(store, TimestoreFixtures.dataset("ds-2", "drafts"), 1,
        TimestoreFixtures.partition("p-9", "ds-2", DAY_1, DAY_2));
    cache.invalidateAll("new dataset");

    SqlQueryResult result = service.execute("SELECT count(*) AS n FROM timestore.drafts");
    assertEquals(0L, result.getRows().get(0).get("n").asLong());
    assertEquals(1, result.getWarnings().size(), result.getWarnings().toString());
    assertTrue(result.getWarnings().get(0)
        .startsWith("Failed to attach partition p-9 for dataset drafts: "));
  }
}
