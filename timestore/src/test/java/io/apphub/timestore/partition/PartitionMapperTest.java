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
package io.apphub.timestore.partition;

import io.apphub.timestore.TimestoreFixtures;
import io.apphub.timestore.metadata.InMemoryMetadataStore;
import io.apphub.timestore.metadata.PartitionRecord;
import io.apphub.timestore.metadata.StorageTargetKind;
import io.apphub.timestore.metadata.StorageTargetRecord;
import io.apphub.timestore.storage.StorageDefaults;
import io.apphub.timestore.storage.StorageLocators;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static io.apphub.timestore.TimestoreFixtures.DAY_1;
import static io.apphub.timestore.TimestoreFixtures.DAY_2;
import static io.apphub.timestore.TimestoreFixtures.DAY_3;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for PartitionMapper.
 */
@Tag("unit")
public class PartitionMapperTest {
  private final InMemoryMetadataStore store = new InMemoryMetadataStore();
  private final PartitionMapper mapper =
      new PartitionMapper(new StorageLocators(StorageDefaults.defaults()));

  private static PartitionRecord onTarget(String id, String targetId) {
    return PartitionRecord.builder()
        .id(id)
        .datasetId("ds-1")
        .storageTargetId(targetId)
        .filePath("ds-1/" + id + ".duckdb")
        .startTime(DAY_1)
        .endTime(DAY_2)
        .build();
  }

  @Test void testSkipsPartitionsOfMissingTarget() {
    store.putStorageTarget(TimestoreFixtures.localTarget(Paths.get("/data")));
    List<String> warnings = new ArrayList<>();
    StorageTargetCache targets = new StorageTargetCache(store);

    List<PartitionExecutionContext> mapped = mapper.mapPartitions(
        ImmutableList.of(
            TimestoreFixtures.partition("p-1", "ds-1", DAY_1, DAY_2),
            onTarget("p-2", "missing"),
            onTarget("p-3", "missing"),
            TimestoreFixtures.partition("p-4", "ds-1", DAY_2, DAY_3)),
        targets, warnings);

    assertEquals(2, mapped.size());
    assertEquals("p-1", mapped.get(0).getId());
    assertEquals("p-4", mapped.get(1).getId());
    assertEquals(PartitionMapper.DEFAULT_TABLE_NAME, mapped.get(0).getTableName());
    assertTrue(mapped.get(0).getLocation().endsWith("p-1.duckdb"));
    assertEquals(
        ImmutableList.of("Storage target missing not found; skipping affected partitions."),
        warnings);
    assertEquals(2, targets.getLookupCount());
  }

  @Test void testSkipsNonDuckDbAndUnresolvable() {
    store.putStorageTarget(TimestoreFixtures.localTarget(Paths.get("/data")));
    store.putStorageTarget(new StorageTargetRecord("s3", "s3", StorageTargetKind.S3,
        ImmutableMap.<String, Object>of()));
    PartitionRecord parquet = PartitionRecord.builder()
        .id("p-parquet")
        .datasetId("ds-1")
        .storageTargetId(TimestoreFixtures.TARGET_ID)
        .fileFormat(PartitionRecord.FILE_FORMAT_PARQUET)
        .filePath("ds-1/p.parquet")
        .startTime(DAY_1)
        .endTime(DAY_2)
        .build();
    List<String> warnings = new ArrayList<>();

    List<PartitionExecutionContext> mapped = mapper.mapPartitions(
        ImmutableList.of(parquet, onTarget("p-s3", "s3")),
        new StorageTargetCache(store), warnings);

    assertTrue(mapped.isEmpty());
    assertEquals("Skipping non-DuckDB partition p-parquet.", warnings.get(0));
    assertTrue(warnings.get(1).startsWith("Failed to resolve location for partition p-s3: "),
        warnings.get(1));
  }

  @Test void testTableNameFromMetadata() {
    PartitionRecord partition = PartitionRecord.builder()
        .id("p-1")
        .datasetId("ds-1")
        .storageTargetId(TimestoreFixtures.TARGET_ID)
        .filePath("ds-1/p-1.duckdb")
        .metadata(ImmutableMap.of("tableName", " readings "))
        .startTime(DAY_1)
        .endTime(DAY_2)
        .build();
    assertEquals("readings", PartitionMapper.tableName(partition));
  }

  @Test void testOverlapIsInclusive() {
    store.putStorageTarget(TimestoreFixtures.localTarget(Paths.get("/data")));
    PartitionExecutionContext context = mapper.mapPartitions(
        ImmutableList.of(TimestoreFixtures.partition("p-1", "ds-1", DAY_1, DAY_2)),
        new StorageTargetCache(store), new ArrayList<String>()).get(0);
    assertTrue(context.overlaps(DAY_2, DAY_3));
    assertTrue(context.overlaps(DAY_1.minusSeconds(60), DAY_1));
    assertFalse(context.overlaps(DAY_2.plusSeconds(1), DAY_3));
  }
}
