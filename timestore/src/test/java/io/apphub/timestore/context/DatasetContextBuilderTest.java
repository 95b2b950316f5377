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
package io.apphub.timestore.context;

import io.apphub.timestore.TimestoreConfig;
import io.apphub.timestore.TimestoreFixtures;
import io.apphub.timestore.metadata.DatasetRecord;
import io.apphub.timestore.metadata.InMemoryMetadataStore;
import io.apphub.timestore.metadata.ManifestRecord;
import io.apphub.timestore.metadata.SchemaLoader;
import io.apphub.timestore.partition.PartitionMapper;
import io.apphub.timestore.partition.StorageTargetCache;
import io.apphub.timestore.storage.StorageDefaults;
import io.apphub.timestore.storage.StorageLocators;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.ZoneOffset;

import static io.apphub.timestore.TimestoreFixtures.DAY_1;
import static io.apphub.timestore.TimestoreFixtures.DAY_2;
import static io.apphub.timestore.TimestoreFixtures.DAY_3;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for DatasetContextBuilder and ContextSignatures.
 */
@Tag("unit")
public class DatasetContextBuilderTest {
  private InMemoryMetadataStore store;
  private DatasetContextBuilder builder;

  @BeforeEach void setUp() {
    store = new InMemoryMetadataStore();
    store.putStorageTarget(TimestoreFixtures.localTarget(Paths.get("/data")));
    builder = new DatasetContextBuilder(TimestoreConfig.defaults(), store,
        new SchemaLoader(store),
        new PartitionMapper(new StorageLocators(StorageDefaults.defaults())),
        Clock.fixed(DAY_3, ZoneOffset.UTC));
  }

  private DatasetCacheState build(DatasetRecord dataset) {
    return builder.build(dataset, new StorageTargetCache(store), "test");
  }

  @Test void testBuildsContext() {
    DatasetRecord dataset = TimestoreFixtures.dataset("ds-1", "observatory");
    TimestoreFixtures.publish(store, dataset, 1,
        TimestoreFixtures.partition("p-1", "ds-1", DAY_1, DAY_2,
            ImmutableMap.of("site", "north")),
        TimestoreFixtures.partition("p-2", "ds-1", DAY_2, DAY_3,
            ImmutableMap.of("region", "eu", "site", "south")));

    DatasetCacheState state = build(dataset);
    DatasetContext context = state.getContext();
    assertNotNull(context);
    assertEquals("observatory", context.getViewName());
    assertEquals("\"timestore\".\"observatory\"", context.getQualifiedViewName());
    assertEquals(2, context.getPartitions().size());
    assertEquals(2, context.getColumns().size());
    assertEquals(ImmutableList.of("region", "site"), context.getPartitionKeys());
    assertEquals(1, context.getManifest().getVersion());
    assertTrue(state.getWarnings().isEmpty(), state.getWarnings().toString());
    assertEquals(DAY_3, state.getRefreshedAt());
    assertEquals("test", state.getReason());
  }

  @Test void testSkipsNonDuckDbDataset() {
    DatasetRecord dataset = TimestoreFixtures.dataset("ds-1", "events").toBuilder()
        .writeFormat("clickhouse").build();
    store.putDataset(dataset);

    DatasetCacheState state = build(dataset);
    assertNull(state.getContext());
    assertEquals("Dataset events is not backed by DuckDB partitions; skipping.",
        state.getWarnings().get(0));
  }

  @Test void testSanitizedViewNameWarns() {
    DatasetRecord dataset = TimestoreFixtures.dataset("ds-1", "Sensor-Readings");
    TimestoreFixtures.publish(store, dataset, 1,
        TimestoreFixtures.partition("p-1", "ds-1", DAY_1, DAY_2));

    DatasetCacheState state = build(dataset);
    assertEquals("sensor_readings", state.getContext().getViewName());
    assertTrue(state.getWarnings().contains(
        "Dataset Sensor-Readings is exposed as timestore.sensor_readings."));
  }

  @Test void testDatasetWithoutManifest() {
    DatasetRecord dataset = TimestoreFixtures.dataset("ds-1", "empty");
    store.putDataset(dataset);

    DatasetContext context = build(dataset).getContext();
    assertNotNull(context);
    assertNull(context.getManifest());
    assertTrue(context.getPartitions().isEmpty());
    assertEquals("Dataset empty has no published schema; autocomplete disabled.",
        context.getWarnings().get(0));
  }

  @Test void testShardedManifestsCombine() {
    DatasetRecord dataset = TimestoreFixtures.dataset("ds-1", "observatory");
    TimestoreFixtures.publish(store, dataset, 3,
        TimestoreFixtures.partition("p-root", "ds-1", DAY_2, DAY_3));
    store.putManifest(ManifestRecord.builder()
        .id("m-shard")
        .datasetId("ds-1")
        .version(5)
        .manifestShard("2023")
        .schemaVersionId("ds-1-schema")
        .partitions(ImmutableList.of(
            TimestoreFixtures.partition("p-old", "ds-1", DAY_1, DAY_2)))
        .build());

    DatasetContext context = build(dataset).getContext();
    ManifestView manifest = context.getManifest();
    assertEquals(ImmutableList.of("m-shard", "ds-1-m3"), manifest.getManifestIds());
    assertEquals(5, manifest.getVersion());
    assertEquals(2, manifest.getPartitionCount());
    assertEquals(2, context.getPartitions().size());
  }

  @Test void testSignaturesAreDeterministic() {
    DatasetRecord dataset = TimestoreFixtures.dataset("ds-1", "observatory");
    TimestoreFixtures.publish(store, dataset, 1,
        TimestoreFixtures.partition("p-1", "ds-1", DAY_1, DAY_2));
    DatasetCacheState first = build(dataset);
    DatasetCacheState second = build(dataset);
    assertEquals(first.getSignature(), second.getSignature());
    assertEquals(ContextSignatures.contextSignature(ImmutableList.of(first.getContext())),
        ContextSignatures.contextSignature(ImmutableList.of(second.getContext())));
  }

  @Test void testSignatureTracksCatalogChanges() {
    DatasetRecord dataset = TimestoreFixtures.dataset("ds-1", "observatory");
    TimestoreFixtures.publish(store, dataset, 1,
        TimestoreFixtures.partition("p-1", "ds-1", DAY_1, DAY_2));
    DatasetCacheState original = build(dataset);
    String originalContext =
        ContextSignatures.contextSignature(ImmutableList.of(original.getContext()));

    TimestoreFixtures.publish(store, dataset, 2,
        TimestoreFixtures.partition("p-1", "ds-1", DAY_1, DAY_2),
        TimestoreFixtures.partition("p-2", "ds-1", DAY_2, DAY_3));
    DatasetCacheState republished = build(dataset);
    assertNotEquals(original.getSignature(), republished.getSignature());
    assertNotEquals(originalContext,
        ContextSignatures.contextSignature(ImmutableList.of(republished.getContext())));

    DatasetRecord touched = dataset.toBuilder().updatedAt(DAY_3).build();
    store.putDataset(touched);
    DatasetCacheState retouched = build(touched);
    assertNotEquals(republished.getSignature(), retouched.getSignature());
    assertNotEquals(ContextSignatures.skippedDatasetSignature(dataset),
        ContextSignatures.skippedDatasetSignature(touched));
  }
}
