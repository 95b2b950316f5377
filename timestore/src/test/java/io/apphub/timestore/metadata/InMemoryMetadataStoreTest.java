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
package io.apphub.timestore.metadata;

import io.apphub.timestore.TimestoreFixtures;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for InMemoryMetadataStore.
 */
@Tag("unit")
public class InMemoryMetadataStoreTest {

  @Test void testPublishingSupersedesSameShard() {
    InMemoryMetadataStore store = new InMemoryMetadataStore();
    store.putManifest(TimestoreFixtures.manifest("m-1", "ds-1", 1, "s"));
    store.putManifest(TimestoreFixtures.manifest("m-2", "ds-1", 2, "s"));
    store.putManifest(ManifestRecord.builder()
        .id("m-3")
        .datasetId("ds-1")
        .version(1)
        .manifestShard("2024-01")
        .build());

    assertEquals("m-2", store.getLatestPublishedManifest("ds-1").getId());
    List<ManifestRecord> published = store.listPublishedManifestsWithPartitions("ds-1");
    assertEquals(2, published.size());
    assertEquals("2024-01", published.get(0).getManifestShard());
    assertEquals("m-2", published.get(1).getId());
  }

  @Test void testDatasetPaging() {
    InMemoryMetadataStore store = new InMemoryMetadataStore();
    store.putDataset(TimestoreFixtures.dataset("ds-1", "one"));
    store.putDataset(TimestoreFixtures.dataset("ds-2", "two"));
    store.putDataset(TimestoreFixtures.dataset("ds-3", "three").toBuilder()
        .status("inactive").build());

    DatasetPage first = store.listDatasets(null, MetadataStore.STATUS_ALL, 2);
    assertEquals(2, first.getDatasets().size());
    DatasetPage second = store.listDatasets(first.getNextCursor(), MetadataStore.STATUS_ALL, 2);
    assertEquals(1, second.getDatasets().size());
    assertNull(second.getNextCursor());

    assertEquals(2, store.listDatasets(null, "active", 10).getDatasets().size());
    assertEquals("ds-2", store.getDatasetBySlug("two").getId());
    store.removeDataset("ds-2");
    assertNull(store.getDatasetBySlug("two"));
  }
}
