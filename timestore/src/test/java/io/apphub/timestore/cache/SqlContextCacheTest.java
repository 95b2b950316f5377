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

import io.apphub.timestore.TimestoreConfig;
import io.apphub.timestore.TimestoreFixtures;
import io.apphub.timestore.context.DatasetContext;
import io.apphub.timestore.context.DatasetContextBuilder;
import io.apphub.timestore.context.SqlContext;
import io.apphub.timestore.metadata.DatasetPage;
import io.apphub.timestore.metadata.DatasetRecord;
import io.apphub.timestore.metadata.InMemoryMetadataStore;
import io.apphub.timestore.metadata.MetadataStoreException;
import io.apphub.timestore.metadata.SchemaLoader;
import io.apphub.timestore.partition.PartitionMapper;
import io.apphub.timestore.storage.StorageDefaults;
import io.apphub.timestore.storage.StorageLocators;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.apphub.timestore.TimestoreFixtures.DAY_1;
import static io.apphub.timestore.TimestoreFixtures.DAY_2;
import static io.apphub.timestore.TimestoreFixtures.DAY_3;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for SqlContextCache.
 */
@Tag("unit")
public class SqlContextCacheTest {
  private final ControllableStore store = new ControllableStore();
  private final MutableClock clock = new MutableClock(DAY_3);
  private final RecordingEngine engine = new RecordingEngine();
  private SqlContextCache cache;

  /** Catalog whose dataset listing can be made to fail or to block. */
  static class ControllableStore extends InMemoryMetadataStore {
    volatile boolean failing;
    volatile @Nullable CountDownLatch entered;
    volatile @Nullable CountDownLatch release;
    volatile @Nullable String unreadableDatasetId;

    @Override public @Nullable DatasetRecord getDatasetById(String datasetId) {
      if (datasetId.equals(unreadableDatasetId)) {
        throw new MetadataStoreException("dataset " + datasetId + " unreadable");
      }
      return super.getDatasetById(datasetId);
    }

    @Override public DatasetPage listDatasets(@Nullable String cursor, String status,
        int limit) {
      if (failing) {
        throw new MetadataStoreException("catalog unavailable");
      }
      CountDownLatch blockUntil = release;
      if (blockUntil != null) {
        release = null;
        entered.countDown();
        try {
          blockUntil.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new MetadataStoreException("interrupted", e);
        }
      }
      return super.listDatasets(cursor, status, limit);
    }
  }

  private SqlContextCache newCache(TimestoreConfig config) {
    StorageLocators locators = new StorageLocators(StorageDefaults.defaults());
    DatasetContextBuilder builder = new DatasetContextBuilder(config, store,
        new SchemaLoader(store), new PartitionMapper(locators), clock);
    ConnectionCache connections =
        new ConnectionCache(engine, new RecordingCatalogInstaller(), config, clock);
    return new SqlContextCache(config, store, builder, connections, clock);
  }

  private void publishDatasets() {
    store.putStorageTarget(TimestoreFixtures.localTarget(Paths.get("/data")));
    TimestoreFixtures.publish(store, TimestoreFixtures.dataset("ds-a", "alpha"), 1,
        TimestoreFixtures.partition("a-1", "ds-a", DAY_1, DAY_2));
    TimestoreFixtures.publish(store, TimestoreFixtures.dataset("ds-b", "beta"), 1,
        TimestoreFixtures.partition("b-1", "ds-b", DAY_1, DAY_2));
  }

  private static Map<String, CacheSnapshot.DatasetSnapshot> byId(CacheSnapshot snapshot) {
    Map<String, CacheSnapshot.DatasetSnapshot> result = new HashMap<>();
    for (CacheSnapshot.DatasetSnapshot dataset : snapshot.getDatasets()) {
      result.put(dataset.getDatasetId(), dataset);
    }
    return result;
  }

  @AfterEach void tearDown() {
    if (cache != null) {
      cache.close();
    }
  }

  @Test void testConcurrentLoadsShareOneBuild() throws Exception {
    publishDatasets();
    cache = newCache(TimestoreConfig.defaults());
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<Versioned<SqlContext>>> loads = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        loads.add(executor.submit(() -> {
          start.await();
          return cache.loadContext();
        }));
      }
      start.countDown();
      long version = loads.get(0).get(5, TimeUnit.SECONDS).getVersion();
      for (Future<Versioned<SqlContext>> load : loads) {
        assertEquals(version, load.get(5, TimeUnit.SECONDS).getVersion());
      }
    } finally {
      executor.shutdownNow();
    }
    assertEquals(1, cache.getFullBuildCount());
  }

  @Test void testReusesContextUntilInvalidated() {
    publishDatasets();
    cache = newCache(TimestoreConfig.defaults());
    Versioned<SqlContext> first = cache.loadContext();
    assertSame(first, cache.loadContext());
    assertEquals(2, first.getValue().getDatasets().size());

    cache.invalidateAll("manual");
    Versioned<SqlContext> second = cache.loadContext();
    assertNotEquals(first.getVersion(), second.getVersion());
    assertEquals(first.getSignature(), second.getSignature());
    assertEquals(2, cache.getFullBuildCount());
  }

  @Test void testIncrementalRefreshRebuildsOnlyInvalidatedDataset() {
    publishDatasets();
    cache = newCache(TimestoreConfig.defaults());
    Versioned<SqlContext> first = cache.loadContext();
    Map<String, CacheSnapshot.DatasetSnapshot> before = byId(cache.getCacheSnapshot());

    clock.advance(Duration.ofSeconds(5));
    TimestoreFixtures.publish(store, TimestoreFixtures.dataset("ds-a", "alpha"), 2,
        TimestoreFixtures.partition("a-1", "ds-a", DAY_1, DAY_2),
        TimestoreFixtures.partition("a-2", "ds-a", DAY_2, DAY_3));
    cache.invalidate(InvalidationRequest.dataset("ds-a", "manifest published"));
    assertEquals(1, cache.getCacheSnapshot().getPendingInvalidations().size());

    Versioned<SqlContext> second = cache.loadContext();
    assertEquals(1, cache.getFullBuildCount());
    assertEquals(1, cache.getIncrementalBuildCount());
    assertTrue(second.getVersion() > first.getVersion());
    assertNotEquals(first.getSignature(), second.getSignature());
    assertEquals(2, second.getValue().getDataset("alpha").getPartitions().size());

    Map<String, CacheSnapshot.DatasetSnapshot> after = byId(cache.getCacheSnapshot());
    assertEquals(before.get("ds-b").getSignature(), after.get("ds-b").getSignature());
    assertEquals(before.get("ds-b").getLastRefreshedAt(), after.get("ds-b").getLastRefreshedAt());
    assertNotEquals(before.get("ds-a").getSignature(), after.get("ds-a").getSignature());
    assertEquals("manifest published", after.get("ds-a").getReason());
    assertTrue(cache.getCacheSnapshot().getPendingInvalidations().isEmpty());
  }

  @Test void testFailedDatasetRefreshStaysQueued() {
    publishDatasets();
    cache = newCache(TimestoreConfig.defaults());
    cache.loadContext();

    clock.advance(Duration.ofSeconds(5));
    TimestoreFixtures.publish(store, TimestoreFixtures.dataset("ds-a", "alpha"), 2,
        TimestoreFixtures.partition("a-1", "ds-a", DAY_1, DAY_2),
        TimestoreFixtures.partition("a-2", "ds-a", DAY_2, DAY_3));
    TimestoreFixtures.publish(store, TimestoreFixtures.dataset("ds-b", "beta"), 2,
        TimestoreFixtures.partition("b-1", "ds-b", DAY_1, DAY_2),
        TimestoreFixtures.partition("b-2", "ds-b", DAY_2, DAY_3));
    store.unreadableDatasetId = "ds-a";
    cache.invalidate(InvalidationRequest.dataset("ds-a", "manifest published"));
    cache.invalidate(InvalidationRequest.dataset("ds-b", "manifest published"));

    Versioned<SqlContext> second = cache.loadContext();
    assertEquals(1, second.getValue().getDataset("alpha").getPartitions().size());
    assertEquals(2, second.getValue().getDataset("beta").getPartitions().size());
    CacheSnapshot snapshot = cache.getCacheSnapshot();
    assertEquals(1, snapshot.getPendingInvalidations().size());
    PendingInvalidation queued = snapshot.getPendingInvalidations().get(0);
    assertEquals("ds-a", queued.getDatasetId());
    assertEquals(1, queued.getAttempts());
    assertTrue(snapshot.getLastError().contains("dataset ds-a unreadable"),
        snapshot.getLastError());

    cache.loadContext();
    assertEquals(2,
        cache.getCacheSnapshot().getPendingInvalidations().get(0).getAttempts());

    store.unreadableDatasetId = null;
    Versioned<SqlContext> recovered = cache.loadContext();
    assertEquals(2, recovered.getValue().getDataset("alpha").getPartitions().size());
    assertTrue(cache.getCacheSnapshot().getPendingInvalidations().isEmpty());
    assertEquals(1, cache.getFullBuildCount());
  }

  @Test void testUnchangedDatasetKeepsVersion() {
    publishDatasets();
    cache = newCache(TimestoreConfig.defaults());
    Versioned<SqlContext> first = cache.loadContext();
    cache.invalidate(InvalidationRequest.builder().datasetSlug("beta").build());
    Versioned<SqlContext> second = cache.loadContext();
    assertEquals(first.getVersion(), second.getVersion());
    assertEquals(1, cache.getIncrementalBuildCount());
  }

  @Test void testIncrementalRefreshDropsDeletedDataset() {
    publishDatasets();
    cache = newCache(TimestoreConfig.defaults());
    cache.loadContext();
    store.removeDataset("ds-b");
    cache.invalidate(InvalidationRequest.dataset("ds-b", "deleted"));

    SqlContext context = cache.loadContext().getValue();
    assertEquals(1, context.getDatasets().size());
    assertNull(context.getDataset("beta"));
    assertEquals(1, cache.getFullBuildCount());
  }

  @Test void testFailedBuildIsRetried() {
    publishDatasets();
    cache = newCache(TimestoreConfig.defaults());
    store.failing = true;
    assertThrows(MetadataStoreException.class, () -> cache.loadContext());
    CacheSnapshot snapshot = cache.getCacheSnapshot();
    assertFalse(snapshot.isCachePresent());
    assertEquals("catalog unavailable", snapshot.getLastError());

    store.failing = false;
    assertEquals(2, cache.loadContext().getValue().getDatasets().size());
    assertEquals(1, cache.getFullBuildCount());
  }

  @Test void testInvalidationDuringBuildDiscardsResult() throws Exception {
    publishDatasets();
    cache = newCache(TimestoreConfig.defaults());
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    store.entered = entered;
    store.release = release;

    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<Versioned<SqlContext>> load = executor.submit(() -> cache.loadContext());
      assertTrue(entered.await(5, TimeUnit.SECONDS));
      cache.invalidateAll("schema change");
      release.countDown();

      Versioned<SqlContext> stale = load.get(5, TimeUnit.SECONDS);
      assertNotNull(stale);
      assertFalse(cache.getCacheSnapshot().isCachePresent());
      assertEquals(1, cache.getCacheSnapshot().getGeneration());
    } finally {
      executor.shutdownNow();
    }

    Versioned<SqlContext> fresh = cache.loadContext();
    assertEquals(2, cache.getFullBuildCount());
    assertTrue(cache.getCacheSnapshot().isCachePresent());
    assertEquals(fresh.getVersion(), cache.getCacheSnapshot().getVersion().longValue());
  }

  @Test void testExpiredContextIsRebuilt() {
    publishDatasets();
    cache = newCache(TimestoreConfig.defaults());
    Versioned<SqlContext> first = cache.loadContext();

    clock.advance(Duration.ofSeconds(20));
    assertSame(first, cache.loadContext());
    // each hit extends the expiry
    clock.advance(Duration.ofSeconds(20));
    assertSame(first, cache.loadContext());

    clock.advance(Duration.ofSeconds(31));
    cache.invalidate(InvalidationRequest.dataset("ds-a", "late"));
    Versioned<SqlContext> second = cache.loadContext();
    assertNotEquals(first.getVersion(), second.getVersion());
    assertEquals(2, cache.getFullBuildCount());
    assertEquals(0, cache.getIncrementalBuildCount());
  }

  @Test void testCachingDisabled() {
    publishDatasets();
    cache = newCache(TimestoreConfig.builder().runtimeCacheTtl(Duration.ZERO).build());
    Versioned<SqlContext> first = cache.loadContext();
    Versioned<SqlContext> second = cache.loadContext();
    assertNotEquals(first.getVersion(), second.getVersion());
    assertEquals(2, cache.getFullBuildCount());

    cache.invalidate(InvalidationRequest.dataset("ds-a", "ignored"));
    assertTrue(cache.getCacheSnapshot().getPendingInvalidations().isEmpty());
    assertFalse(cache.getCacheSnapshot().isCachePresent());
  }

  @Test void testIncrementalRefreshDisabledInvalidatesEverything() {
    publishDatasets();
    cache = newCache(TimestoreConfig.builder().incrementalRefreshEnabled(false).build());
    cache.loadContext();
    cache.invalidate(InvalidationRequest.dataset("ds-a", "published"));
    assertFalse(cache.getCacheSnapshot().isCachePresent());
    cache.loadContext();
    assertEquals(2, cache.getFullBuildCount());
    assertEquals(0, cache.getIncrementalBuildCount());
  }

  @Test void testFullInvalidationFlushesConnections() {
    publishDatasets();
    cache = newCache(TimestoreConfig.defaults());
    Versioned<SqlContext> context = cache.loadContext();
    try (ConnectionLease lease = cache.createConnection(context)) {
      assertEquals(context.getSignature(), lease.getSignature());
      assertEquals(1, lease.getAttachments("alpha").size());
    }
    assertEquals(1, engine.openCount());
    assertEquals(0, engine.closedCount());

    cache.invalidateAll("flush");
    assertEquals(1, engine.closedCount());
    assertTrue(cache.getCacheSnapshot().getConnections().isEmpty());
  }

  @Test void testSnapshotDescribesCache() {
    publishDatasets();
    cache = newCache(TimestoreConfig.defaults());
    CacheSnapshot empty = cache.getCacheSnapshot();
    assertFalse(empty.isCachePresent());
    assertNull(empty.getSignature());

    Versioned<SqlContext> context = cache.loadContext();
    try (ConnectionLease lease = cache.createConnection(context)) {
      CacheSnapshot snapshot = cache.getCacheSnapshot();
      assertTrue(snapshot.isCachePresent());
      assertEquals(context.getSignature(), snapshot.getSignature());
      assertEquals(DAY_3.plus(Duration.ofSeconds(30)), snapshot.getExpiresAt());
      assertEquals(DAY_3, snapshot.getLastFullRefreshAt());
      assertEquals(2, snapshot.getDatasets().size());
      assertTrue(byId(snapshot).get("ds-a").isQueryable());
      assertEquals("initial", byId(snapshot).get("ds-a").getReason());
      assertEquals(1, snapshot.getConnections().size());
      assertEquals(1, snapshot.getConnections().get(0).getActiveLeases());
    }
  }

  @Test void testDatasetViewsInstalledOnLease() {
    publishDatasets();
    cache = newCache(TimestoreConfig.defaults());
    Versioned<SqlContext> context = cache.loadContext();
    DatasetContext alpha = context.getValue().getDataset("alpha");
    try (ConnectionLease lease = cache.createConnection(context)) {
      assertTrue(lease.getWarnings().isEmpty());
    }
    boolean viewCreated = false;
    for (String statement : engine.statements) {
      if (statement.equals("CREATE VIEW " + alpha.getQualifiedViewName())) {
        viewCreated = true;
      }
    }
    assertTrue(viewCreated, engine.statements.toString());
  }
}
