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
import io.apphub.timestore.context.ContextSignatures;
import io.apphub.timestore.context.DatasetCacheState;
import io.apphub.timestore.context.DatasetContextBuilder;
import io.apphub.timestore.context.SqlContext;
import io.apphub.timestore.execution.duckdb.DuckDBExecutionEngine;
import io.apphub.timestore.execution.duckdb.DuckDBRuntimeCatalog;
import io.apphub.timestore.metadata.DatasetPage;
import io.apphub.timestore.metadata.DatasetRecord;
import io.apphub.timestore.metadata.MetadataStore;
import io.apphub.timestore.metadata.SchemaLoader;
import io.apphub.timestore.partition.PartitionMapper;
import io.apphub.timestore.partition.StorageTargetCache;
import io.apphub.timestore.storage.StorageLocators;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The SQL runtime cache: a TTL-bounded, versioned {@link SqlContext} over
 * every dataset in the catalog, plus the execution connections prepared
 * for it.
 *
 * <p>Concurrent loads share one build. Dataset-scoped invalidations are
 * queued and drained by the next load, which rebuilds only those datasets
 * and keeps the state of the others. A full invalidation drops everything
 * and bumps a generation counter, so a build that was already running when
 * it arrived is returned to its callers but never cached.
 *
 * <p>Instances are independent of each other; tests build as many as they
 * need.
 */
public class SqlContextCache implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(SqlContextCache.class);

  static final int DATASET_PAGE_SIZE = 100;

  private static final String CONTEXT_KEY = "sql-context";

  private final TimestoreConfig config;
  private final MetadataStore metadataStore;
  private final DatasetContextBuilder contextBuilder;
  private final ConnectionCache connectionCache;
  private final Clock clock;

  private final Object lock = new Object();
  private final SingleFlight<String, Versioned<SqlContext>> builds = new SingleFlight<>();
  private final Map<String, PendingInvalidation> pending = new LinkedHashMap<>();
  private final AtomicLong versions = new AtomicLong();
  private final AtomicLong fullBuilds = new AtomicLong();
  private final AtomicLong incrementalBuilds = new AtomicLong();

  // guarded by lock
  private @Nullable Slot slot;
  private long generation;
  private @Nullable Instant lastFullRefreshAt;
  private @Nullable Instant lastIncrementalRefreshAt;
  private @Nullable String lastError;
  private @Nullable Instant lastErrorAt;

  public SqlContextCache(TimestoreConfig config, MetadataStore metadataStore,
      DatasetContextBuilder contextBuilder, ConnectionCache connectionCache, Clock clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metadataStore = Objects.requireNonNull(metadataStore, "metadataStore");
    this.contextBuilder = Objects.requireNonNull(contextBuilder, "contextBuilder");
    this.connectionCache = Objects.requireNonNull(connectionCache, "connectionCache");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Creates a cache wired with the DuckDB engine and the storage locators
   * of the configuration.
   */
  public static SqlContextCache create(TimestoreConfig config, MetadataStore metadataStore) {
    return create(config, metadataStore, Clock.systemUTC());
  }

  public static SqlContextCache create(TimestoreConfig config, MetadataStore metadataStore,
      Clock clock) {
    StorageLocators locators = new StorageLocators(config.getStorage());
    DatasetContextBuilder contextBuilder =
        new DatasetContextBuilder(config, metadataStore, new SchemaLoader(metadataStore),
            new PartitionMapper(locators), clock);
    ConnectionCache connectionCache =
        new ConnectionCache(new DuckDBExecutionEngine(config.getEngine()),
            new DuckDBRuntimeCatalog(locators), config, clock);
    return new SqlContextCache(config, metadataStore, contextBuilder, connectionCache, clock);
  }

  public TimestoreConfig getConfig() {
    return config;
  }

  public MetadataStore getMetadataStore() {
    return metadataStore;
  }

  public ConnectionCache getConnectionCache() {
    return connectionCache;
  }

  /**
   * Returns the current context, building it if it is missing, expired or
   * has pending dataset invalidations.
   *
   * @throws io.apphub.timestore.metadata.MetadataStoreException if a full
   *     build cannot read the catalog
   */
  public Versioned<SqlContext> loadContext() {
    if (!config.isCachingEnabled()) {
      return buildFull("uncached").context;
    }
    connectionCache.pruneExpired();
    synchronized (lock) {
      Versioned<SqlContext> hit = freshContext(clock.instant());
      if (hit != null) {
        LOGGER.debug("SQL context cache hit (version {})", hit.getVersion());
        return hit;
      }
    }
    return builds.execute(CONTEXT_KEY, this::refresh);
  }

  /**
   * Leases an execution connection prepared for a context.
   *
   * @param context Context returned by {@link #loadContext()}
   * @return Lease to close when done
   */
  public ConnectionLease createConnection(Versioned<SqlContext> context) {
    return connectionCache.lease(context);
  }

  /**
   * Drops cached state after a manifest or partition change.
   *
   * <p>Dataset-scoped requests are queued when incremental refresh is on;
   * anything else drops the context and flushes every cached connection.
   */
  public void invalidate(InvalidationRequest request) {
    Instant now = clock.instant();
    if (request.isDatasetScoped() && config.isIncrementalRefreshEnabled()
        && config.isCachingEnabled()) {
      PendingInvalidation incoming = PendingInvalidation.of(request, now);
      synchronized (lock) {
        PendingInvalidation existing = pending.get(incoming.key());
        pending.put(incoming.key(), existing == null ? incoming : existing.merge(incoming));
      }
      LOGGER.debug("Queued SQL context refresh for {}", incoming);
      return;
    }
    synchronized (lock) {
      generation++;
      slot = null;
      pending.clear();
    }
    connectionCache.flushAll();
    LOGGER.info("Invalidated SQL runtime cache{}",
        request.getReason() == null ? "" : " (" + request.getReason() + ")");
  }

  /** Drops everything. */
  public void invalidateAll(@Nullable String reason) {
    invalidate(InvalidationRequest.full(reason));
  }

  public long getFullBuildCount() {
    return fullBuilds.get();
  }

  public long getIncrementalBuildCount() {
    return incrementalBuilds.get();
  }

  public CacheSnapshot getCacheSnapshot() {
    synchronized (lock) {
      List<CacheSnapshot.DatasetSnapshot> datasets = new ArrayList<>();
      if (slot != null) {
        for (DatasetCacheState state : slot.states.values()) {
          datasets.add(
              new CacheSnapshot.DatasetSnapshot(state.getDatasetId(), state.getSlug(),
                  state.getSignature(), state.getRefreshedAt(), state.getReason(),
                  state.getContext() != null));
        }
      }
      return new CacheSnapshot(slot != null,
          slot == null ? null : slot.context.getSignature(),
          slot == null ? null : slot.context.getVersion(),
          slot == null ? null : slot.expiresAt,
          generation, fullBuilds.get(), incrementalBuilds.get(),
          lastFullRefreshAt, lastIncrementalRefreshAt, lastError, lastErrorAt,
          ImmutableList.copyOf(pending.values()), datasets, connectionCache.snapshot());
    }
  }

  @Override public void close() {
    synchronized (lock) {
      generation++;
      slot = null;
      pending.clear();
    }
    connectionCache.close();
  }

  /** Must hold {@link #lock}. */
  private @Nullable Versioned<SqlContext> freshContext(Instant now) {
    if (slot != null && pending.isEmpty() && now.isBefore(slot.expiresAt)) {
      slot.expiresAt = now.plus(config.getRuntimeCacheTtl());
      return slot.context;
    }
    return null;
  }

  private Versioned<SqlContext> refresh() {
    Instant now = clock.instant();
    long startGeneration;
    @Nullable Slot previous;
    List<PendingInvalidation> drained;
    synchronized (lock) {
      Versioned<SqlContext> hit = freshContext(now);
      if (hit != null) {
        return hit;
      }
      startGeneration = generation;
      previous = slot;
      drained = new ArrayList<>(pending.values());
    }

    boolean live = previous != null && now.isBefore(previous.expiresAt);
    if (live && !drained.isEmpty() && config.isIncrementalRefreshEnabled()) {
      return refreshIncrementally(previous, drained, startGeneration);
    }
    return refreshFully(previous, drained, startGeneration);
  }

  private Versioned<SqlContext> refreshFully(@Nullable Slot previous,
      List<PendingInvalidation> drained, long startGeneration) {
    Slot next;
    try {
      next = buildFull(previous == null ? "initial" : "refresh");
    } catch (RuntimeException e) {
      LOGGER.error("Failed to build SQL context: {}", e.getMessage(), e);
      recordError(e);
      throw e;
    }

    synchronized (lock) {
      if (generation != startGeneration) {
        LOGGER.info("Discarding SQL context version {}: cache was invalidated during build",
            next.context.getVersion());
        return next.context;
      }
      slot = next;
      for (PendingInvalidation invalidation : drained) {
        pending.remove(invalidation.key(), invalidation);
      }
      lastFullRefreshAt = clock.instant();
    }
    if (previous != null
        && !previous.context.getSignature().equals(next.context.getSignature())) {
      connectionCache.invalidateSignature(previous.context.getSignature());
    }
    return next.context;
  }

  private Versioned<SqlContext> refreshIncrementally(Slot current,
      List<PendingInvalidation> drained, long startGeneration) {
    Map<String, DatasetCacheState> states = new LinkedHashMap<>(current.states);
    StorageTargetCache storageTargets = new StorageTargetCache(metadataStore);
    List<PendingInvalidation> succeeded = new ArrayList<>();
    List<PendingInvalidation> failed = new ArrayList<>();
    boolean changed = false;

    for (PendingInvalidation invalidation : drained) {
      try {
        changed |= refreshDataset(invalidation, states, storageTargets);
        succeeded.add(invalidation);
      } catch (RuntimeException e) {
        LOGGER.warn("Failed to refresh dataset {}; will retry on next load: {}",
            label(invalidation), e.getMessage());
        recordError(e);
        failed.add(invalidation);
      }
    }
    incrementalBuilds.incrementAndGet();

    Instant now = clock.instant();
    Slot next = changed
        ? assemble(states, now)
        : new Slot(current.context, current.states, now.plus(config.getRuntimeCacheTtl()));

    synchronized (lock) {
      if (generation != startGeneration) {
        LOGGER.info("Discarding incremental SQL context refresh: cache was invalidated");
        return next.context;
      }
      slot = next;
      for (PendingInvalidation invalidation : succeeded) {
        pending.remove(invalidation.key(), invalidation);
      }
      for (PendingInvalidation invalidation : failed) {
        if (pending.get(invalidation.key()) == invalidation) {
          pending.put(invalidation.key(), invalidation.retry(now));
        }
      }
      lastIncrementalRefreshAt = now;
    }
    if (changed) {
      // views of the old context are stale even when the signature is unchanged
      connectionCache.invalidateSignature(current.context.getSignature());
      LOGGER.info("Refreshed {} datasets; SQL context version {} -> {}",
          succeeded.size(), current.context.getVersion(), next.context.getVersion());
    }
    return next.context;
  }

  /**
   * Rebuilds or removes one dataset's state.
   *
   * @return whether the state map changed
   */
  private boolean refreshDataset(PendingInvalidation invalidation,
      Map<String, DatasetCacheState> states, StorageTargetCache storageTargets) {
    DatasetRecord dataset = invalidation.getDatasetId() != null
        ? metadataStore.getDatasetById(invalidation.getDatasetId())
        : metadataStore.getDatasetBySlug(invalidation.getDatasetSlug());
    if (dataset == null) {
      String key = invalidation.getDatasetId() != null
          ? invalidation.getDatasetId()
          : findIdBySlug(states, invalidation.getDatasetSlug());
      if (key != null && states.remove(key) != null) {
        LOGGER.info("Dataset {} no longer exists; removed from SQL context", label(invalidation));
        return true;
      }
      return false;
    }

    DatasetCacheState rebuilt =
        contextBuilder.build(dataset, storageTargets, invalidation.getReason());
    DatasetCacheState existing = states.get(dataset.getId());
    if (existing != null && existing.getSignature().equals(rebuilt.getSignature())) {
      LOGGER.debug("Dataset {} unchanged after refresh", dataset.getSlug());
      return false;
    }
    states.put(dataset.getId(), rebuilt);
    return true;
  }

  private Slot buildFull(String reason) {
    StorageTargetCache storageTargets = new StorageTargetCache(metadataStore);
    Map<String, DatasetCacheState> states = new LinkedHashMap<>();
    String cursor = null;
    do {
      DatasetPage page =
          metadataStore.listDatasets(cursor, MetadataStore.STATUS_ALL, DATASET_PAGE_SIZE);
      for (DatasetRecord dataset : page.getDatasets()) {
        states.put(dataset.getId(), contextBuilder.build(dataset, storageTargets, reason));
      }
      cursor = page.getNextCursor();
    } while (cursor != null);
    fullBuilds.incrementAndGet();
    Slot built = assemble(states, clock.instant());
    LOGGER.info("Built SQL context version {}: {} datasets, {} warnings",
        built.context.getVersion(), built.context.getValue().getDatasets().size(),
        built.context.getValue().getWarnings().size());
    return built;
  }

  private Slot assemble(Map<String, DatasetCacheState> states, Instant now) {
    SqlContext context = SqlContext.assemble(config, states.values(), now);
    String signature = ContextSignatures.contextSignature(context.getDatasets());
    return new Slot(new Versioned<>(context, signature, versions.incrementAndGet()), states,
        now.plus(config.getRuntimeCacheTtl()));
  }

  private void recordError(RuntimeException e) {
    synchronized (lock) {
      lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      lastErrorAt = clock.instant();
    }
  }

  private static @Nullable String findIdBySlug(Map<String, DatasetCacheState> states,
      @Nullable String slug) {
    for (DatasetCacheState state : states.values()) {
      if (state.getSlug().equals(slug)) {
        return state.getDatasetId();
      }
    }
    return null;
  }

  private static String label(PendingInvalidation invalidation) {
    return invalidation.getDatasetSlug() != null
        ? invalidation.getDatasetSlug() : String.valueOf(invalidation.getDatasetId());
  }

  /** The cached context and the per-dataset states it was assembled from. */
  private static final class Slot {
    final Versioned<SqlContext> context;
    final Map<String, DatasetCacheState> states;
    Instant expiresAt;

    Slot(Versioned<SqlContext> context, Map<String, DatasetCacheState> states,
        Instant expiresAt) {
      this.context = context;
      this.states = ImmutableMap.copyOf(states);
      this.expiresAt = expiresAt;
    }
  }
}
