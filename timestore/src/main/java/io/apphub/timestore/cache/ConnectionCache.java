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
import io.apphub.timestore.context.SqlContext;
import io.apphub.timestore.execution.CatalogInstaller;
import io.apphub.timestore.execution.EngineConnection;
import io.apphub.timestore.execution.EngineException;
import io.apphub.timestore.execution.EngineInstance;
import io.apphub.timestore.execution.ExecutionEngine;
import io.apphub.timestore.execution.RuntimeCatalog;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prepared engine instances keyed by context signature.
 *
 * <p>Preparing an instance (remote credentials, inventory tables, one view
 * per dataset) is expensive, so it happens once per signature and every
 * lease gets its own logical connection to the shared instance. Concurrent
 * leases for a signature that is not cached yet wait for a single build.
 *
 * <p>With caching disabled ({@code sql.runtimeCacheTtl <= 0}) every lease
 * builds a private instance that is closed when the lease is released.
 */
public class ConnectionCache implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionCache.class);

  private static final int MAX_LEASE_ATTEMPTS = 3;

  private final ExecutionEngine engine;
  private final CatalogInstaller catalog;
  private final TimestoreConfig config;
  private final Clock clock;
  private final Map<String, CachedConnectionEntry> entries = new ConcurrentHashMap<>();
  private final SingleFlight<String, CachedConnectionEntry> builds = new SingleFlight<>();
  private final AtomicLong flushGeneration = new AtomicLong();
  private final AtomicLong buildCount = new AtomicLong();

  public ConnectionCache(ExecutionEngine engine, CatalogInstaller catalog,
      TimestoreConfig config, Clock clock) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Leases a connection prepared for a context.
   *
   * @param context Context, with the signature the connection is keyed by
   * @return Lease to close once the caller is done with the connection
   * @throws EngineException if the engine instance cannot be prepared
   */
  public ConnectionLease lease(Versioned<SqlContext> context) {
    if (!config.isCachingEnabled()) {
      CachedConnectionEntry entry = build(context);
      entry.tryAcquire(clock.instant(), Duration.ZERO);
      entry.markDisposed();
      return connect(entry);
    }

    Duration ttl = config.getRuntimeCacheTtl();
    for (int attempt = 0; attempt < MAX_LEASE_ATTEMPTS; attempt++) {
      Instant now = clock.instant();
      CachedConnectionEntry entry = entries.get(context.getSignature());
      if (entry != null && !entry.isExpired(now) && entry.tryAcquire(now, ttl)) {
        LOGGER.debug("Reusing execution engine for context {}",
            CachedConnectionEntry.shortSignature(entry.getSignature()));
        return connect(entry);
      }
      if (entry != null) {
        evict(entry);
      }

      final long generation = flushGeneration.get();
      CachedConnectionEntry built = builds.execute(context.getSignature(), () -> {
        CachedConnectionEntry current = entries.get(context.getSignature());
        if (current != null && !current.isDisposed() && !current.isExpired(clock.instant())) {
          return current;
        }
        CachedConnectionEntry fresh = build(context);
        if (flushGeneration.get() == generation) {
          entries.put(context.getSignature(), fresh);
        }
        return fresh;
      });
      if (built.tryAcquire(clock.instant(), ttl)) {
        if (entries.get(built.getSignature()) != built) {
          // built across a flush: serve this lease, then let it go
          built.markDisposed();
        }
        return connect(built);
      }
    }
    throw new EngineException("Failed to lease a connection for context "
        + CachedConnectionEntry.shortSignature(context.getSignature()),
        new IllegalStateException("Entry was disposed while leasing"));
  }

  /**
   * Disposes every cached entry. Entries with active leases close when the
   * last lease is returned.
   */
  public void flushAll() {
    flushGeneration.incrementAndGet();
    List<CachedConnectionEntry> flushed = new ArrayList<>(entries.values());
    for (CachedConnectionEntry entry : flushed) {
      evict(entry);
    }
    if (!flushed.isEmpty()) {
      LOGGER.info("Flushed {} cached execution engines", flushed.size());
    }
  }

  /** Disposes the entry of one signature, if cached. */
  public void invalidateSignature(String signature) {
    CachedConnectionEntry entry = entries.get(signature);
    if (entry != null) {
      evict(entry);
      LOGGER.debug("Invalidated execution engine for context {}",
          CachedConnectionEntry.shortSignature(signature));
    }
  }

  /** Disposes entries whose expiry has passed. */
  public void pruneExpired() {
    Instant now = clock.instant();
    for (CachedConnectionEntry entry : new ArrayList<>(entries.values())) {
      if (entry.isExpired(now)) {
        LOGGER.debug("Execution engine for context {} expired",
            CachedConnectionEntry.shortSignature(entry.getSignature()));
        evict(entry);
      }
    }
  }

  /** Number of engine instances prepared so far. */
  public long getBuildCount() {
    return buildCount.get();
  }

  public List<CacheSnapshot.ConnectionSnapshot> snapshot() {
    ImmutableList.Builder<CacheSnapshot.ConnectionSnapshot> result = ImmutableList.builder();
    for (CachedConnectionEntry entry : entries.values()) {
      result.add(
          new CacheSnapshot.ConnectionSnapshot(entry.getSignature(), entry.getActiveLeases(),
              entry.isDisposed(), entry.getExpiresAt()));
    }
    return result.build();
  }

  @Override public void close() {
    flushAll();
  }

  void release(CachedConnectionEntry entry) {
    if (entry.release()) {
      entry.closeOnce();
    }
  }

  private void evict(CachedConnectionEntry entry) {
    entries.remove(entry.getSignature(), entry);
    if (entry.markDisposed()) {
      entry.closeOnce();
    }
  }

  private ConnectionLease connect(CachedConnectionEntry entry) {
    EngineConnection connection;
    try {
      connection = entry.getInstance().connect();
    } catch (SQLException e) {
      release(entry);
      throw new EngineException("Failed to open a connection to the execution engine", e);
    }
    return new ConnectionLease(this, entry, connection);
  }

  private CachedConnectionEntry build(Versioned<SqlContext> context) {
    long started = System.nanoTime();
    EngineInstance instance;
    try {
      instance = engine.open();
    } catch (SQLException e) {
      throw new EngineException("Failed to open " + engine.getEngineType()
          + " execution engine", e);
    }
    try {
      RuntimeCatalog installed;
      try (EngineConnection setup = instance.connect()) {
        installed = catalog.install(setup, context.getValue());
      }
      buildCount.incrementAndGet();
      LOGGER.info("Prepared {} execution engine for context {} (version {}) in {} ms",
          engine.getEngineType(), CachedConnectionEntry.shortSignature(context.getSignature()),
          context.getVersion(), (System.nanoTime() - started) / 1_000_000L);
      return new CachedConnectionEntry(context.getSignature(), instance, installed,
          clock.instant().plus(config.getRuntimeCacheTtl()));
    } catch (SQLException | RuntimeException e) {
      closeAfterFailure(instance, e);
      if (e instanceof RuntimeException) {
        throw (RuntimeException) e;
      }
      throw new EngineException("Failed to prepare execution engine for context "
          + CachedConnectionEntry.shortSignature(context.getSignature()), e);
    }
  }

  private static void closeAfterFailure(EngineInstance instance, Exception cause) {
    try {
      instance.close();
    } catch (SQLException closeError) {
      cause.addSuppressed(closeError);
    }
  }
}
