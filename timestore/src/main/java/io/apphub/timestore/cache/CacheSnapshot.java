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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the runtime cache state, for operational endpoints.
 */
public final class CacheSnapshot {
  private final boolean cachePresent;
  private final @Nullable String signature;
  private final @Nullable Long version;
  private final @Nullable Instant expiresAt;
  private final long generation;
  private final long fullBuilds;
  private final long incrementalBuilds;
  private final @Nullable Instant lastFullRefreshAt;
  private final @Nullable Instant lastIncrementalRefreshAt;
  private final @Nullable String lastError;
  private final @Nullable Instant lastErrorAt;
  private final List<PendingInvalidation> pendingInvalidations;
  private final List<DatasetSnapshot> datasets;
  private final List<ConnectionSnapshot> connections;

  CacheSnapshot(boolean cachePresent, @Nullable String signature, @Nullable Long version,
      @Nullable Instant expiresAt, long generation, long fullBuilds, long incrementalBuilds,
      @Nullable Instant lastFullRefreshAt, @Nullable Instant lastIncrementalRefreshAt,
      @Nullable String lastError, @Nullable Instant lastErrorAt,
      List<PendingInvalidation> pendingInvalidations, List<DatasetSnapshot> datasets,
      List<ConnectionSnapshot> connections) {
    this.cachePresent = cachePresent;
    this.signature = signature;
    this.version = version;
    this.expiresAt = expiresAt;
    this.generation = generation;
    this.fullBuilds = fullBuilds;
    this.incrementalBuilds = incrementalBuilds;
    this.lastFullRefreshAt = lastFullRefreshAt;
    this.lastIncrementalRefreshAt = lastIncrementalRefreshAt;
    this.lastError = lastError;
    this.lastErrorAt = lastErrorAt;
    this.pendingInvalidations = ImmutableList.copyOf(pendingInvalidations);
    this.datasets = ImmutableList.copyOf(datasets);
    this.connections = ImmutableList.copyOf(connections);
  }

  public boolean isCachePresent() {
    return cachePresent;
  }

  public @Nullable String getSignature() {
    return signature;
  }

  public @Nullable Long getVersion() {
    return version;
  }

  public @Nullable Instant getExpiresAt() {
    return expiresAt;
  }

  public long getGeneration() {
    return generation;
  }

  public long getFullBuilds() {
    return fullBuilds;
  }

  public long getIncrementalBuilds() {
    return incrementalBuilds;
  }

  public @Nullable Instant getLastFullRefreshAt() {
    return lastFullRefreshAt;
  }

  public @Nullable Instant getLastIncrementalRefreshAt() {
    return lastIncrementalRefreshAt;
  }

  public @Nullable String getLastError() {
    return lastError;
  }

  public @Nullable Instant getLastErrorAt() {
    return lastErrorAt;
  }

  public List<PendingInvalidation> getPendingInvalidations() {
    return pendingInvalidations;
  }

  public List<DatasetSnapshot> getDatasets() {
    return datasets;
  }

  public List<ConnectionSnapshot> getConnections() {
    return connections;
  }

  /** Cached state of one dataset. */
  public static final class DatasetSnapshot {
    private final String datasetId;
    private final String datasetSlug;
    private final String signature;
    private final Instant lastRefreshedAt;
    private final @Nullable String reason;
    private final boolean queryable;

    DatasetSnapshot(String datasetId, String datasetSlug, String signature,
        Instant lastRefreshedAt, @Nullable String reason, boolean queryable) {
      this.datasetId = datasetId;
      this.datasetSlug = datasetSlug;
      this.signature = signature;
      this.lastRefreshedAt = lastRefreshedAt;
      this.reason = reason;
      this.queryable = queryable;
    }

    public String getDatasetId() {
      return datasetId;
    }

    public String getDatasetSlug() {
      return datasetSlug;
    }

    public String getSignature() {
      return signature;
    }

    public Instant getLastRefreshedAt() {
      return lastRefreshedAt;
    }

    public @Nullable String getReason() {
      return reason;
    }

    /** False for datasets excluded from SQL, such as non-DuckDB ones. */
    public boolean isQueryable() {
      return queryable;
    }
  }

  /** State of one cached execution engine. */
  public static final class ConnectionSnapshot {
    private final String signature;
    private final int activeLeases;
    private final boolean disposed;
    private final Instant expiresAt;

    ConnectionSnapshot(String signature, int activeLeases, boolean disposed,
        Instant expiresAt) {
      this.signature = signature;
      this.activeLeases = activeLeases;
      this.disposed = disposed;
      this.expiresAt = expiresAt;
    }

    public String getSignature() {
      return signature;
    }

    public int getActiveLeases() {
      return activeLeases;
    }

    public boolean isDisposed() {
      return disposed;
    }

    public Instant getExpiresAt() {
      return expiresAt;
    }
  }
}
