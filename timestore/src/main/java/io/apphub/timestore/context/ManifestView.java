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

import io.apphub.timestore.metadata.ManifestRecord;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * The published manifests a dataset context is built from, seen as one.
 *
 * <p>Sharded datasets publish one manifest per shard: totals are summed,
 * the newest {@code updatedAt} marks freshness and the first shard's schema
 * version applies to all of them.
 */
public final class ManifestView {
  private final List<String> manifestIds;
  private final int version;
  private final @Nullable String schemaVersionId;
  private final int partitionCount;
  private final long totalRows;
  private final long totalBytes;
  private final Instant updatedAt;

  private ManifestView(List<String> manifestIds, int version, @Nullable String schemaVersionId,
      int partitionCount, long totalRows, long totalBytes, Instant updatedAt) {
    this.manifestIds = ImmutableList.copyOf(manifestIds);
    this.version = version;
    this.schemaVersionId = schemaVersionId;
    this.partitionCount = partitionCount;
    this.totalRows = totalRows;
    this.totalBytes = totalBytes;
    this.updatedAt = updatedAt;
  }

  /**
   * Combines the published manifests of a dataset.
   *
   * @param manifests At least one manifest, first shard first
   */
  public static ManifestView of(List<ManifestRecord> manifests) {
    if (manifests.isEmpty()) {
      throw new IllegalArgumentException("At least one manifest is required");
    }
    ImmutableList.Builder<String> ids = ImmutableList.builder();
    int version = 0;
    int partitionCount = 0;
    long totalRows = 0;
    long totalBytes = 0;
    Instant updatedAt = Instant.EPOCH;
    for (ManifestRecord manifest : manifests) {
      ids.add(manifest.getId());
      version = Math.max(version, manifest.getVersion());
      partitionCount += manifest.getPartitionCount();
      totalRows += manifest.getTotalRows();
      totalBytes += manifest.getTotalBytes();
      if (manifest.getUpdatedAt().isAfter(updatedAt)) {
        updatedAt = manifest.getUpdatedAt();
      }
    }
    return new ManifestView(ids.build(), version, manifests.get(0).getSchemaVersionId(),
        partitionCount, totalRows, totalBytes, updatedAt);
  }

  public List<String> getManifestIds() {
    return manifestIds;
  }

  /** Highest version among the shards. */
  public int getVersion() {
    return version;
  }

  public @Nullable String getSchemaVersionId() {
    return schemaVersionId;
  }

  public int getPartitionCount() {
    return partitionCount;
  }

  public long getTotalRows() {
    return totalRows;
  }

  public long getTotalBytes() {
    return totalBytes;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
