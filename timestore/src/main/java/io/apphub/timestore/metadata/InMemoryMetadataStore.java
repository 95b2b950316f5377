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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MetadataStore} held entirely in memory.
 *
 * <p>Used when the runtime is embedded without a catalog database and as the
 * catalog in tests. Cursors are offsets into the dataset listing, which
 * keeps insertion order.
 */
public class InMemoryMetadataStore implements MetadataStore {
  private final Map<String, DatasetRecord> datasets = new LinkedHashMap<>();
  private final Map<String, List<ManifestRecord>> manifests = new ConcurrentHashMap<>();
  private final Map<String, SchemaVersionRecord> schemaVersions = new ConcurrentHashMap<>();
  private final Map<String, StorageTargetRecord> storageTargets = new ConcurrentHashMap<>();

  public synchronized void putDataset(DatasetRecord dataset) {
    datasets.put(dataset.getId(), dataset);
  }

  public synchronized void removeDataset(String datasetId) {
    datasets.remove(datasetId);
    manifests.remove(datasetId);
  }

  /**
   * Adds a manifest. Publishing a manifest supersedes the previously
   * published manifest of the same shard.
   */
  public void putManifest(ManifestRecord manifest) {
    manifests.compute(manifest.getDatasetId(), (datasetId, existing) -> {
      List<ManifestRecord> updated = new ArrayList<>();
      if (existing != null) {
        for (ManifestRecord current : existing) {
          if (manifest.getStatus() == ManifestRecord.Status.PUBLISHED
              && current.getStatus() == ManifestRecord.Status.PUBLISHED
              && current.getManifestShard().equals(manifest.getManifestShard())) {
            updated.add(supersede(current));
          } else {
            updated.add(current);
          }
        }
      }
      updated.add(manifest);
      return updated;
    });
  }

  public void putSchemaVersion(SchemaVersionRecord schemaVersion) {
    schemaVersions.put(schemaVersion.getId(), schemaVersion);
  }

  public void putStorageTarget(StorageTargetRecord storageTarget) {
    storageTargets.put(storageTarget.getId(), storageTarget);
  }

  @Override public synchronized DatasetPage listDatasets(@Nullable String cursor,
      String status, int limit) {
    List<DatasetRecord> matching = new ArrayList<>();
    for (DatasetRecord dataset : datasets.values()) {
      if (STATUS_ALL.equals(status) || dataset.getStatus().equals(status)) {
        matching.add(dataset);
      }
    }
    int offset = cursor == null ? 0 : Integer.parseInt(cursor);
    int end = Math.min(matching.size(), offset + Math.max(1, limit));
    List<DatasetRecord> page = offset >= matching.size()
        ? ImmutableList.<DatasetRecord>of()
        : matching.subList(offset, end);
    String next = end < matching.size() ? Integer.toString(end) : null;
    return new DatasetPage(page, next);
  }

  @Override public @Nullable ManifestRecord getLatestPublishedManifest(String datasetId) {
    ManifestRecord latest = null;
    for (ManifestRecord manifest : manifests.getOrDefault(datasetId, ImmutableList.of())) {
      if (manifest.getStatus() == ManifestRecord.Status.PUBLISHED
          && (latest == null || manifest.getVersion() > latest.getVersion())) {
        latest = manifest;
      }
    }
    return latest;
  }

  @Override public List<ManifestRecord> listPublishedManifestsWithPartitions(String datasetId) {
    Map<String, ManifestRecord> byShard = new TreeMap<>();
    for (ManifestRecord manifest : manifests.getOrDefault(datasetId, ImmutableList.of())) {
      if (manifest.getStatus() != ManifestRecord.Status.PUBLISHED) {
        continue;
      }
      ManifestRecord current = byShard.get(manifest.getManifestShard());
      if (current == null || manifest.getVersion() > current.getVersion()) {
        byShard.put(manifest.getManifestShard(), manifest);
      }
    }
    return ImmutableList.copyOf(byShard.values());
  }

  @Override public @Nullable SchemaVersionRecord getSchemaVersionById(String schemaVersionId) {
    return schemaVersions.get(schemaVersionId);
  }

  @Override public @Nullable StorageTargetRecord getStorageTargetById(String storageTargetId) {
    return storageTargets.get(storageTargetId);
  }

  @Override public synchronized @Nullable DatasetRecord getDatasetById(String datasetId) {
    return datasets.get(datasetId);
  }

  @Override public synchronized @Nullable DatasetRecord getDatasetBySlug(String slug) {
    for (DatasetRecord dataset : datasets.values()) {
      if (dataset.getSlug().equals(slug)) {
        return dataset;
      }
    }
    return null;
  }

  private static ManifestRecord supersede(ManifestRecord manifest) {
    return ManifestRecord.builder()
        .id(manifest.getId())
        .datasetId(manifest.getDatasetId())
        .version(manifest.getVersion())
        .status(ManifestRecord.Status.SUPERSEDED)
        .schemaVersionId(manifest.getSchemaVersionId())
        .manifestShard(manifest.getManifestShard())
        .partitionCount(manifest.getPartitionCount())
        .totalRows(manifest.getTotalRows())
        .totalBytes(manifest.getTotalBytes())
        .createdAt(manifest.getCreatedAt())
        .updatedAt(manifest.getUpdatedAt())
        .partitions(manifest.getPartitions())
        .build();
  }
}
