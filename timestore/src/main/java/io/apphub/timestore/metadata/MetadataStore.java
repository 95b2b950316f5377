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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Read access to the timestore metadata catalog.
 *
 * <p>Implementations talk to the catalog database; any failure to reach it
 * is reported as a {@link MetadataStoreException}. A missing record is a
 * {@code null} return, never an exception.
 */
public interface MetadataStore {

  /** Status filter matching every dataset regardless of status. */
  String STATUS_ALL = "all";

  /**
   * Lists datasets one page at a time.
   *
   * @param cursor Cursor returned by the previous page, or null for the first
   * @param status Status to match, or {@link #STATUS_ALL}
   * @param limit Maximum number of datasets on the page
   * @return The page and the cursor of the next one
   * @throws MetadataStoreException if the catalog cannot be read
   */
  DatasetPage listDatasets(@Nullable String cursor, String status, int limit);

  /**
   * Returns the latest published manifest of a dataset, with partitions.
   *
   * @param datasetId Dataset identifier
   * @return The manifest, or null if nothing has been published
   */
  @Nullable ManifestRecord getLatestPublishedManifest(String datasetId);

  /**
   * Returns the latest published manifest of every shard of a dataset, with
   * partitions, ordered by shard.
   *
   * @param datasetId Dataset identifier
   * @return Published manifests, empty if nothing has been published
   */
  List<ManifestRecord> listPublishedManifestsWithPartitions(String datasetId);

  @Nullable SchemaVersionRecord getSchemaVersionById(String schemaVersionId);

  @Nullable StorageTargetRecord getStorageTargetById(String storageTargetId);

  @Nullable DatasetRecord getDatasetById(String datasetId);

  @Nullable DatasetRecord getDatasetBySlug(String slug);
}
