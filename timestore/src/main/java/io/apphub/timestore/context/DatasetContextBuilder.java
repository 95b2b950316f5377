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
import io.apphub.timestore.metadata.ColumnInfo;
import io.apphub.timestore.metadata.DatasetRecord;
import io.apphub.timestore.metadata.ManifestRecord;
import io.apphub.timestore.metadata.MetadataStore;
import io.apphub.timestore.metadata.PartitionRecord;
import io.apphub.timestore.metadata.SchemaLoader;
import io.apphub.timestore.partition.PartitionExecutionContext;
import io.apphub.timestore.partition.PartitionMapper;
import io.apphub.timestore.partition.StorageTargetCache;
import io.apphub.timestore.util.SqlIdentifiers;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Builds the {@link DatasetContext} of one dataset from the catalog.
 *
 * <p>Schema and partition problems degrade the context with warnings; only
 * a catalog failure ({@link io.apphub.timestore.metadata.MetadataStoreException})
 * escapes.
 */
public class DatasetContextBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(DatasetContextBuilder.class);

  private final TimestoreConfig config;
  private final MetadataStore metadataStore;
  private final SchemaLoader schemaLoader;
  private final PartitionMapper partitionMapper;
  private final Clock clock;

  public DatasetContextBuilder(TimestoreConfig config, MetadataStore metadataStore,
      SchemaLoader schemaLoader, PartitionMapper partitionMapper, Clock clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metadataStore = Objects.requireNonNull(metadataStore, "metadataStore");
    this.schemaLoader = Objects.requireNonNull(schemaLoader, "schemaLoader");
    this.partitionMapper = Objects.requireNonNull(partitionMapper, "partitionMapper");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public TimestoreConfig getConfig() {
    return config;
  }

  /**
   * Builds the cache state of a dataset.
   *
   * @param dataset Dataset to build
   * @param storageTargets Storage target lookups shared by the current build
   * @param reason Why the dataset is being (re)built, for diagnostics
   * @return State holding the context, or no context if the dataset is skipped
   */
  public DatasetCacheState build(DatasetRecord dataset, StorageTargetCache storageTargets,
      @Nullable String reason) {
    if (!DatasetRecord.WRITE_FORMAT_DUCKDB.equals(dataset.getWriteFormat())) {
      LOGGER.debug("Dataset {} uses write format {}; not exposed to SQL",
          dataset.getSlug(), dataset.getWriteFormat());
      return new DatasetCacheState(dataset, null,
          ContextSignatures.skippedDatasetSignature(dataset),
          ImmutableList.of("Dataset " + dataset.getSlug()
              + " is not backed by DuckDB partitions; skipping."),
          clock.instant(), reason);
    }

    List<String> warnings = new ArrayList<>();
    List<ManifestRecord> manifests = publishedManifests(dataset);
    ManifestView manifestView = manifests.isEmpty() ? null : ManifestView.of(manifests);

    SchemaLoader.Result schema =
        schemaLoader.loadColumns(dataset, manifests.isEmpty() ? null : manifests.get(0));
    warnings.addAll(schema.getWarnings());
    List<ColumnInfo> columns = schema.getColumns();

    List<PartitionRecord> partitions = new ArrayList<>();
    for (ManifestRecord manifest : manifests) {
      partitions.addAll(manifest.getPartitions());
    }
    List<PartitionExecutionContext> mapped =
        partitionMapper.mapPartitions(partitions, storageTargets, warnings);

    TreeSet<String> partitionKeys = new TreeSet<>();
    for (PartitionExecutionContext partition : mapped) {
      partitionKeys.addAll(partition.getPartitionKey().keySet());
    }

    String viewName = SqlIdentifiers.sanitize(dataset.getSlug(), "dataset");
    if (!viewName.equals(dataset.getSlug())) {
      warnings.add("Dataset " + dataset.getSlug() + " is exposed as "
          + DatasetContext.VIEW_SCHEMA + "." + viewName + ".");
    }

    DatasetContext context = new DatasetContext(dataset, manifestView, columns,
        ImmutableList.copyOf(partitionKeys), mapped, viewName, warnings);
    LOGGER.debug("Built context for dataset {}: {} of {} partitions, {} columns",
        dataset.getSlug(), mapped.size(), partitions.size(), columns.size());
    return new DatasetCacheState(dataset, context,
        ContextSignatures.datasetSignature(dataset, context), warnings, clock.instant(),
        reason);
  }

  private List<ManifestRecord> publishedManifests(DatasetRecord dataset) {
    List<ManifestRecord> manifests =
        metadataStore.listPublishedManifestsWithPartitions(dataset.getId());
    if (!manifests.isEmpty()) {
      return manifests;
    }
    ManifestRecord latest = metadataStore.getLatestPublishedManifest(dataset.getId());
    return latest == null ? ImmutableList.<ManifestRecord>of() : ImmutableList.of(latest);
  }
}
