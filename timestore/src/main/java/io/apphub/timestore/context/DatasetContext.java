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

import io.apphub.timestore.metadata.ColumnInfo;
import io.apphub.timestore.metadata.DatasetRecord;
import io.apphub.timestore.partition.PartitionExecutionContext;
import io.apphub.timestore.util.SqlIdentifiers;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Everything the query engine needs to know about one dataset: its record,
 * manifest, columns, attachable partitions and the view exposing them.
 */
public final class DatasetContext {
  /** Schema holding one view per dataset. */
  public static final String VIEW_SCHEMA = "timestore";

  private final DatasetRecord dataset;
  private final @Nullable ManifestView manifest;
  private final List<ColumnInfo> columns;
  private final List<String> partitionKeys;
  private final List<PartitionExecutionContext> partitions;
  private final String viewName;
  private final List<String> warnings;

  public DatasetContext(DatasetRecord dataset, @Nullable ManifestView manifest,
      List<ColumnInfo> columns, List<String> partitionKeys,
      List<PartitionExecutionContext> partitions, String viewName, List<String> warnings) {
    this.dataset = Objects.requireNonNull(dataset, "dataset");
    this.manifest = manifest;
    this.columns = ImmutableList.copyOf(columns);
    this.partitionKeys = ImmutableList.copyOf(partitionKeys);
    this.partitions = ImmutableList.copyOf(partitions);
    this.viewName = Objects.requireNonNull(viewName, "viewName");
    this.warnings = ImmutableList.copyOf(warnings);
  }

  public DatasetRecord getDataset() {
    return dataset;
  }

  public String getSlug() {
    return dataset.getSlug();
  }

  public @Nullable ManifestView getManifest() {
    return manifest;
  }

  public List<ColumnInfo> getColumns() {
    return columns;
  }

  /** Sorted names of every partition-key attribute used by the partitions. */
  public List<String> getPartitionKeys() {
    return partitionKeys;
  }

  public List<PartitionExecutionContext> getPartitions() {
    return partitions;
  }

  /** Unqualified view name inside {@link #VIEW_SCHEMA}. */
  public String getViewName() {
    return viewName;
  }

  /** Quoted, schema-qualified view name. */
  public String getQualifiedViewName() {
    return SqlIdentifiers.qualify(VIEW_SCHEMA, viewName);
  }

  public List<String> getWarnings() {
    return warnings;
  }

  @Override public String toString() {
    return "DatasetContext{" + dataset.getSlug() + ", view=" + VIEW_SCHEMA + "." + viewName
        + ", partitions=" + partitions.size() + "}";
  }
}
