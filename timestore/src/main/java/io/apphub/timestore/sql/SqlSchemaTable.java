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
package io.apphub.timestore.sql;

import io.apphub.timestore.metadata.ColumnInfo;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * A dataset view as seen by SQL callers.
 */
public final class SqlSchemaTable {
  private final String name;
  private final String datasetSlug;
  private final @Nullable String description;
  private final List<String> partitionKeys;
  private final List<ColumnInfo> columns;

  public SqlSchemaTable(String name, String datasetSlug, @Nullable String description,
      List<String> partitionKeys, List<ColumnInfo> columns) {
    this.name = name;
    this.datasetSlug = datasetSlug;
    this.description = description;
    this.partitionKeys = ImmutableList.copyOf(partitionKeys);
    this.columns = ImmutableList.copyOf(columns);
  }

  /** Qualified view name, such as {@code timestore.observatory_readings}. */
  public String getName() {
    return name;
  }

  public String getDatasetSlug() {
    return datasetSlug;
  }

  public @Nullable String getDescription() {
    return description;
  }

  public List<String> getPartitionKeys() {
    return partitionKeys;
  }

  public List<ColumnInfo> getColumns() {
    return columns;
  }
}
