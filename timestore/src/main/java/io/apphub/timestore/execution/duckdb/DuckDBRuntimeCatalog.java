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
package io.apphub.timestore.execution.duckdb;

import io.apphub.timestore.context.DatasetContext;
import io.apphub.timestore.context.ManifestView;
import io.apphub.timestore.context.SqlContext;
import io.apphub.timestore.execution.CatalogInstaller;
import io.apphub.timestore.execution.DatasetAttachment;
import io.apphub.timestore.execution.EngineConnection;
import io.apphub.timestore.execution.RuntimeCatalog;
import io.apphub.timestore.metadata.ColumnInfo;
import io.apphub.timestore.partition.PartitionExecutionContext;
import io.apphub.timestore.storage.RemoteBackend;
import io.apphub.timestore.storage.StorageLocators;
import io.apphub.timestore.util.SqlIdentifiers;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Installs a {@link SqlContext} into a fresh DuckDB instance.
 *
 * <p>Creates schema {@value DatasetContext#VIEW_SCHEMA} with one view per
 * dataset (the union of its attached partition files) and schema
 * {@value #RUNTIME_SCHEMA} with inventory tables describing datasets,
 * partitions and columns. Runs once per connection-cache entry, before
 * any lease is handed out.
 */
public class DuckDBRuntimeCatalog implements CatalogInstaller {
  private static final Logger LOGGER = LoggerFactory.getLogger(DuckDBRuntimeCatalog.class);

  public static final String RUNTIME_SCHEMA = "timestore_runtime";

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);

  private final StorageLocators locators;

  public DuckDBRuntimeCatalog(StorageLocators locators) {
    this.locators = Objects.requireNonNull(locators, "locators");
  }

  /** Creates schemas, inventory tables and dataset views. */
  @Override public RuntimeCatalog install(EngineConnection connection, SqlContext context)
      throws SQLException {
    connection.run("CREATE SCHEMA IF NOT EXISTS "
        + SqlIdentifiers.quote(DatasetContext.VIEW_SCHEMA));
    connection.run("CREATE SCHEMA IF NOT EXISTS " + SqlIdentifiers.quote(RUNTIME_SCHEMA));
    createRuntimeTables(connection);
    populateRuntimeTables(connection, context.getDatasets());

    List<String> warnings = new ArrayList<>();
    Map<String, Boolean> configuredBackends = new HashMap<>();
    Map<String, List<DatasetAttachment>> attachments = new LinkedHashMap<>();
    for (DatasetContext dataset : context.getDatasets()) {
      attachments.put(dataset.getSlug(),
          attachDataset(connection, dataset, configuredBackends, warnings));
    }
    LOGGER.info("Installed runtime catalog: {} datasets, {} warnings",
        context.getDatasets().size(), warnings.size());
    return new RuntimeCatalog(attachments, warnings);
  }

  private List<DatasetAttachment> attachDataset(EngineConnection connection,
      DatasetContext dataset, Map<String, Boolean> configuredBackends, List<String> warnings)
      throws SQLException {
    List<DatasetAttachment> attached = new ArrayList<>();
    List<String> selects = new ArrayList<>();
    int index = 0;
    for (PartitionExecutionContext partition : dataset.getPartitions()) {
      String alias = "p_" + dataset.getViewName() + "_" + index++;
      try {
        if (!ensureBackend(connection, partition, configuredBackends)) {
          warnings.add("Failed to attach partition " + partition.getId() + " for dataset "
              + dataset.getSlug() + ": remote access is not configured");
          continue;
        }
        connection.run("ATTACH " + SqlIdentifiers.literal(partition.getLocation()) + " AS "
            + SqlIdentifiers.quote(alias) + " (READ_ONLY)");
      } catch (SQLException e) {
        LOGGER.warn("Failed to attach partition {} for dataset {}: {}",
            partition.getId(), dataset.getSlug(), e.getMessage());
        warnings.add("Failed to attach partition " + partition.getId() + " for dataset "
            + dataset.getSlug() + ": " + e.getMessage());
        continue;
      }
      DatasetAttachment attachment = new DatasetAttachment(dataset.getSlug(), alias, partition);
      attached.add(attachment);
      selects.add("SELECT * FROM " + attachment.getQualifiedTableName());
    }

    if (selects.isEmpty()) {
      connection.run("CREATE OR REPLACE VIEW " + dataset.getQualifiedViewName() + " AS "
          + emptySelect(dataset.getColumns()));
    } else {
      connection.run("CREATE OR REPLACE VIEW " + dataset.getQualifiedViewName() + " AS "
          + String.join("\nUNION ALL BY NAME\n", selects));
    }
    return attached;
  }

  /**
   * Configures the remote backend of a partition once per instance.
   *
   * @return false if the backend was already found to be unusable
   */
  private boolean ensureBackend(EngineConnection connection, PartitionExecutionContext partition,
      Map<String, Boolean> configuredBackends) throws SQLException {
    RemoteBackend backend = locators.describeBackend(partition.getStorageTarget());
    if (backend == null) {
      return true;
    }
    Boolean configured = configuredBackends.get(backend.getIdentity());
    if (configured != null) {
      return configured;
    }
    try {
      StorageLocators.configureRemoteAccess(connection, backend);
      configuredBackends.put(backend.getIdentity(), Boolean.TRUE);
      return true;
    } catch (SQLException e) {
      configuredBackends.put(backend.getIdentity(), Boolean.FALSE);
      throw e;
    }
  }

  /**
   * A select with the dataset's columns and no rows, so the view keeps its
   * shape when no partition could be attached.
   */
  public static String emptySelect(List<ColumnInfo> columns) {
    if (columns.isEmpty()) {
      return "SELECT 1 WHERE 1=0";
    }
    StringBuilder sql = new StringBuilder("SELECT ");
    for (int i = 0; i < columns.size(); i++) {
      ColumnInfo column = columns.get(i);
      if (i > 0) {
        sql.append(", ");
      }
      sql.append("CAST(NULL AS ").append(column.getType().getSqlType()).append(") AS ")
          .append(SqlIdentifiers.quote(column.getName()));
    }
    return sql.append(" WHERE 1=0").toString();
  }

  private static void createRuntimeTables(EngineConnection connection) throws SQLException {
    connection.run("CREATE TABLE " + runtimeTable("datasets") + " (\n"
        + "  dataset_id VARCHAR,\n"
        + "  dataset_slug VARCHAR,\n"
        + "  dataset_name VARCHAR,\n"
        + "  status VARCHAR,\n"
        + "  write_format VARCHAR,\n"
        + "  partition_count BIGINT,\n"
        + "  total_rows BIGINT,\n"
        + "  total_bytes BIGINT,\n"
        + "  updated_at TIMESTAMP,\n"
        + "  manifest_version BIGINT\n"
        + ")");
    connection.run("CREATE TABLE " + runtimeTable("partitions") + " (\n"
        + "  dataset_slug VARCHAR,\n"
        + "  partition_id VARCHAR,\n"
        + "  storage_target VARCHAR,\n"
        + "  storage_kind VARCHAR,\n"
        + "  location VARCHAR,\n"
        + "  table_name VARCHAR,\n"
        + "  row_count BIGINT,\n"
        + "  file_size_bytes BIGINT,\n"
        + "  start_time TIMESTAMP,\n"
        + "  end_time TIMESTAMP\n"
        + ")");
    connection.run("CREATE TABLE " + runtimeTable("columns") + " (\n"
        + "  dataset_slug VARCHAR,\n"
        + "  column_name VARCHAR,\n"
        + "  data_type VARCHAR,\n"
        + "  nullable BOOLEAN,\n"
        + "  description VARCHAR\n"
        + ")");
  }

  private static void populateRuntimeTables(EngineConnection connection,
      List<DatasetContext> datasets) throws SQLException {
    for (DatasetContext dataset : datasets) {
      ManifestView manifest = dataset.getManifest();
      connection.run("INSERT INTO " + runtimeTable("datasets")
              + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS TIMESTAMP), ?)",
          dataset.getDataset().getId(),
          dataset.getSlug(),
          dataset.getDataset().getName(),
          dataset.getDataset().getStatus(),
          dataset.getDataset().getWriteFormat(),
          manifest == null ? 0L : (long) manifest.getPartitionCount(),
          manifest == null ? 0L : manifest.getTotalRows(),
          manifest == null ? 0L : manifest.getTotalBytes(),
          timestamp(manifest == null ? dataset.getDataset().getUpdatedAt()
              : manifest.getUpdatedAt()),
          manifest == null ? null : Long.valueOf(manifest.getVersion()));

      for (ColumnInfo column : dataset.getColumns()) {
        connection.run("INSERT INTO " + runtimeTable("columns") + " VALUES (?, ?, ?, ?, ?)",
            dataset.getSlug(),
            column.getName(),
            column.getType().getSqlType(),
            column.getNullable(),
            column.getDescription());
      }

      for (PartitionExecutionContext partition : dataset.getPartitions()) {
        connection.run("INSERT INTO " + runtimeTable("partitions")
                + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS TIMESTAMP), CAST(? AS TIMESTAMP))",
            dataset.getSlug(),
            partition.getId(),
            partition.getStorageTarget().getName(),
            partition.getStorageTarget().getKind().getValue(),
            partition.getLocation(),
            partition.getTableName(),
            partition.getRowCount(),
            partition.getFileSizeBytes(),
            timestamp(partition.getStartTime()),
            timestamp(partition.getEndTime()));
      }
    }
  }

  private static String runtimeTable(String name) {
    return SqlIdentifiers.qualify(RUNTIME_SCHEMA, name);
  }

  private static @Nullable String timestamp(@Nullable Instant instant) {
    return instant == null ? null : TIMESTAMP_FORMAT.format(instant);
  }
}
