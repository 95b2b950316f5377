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
package io.apphub.timestore;

import io.apphub.timestore.metadata.DatasetRecord;
import io.apphub.timestore.metadata.InMemoryMetadataStore;
import io.apphub.timestore.metadata.ManifestRecord;
import io.apphub.timestore.metadata.PartitionRecord;
import io.apphub.timestore.metadata.SchemaVersionRecord;
import io.apphub.timestore.metadata.StorageTargetKind;
import io.apphub.timestore.metadata.StorageTargetRecord;
import io.apphub.timestore.util.SqlIdentifiers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.Map;

/**
 * Catalog records and DuckDB files shared by tests.
 */
public final class TimestoreFixtures {
  public static final String TARGET_ID = "local-target";
  public static final Instant DAY_1 = Instant.parse("2024-01-01T00:00:00Z");
  public static final Instant DAY_2 = Instant.parse("2024-01-02T00:00:00Z");
  public static final Instant DAY_3 = Instant.parse("2024-01-03T00:00:00Z");

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private TimestoreFixtures() {
  }

  public static StorageTargetRecord localTarget(Path root) {
    return new StorageTargetRecord(TARGET_ID, "local", StorageTargetKind.LOCAL,
        ImmutableMap.of("root", root.toString()));
  }

  public static DatasetRecord dataset(String id, String slug) {
    return DatasetRecord.builder()
        .id(id)
        .slug(slug)
        .updatedAt(DAY_1)
        .build();
  }

  /** Schema with a {@code timestamp} column and a {@code temperature_c} column. */
  public static SchemaVersionRecord temperatureSchema(String id, String datasetId) {
    ObjectNode schema = MAPPER.createObjectNode();
    ArrayNode fields = schema.putArray("fields");
    fields.addObject().put("name", "timestamp").put("type", "timestamp");
    fields.addObject().put("name", "temperature_c").put("type", "double");
    return new SchemaVersionRecord(id, datasetId, 1, schema);
  }

  public static PartitionRecord partition(String id, String datasetId, Instant start,
      Instant end) {
    return partition(id, datasetId, start, end, ImmutableMap.<String, Object>of());
  }

  public static PartitionRecord partition(String id, String datasetId, Instant start,
      Instant end, Map<String, ?> partitionKey) {
    return PartitionRecord.builder()
        .id(id)
        .datasetId(datasetId)
        .storageTargetId(TARGET_ID)
        .filePath(datasetId + "/" + id + ".duckdb")
        .partitionKey(partitionKey)
        .startTime(start)
        .endTime(end)
        .rowCount(1L)
        .build();
  }

  public static ManifestRecord manifest(String id, String datasetId, int version,
      String schemaVersionId, PartitionRecord... partitions) {
    return ManifestRecord.builder()
        .id(id)
        .datasetId(datasetId)
        .version(version)
        .schemaVersionId(schemaVersionId)
        .updatedAt(DAY_1.plusSeconds(version))
        .partitions(ImmutableList.copyOf(partitions))
        .build();
  }

  /**
   * Registers a dataset with one published manifest over the given
   * partitions.
   */
  public static void publish(InMemoryMetadataStore store, DatasetRecord dataset, int version,
      PartitionRecord... partitions) {
    String schemaId = dataset.getId() + "-schema";
    store.putDataset(dataset);
    store.putSchemaVersion(temperatureSchema(schemaId, dataset.getId()));
    store.putManifest(
        manifest(dataset.getId() + "-m" + version, dataset.getId(), version, schemaId,
            partitions));
  }

  /**
   * Writes a partition file with table {@code records} holding the given
   * (timestamp, temperature) rows.
   */
  public static void writePartitionFile(Path file, Instant[] timestamps, double[] temperatures)
      throws SQLException {
    file.getParent().toFile().mkdirs();
    try (Connection connection = DriverManager.getConnection("jdbc:duckdb:" + file)) {
      try (Statement stmt = connection.createStatement()) {
        stmt.execute("CREATE TABLE records (\"timestamp\" TIMESTAMP, temperature_c DOUBLE)");
        for (int i = 0; i < timestamps.length; i++) {
          stmt.execute("INSERT INTO records VALUES ("
              + SqlIdentifiers.timestampLiteral(timestamps[i]) + ", " + temperatures[i] + ")");
        }
      }
    }
  }
}
