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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic SHA-256 signatures over dataset and context inputs.
 *
 * <p>Signatures only depend on content, never on build time or object
 * identity, so two builds over an unchanged catalog agree.
 */
public final class ContextSignatures {
  private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
      .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
      .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
      .build();

  private ContextSignatures() {
    // Utility class should not be instantiated
  }

  /**
   * Signature of one dataset's built state: dataset identity, status and
   * metadata, manifest identity and totals, partitions sorted by id and
   * columns in schema order.
   */
  public static String datasetSignature(DatasetRecord dataset, DatasetContext context) {
    Map<String, Object> input = new LinkedHashMap<>();
    input.put("dataset", datasetInput(dataset));

    ManifestView manifest = context.getManifest();
    if (manifest != null) {
      Map<String, Object> manifestInput = new LinkedHashMap<>();
      manifestInput.put("ids", manifest.getManifestIds());
      manifestInput.put("version", manifest.getVersion());
      manifestInput.put("schemaVersionId", manifest.getSchemaVersionId());
      manifestInput.put("partitionCount", manifest.getPartitionCount());
      manifestInput.put("totalRows", manifest.getTotalRows());
      manifestInput.put("totalBytes", manifest.getTotalBytes());
      manifestInput.put("updatedAt", manifest.getUpdatedAt().toString());
      input.put("manifest", manifestInput);
    }

    List<PartitionExecutionContext> partitions = new ArrayList<>(context.getPartitions());
    partitions.sort((a, b) -> a.getId().compareTo(b.getId()));
    List<Map<String, Object>> partitionInput = new ArrayList<>();
    for (PartitionExecutionContext partition : partitions) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("id", partition.getId());
      entry.put("location", partition.getLocation());
      entry.put("tableName", partition.getTableName());
      entry.put("startTime", partition.getStartTime().toString());
      entry.put("endTime", partition.getEndTime().toString());
      entry.put("rowCount", partition.getRowCount());
      entry.put("fileSizeBytes", partition.getFileSizeBytes());
      partitionInput.add(entry);
    }
    input.put("partitions", partitionInput);

    List<Map<String, Object>> columnInput = new ArrayList<>();
    for (ColumnInfo column : context.getColumns()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("name", column.getName());
      entry.put("type", column.getType().getSqlType());
      entry.put("nullable", column.getNullable());
      entry.put("description", column.getDescription());
      columnInput.add(entry);
    }
    input.put("columns", columnInput);
    input.put("viewName", context.getViewName());
    return hash(input);
  }

  /** Signature of a dataset that is excluded from SQL. */
  public static String skippedDatasetSignature(DatasetRecord dataset) {
    Map<String, Object> input = new LinkedHashMap<>();
    input.put("dataset", datasetInput(dataset));
    input.put("skipped", true);
    return hash(input);
  }

  /**
   * Signature of a whole context: for each dataset its id, slug and
   * updatedAt, its manifest ids, version and updatedAt, and its sorted
   * partition ids.
   */
  public static String contextSignature(List<DatasetContext> datasets) {
    Hasher hasher = Hashing.sha256().newHasher();
    for (DatasetContext context : datasets) {
      DatasetRecord dataset = context.getDataset();
      hasher.putString(dataset.getId(), StandardCharsets.UTF_8).putByte((byte) 0);
      hasher.putString(dataset.getSlug(), StandardCharsets.UTF_8).putByte((byte) 0);
      hasher.putString(dataset.getUpdatedAt().toString(), StandardCharsets.UTF_8)
          .putByte((byte) 0);
      ManifestView manifest = context.getManifest();
      if (manifest != null) {
        hasher.putString(String.join(",", manifest.getManifestIds()), StandardCharsets.UTF_8)
            .putByte((byte) 0);
        hasher.putInt(manifest.getVersion());
        hasher.putString(manifest.getUpdatedAt().toString(), StandardCharsets.UTF_8)
            .putByte((byte) 0);
      } else {
        hasher.putString("-", StandardCharsets.UTF_8).putByte((byte) 0);
      }
      List<String> partitionIds = new ArrayList<>();
      for (PartitionExecutionContext partition : context.getPartitions()) {
        partitionIds.add(partition.getId());
      }
      Collections.sort(partitionIds);
      for (String partitionId : partitionIds) {
        hasher.putString(partitionId, StandardCharsets.UTF_8).putByte((byte) 1);
      }
      hasher.putByte((byte) 2);
    }
    return hasher.hash().toString();
  }

  private static Map<String, Object> datasetInput(DatasetRecord dataset) {
    Map<String, Object> input = new LinkedHashMap<>();
    input.put("id", dataset.getId());
    input.put("slug", dataset.getSlug());
    input.put("name", dataset.getName());
    input.put("status", dataset.getStatus());
    input.put("writeFormat", dataset.getWriteFormat());
    input.put("updatedAt", dataset.getUpdatedAt().toString());
    input.put("metadata", dataset.getMetadata());
    return input;
  }

  private static String hash(Map<String, Object> input) {
    try {
      return Hashing.sha256()
          .hashString(CANONICAL_MAPPER.writeValueAsString(input), StandardCharsets.UTF_8)
          .toString();
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize signature input", e);
    }
  }
}
