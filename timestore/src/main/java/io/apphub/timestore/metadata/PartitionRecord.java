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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable physical slice of a manifest: one data file with time
 * bounds and partition-key attributes.
 */
public final class PartitionRecord {
  public static final String FILE_FORMAT_DUCKDB = "duckdb";
  public static final String FILE_FORMAT_PARQUET = "parquet";

  private final String id;
  private final String datasetId;
  private final @Nullable String manifestId;
  private final Map<String, Object> partitionKey;
  private final String storageTargetId;
  private final String fileFormat;
  private final String filePath;
  private final @Nullable Long fileSizeBytes;
  private final @Nullable Long rowCount;
  private final Instant startTime;
  private final Instant endTime;
  private final @Nullable String checksum;
  private final Map<String, Object> metadata;

  private PartitionRecord(Builder builder) {
    this.id = Objects.requireNonNull(builder.id, "id");
    this.datasetId = Objects.requireNonNull(builder.datasetId, "datasetId");
    this.manifestId = builder.manifestId;
    this.partitionKey =
        Collections.unmodifiableMap(new LinkedHashMap<String, Object>(builder.partitionKey));
    this.storageTargetId = Objects.requireNonNull(builder.storageTargetId, "storageTargetId");
    this.fileFormat = builder.fileFormat;
    this.filePath = Objects.requireNonNull(builder.filePath, "filePath");
    this.fileSizeBytes = builder.fileSizeBytes;
    this.rowCount = builder.rowCount;
    this.startTime = Objects.requireNonNull(builder.startTime, "startTime");
    this.endTime = Objects.requireNonNull(builder.endTime, "endTime");
    if (startTime.isAfter(endTime)) {
      throw new IllegalArgumentException("Partition " + id + " starts after it ends: "
          + startTime + " > " + endTime);
    }
    this.checksum = builder.checksum;
    this.metadata =
        Collections.unmodifiableMap(new LinkedHashMap<String, Object>(builder.metadata));
  }

  public String getId() {
    return id;
  }

  public String getDatasetId() {
    return datasetId;
  }

  public @Nullable String getManifestId() {
    return manifestId;
  }

  public Map<String, Object> getPartitionKey() {
    return partitionKey;
  }

  public String getStorageTargetId() {
    return storageTargetId;
  }

  public String getFileFormat() {
    return fileFormat;
  }

  public String getFilePath() {
    return filePath;
  }

  public @Nullable Long getFileSizeBytes() {
    return fileSizeBytes;
  }

  public @Nullable Long getRowCount() {
    return rowCount;
  }

  public Instant getStartTime() {
    return startTime;
  }

  public Instant getEndTime() {
    return endTime;
  }

  public @Nullable String getChecksum() {
    return checksum;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    return "Partition{id=" + id + ", path=" + filePath + ", start=" + startTime
        + ", end=" + endTime + "}";
  }

  /**
   * Builder for {@link PartitionRecord}.
   */
  public static class Builder {
    private String id;
    private String datasetId;
    private String manifestId;
    private Map<String, Object> partitionKey = Collections.emptyMap();
    private String storageTargetId;
    private String fileFormat = FILE_FORMAT_DUCKDB;
    private String filePath;
    private Long fileSizeBytes;
    private Long rowCount;
    private Instant startTime;
    private Instant endTime;
    private String checksum;
    private Map<String, Object> metadata = Collections.emptyMap();

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder datasetId(String datasetId) {
      this.datasetId = datasetId;
      return this;
    }

    public Builder manifestId(@Nullable String manifestId) {
      this.manifestId = manifestId;
      return this;
    }

    public Builder partitionKey(Map<String, ?> partitionKey) {
      this.partitionKey = new LinkedHashMap<String, Object>(partitionKey);
      return this;
    }

    public Builder storageTargetId(String storageTargetId) {
      this.storageTargetId = storageTargetId;
      return this;
    }

    public Builder fileFormat(String fileFormat) {
      this.fileFormat = fileFormat;
      return this;
    }

    public Builder filePath(String filePath) {
      this.filePath = filePath;
      return this;
    }

    public Builder fileSizeBytes(@Nullable Long fileSizeBytes) {
      this.fileSizeBytes = fileSizeBytes;
      return this;
    }

    public Builder rowCount(@Nullable Long rowCount) {
      this.rowCount = rowCount;
      return this;
    }

    public Builder startTime(Instant startTime) {
      this.startTime = startTime;
      return this;
    }

    public Builder endTime(Instant endTime) {
      this.endTime = endTime;
      return this;
    }

    public Builder checksum(@Nullable String checksum) {
      this.checksum = checksum;
      return this;
    }

    public Builder metadata(Map<String, ?> metadata) {
      this.metadata = new LinkedHashMap<String, Object>(metadata);
      return this;
    }

    public PartitionRecord build() {
      return new PartitionRecord(this);
    }
  }
}
