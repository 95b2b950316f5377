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

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * An immutable, versioned snapshot of a dataset's partition set.
 */
public final class ManifestRecord {

  /** Lifecycle status of a manifest. */
  public enum Status {
    DRAFT, PUBLISHED, SUPERSEDED;

    public String getValue() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private final String id;
  private final String datasetId;
  private final int version;
  private final Status status;
  private final @Nullable String schemaVersionId;
  private final String manifestShard;
  private final int partitionCount;
  private final long totalRows;
  private final long totalBytes;
  private final Instant createdAt;
  private final Instant updatedAt;
  private final List<PartitionRecord> partitions;

  private ManifestRecord(Builder builder) {
    this.id = Objects.requireNonNull(builder.id, "id");
    this.datasetId = Objects.requireNonNull(builder.datasetId, "datasetId");
    this.version = builder.version;
    this.status = builder.status;
    this.schemaVersionId = builder.schemaVersionId;
    this.manifestShard = builder.manifestShard;
    this.partitions = ImmutableList.copyOf(builder.partitions);
    this.partitionCount = builder.partitionCount != null
        ? builder.partitionCount : partitions.size();
    long rows = 0;
    long bytes = 0;
    for (PartitionRecord partition : partitions) {
      rows += partition.getRowCount() != null ? partition.getRowCount() : 0L;
      bytes += partition.getFileSizeBytes() != null ? partition.getFileSizeBytes() : 0L;
    }
    this.totalRows = builder.totalRows != null ? builder.totalRows : rows;
    this.totalBytes = builder.totalBytes != null ? builder.totalBytes : bytes;
    this.updatedAt = builder.updatedAt != null ? builder.updatedAt : Instant.EPOCH;
    this.createdAt = builder.createdAt != null ? builder.createdAt : this.updatedAt;
  }

  public String getId() {
    return id;
  }

  public String getDatasetId() {
    return datasetId;
  }

  public int getVersion() {
    return version;
  }

  public Status getStatus() {
    return status;
  }

  public @Nullable String getSchemaVersionId() {
    return schemaVersionId;
  }

  public String getManifestShard() {
    return manifestShard;
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

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public List<PartitionRecord> getPartitions() {
    return partitions;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    return "Manifest{id=" + id + ", dataset=" + datasetId + ", version=" + version
        + ", shard=" + manifestShard + ", status=" + status.getValue() + "}";
  }

  /**
   * Builder for {@link ManifestRecord}. Totals default to the sums over
   * the partition list.
   */
  public static class Builder {
    private String id;
    private String datasetId;
    private int version = 1;
    private Status status = Status.PUBLISHED;
    private String schemaVersionId;
    private String manifestShard = "root";
    private Integer partitionCount;
    private Long totalRows;
    private Long totalBytes;
    private Instant createdAt;
    private Instant updatedAt;
    private List<PartitionRecord> partitions = ImmutableList.of();

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder datasetId(String datasetId) {
      this.datasetId = datasetId;
      return this;
    }

    public Builder version(int version) {
      this.version = version;
      return this;
    }

    public Builder status(Status status) {
      this.status = status;
      return this;
    }

    public Builder schemaVersionId(@Nullable String schemaVersionId) {
      this.schemaVersionId = schemaVersionId;
      return this;
    }

    public Builder manifestShard(String manifestShard) {
      this.manifestShard = manifestShard;
      return this;
    }

    public Builder partitionCount(int partitionCount) {
      this.partitionCount = partitionCount;
      return this;
    }

    public Builder totalRows(long totalRows) {
      this.totalRows = totalRows;
      return this;
    }

    public Builder totalBytes(long totalBytes) {
      this.totalBytes = totalBytes;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public Builder partitions(List<PartitionRecord> partitions) {
      this.partitions = partitions;
      return this;
    }

    public ManifestRecord build() {
      return new ManifestRecord(this);
    }
  }
}
