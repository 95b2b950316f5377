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
package io.apphub.timestore.partition;

import io.apphub.timestore.metadata.PartitionRecord;
import io.apphub.timestore.metadata.StorageTargetRecord;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A partition ready to be attached: its record, resolved location, storage
 * target and the table holding its rows.
 */
public final class PartitionExecutionContext {
  private final PartitionRecord partition;
  private final StorageTargetRecord storageTarget;
  private final String location;
  private final String tableName;

  public PartitionExecutionContext(PartitionRecord partition, StorageTargetRecord storageTarget,
      String location, String tableName) {
    this.partition = Objects.requireNonNull(partition, "partition");
    this.storageTarget = Objects.requireNonNull(storageTarget, "storageTarget");
    this.location = Objects.requireNonNull(location, "location");
    this.tableName = Objects.requireNonNull(tableName, "tableName");
  }

  public String getId() {
    return partition.getId();
  }

  public PartitionRecord getPartition() {
    return partition;
  }

  public StorageTargetRecord getStorageTarget() {
    return storageTarget;
  }

  public String getLocation() {
    return location;
  }

  public String getTableName() {
    return tableName;
  }

  public Instant getStartTime() {
    return partition.getStartTime();
  }

  public Instant getEndTime() {
    return partition.getEndTime();
  }

  public @Nullable Long getRowCount() {
    return partition.getRowCount();
  }

  public @Nullable Long getFileSizeBytes() {
    return partition.getFileSizeBytes();
  }

  public Map<String, Object> getPartitionKey() {
    return partition.getPartitionKey();
  }

  /** Whether the partition's time bounds intersect {@code [start, end]}. */
  public boolean overlaps(Instant start, Instant end) {
    return !partition.getStartTime().isAfter(end) && !partition.getEndTime().isBefore(start);
  }

  @Override public String toString() {
    return "PartitionExecutionContext{" + partition.getId() + " @ " + location + "}";
  }
}
