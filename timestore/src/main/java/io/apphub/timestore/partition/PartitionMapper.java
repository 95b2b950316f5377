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
import io.apphub.timestore.storage.StorageLocators;
import io.apphub.timestore.storage.UnresolvedStorageTargetException;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Maps catalog partitions to {@link PartitionExecutionContext}s.
 *
 * <p>A filtering map: partitions that are not DuckDB files, reference an
 * unknown storage target or cannot be located are dropped with a warning.
 * One bad partition never fails the dataset.
 */
public class PartitionMapper {
  private static final Logger LOGGER = LoggerFactory.getLogger(PartitionMapper.class);

  /** Table read from a partition file whose metadata names none. */
  public static final String DEFAULT_TABLE_NAME = "records";

  private final StorageLocators locators;

  public PartitionMapper(StorageLocators locators) {
    this.locators = Objects.requireNonNull(locators, "locators");
  }

  /**
   * Maps partitions, skipping the ones that cannot be attached.
   *
   * @param partitions Catalog partitions of one dataset
   * @param storageTargets Storage target lookups shared across the build
   * @param warnings Receives one warning per skipped partition or missing target
   * @return Attachable partitions in input order
   */
  public List<PartitionExecutionContext> mapPartitions(List<PartitionRecord> partitions,
      StorageTargetCache storageTargets, List<String> warnings) {
    ImmutableList.Builder<PartitionExecutionContext> mapped = ImmutableList.builder();
    Set<String> missingTargets = new HashSet<>();
    for (PartitionRecord partition : partitions) {
      if (!PartitionRecord.FILE_FORMAT_DUCKDB.equals(partition.getFileFormat())) {
        warnings.add("Skipping non-DuckDB partition " + partition.getId() + ".");
        continue;
      }

      StorageTargetRecord target = storageTargets.get(partition.getStorageTargetId());
      if (target == null) {
        if (missingTargets.add(partition.getStorageTargetId())) {
          warnings.add("Storage target " + partition.getStorageTargetId()
              + " not found; skipping affected partitions.");
        }
        continue;
      }

      String location;
      try {
        location = locators.resolveLocation(partition, target);
      } catch (UnresolvedStorageTargetException e) {
        LOGGER.warn("Failed to resolve location for partition {}: {}",
            partition.getId(), e.getMessage());
        warnings.add("Failed to resolve location for partition " + partition.getId() + ": "
            + e.getMessage());
        continue;
      }
      mapped.add(
          new PartitionExecutionContext(partition, target, location, tableName(partition)));
    }
    return mapped.build();
  }

  static String tableName(PartitionRecord partition) {
    Object value = partition.getMetadata().get("tableName");
    if (value instanceof String && !((String) value).trim().isEmpty()) {
      return ((String) value).trim();
    }
    return DEFAULT_TABLE_NAME;
  }
}
