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
package io.apphub.timestore.storage;

import io.apphub.timestore.metadata.PartitionRecord;
import io.apphub.timestore.metadata.StorageTargetKind;
import io.apphub.timestore.metadata.StorageTargetRecord;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves partitions stored on one kind of storage target.
 */
public interface StorageLocator {

  /** Storage target kind this locator handles. */
  StorageTargetKind getKind();

  /**
   * Returns the location DuckDB attaches the partition file from.
   *
   * @param partition Partition whose file is being located
   * @param target Storage target the partition references
   * @return A local path or a URI such as {@code s3://bucket/key}
   * @throws UnresolvedStorageTargetException if a required setting is missing
   */
  String resolveLocation(PartitionRecord partition, StorageTargetRecord target);

  /**
   * Describes the remote configuration a connection needs before attaching
   * files from the target.
   *
   * @param target Storage target
   * @return The backend, or null if the target needs no setup
   * @throws UnresolvedStorageTargetException if a required setting is missing
   */
  default @Nullable RemoteBackend describeBackend(StorageTargetRecord target) {
    return null;
  }
}
