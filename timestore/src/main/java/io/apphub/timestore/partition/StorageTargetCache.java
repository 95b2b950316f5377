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

import io.apphub.timestore.metadata.MetadataStore;
import io.apphub.timestore.metadata.StorageTargetRecord;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Storage target lookups memoized for the duration of one context build.
 *
 * <p>Misses are cached too, so a dangling storage target id costs a single
 * catalog query no matter how many partitions reference it.
 */
public class StorageTargetCache {
  private static final Logger LOGGER = LoggerFactory.getLogger(StorageTargetCache.class);

  private final MetadataStore metadataStore;
  private final Map<String, Optional<StorageTargetRecord>> targets = new ConcurrentHashMap<>();
  private final AtomicInteger lookups = new AtomicInteger();

  public StorageTargetCache(MetadataStore metadataStore) {
    this.metadataStore = Objects.requireNonNull(metadataStore, "metadataStore");
  }

  /**
   * Returns the storage target, or null if the catalog has no such target.
   */
  public @Nullable StorageTargetRecord get(String storageTargetId) {
    Optional<StorageTargetRecord> target = targets.get(storageTargetId);
    if (target == null) {
      lookups.incrementAndGet();
      target = Optional.ofNullable(metadataStore.getStorageTargetById(storageTargetId));
      if (!target.isPresent()) {
        LOGGER.debug("Storage target {} not found; caching the miss", storageTargetId);
      }
      targets.putIfAbsent(storageTargetId, target);
    }
    return target.orElse(null);
  }

  /** Number of catalog queries issued so far. */
  public int getLookupCount() {
    return lookups.get();
  }
}
