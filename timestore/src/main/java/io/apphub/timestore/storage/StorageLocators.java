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

import io.apphub.timestore.execution.EngineConnection;
import io.apphub.timestore.metadata.PartitionRecord;
import io.apphub.timestore.metadata.StorageTargetKind;
import io.apphub.timestore.metadata.StorageTargetRecord;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Dispatches location resolution and remote-access setup to the locator
 * registered for a storage target's kind.
 */
public class StorageLocators {
  private static final Logger LOGGER = LoggerFactory.getLogger(StorageLocators.class);

  private final Map<StorageTargetKind, StorageLocator> locators;

  public StorageLocators(StorageDefaults defaults) {
    this(new LocalStorageLocator(defaults), new S3StorageLocator(defaults),
        new GcsStorageLocator(defaults), new AzureBlobStorageLocator(defaults));
  }

  public StorageLocators(StorageLocator... locators) {
    ImmutableMap.Builder<StorageTargetKind, StorageLocator> builder = ImmutableMap.builder();
    for (StorageLocator locator : locators) {
      builder.put(locator.getKind(), locator);
    }
    this.locators = builder.build();
  }

  /**
   * Resolves the location of a partition file.
   *
   * @throws UnresolvedStorageTargetException if the kind is unsupported or the
   *     target lacks a required setting
   */
  public String resolveLocation(PartitionRecord partition, StorageTargetRecord target) {
    return locatorFor(target).resolveLocation(partition, target);
  }

  /**
   * Returns the remote configuration a target needs, or null for local targets.
   */
  public @Nullable RemoteBackend describeBackend(StorageTargetRecord target) {
    return locatorFor(target).describeBackend(target);
  }

  /**
   * Installs the extensions and the scoped secret of a backend on a
   * connection. Callers track which backends a connection already has;
   * repeating the setup is harmless but wasted work.
   *
   * @throws SQLException if an extension cannot be loaded or the secret is rejected
   */
  public static void configureRemoteAccess(EngineConnection connection, RemoteBackend backend)
      throws SQLException {
    for (String statement : backend.getSetupStatements()) {
      connection.run(statement);
    }
    LOGGER.info("Configured remote access for {} (credentials: {})",
        backend.getScope(), backend.hasCredentials() ? "scoped secret" : "none");
  }

  /**
   * Relative path of a partition file:
   * {@code <dataset>/<key>=<value>/.../<partitionId>.duckdb}, keys sorted.
   */
  public static String partitionRelativePath(String datasetSlug, Map<String, ?> partitionKey,
      String partitionId) {
    List<String> segments = new ArrayList<>();
    segments.add(sanitizeSegment(datasetSlug));
    for (Map.Entry<String, ?> entry : new TreeMap<String, Object>(partitionKey).entrySet()) {
      segments.add(sanitizeSegment(entry.getKey()) + "="
          + sanitizeSegment(String.valueOf(entry.getValue())));
    }
    segments.add(partitionId + ".duckdb");
    return String.join("/", segments);
  }

  static String sanitizeSegment(String input) {
    String sanitized = input.trim().toLowerCase(Locale.ROOT)
        .replaceAll("[\\s/\\\\]+", "_")
        .replaceAll("[^a-z0-9._-]", "_")
        .replaceAll("_+", "_")
        .replaceAll("^_+|_+$", "");
    return sanitized.isEmpty() ? "segment" : sanitized;
  }

  private StorageLocator locatorFor(StorageTargetRecord target) {
    StorageLocator locator = locators.get(target.getKind());
    if (locator == null) {
      throw new UnresolvedStorageTargetException("Unsupported storage target kind: "
          + target.getKind().getValue());
    }
    return locator;
  }
}
