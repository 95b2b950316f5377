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
import io.apphub.timestore.util.ConfigValues;
import io.apphub.timestore.util.SqlIdentifiers;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Partitions in a Google Cloud Storage bucket. DuckDB reads GCS through
 * {@code httpfs} with HMAC keys; without keys the bucket must be public.
 */
public class GcsStorageLocator implements StorageLocator {
  private static final Logger LOGGER = LoggerFactory.getLogger(GcsStorageLocator.class);

  private final StorageDefaults defaults;

  public GcsStorageLocator(StorageDefaults defaults) {
    this.defaults = defaults;
  }

  @Override public StorageTargetKind getKind() {
    return StorageTargetKind.GCS;
  }

  @Override public String resolveLocation(PartitionRecord partition, StorageTargetRecord target) {
    return "gs://" + bucket(target) + "/" + partition.getFilePath();
  }

  @Override public RemoteBackend describeBackend(StorageTargetRecord target) {
    Map<String, Object> config = target.getConfig();
    String bucket = bucket(target);
    String keyId = ConfigValues.getString(config, "hmacKeyId", defaults.getGcsHmacKeyId());
    String secret = ConfigValues.getString(config, "hmacSecret", defaults.getGcsHmacSecret());
    String scope = "gs://" + bucket;

    String definition = null;
    if (keyId != null && secret != null) {
      definition = "TYPE gcs, KEY_ID " + SqlIdentifiers.literal(keyId)
          + ", SECRET " + SqlIdentifiers.literal(secret)
          + ", SCOPE " + SqlIdentifiers.literal(scope);
    } else {
      LOGGER.warn("GCS storage target {} has no HMAC key; bucket {} must allow anonymous reads",
          target.getName(), bucket);
    }
    return new RemoteBackend(StorageTargetKind.GCS, "gcs:" + bucket, scope,
        ImmutableList.of("httpfs"), definition);
  }

  private String bucket(StorageTargetRecord target) {
    String bucket = ConfigValues.getString(target.getConfig(), "bucket", defaults.getGcsBucket());
    if (bucket == null) {
      throw new UnresolvedStorageTargetException(
          "GCS storage target missing bucket configuration");
    }
    return bucket;
  }
}
