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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;
import java.util.Map;

/**
 * Kind of backend a storage target stores partition files on.
 */
public enum StorageTargetKind {
  LOCAL("local"),
  S3("s3"),
  GCS("gcs"),
  AZURE_BLOB("azure_blob");

  private static final Map<String, StorageTargetKind> MAP;

  static {
    ImmutableMap.Builder<String, StorageTargetKind> builder = ImmutableMap.builder();
    for (StorageTargetKind kind : values()) {
      builder.put(kind.value, kind);
    }
    builder.put("azure", AZURE_BLOB);
    builder.put("gs", GCS);
    MAP = builder.build();
  }

  private final String value;

  StorageTargetKind(String value) {
    this.value = value;
  }

  /** Name used in the catalog and the runtime introspection tables. */
  public String getValue() {
    return value;
  }

  /** Returns the kind for a catalog value, or null if it is not known. */
  public static @Nullable StorageTargetKind of(@Nullable String value) {
    if (value == null) {
      return null;
    }
    return MAP.get(value.trim().toLowerCase(Locale.ROOT));
  }
}
