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
package io.apphub.timestore.execution.duckdb;

import io.apphub.timestore.util.ConfigValues;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Resource settings applied to every DuckDB instance the runtime opens.
 *
 * <p>Example configuration:
 * <pre>{@code
 * "engine": {
 *   "threads": 4,
 *   "memoryLimit": "4GB",
 *   "tempDirectory": "/var/tmp/timestore"
 * }
 * }</pre>
 */
public final class DuckDBSettings {
  private final @Nullable Integer threads;
  private final @Nullable String memoryLimit;
  private final @Nullable String tempDirectory;
  private final boolean preserveInsertionOrder;

  private DuckDBSettings(Builder builder) {
    this.threads = builder.threads;
    this.memoryLimit = builder.memoryLimit;
    this.tempDirectory = builder.tempDirectory;
    this.preserveInsertionOrder = builder.preserveInsertionOrder;
  }

  public @Nullable Integer getThreads() {
    return threads;
  }

  public @Nullable String getMemoryLimit() {
    return memoryLimit;
  }

  public @Nullable String getTempDirectory() {
    return tempDirectory;
  }

  public boolean isPreserveInsertionOrder() {
    return preserveInsertionOrder;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Engine defaults: DuckDB picks threads and memory itself. */
  public static DuckDBSettings defaults() {
    return builder().build();
  }

  public static DuckDBSettings fromMap(@Nullable Map<String, Object> map) {
    if (map == null || map.isEmpty()) {
      return defaults();
    }
    Builder builder = builder()
        .memoryLimit(ConfigValues.getString(map, "memoryLimit"))
        .tempDirectory(ConfigValues.getString(map, "tempDirectory"))
        .preserveInsertionOrder(
            ConfigValues.getBoolean(map, "preserveInsertionOrder", false));
    if (map.get("threads") != null) {
      builder.threads(ConfigValues.getInt(map, "threads", 0));
    }
    return builder.build();
  }

  /**
   * Builder for {@link DuckDBSettings}.
   */
  public static class Builder {
    private Integer threads;
    private String memoryLimit;
    private String tempDirectory;
    private boolean preserveInsertionOrder;

    public Builder threads(@Nullable Integer threads) {
      this.threads = threads;
      return this;
    }

    public Builder memoryLimit(@Nullable String memoryLimit) {
      this.memoryLimit = memoryLimit;
      return this;
    }

    public Builder tempDirectory(@Nullable String tempDirectory) {
      this.tempDirectory = tempDirectory;
      return this;
    }

    public Builder preserveInsertionOrder(boolean preserveInsertionOrder) {
      this.preserveInsertionOrder = preserveInsertionOrder;
      return this;
    }

    public DuckDBSettings build() {
      if (threads != null && threads <= 0) {
        throw new IllegalArgumentException("threads must be positive: " + threads);
      }
      return new DuckDBSettings(this);
    }
  }
}
