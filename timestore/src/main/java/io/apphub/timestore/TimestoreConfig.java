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
package io.apphub.timestore;

import io.apphub.timestore.execution.duckdb.DuckDBSettings;
import io.apphub.timestore.storage.StorageDefaults;
import io.apphub.timestore.streaming.HotBufferConfig;
import io.apphub.timestore.util.ConfigValues;
import io.apphub.timestore.util.Durations;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of the SQL runtime.
 *
 * <p>Example configuration:
 * <pre>{@code
 * {
 *   "storage": {"root": "/var/lib/timestore"},
 *   "sql": {
 *     "runtimeCacheTtl": "30 seconds",
 *     "incrementalRefresh": true,
 *     "maxStatementLength": 10000,
 *     "statementTimeout": "30s"
 *   },
 *   "query": {"timestampColumn": "timestamp", "executionBackend": "duckdb"},
 *   "staging": {"directory": "/var/lib/timestore/staging"},
 *   "streaming": {"hotBuffer": {"enabled": true}},
 *   "engine": {"threads": 4, "memoryLimit": "4GB"}
 * }
 * }</pre>
 *
 * <p>A cache TTL of zero or less disables both the context cache and the
 * connection cache.
 */
public final class TimestoreConfig {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final StorageDefaults storage;
  private final Duration runtimeCacheTtl;
  private final boolean incrementalRefreshEnabled;
  private final int maxStatementLength;
  private final Duration statementTimeout;
  private final String defaultTimestampColumn;
  private final String defaultExecutionBackend;
  private final @Nullable Path stagingDirectory;
  private final HotBufferConfig hotBuffer;
  private final DuckDBSettings engine;

  private TimestoreConfig(Builder builder) {
    this.storage = builder.storage;
    this.runtimeCacheTtl = builder.runtimeCacheTtl;
    this.incrementalRefreshEnabled = builder.incrementalRefreshEnabled;
    this.maxStatementLength = builder.maxStatementLength;
    this.statementTimeout = builder.statementTimeout;
    this.defaultTimestampColumn = builder.defaultTimestampColumn;
    this.defaultExecutionBackend = builder.defaultExecutionBackend;
    this.stagingDirectory = builder.stagingDirectory;
    this.hotBuffer = builder.hotBuffer;
    this.engine = builder.engine;
  }

  public StorageDefaults getStorage() {
    return storage;
  }

  public Duration getRuntimeCacheTtl() {
    return runtimeCacheTtl;
  }

  /** Whether caching of contexts and connections is on at all. */
  public boolean isCachingEnabled() {
    return !runtimeCacheTtl.isZero() && !runtimeCacheTtl.isNegative();
  }

  public boolean isIncrementalRefreshEnabled() {
    return incrementalRefreshEnabled;
  }

  public int getMaxStatementLength() {
    return maxStatementLength;
  }

  public Duration getStatementTimeout() {
    return statementTimeout;
  }

  public String getDefaultTimestampColumn() {
    return defaultTimestampColumn;
  }

  public String getDefaultExecutionBackend() {
    return defaultExecutionBackend;
  }

  public @Nullable Path getStagingDirectory() {
    return stagingDirectory;
  }

  public HotBufferConfig getHotBuffer() {
    return hotBuffer;
  }

  public DuckDBSettings getEngine() {
    return engine;
  }

  public Builder toBuilder() {
    return builder()
        .storage(storage)
        .runtimeCacheTtl(runtimeCacheTtl)
        .incrementalRefreshEnabled(incrementalRefreshEnabled)
        .maxStatementLength(maxStatementLength)
        .statementTimeout(statementTimeout)
        .defaultTimestampColumn(defaultTimestampColumn)
        .defaultExecutionBackend(defaultExecutionBackend)
        .stagingDirectory(stagingDirectory)
        .hotBuffer(hotBuffer)
        .engine(engine);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static TimestoreConfig defaults() {
    return builder().build();
  }

  /**
   * Creates a configuration from the nested map form shown in the class
   * documentation. Missing sections keep their defaults.
   *
   * @throws IllegalArgumentException if a value has the wrong shape
   */
  public static TimestoreConfig fromMap(@Nullable Map<String, Object> map) {
    if (map == null || map.isEmpty()) {
      return defaults();
    }
    Map<String, Object> sql = ConfigValues.getMap(map, "sql");
    Map<String, Object> query = ConfigValues.getMap(map, "query");
    Map<String, Object> staging = ConfigValues.getMap(map, "staging");
    Map<String, Object> streaming = ConfigValues.getMap(map, "streaming");

    Builder builder = builder()
        .storage(StorageDefaults.fromMap(ConfigValues.getMap(map, "storage")))
        .runtimeCacheTtl(
            Durations.fromConfigValue(sql.get("runtimeCacheTtl"), Builder.DEFAULT_CACHE_TTL))
        .incrementalRefreshEnabled(ConfigValues.getBoolean(sql, "incrementalRefresh", true))
        .maxStatementLength(
            ConfigValues.getInt(sql, "maxStatementLength", Builder.DEFAULT_MAX_STATEMENT_LENGTH))
        .statementTimeout(
            Durations.fromConfigValue(sql.get("statementTimeout"),
                Builder.DEFAULT_STATEMENT_TIMEOUT))
        .defaultTimestampColumn(
            ConfigValues.getString(query, "timestampColumn", Builder.DEFAULT_TIMESTAMP_COLUMN))
        .defaultExecutionBackend(
            ConfigValues.getString(query, "executionBackend", Builder.DEFAULT_BACKEND))
        .hotBuffer(HotBufferConfig.fromMap(ConfigValues.getMap(streaming, "hotBuffer")))
        .engine(DuckDBSettings.fromMap(ConfigValues.getMap(map, "engine")));

    String stagingDirectory = ConfigValues.getString(staging, "directory");
    if (stagingDirectory != null) {
      builder.stagingDirectory(Paths.get(stagingDirectory));
    }
    return builder.build();
  }

  /**
   * Reads a JSON configuration file.
   *
   * @throws IOException if the file cannot be read or is not a JSON object
   */
  public static TimestoreConfig load(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      Map<String, Object> map = MAPPER.readValue(in, new TypeReference<Map<String, Object>>() {
      });
      return fromMap(map);
    }
  }

  /**
   * Builder for {@link TimestoreConfig}.
   */
  public static class Builder {
    static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(30);
    static final Duration DEFAULT_STATEMENT_TIMEOUT = Duration.ofSeconds(30);
    static final int DEFAULT_MAX_STATEMENT_LENGTH = 10_000;
    static final String DEFAULT_TIMESTAMP_COLUMN = "timestamp";
    static final String DEFAULT_BACKEND = "duckdb";

    private StorageDefaults storage = StorageDefaults.defaults();
    private Duration runtimeCacheTtl = DEFAULT_CACHE_TTL;
    private boolean incrementalRefreshEnabled = true;
    private int maxStatementLength = DEFAULT_MAX_STATEMENT_LENGTH;
    private Duration statementTimeout = DEFAULT_STATEMENT_TIMEOUT;
    private String defaultTimestampColumn = DEFAULT_TIMESTAMP_COLUMN;
    private String defaultExecutionBackend = DEFAULT_BACKEND;
    private Path stagingDirectory;
    private HotBufferConfig hotBuffer = HotBufferConfig.defaults();
    private DuckDBSettings engine = DuckDBSettings.defaults();

    public Builder storage(StorageDefaults storage) {
      this.storage = storage;
      return this;
    }

    public Builder runtimeCacheTtl(Duration runtimeCacheTtl) {
      this.runtimeCacheTtl = runtimeCacheTtl;
      return this;
    }

    public Builder incrementalRefreshEnabled(boolean incrementalRefreshEnabled) {
      this.incrementalRefreshEnabled = incrementalRefreshEnabled;
      return this;
    }

    public Builder maxStatementLength(int maxStatementLength) {
      this.maxStatementLength = maxStatementLength;
      return this;
    }

    public Builder statementTimeout(Duration statementTimeout) {
      this.statementTimeout = statementTimeout;
      return this;
    }

    public Builder defaultTimestampColumn(String defaultTimestampColumn) {
      this.defaultTimestampColumn = defaultTimestampColumn;
      return this;
    }

    public Builder defaultExecutionBackend(String defaultExecutionBackend) {
      this.defaultExecutionBackend = defaultExecutionBackend;
      return this;
    }

    public Builder stagingDirectory(@Nullable Path stagingDirectory) {
      this.stagingDirectory = stagingDirectory;
      return this;
    }

    public Builder hotBuffer(HotBufferConfig hotBuffer) {
      this.hotBuffer = hotBuffer;
      return this;
    }

    public Builder engine(DuckDBSettings engine) {
      this.engine = engine;
      return this;
    }

    public TimestoreConfig build() {
      Objects.requireNonNull(storage, "storage");
      Objects.requireNonNull(runtimeCacheTtl, "runtimeCacheTtl");
      Objects.requireNonNull(statementTimeout, "statementTimeout");
      if (maxStatementLength <= 0) {
        throw new IllegalArgumentException("maxStatementLength must be positive: "
            + maxStatementLength);
      }
      return new TimestoreConfig(this);
    }
  }
}
