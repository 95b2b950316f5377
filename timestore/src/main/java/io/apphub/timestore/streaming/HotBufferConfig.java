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
package io.apphub.timestore.streaming;

import io.apphub.timestore.util.ConfigValues;
import io.apphub.timestore.util.Durations;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Settings of the streaming hot buffer.
 *
 * <p>Example configuration:
 * <pre>{@code
 * "streaming": {
 *   "hotBuffer": {
 *     "enabled": true,
 *     "retention": "2 hours",
 *     "maxRowsPerDataset": 10000,
 *     "maxTotalRows": 100000,
 *     "fallbackMode": "published"
 *   }
 * }
 * }</pre>
 */
public final class HotBufferConfig {

  /** What a query does when the hot buffer cannot serve rows. */
  public enum FallbackMode {
    /** Serve published and staged rows only, with a warning. */
    PUBLISHED,
    /** Fail the query. */
    ERROR
  }

  private final boolean enabled;
  private final Duration retention;
  private final int maxRowsPerDataset;
  private final int maxTotalRows;
  private final FallbackMode fallbackMode;

  private HotBufferConfig(Builder builder) {
    this.enabled = builder.enabled;
    this.retention = builder.retention;
    this.maxRowsPerDataset = builder.maxRowsPerDataset;
    this.maxTotalRows = builder.maxTotalRows;
    this.fallbackMode = builder.fallbackMode;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Duration getRetention() {
    return retention;
  }

  public int getMaxRowsPerDataset() {
    return maxRowsPerDataset;
  }

  /** Upper bound across all datasets; 0 means unbounded. */
  public int getMaxTotalRows() {
    return maxTotalRows;
  }

  public FallbackMode getFallbackMode() {
    return fallbackMode;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Hot buffer disabled. */
  public static HotBufferConfig defaults() {
    return builder().build();
  }

  public static HotBufferConfig fromMap(@Nullable Map<String, Object> map) {
    if (map == null || map.isEmpty()) {
      return defaults();
    }
    Builder builder = builder()
        .enabled(ConfigValues.getBoolean(map, "enabled", false))
        .retention(Durations.fromConfigValue(map.get("retention"), Builder.DEFAULT_RETENTION))
        .maxRowsPerDataset(
            ConfigValues.getInt(map, "maxRowsPerDataset", Builder.DEFAULT_MAX_ROWS_PER_DATASET))
        .maxTotalRows(ConfigValues.getInt(map, "maxTotalRows", 0));
    String mode = ConfigValues.getString(map, "fallbackMode");
    if (mode != null) {
      builder.fallbackMode(parseFallbackMode(mode));
    }
    return builder.build();
  }

  static FallbackMode parseFallbackMode(String mode) {
    switch (mode.trim().toLowerCase(Locale.ROOT)) {
    case "error":
      return FallbackMode.ERROR;
    case "published":
    case "parquet":
      return FallbackMode.PUBLISHED;
    default:
      throw new IllegalArgumentException("Unknown hot buffer fallback mode: " + mode);
    }
  }

  /**
   * Builder for {@link HotBufferConfig}.
   */
  public static class Builder {
    static final Duration DEFAULT_RETENTION = Duration.ofHours(2);
    static final int DEFAULT_MAX_ROWS_PER_DATASET = 10_000;

    private boolean enabled;
    private Duration retention = DEFAULT_RETENTION;
    private int maxRowsPerDataset = DEFAULT_MAX_ROWS_PER_DATASET;
    private int maxTotalRows;
    private FallbackMode fallbackMode = FallbackMode.PUBLISHED;

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    public Builder maxRowsPerDataset(int maxRowsPerDataset) {
      this.maxRowsPerDataset = maxRowsPerDataset;
      return this;
    }

    public Builder maxTotalRows(int maxTotalRows) {
      this.maxTotalRows = maxTotalRows;
      return this;
    }

    public Builder fallbackMode(FallbackMode fallbackMode) {
      this.fallbackMode = fallbackMode;
      return this;
    }

    public HotBufferConfig build() {
      if (maxRowsPerDataset <= 0) {
        throw new IllegalArgumentException("maxRowsPerDataset must be positive");
      }
      return new HotBufferConfig(this);
    }
  }
}
