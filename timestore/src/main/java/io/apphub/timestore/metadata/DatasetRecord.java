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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named, sluggable collection of time-series data.
 *
 * <p>Only datasets whose write format is {@link #WRITE_FORMAT_DUCKDB}
 * take part in SQL federation.
 */
public final class DatasetRecord {
  public static final String WRITE_FORMAT_DUCKDB = "duckdb";

  private final String id;
  private final String slug;
  private final String name;
  private final @Nullable String description;
  private final String status;
  private final String writeFormat;
  private final @Nullable String defaultStorageTargetId;
  private final Map<String, Object> metadata;
  private final Instant createdAt;
  private final Instant updatedAt;

  private DatasetRecord(Builder builder) {
    this.id = Objects.requireNonNull(builder.id, "id");
    this.slug = Objects.requireNonNull(builder.slug, "slug");
    this.name = builder.name != null ? builder.name : builder.slug;
    this.description = builder.description;
    this.status = builder.status;
    this.writeFormat = builder.writeFormat;
    this.defaultStorageTargetId = builder.defaultStorageTargetId;
    this.metadata =
        Collections.unmodifiableMap(new LinkedHashMap<String, Object>(builder.metadata));
    this.updatedAt = builder.updatedAt != null ? builder.updatedAt : Instant.EPOCH;
    this.createdAt = builder.createdAt != null ? builder.createdAt : this.updatedAt;
  }

  public String getId() {
    return id;
  }

  public String getSlug() {
    return slug;
  }

  public String getName() {
    return name;
  }

  public @Nullable String getDescription() {
    return description;
  }

  public String getStatus() {
    return status;
  }

  public String getWriteFormat() {
    return writeFormat;
  }

  public @Nullable String getDefaultStorageTargetId() {
    return defaultStorageTargetId;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /** Returns a builder pre-populated with this record's values. */
  public Builder toBuilder() {
    return builder()
        .id(id)
        .slug(slug)
        .name(name)
        .description(description)
        .status(status)
        .writeFormat(writeFormat)
        .defaultStorageTargetId(defaultStorageTargetId)
        .metadata(metadata)
        .createdAt(createdAt)
        .updatedAt(updatedAt);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    return "Dataset{id=" + id + ", slug=" + slug + ", status=" + status + "}";
  }

  /**
   * Builder for {@link DatasetRecord}.
   */
  public static class Builder {
    private String id;
    private String slug;
    private String name;
    private String description;
    private String status = "active";
    private String writeFormat = WRITE_FORMAT_DUCKDB;
    private String defaultStorageTargetId;
    private Map<String, Object> metadata = Collections.emptyMap();
    private Instant createdAt;
    private Instant updatedAt;

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder slug(String slug) {
      this.slug = slug;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(@Nullable String description) {
      this.description = description;
      return this;
    }

    public Builder status(String status) {
      this.status = status;
      return this;
    }

    public Builder writeFormat(String writeFormat) {
      this.writeFormat = writeFormat;
      return this;
    }

    public Builder defaultStorageTargetId(@Nullable String defaultStorageTargetId) {
      this.defaultStorageTargetId = defaultStorageTargetId;
      return this;
    }

    public Builder metadata(Map<String, ?> metadata) {
      this.metadata = new LinkedHashMap<String, Object>(metadata);
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public DatasetRecord build() {
      return new DatasetRecord(this);
    }
  }
}
