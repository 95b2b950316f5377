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
package io.apphub.timestore.cache;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A request to drop cached state after a manifest or partition change.
 *
 * <p>A request without a dataset, or with {@link Scope#FULL}, drops the
 * whole context and every cached connection. A dataset-scoped request only
 * marks that dataset for refresh on the next load.
 */
public final class InvalidationRequest {

  /** How much cached state a request drops. */
  public enum Scope {
    FULL,
    DATASET
  }

  private final @Nullable String datasetId;
  private final @Nullable String datasetSlug;
  private final @Nullable String reason;
  private final Scope scope;

  private InvalidationRequest(Builder builder) {
    this.datasetId = builder.datasetId;
    this.datasetSlug = builder.datasetSlug;
    this.reason = builder.reason;
    this.scope = builder.scope != null ? builder.scope
        : builder.datasetId != null || builder.datasetSlug != null ? Scope.DATASET : Scope.FULL;
  }

  /** Request that drops everything. */
  public static InvalidationRequest full(@Nullable String reason) {
    return builder().reason(reason).scope(Scope.FULL).build();
  }

  /** Request that refreshes one dataset. */
  public static InvalidationRequest dataset(String datasetId, @Nullable String reason) {
    return builder().datasetId(datasetId).reason(reason).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public @Nullable String getDatasetId() {
    return datasetId;
  }

  public @Nullable String getDatasetSlug() {
    return datasetSlug;
  }

  public @Nullable String getReason() {
    return reason;
  }

  public Scope getScope() {
    return scope;
  }

  /** Whether this request only concerns one dataset. */
  public boolean isDatasetScoped() {
    return scope == Scope.DATASET && (datasetId != null || datasetSlug != null);
  }

  @Override public String toString() {
    return "InvalidationRequest{scope=" + scope + ", datasetId=" + datasetId
        + ", datasetSlug=" + datasetSlug + ", reason=" + reason + "}";
  }

  /**
   * Builder for {@link InvalidationRequest}.
   */
  public static final class Builder {
    private @Nullable String datasetId;
    private @Nullable String datasetSlug;
    private @Nullable String reason;
    private @Nullable Scope scope;

    private Builder() {
    }

    public Builder datasetId(@Nullable String datasetId) {
      this.datasetId = datasetId;
      return this;
    }

    public Builder datasetSlug(@Nullable String datasetSlug) {
      this.datasetSlug = datasetSlug;
      return this;
    }

    public Builder reason(@Nullable String reason) {
      this.reason = reason;
      return this;
    }

    public Builder scope(@Nullable Scope scope) {
      this.scope = scope;
      return this;
    }

    public InvalidationRequest build() {
      return new InvalidationRequest(this);
    }
  }
}
