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
package io.apphub.timestore.context;

import io.apphub.timestore.metadata.DatasetRecord;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Cached build result for one dataset: its context (absent when the
 * dataset is skipped), content signature, and when and why it was built.
 */
public final class DatasetCacheState {
  private final DatasetRecord dataset;
  private final @Nullable DatasetContext context;
  private final String signature;
  private final List<String> warnings;
  private final Instant refreshedAt;
  private final @Nullable String reason;

  DatasetCacheState(DatasetRecord dataset, @Nullable DatasetContext context, String signature,
      List<String> warnings, Instant refreshedAt, @Nullable String reason) {
    this.dataset = Objects.requireNonNull(dataset, "dataset");
    this.context = context;
    this.signature = Objects.requireNonNull(signature, "signature");
    this.warnings = ImmutableList.copyOf(warnings);
    this.refreshedAt = Objects.requireNonNull(refreshedAt, "refreshedAt");
    this.reason = reason;
  }

  public String getDatasetId() {
    return dataset.getId();
  }

  public String getSlug() {
    return dataset.getSlug();
  }

  public DatasetRecord getDataset() {
    return dataset;
  }

  /** The dataset context, or null if the dataset is excluded from SQL. */
  public @Nullable DatasetContext getContext() {
    return context;
  }

  public String getSignature() {
    return signature;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  public Instant getRefreshedAt() {
    return refreshedAt;
  }

  public @Nullable String getReason() {
    return reason;
  }
}
