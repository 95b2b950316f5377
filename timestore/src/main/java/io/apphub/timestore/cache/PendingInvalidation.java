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

import java.time.Instant;
import java.util.Objects;

/**
 * A dataset waiting to be refreshed by the next context load.
 *
 * <p>Failed refreshes keep the entry with a bumped attempt count; there is
 * no retry cap.
 */
public final class PendingInvalidation {
  private final @Nullable String datasetId;
  private final @Nullable String datasetSlug;
  private final @Nullable String reason;
  private final Instant requestedAt;
  private final int attempts;

  PendingInvalidation(@Nullable String datasetId, @Nullable String datasetSlug,
      @Nullable String reason, Instant requestedAt, int attempts) {
    this.datasetId = datasetId;
    this.datasetSlug = datasetSlug;
    this.reason = reason;
    this.requestedAt = Objects.requireNonNull(requestedAt, "requestedAt");
    this.attempts = attempts;
  }

  static PendingInvalidation of(InvalidationRequest request, Instant now) {
    return new PendingInvalidation(request.getDatasetId(), request.getDatasetSlug(),
        request.getReason(), now, 0);
  }

  /** Key under which the invalidation is tracked: the id, else the slug. */
  String key() {
    return datasetId != null ? datasetId : "slug:" + datasetSlug;
  }

  /** Merges a newer request for the same dataset into this one. */
  PendingInvalidation merge(PendingInvalidation newer) {
    return new PendingInvalidation(
        datasetId != null ? datasetId : newer.datasetId,
        newer.datasetSlug != null ? newer.datasetSlug : datasetSlug,
        newer.reason != null ? newer.reason : reason,
        newer.requestedAt, attempts);
  }

  PendingInvalidation retry(Instant now) {
    return new PendingInvalidation(datasetId, datasetSlug, reason, now, attempts + 1);
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

  public Instant getRequestedAt() {
    return requestedAt;
  }

  public int getAttempts() {
    return attempts;
  }

  @Override public String toString() {
    return "PendingInvalidation{" + key() + ", reason=" + reason + ", attempts=" + attempts + "}";
  }
}
