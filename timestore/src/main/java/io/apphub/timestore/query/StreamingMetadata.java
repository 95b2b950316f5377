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
package io.apphub.timestore.query;

import io.apphub.timestore.streaming.HotBuffer;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;

/**
 * Hot buffer state reported with a query result.
 */
public final class StreamingMetadata {
  private final boolean enabled;
  private final HotBuffer.State bufferState;
  private final int rows;
  private final @Nullable Instant watermark;
  private final @Nullable Instant latestTimestamp;
  private final boolean fresh;

  public StreamingMetadata(boolean enabled, HotBuffer.State bufferState, int rows,
      @Nullable Instant watermark, @Nullable Instant latestTimestamp, boolean fresh) {
    this.enabled = enabled;
    this.bufferState = bufferState;
    this.rows = rows;
    this.watermark = watermark;
    this.latestTimestamp = latestTimestamp;
    this.fresh = fresh;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public HotBuffer.State getBufferState() {
    return bufferState;
  }

  /** Buffered rows that made it into the result. */
  public int getRows() {
    return rows;
  }

  public @Nullable Instant getWatermark() {
    return watermark;
  }

  public @Nullable Instant getLatestTimestamp() {
    return latestTimestamp;
  }

  /** Whether the buffer holds data up to the end of the query range. */
  public boolean isFresh() {
    return fresh;
  }
}
