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

import io.apphub.timestore.query.ColumnValue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-dataset buffer of streamed rows, ordered by event time.
 *
 * <p>Rows at or before a dataset's watermark have been flushed to staging
 * or a published partition and are dropped. Rows older than the retention
 * window, or beyond the per-dataset and global caps, are evicted oldest
 * first.
 */
public class HotBuffer {
  private static final Logger LOGGER = LoggerFactory.getLogger(HotBuffer.class);

  /** Availability of the buffer as seen by queries. */
  public enum State {
    DISABLED, READY, UNAVAILABLE
  }

  private final HotBufferConfig config;
  private final Clock clock;
  private final Map<String, DatasetBuffer> buffers = new HashMap<>();
  private int totalRows;
  private State state;

  public HotBuffer(HotBufferConfig config) {
    this(config, Clock.systemUTC());
  }

  public HotBuffer(HotBufferConfig config, Clock clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.state = config.isEnabled() ? State.READY : State.DISABLED;
  }

  public HotBufferConfig getConfig() {
    return config;
  }

  public synchronized State getState() {
    return state;
  }

  /** Marks the buffer unusable, for example after the stream consumer failed. */
  public synchronized void markUnavailable(String reason) {
    if (state != State.DISABLED) {
      LOGGER.warn("Hot buffer unavailable: {}", reason);
      state = State.UNAVAILABLE;
    }
  }

  public synchronized void markReady() {
    if (state != State.DISABLED) {
      state = State.READY;
    }
  }

  /**
   * Buffers one row. Ignored when the buffer is disabled or the row is at or
   * before the dataset's watermark.
   */
  public synchronized void ingest(String datasetSlug, Map<String, ColumnValue> row,
      Instant timestamp) {
    if (state == State.DISABLED) {
      return;
    }
    DatasetBuffer buffer = ensureBuffer(datasetSlug);
    if (buffer.watermark != null && !timestamp.isAfter(buffer.watermark)) {
      return;
    }
    buffer.insert(new Event(timestamp, ImmutableMap.copyOf(row)));
    totalRows++;
    prune(buffer);
    enforceGlobalLimit();
  }

  /** Records that rows up to {@code watermark} are now served from storage. */
  public synchronized void setWatermark(String datasetSlug, Instant watermark) {
    DatasetBuffer buffer = ensureBuffer(datasetSlug);
    buffer.watermark = watermark;
    prune(buffer);
  }

  /**
   * Returns buffered rows of a dataset inside {@code [start, end]} that are
   * newer than its watermark.
   *
   * @param limit Maximum rows, or null for all
   */
  public synchronized Result query(String datasetSlug, Instant rangeStart, Instant rangeEnd,
      @Nullable Integer limit) {
    DatasetBuffer buffer = buffers.get(datasetSlug);
    if (state != State.READY || buffer == null || buffer.events.isEmpty()) {
      return new Result(ImmutableList.<Map<String, ColumnValue>>of(),
          buffer != null ? buffer.watermark : null, null, state);
    }
    List<Map<String, ColumnValue>> rows = new ArrayList<>();
    for (Event event : buffer.events) {
      if (event.timestamp.isBefore(rangeStart)) {
        continue;
      }
      if (buffer.watermark != null && !event.timestamp.isAfter(buffer.watermark)) {
        continue;
      }
      if (event.timestamp.isAfter(rangeEnd)) {
        break;
      }
      rows.add(event.row);
      if (limit != null && rows.size() >= limit) {
        break;
      }
    }
    return new Result(rows, buffer.watermark, buffer.latestTimestamp(), state);
  }

  /** Row counts per dataset, for diagnostics. */
  public synchronized Map<String, Integer> rowCounts() {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (Map.Entry<String, DatasetBuffer> entry : buffers.entrySet()) {
      counts.put(entry.getKey(), entry.getValue().events.size());
    }
    return Collections.unmodifiableMap(counts);
  }

  public synchronized void clear() {
    buffers.clear();
    totalRows = 0;
  }

  private DatasetBuffer ensureBuffer(String datasetSlug) {
    DatasetBuffer buffer = buffers.get(datasetSlug);
    if (buffer == null) {
      buffer = new DatasetBuffer();
      buffers.put(datasetSlug, buffer);
    }
    return buffer;
  }

  private void prune(DatasetBuffer buffer) {
    Instant retentionCutoff = clock.instant().minus(config.getRetention());
    while (!buffer.events.isEmpty()) {
      Event head = buffer.events.get(0);
      boolean flushed = buffer.watermark != null && !head.timestamp.isAfter(buffer.watermark);
      if (flushed || head.timestamp.isBefore(retentionCutoff)) {
        buffer.events.remove(0);
        totalRows--;
        continue;
      }
      break;
    }
    while (buffer.events.size() > config.getMaxRowsPerDataset()) {
      buffer.events.remove(0);
      totalRows--;
    }
  }

  private void enforceGlobalLimit() {
    int maxTotal = config.getMaxTotalRows();
    if (maxTotal <= 0) {
      return;
    }
    while (totalRows > maxTotal) {
      DatasetBuffer oldest = null;
      for (DatasetBuffer buffer : buffers.values()) {
        if (!buffer.events.isEmpty()
            && (oldest == null
                || buffer.events.get(0).timestamp.isBefore(oldest.events.get(0).timestamp))) {
          oldest = buffer;
        }
      }
      if (oldest == null) {
        break;
      }
      oldest.events.remove(0);
      totalRows--;
    }
  }

  /** Rows of one dataset plus its watermark. */
  private static final class DatasetBuffer {
    final List<Event> events = new ArrayList<>();
    @Nullable Instant watermark;

    void insert(Event event) {
      int low = 0;
      int high = events.size() - 1;
      while (low <= high) {
        int mid = (low + high) >>> 1;
        if (!events.get(mid).timestamp.isAfter(event.timestamp)) {
          low = mid + 1;
        } else {
          high = mid - 1;
        }
      }
      events.add(low, event);
    }

    @Nullable Instant latestTimestamp() {
      return events.isEmpty() ? null : events.get(events.size() - 1).timestamp;
    }
  }

  /** A buffered row with its event time. */
  private static final class Event {
    final Instant timestamp;
    final Map<String, ColumnValue> row;

    Event(Instant timestamp, Map<String, ColumnValue> row) {
      this.timestamp = timestamp;
      this.row = row;
    }
  }

  /**
   * Rows returned by {@link #query}, with the buffer's state for the dataset.
   */
  public static final class Result {
    private final List<Map<String, ColumnValue>> rows;
    private final @Nullable Instant watermark;
    private final @Nullable Instant latestTimestamp;
    private final State state;

    Result(List<Map<String, ColumnValue>> rows, @Nullable Instant watermark,
        @Nullable Instant latestTimestamp, State state) {
      this.rows = ImmutableList.copyOf(rows);
      this.watermark = watermark;
      this.latestTimestamp = latestTimestamp;
      this.state = state;
    }

    public List<Map<String, ColumnValue>> getRows() {
      return rows;
    }

    public @Nullable Instant getWatermark() {
      return watermark;
    }

    public @Nullable Instant getLatestTimestamp() {
      return latestTimestamp;
    }

    public State getState() {
      return state;
    }

    /** Same watermark and state with other rows. */
    public Result withRows(List<Map<String, ColumnValue>> rows) {
      return new Result(rows, watermark, latestTimestamp, state);
    }
  }
}
