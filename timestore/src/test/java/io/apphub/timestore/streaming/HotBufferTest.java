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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link HotBuffer}.
 */
@Tag("unit")
class HotBufferTest {
  private static final Instant NOW = Instant.parse("2024-01-01T02:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  private static Map<String, ColumnValue> row(int value) {
    return ImmutableMap.of("value", ColumnValue.of(value));
  }

  private static List<Long> values(HotBuffer.Result result) {
    List<Long> values = new ArrayList<>();
    for (Map<String, ColumnValue> row : result.getRows()) {
      values.add(row.get("value").asLong());
    }
    return values;
  }

  private static HotBuffer enabled(HotBufferConfig.Builder builder) {
    return new HotBuffer(builder.enabled(true).build(), CLOCK);
  }

  @Test void testRowsAreReturnedInTimestampOrder() {
    HotBuffer buffer = enabled(HotBufferConfig.builder());
    buffer.ingest("ds", row(3), NOW.minusSeconds(10));
    buffer.ingest("ds", row(1), NOW.minusSeconds(30));
    buffer.ingest("ds", row(2), NOW.minusSeconds(20));

    HotBuffer.Result result = buffer.query("ds", NOW.minusSeconds(60), NOW, null);
    assertEquals(ImmutableList.of(1L, 2L, 3L), values(result));
    assertEquals(NOW.minusSeconds(10), result.getLatestTimestamp());
    assertEquals(HotBuffer.State.READY, result.getState());
  }

  @Test void testQueryHonoursRangeAndLimit() {
    HotBuffer buffer = enabled(HotBufferConfig.builder());
    for (int i = 1; i <= 5; i++) {
      buffer.ingest("ds", row(i), NOW.minusSeconds(60 - i * 10));
    }
    assertEquals(ImmutableList.of(2L, 3L, 4L),
        values(buffer.query("ds", NOW.minusSeconds(40), NOW.minusSeconds(20), null)));
    assertEquals(ImmutableList.of(1L, 2L),
        values(buffer.query("ds", NOW.minusSeconds(60), NOW, 2)));
  }

  @Test void testWatermarkDropsFlushedRows() {
    HotBuffer buffer = enabled(HotBufferConfig.builder());
    buffer.ingest("ds", row(1), NOW.minusSeconds(30));
    buffer.ingest("ds", row(2), NOW.minusSeconds(20));
    buffer.ingest("ds", row(3), NOW.minusSeconds(10));

    buffer.setWatermark("ds", NOW.minusSeconds(20));
    assertEquals(1, buffer.rowCounts().get("ds"));

    // At or before the watermark is already in storage.
    buffer.ingest("ds", row(4), NOW.minusSeconds(20));
    HotBuffer.Result result = buffer.query("ds", NOW.minusSeconds(60), NOW, null);
    assertEquals(ImmutableList.of(3L), values(result));
    assertEquals(NOW.minusSeconds(20), result.getWatermark());
  }

  @Test void testRetentionEvictsOldRows() {
    HotBuffer buffer = enabled(HotBufferConfig.builder().retention(Duration.ofMinutes(5)));
    buffer.ingest("ds", row(1), NOW.minus(Duration.ofMinutes(10)));
    buffer.ingest("ds", row(2), NOW.minus(Duration.ofMinutes(1)));

    assertEquals(ImmutableList.of(2L),
        values(buffer.query("ds", NOW.minus(Duration.ofHours(1)), NOW, null)));
  }

  @Test void testPerDatasetCapKeepsNewestRows() {
    HotBuffer buffer = enabled(HotBufferConfig.builder().maxRowsPerDataset(2));
    buffer.ingest("ds", row(1), NOW.minusSeconds(30));
    buffer.ingest("ds", row(2), NOW.minusSeconds(20));
    buffer.ingest("ds", row(3), NOW.minusSeconds(10));
    buffer.ingest("other", row(9), NOW.minusSeconds(5));

    assertEquals(ImmutableList.of(2L, 3L),
        values(buffer.query("ds", NOW.minusSeconds(60), NOW, null)));
    assertEquals(ImmutableMap.of("ds", 2, "other", 1), buffer.rowCounts());
  }

  @Test void testGlobalCapEvictsOldestAcrossDatasets() {
    HotBuffer buffer = enabled(HotBufferConfig.builder().maxTotalRows(3));
    buffer.ingest("a", row(1), NOW.minusSeconds(40));
    buffer.ingest("b", row(2), NOW.minusSeconds(30));
    buffer.ingest("a", row(3), NOW.minusSeconds(20));
    buffer.ingest("b", row(4), NOW.minusSeconds(10));

    assertEquals(ImmutableList.of(3L), values(buffer.query("a", NOW.minusSeconds(60), NOW, null)));
    assertEquals(ImmutableList.of(2L, 4L),
        values(buffer.query("b", NOW.minusSeconds(60), NOW, null)));
  }

  @Test void testDisabledBufferIgnoresRows() {
    HotBuffer buffer = new HotBuffer(HotBufferConfig.defaults(), CLOCK);
    assertEquals(HotBuffer.State.DISABLED, buffer.getState());
    buffer.ingest("ds", row(1), NOW);

    HotBuffer.Result result = buffer.query("ds", NOW.minusSeconds(60), NOW, null);
    assertTrue(result.getRows().isEmpty());
    assertEquals(HotBuffer.State.DISABLED, result.getState());
    assertTrue(buffer.rowCounts().isEmpty());
  }

  @Test void testUnavailableBufferServesNothing() {
    HotBuffer buffer = enabled(HotBufferConfig.builder());
    buffer.ingest("ds", row(1), NOW.minusSeconds(10));
    buffer.markUnavailable("stream disconnected");

    HotBuffer.Result result = buffer.query("ds", NOW.minusSeconds(60), NOW, null);
    assertTrue(result.getRows().isEmpty());
    assertEquals(HotBuffer.State.UNAVAILABLE, result.getState());
    assertNull(result.getLatestTimestamp());

    buffer.markReady();
    assertEquals(ImmutableList.of(1L), values(buffer.query("ds", NOW.minusSeconds(60), NOW, null)));
  }

  @Test void testClear() {
    HotBuffer buffer = enabled(HotBufferConfig.builder());
    buffer.ingest("ds", row(1), NOW);
    buffer.clear();
    assertTrue(buffer.rowCounts().isEmpty());
    assertTrue(buffer.query("ds", NOW.minusSeconds(60), NOW, null).getRows().isEmpty());
  }

  @Test void testConfigDefaults() {
    HotBufferConfig config = HotBufferConfig.defaults();
    assertFalse(config.isEnabled());
    assertEquals(Duration.ofHours(2), config.getRetention());
    assertEquals(10_000, config.getMaxRowsPerDataset());
    assertEquals(0, config.getMaxTotalRows());
    assertEquals(HotBufferConfig.FallbackMode.PUBLISHED, config.getFallbackMode());
  }

  @Test void testConfigFromMap() {
    HotBufferConfig config = HotBufferConfig.fromMap(
        ImmutableMap.<String, Object>of("enabled", true, "retention", "15m",
            "maxRowsPerDataset", 50, "maxTotalRows", 200, "fallbackMode", "Error"));
    assertTrue(config.isEnabled());
    assertEquals(Duration.ofMinutes(15), config.getRetention());
    assertEquals(50, config.getMaxRowsPerDataset());
    assertEquals(200, config.getMaxTotalRows());
    assertEquals(HotBufferConfig.FallbackMode.ERROR, config.getFallbackMode());

    assertThrows(IllegalArgumentException.class,
        () -> HotBufferConfig.fromMap(ImmutableMap.<String, Object>of("fallbackMode", "never")));
    assertThrows(IllegalArgumentException.class,
        () -> HotBufferConfig.builder().maxRowsPerDataset(0).build());
  }
}
