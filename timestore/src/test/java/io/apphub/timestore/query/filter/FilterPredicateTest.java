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
package io.apphub.timestore.query.filter;

import io.apphub.timestore.query.ColumnValue;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the filter predicates and QueryFilters.
 */
@Tag("unit")
public class FilterPredicateTest {
  private static final Instant NOON = Instant.parse("2024-01-01T12:00:00Z");

  @Test void testStringPredicate() {
    StringPredicate in = StringPredicate.in("north", "south");
    assertTrue(in.matches(ColumnValue.of("north")));
    assertFalse(in.matches(ColumnValue.of("east")));
    assertFalse(in.matches(ColumnValue.ofNull()));
    assertEquals("\"site\" IN ('north', 'south')", in.toSql("\"site\""));

    StringPredicate range = StringPredicate.builder().gte("b").lt("d").build();
    assertTrue(range.matches(ColumnValue.of("c")));
    assertFalse(range.matches(ColumnValue.of("d")));
    assertEquals("(\"site\" >= 'b' AND \"site\" < 'd')", range.toSql("\"site\""));
    assertEquals("\"site\" = 'o''hare'", StringPredicate.eq("o'hare").toSql("\"site\""));
  }

  @Test void testNumberPredicate() {
    NumberPredicate between = NumberPredicate.between(10, 20);
    assertTrue(between.matches(ColumnValue.of(10L)));
    assertTrue(between.matches(ColumnValue.of("15.5")));
    assertFalse(between.matches(ColumnValue.of(20.0)));
    assertFalse(between.matches(ColumnValue.of("warm")));
    assertEquals("(\"temp\" >= 10.0 AND \"temp\" < 20.0)", between.toSql("\"temp\""));

    assertTrue(between.mayMatchRange(ColumnValue.of(15L), ColumnValue.of(30L)));
    assertFalse(between.mayMatchRange(ColumnValue.of(20L), ColumnValue.of(30L)));
    assertFalse(NumberPredicate.eq(5).mayMatchRange(ColumnValue.of(6L), ColumnValue.of(9L)));
    assertTrue(NumberPredicate.eq(5).mayMatchRange(ColumnValue.ofNull(), ColumnValue.of(1L)));
  }

  @Test void testTimestampPredicate() {
    TimestampPredicate after = TimestampPredicate.builder().gt(NOON).build();
    assertTrue(after.matches(ColumnValue.of(NOON.plusSeconds(1))));
    assertTrue(after.matches(ColumnValue.of("2024-01-02T00:00:00Z")));
    assertTrue(after.matches(ColumnValue.of(NOON.plusSeconds(60).toEpochMilli())));
    assertFalse(after.matches(ColumnValue.of(NOON)));
    assertEquals("\"ts\" > TIMESTAMP '2024-01-01 12:00:00.000000'", after.toSql("\"ts\""));
  }

  @Test void testBooleanPredicate() {
    BooleanPredicate flag = BooleanPredicate.eq(true);
    assertTrue(flag.matches(ColumnValue.of(true)));
    assertTrue(flag.matches(ColumnValue.of("yes")));
    assertTrue(flag.matches(ColumnValue.of(2L)));
    assertFalse(flag.matches(ColumnValue.of("n")));
    assertFalse(flag.matches(ColumnValue.of("maybe")));
    assertNull(BooleanPredicate.parse("maybe"));
    assertEquals("\"active\" = TRUE", flag.toSql("\"active\""));
  }

  @Test void testEmptyPredicateRejected() {
    assertThrows(IllegalArgumentException.class, () -> NumberPredicate.builder().build());
  }

  @Test void testQueryFilters() {
    QueryFilters filters = QueryFilters.builder()
        .partitionKey("site", StringPredicate.eq("north"))
        .column("temperature_c", NumberPredicate.builder().gt(0.0).build())
        .build();
    assertFalse(filters.isEmpty());
    assertEquals(ImmutableList.of("site"),
        ImmutableList.copyOf(filters.getPartitionKeys().keySet()));
    assertEquals(1, filters.getColumns().size());
    assertTrue(QueryFilters.none().isEmpty());
  }
}
