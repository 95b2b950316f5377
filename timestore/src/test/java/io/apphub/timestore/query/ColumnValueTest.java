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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for ColumnValue.
 */
@Tag("unit")
public class ColumnValueTest {

  @Test void testFromJdbcValues() {
    Instant instant = Instant.parse("2024-01-01T00:30:00Z");
    assertEquals(ColumnValue.of(instant),
        ColumnValue.from(Timestamp.valueOf(LocalDateTime.of(2024, 1, 1, 0, 30))));
    assertEquals(ColumnValue.of(instant), ColumnValue.from(LocalDateTime.of(2024, 1, 1, 0, 30)));
    assertEquals(ColumnValue.Kind.NUMBER, ColumnValue.from(42).getKind());
    assertEquals(ColumnValue.Kind.BOOLEAN, ColumnValue.from(Boolean.TRUE).getKind());
    assertTrue(ColumnValue.from(null).isNull());
    assertTrue(ColumnValue.from(Double.NaN).isNull());
  }

  @Test void testLargeIntegersBecomeStrings() {
    assertEquals(ColumnValue.Kind.STRING, ColumnValue.of(Long.MAX_VALUE).getKind());
    assertEquals(ColumnValue.Kind.STRING,
        ColumnValue.of(BigInteger.ONE.shiftLeft(70)).getKind());
    assertEquals(ColumnValue.Kind.NUMBER, ColumnValue.of((1L << 53) - 1).getKind());
  }

  @Test void testNumbersCompareByValue() {
    assertEquals(ColumnValue.of(22L), ColumnValue.of(22.0));
    assertEquals(ColumnValue.of(22L).hashCode(),
        ColumnValue.of(new BigDecimal("22.00")).hashCode());
    assertEquals("22.50", ColumnValue.of(new BigDecimal("22.50")).asString());
  }

  @Test void testOrderPutsNullsFirst() {
    List<ColumnValue> values = new ArrayList<>(ImmutableList.of(
        ColumnValue.of(3L), ColumnValue.ofNull(), ColumnValue.of(1L)));
    values.sort(ColumnValue.ORDER);
    assertEquals(ImmutableList.of(ColumnValue.ofNull(), ColumnValue.of(1L), ColumnValue.of(3L)),
        values);
  }

  @Test void testJsonScalars() throws Exception {
    ObjectMapper mapper = new ObjectMapper();
    List<ColumnValue> row = ImmutableList.of(
        ColumnValue.of(Instant.parse("2024-01-01T00:00:00Z")), ColumnValue.of(1.5),
        ColumnValue.of("north"), ColumnValue.ofNull(), ColumnValue.of(true));
    assertEquals("[\"2024-01-01T00:00:00Z\",1.5,\"north\",null,true]",
        mapper.writeValueAsString(row));
    assertNull(ColumnValue.ofNull().asString());
  }
}
