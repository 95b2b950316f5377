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
package io.apphub.timestore.util;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for SqlIdentifiers.
 */
@Tag("unit")
public class SqlIdentifiersTest {

  @Test void testQuote() {
    assertEquals("\"timestamp\"", SqlIdentifiers.quote("timestamp"));
    assertEquals("\"a\"\"b\"", SqlIdentifiers.quote("a\"b"));
    assertEquals("\"timestore\".\"readings\"",
        SqlIdentifiers.qualify("timestore", "readings"));
  }

  @Test void testLiterals() {
    assertEquals("'it''s'", SqlIdentifiers.literal("it's"));
    assertEquals("NULL", SqlIdentifiers.literal(null));
    assertEquals("TIMESTAMP '2024-01-02 03:04:05.000000'",
        SqlIdentifiers.timestampLiteral(Instant.parse("2024-01-02T03:04:05Z")));
  }

  @Test void testSanitize() {
    assertEquals("observatory_readings",
        SqlIdentifiers.sanitize("Observatory-Readings", "dataset"));
    assertEquals("_2024_data", SqlIdentifiers.sanitize("2024 data", "dataset"));
    assertEquals("a_b", SqlIdentifiers.sanitize("__a--b__", "dataset"));
    assertEquals("dataset", SqlIdentifiers.sanitize("---", "dataset"));
  }
}
