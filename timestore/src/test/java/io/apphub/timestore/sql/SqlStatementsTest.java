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
package io.apphub.timestore.sql;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for SqlStatements.
 */
@Tag("unit")
public class SqlStatementsTest {

  private static String rejection(String sql) {
    return assertThrows(StatementRejectedException.class,
        () -> SqlStatements.normalize(sql, 200)).getMessage();
  }

  @Test void testAcceptsQueries() {
    assertEquals("SELECT 1", SqlStatements.normalize("SELECT 1;", 200));
    assertEquals("select * from timestore.observatory",
        SqlStatements.normalize("-- latest\nselect * from timestore.observatory ; ;", 200));
    assertEquals("WITH x AS (SELECT 1) SELECT * FROM x",
        SqlStatements.normalize("WITH x AS (SELECT 1) SELECT * FROM x", 200));
    assertEquals("( SELECT 1) UNION (SELECT 2)",
        SqlStatements.normalize("( SELECT 1) UNION (SELECT 2)", 200));
    assertEquals("SELECT 'a;b' AS \"x--y\"",
        SqlStatements.normalize("SELECT 'a;b' AS \"x--y\"", 200));
  }

  @Test void testRejectsStatements() {
    assertEquals("SQL statement is empty", rejection("   "));
    assertEquals("SQL statement is empty", rejection("-- nothing\n;"));
    assertEquals("SQL statement exceeds maximum length of 200 characters",
        rejection("SELECT " + new String(new char[200]).replace('\0', '1')));
    assertEquals("Only a single SQL statement is allowed",
        rejection("SELECT 1; DROP TABLE t"));
    assertEquals("Only SELECT queries are allowed",
        rejection("DELETE FROM timestore.observatory"));
    assertEquals("Only SELECT queries are allowed",
        rejection("/* select */ INSERT INTO t VALUES (1)"));
  }

  @Test void testQuoteAwareScanning() {
    assertEquals("SELECT ' -- kept' ", SqlStatements.stripComments("SELECT ' -- kept' -- gone"));
    assertEquals("SELECT   1", SqlStatements.stripComments("SELECT /* c */ 1"));
    assertFalse(SqlStatements.containsUnquoted("SELECT 'it''s;'", ';'));
    assertTrue(SqlStatements.containsUnquoted("SELECT 1; SELECT 2", ';'));
  }
}
