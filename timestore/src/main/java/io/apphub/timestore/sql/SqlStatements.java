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

import java.util.Locale;

/**
 * Checks that SQL text is a single read-only query.
 *
 * <p>Comments are stripped and a trailing semicolon is dropped. Quoted
 * strings and identifiers are skipped while scanning, so semicolons and
 * comment markers inside them do not count.
 */
public final class SqlStatements {

  private SqlStatements() {
    // Utility class should not be instantiated
  }

  /**
   * Validates and normalizes a statement.
   *
   * @param sql Raw text
   * @param maxLength Maximum accepted length of the raw text
   * @return The statement without comments or a trailing semicolon
   * @throws StatementRejectedException if the text is empty, too long, holds
   *     more than one statement or is not a SELECT or WITH query
   */
  public static String normalize(String sql, int maxLength) {
    if (sql == null || sql.trim().isEmpty()) {
      throw new StatementRejectedException("SQL statement is empty");
    }
    if (sql.length() > maxLength) {
      throw new StatementRejectedException(
          "SQL statement exceeds maximum length of " + maxLength + " characters");
    }
    String statement = stripComments(sql).trim();
    while (statement.endsWith(";")) {
      statement = statement.substring(0, statement.length() - 1).trim();
    }
    if (statement.isEmpty()) {
      throw new StatementRejectedException("SQL statement is empty");
    }
    if (containsUnquoted(statement, ';')) {
      throw new StatementRejectedException("Only a single SQL statement is allowed");
    }
    String keyword = firstKeyword(statement);
    if (!"select".equals(keyword) && !"with".equals(keyword)) {
      throw new StatementRejectedException("Only SELECT queries are allowed");
    }
    return statement;
  }

  /** Removes {@code --} line comments and block comments outside quotes. */
  static String stripComments(String sql) {
    StringBuilder out = new StringBuilder(sql.length());
    int i = 0;
    int n = sql.length();
    while (i < n) {
      char c = sql.charAt(i);
      if (c == '\'' || c == '"') {
        int end = skipQuoted(sql, i);
        out.append(sql, i, end);
        i = end;
      } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
        while (i < n && sql.charAt(i) != '\n') {
          i++;
        }
      } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
        int end = sql.indexOf("*/", i + 2);
        i = end < 0 ? n : end + 2;
        out.append(' ');
      } else {
        out.append(c);
        i++;
      }
    }
    return out.toString();
  }

  static boolean containsUnquoted(String sql, char target) {
    int i = 0;
    while (i < sql.length()) {
      char c = sql.charAt(i);
      if (c == '\'' || c == '"') {
        i = skipQuoted(sql, i);
      } else if (c == target) {
        return true;
      } else {
        i++;
      }
    }
    return false;
  }

  /** Index just past the quoted run starting at {@code start}. */
  private static int skipQuoted(String sql, int start) {
    char quote = sql.charAt(start);
    int i = start + 1;
    while (i < sql.length()) {
      if (sql.charAt(i) == quote) {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return sql.length();
  }

  private static String firstKeyword(String statement) {
    int start = 0;
    while (start < statement.length()
        && (statement.charAt(start) == '(' || Character.isWhitespace(statement.charAt(start)))) {
      start++;
    }
    int end = start;
    while (end < statement.length() && Character.isLetter(statement.charAt(end))) {
      end++;
    }
    return statement.substring(start, end).toLowerCase(Locale.ROOT);
  }
}
