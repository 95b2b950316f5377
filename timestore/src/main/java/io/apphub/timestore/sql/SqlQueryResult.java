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

import io.apphub.timestore.query.ColumnValue;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Map;

/**
 * Rows of an ad-hoc SQL query.
 */
public final class SqlQueryResult {
  private final List<Column> columns;
  private final List<Map<String, ColumnValue>> rows;
  private final List<String> warnings;

  public SqlQueryResult(List<Column> columns, List<Map<String, ColumnValue>> rows,
      List<String> warnings) {
    this.columns = ImmutableList.copyOf(columns);
    this.rows = ImmutableList.copyOf(rows);
    this.warnings = ImmutableList.copyOf(warnings);
  }

  public List<Column> getColumns() {
    return columns;
  }

  public List<Map<String, ColumnValue>> getRows() {
    return rows;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  /** Name and engine type of a result column. */
  public static final class Column {
    private final String name;
    private final String type;

    public Column(String name, String type) {
      this.name = name;
      this.type = type;
    }

    public String getName() {
      return name;
    }

    public String getType() {
      return type;
    }

    @Override public String toString() {
      return name + " " + type;
    }
  }
}
