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
package io.apphub.timestore.execution;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Materialized query result: column descriptors and raw JDBC values.
 */
public final class EngineResult {
  private final List<Column> columns;
  private final List<List<Object>> rows;

  public EngineResult(List<Column> columns, List<List<Object>> rows) {
    this.columns = ImmutableList.copyOf(columns);
    List<List<Object>> copy = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      // rows may contain SQL NULLs, which ImmutableList rejects
      copy.add(Collections.unmodifiableList(new ArrayList<Object>(row)));
    }
    this.rows = Collections.unmodifiableList(copy);
  }

  public static EngineResult empty() {
    return new EngineResult(ImmutableList.<Column>of(), ImmutableList.<List<Object>>of());
  }

  public List<Column> getColumns() {
    return columns;
  }

  public List<List<Object>> getRows() {
    return rows;
  }

  public List<String> getColumnNames() {
    List<String> names = new ArrayList<>(columns.size());
    for (Column column : columns) {
      names.add(column.getName());
    }
    return names;
  }

  /**
   * A result column: its label and the engine's type name.
   */
  public static final class Column {
    private final String name;
    private final String typeName;

    public Column(String name, String typeName) {
      this.name = Objects.requireNonNull(name, "name");
      this.typeName = Objects.requireNonNull(typeName, "typeName");
    }

    public String getName() {
      return name;
    }

    public String getTypeName() {
      return typeName;
    }
  }
}
