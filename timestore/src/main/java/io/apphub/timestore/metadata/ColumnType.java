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
package io.apphub.timestore.metadata;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;
import java.util.Map;

/**
 * Closed set of column types exposed through dataset views.
 *
 * <p>Schema payloads use loose type names ("float", "int", "bool"); they are
 * normalized here. Anything unrecognized is a {@link #VARCHAR}.
 */
public enum ColumnType {
  TIMESTAMP("TIMESTAMP"),
  DOUBLE("DOUBLE"),
  BIGINT("BIGINT"),
  BOOLEAN("BOOLEAN"),
  VARCHAR("VARCHAR");

  private static final Map<String, ColumnType> MAP;

  static {
    ImmutableMap.Builder<String, ColumnType> builder = ImmutableMap.builder();
    builder.put("timestamp", TIMESTAMP);
    builder.put("timestamptz", TIMESTAMP);
    builder.put("datetime", TIMESTAMP);
    builder.put("double", DOUBLE);
    builder.put("float", DOUBLE);
    builder.put("real", DOUBLE);
    builder.put("number", DOUBLE);
    builder.put("integer", BIGINT);
    builder.put("int", BIGINT);
    builder.put("bigint", BIGINT);
    builder.put("long", BIGINT);
    builder.put("boolean", BOOLEAN);
    builder.put("bool", BOOLEAN);
    builder.put("string", VARCHAR);
    builder.put("varchar", VARCHAR);
    builder.put("text", VARCHAR);
    MAP = builder.build();
  }

  private final String sqlType;

  ColumnType(String sqlType) {
    this.sqlType = sqlType;
  }

  /** DuckDB type name used in casts and in {@code timestore_runtime.columns}. */
  public String getSqlType() {
    return sqlType;
  }

  public static ColumnType of(@Nullable String typeString) {
    if (typeString == null) {
      return VARCHAR;
    }
    ColumnType type = MAP.get(typeString.trim().toLowerCase(Locale.ROOT));
    return type != null ? type : VARCHAR;
  }
}
