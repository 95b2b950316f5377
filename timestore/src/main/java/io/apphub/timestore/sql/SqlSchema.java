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

import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.List;

/**
 * Tables visible to SQL callers, with the warnings of the context they
 * were read from.
 */
public final class SqlSchema {
  private final List<SqlSchemaTable> tables;
  private final List<String> warnings;
  private final Instant builtAt;

  public SqlSchema(List<SqlSchemaTable> tables, List<String> warnings, Instant builtAt) {
    this.tables = ImmutableList.copyOf(tables);
    this.warnings = ImmutableList.copyOf(warnings);
    this.builtAt = builtAt;
  }

  public List<SqlSchemaTable> getTables() {
    return tables;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  public Instant getBuiltAt() {
    return builtAt;
  }
}
