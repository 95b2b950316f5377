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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * A typed column of a dataset view.
 */
public final class ColumnInfo {
  private final String name;
  private final ColumnType type;
  private final @Nullable Boolean nullable;
  private final @Nullable String description;

  public ColumnInfo(String name, ColumnType type, @Nullable Boolean nullable,
      @Nullable String description) {
    this.name = Objects.requireNonNull(name, "name");
    this.type = Objects.requireNonNull(type, "type");
    this.nullable = nullable;
    this.description = description;
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  public @Nullable Boolean getNullable() {
    return nullable;
  }

  public @Nullable String getDescription() {
    return description;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnInfo)) {
      return false;
    }
    ColumnInfo that = (ColumnInfo) o;
    return name.equals(that.name)
        && type == that.type
        && Objects.equals(nullable, that.nullable)
        && Objects.equals(description, that.description);
  }

  @Override public int hashCode() {
    return Objects.hash(name, type, nullable, description);
  }

  @Override public String toString() {
    return name + " " + type.getSqlType();
  }
}
