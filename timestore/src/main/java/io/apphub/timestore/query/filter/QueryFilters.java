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

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Filters of a query: predicates on partition keys, which only prune
 * partitions, and predicates on columns, which prune partitions by their
 * statistics and filter rows.
 */
public final class QueryFilters {
  private static final QueryFilters NONE = builder().build();

  private final Map<String, FilterPredicate> partitionKeys;
  private final Map<String, FilterPredicate> columns;

  private QueryFilters(Builder builder) {
    this.partitionKeys = ImmutableMap.copyOf(builder.partitionKeys);
    this.columns = ImmutableMap.copyOf(builder.columns);
  }

  public static QueryFilters none() {
    return NONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<String, FilterPredicate> getPartitionKeys() {
    return partitionKeys;
  }

  public Map<String, FilterPredicate> getColumns() {
    return columns;
  }

  public boolean isEmpty() {
    return partitionKeys.isEmpty() && columns.isEmpty();
  }

  @Override public String toString() {
    return "QueryFilters{partitionKeys=" + partitionKeys + ", columns=" + columns + "}";
  }

  /**
   * Builder for {@link QueryFilters}.
   */
  public static final class Builder {
    private final Map<String, FilterPredicate> partitionKeys = new LinkedHashMap<>();
    private final Map<String, FilterPredicate> columns = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder partitionKey(String key, FilterPredicate predicate) {
      partitionKeys.put(Objects.requireNonNull(key, "key"),
          Objects.requireNonNull(predicate, "predicate"));
      return this;
    }

    public Builder column(String column, FilterPredicate predicate) {
      columns.put(Objects.requireNonNull(column, "column"),
          Objects.requireNonNull(predicate, "predicate"));
      return this;
    }

    public QueryFilters build() {
      return new QueryFilters(this);
    }
  }
}
