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

import io.apphub.timestore.query.ColumnValue;

/**
 * A condition on a single value.
 */
public interface FilterPredicate {

  /**
   * Tests a concrete value. Values that cannot be read as the predicate's
   * type never match.
   */
  boolean matches(ColumnValue value);

  /**
   * Tests whether some value in {@code [min, max]} could match, for pruning
   * partitions by column statistics. Unreadable bounds never prune.
   */
  boolean mayMatchRange(ColumnValue min, ColumnValue max);

  /**
   * Renders the condition as SQL.
   *
   * @param quotedColumn Already-quoted column reference
   * @return Boolean SQL expression
   */
  String toSql(String quotedColumn);
}
