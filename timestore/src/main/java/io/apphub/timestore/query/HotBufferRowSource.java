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
package io.apphub.timestore.query;

import io.apphub.timestore.streaming.HotBuffer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Adapts {@link HotBuffer} to the shape of a query: rows are projected to
 * the requested columns plus the timestamp column.
 */
public class HotBufferRowSource {
  private final HotBuffer hotBuffer;

  public HotBufferRowSource(HotBuffer hotBuffer) {
    this.hotBuffer = Objects.requireNonNull(hotBuffer, "hotBuffer");
  }

  public HotBuffer getHotBuffer() {
    return hotBuffer;
  }

  public boolean isEnabled() {
    return hotBuffer.getConfig().isEnabled();
  }

  /**
   * Fetches buffered rows of the request's dataset and range.
   *
   * @return The buffer's result, with rows projected
   */
  public HotBuffer.Result fetch(RowSourceRequest request) {
    HotBuffer.Result result = hotBuffer.query(request.getDatasetSlug(),
        request.getRangeStart(), request.getRangeEnd(), request.getLimit());
    if (request.getColumns().isEmpty() || result.getRows().isEmpty()) {
      return result;
    }
    List<Map<String, ColumnValue>> projected = new ArrayList<>(result.getRows().size());
    for (Map<String, ColumnValue> row : result.getRows()) {
      Map<String, ColumnValue> copy = new LinkedHashMap<>();
      ColumnValue ts = row.get(request.getTimestampColumn());
      if (ts != null) {
        copy.put(request.getTimestampColumn(), ts);
      }
      for (String column : request.getColumns()) {
        ColumnValue value = row.get(column);
        copy.put(column, value == null ? ColumnValue.ofNull() : value);
      }
      projected.add(copy);
    }
    return result.withRows(projected);
  }
}
