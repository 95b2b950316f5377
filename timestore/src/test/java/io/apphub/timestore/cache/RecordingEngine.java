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
package io.apphub.timestore.cache;

import io.apphub.timestore.execution.EngineConnection;
import io.apphub.timestore.execution.EngineInstance;
import io.apphub.timestore.execution.EngineResult;
import io.apphub.timestore.execution.ExecutionEngine;

import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Execution engine that accepts every statement and records what happens
 * to its instances.
 */
class RecordingEngine implements ExecutionEngine {
  final List<RecordingInstance> instances = new CopyOnWriteArrayList<>();
  final List<String> statements = new CopyOnWriteArrayList<>();
  volatile String failOn;

  @Override public String getEngineType() {
    return "duckdb";
  }

  @Override public EngineInstance open() {
    RecordingInstance instance = new RecordingInstance();
    instances.add(instance);
    return instance;
  }

  int openCount() {
    return instances.size();
  }

  int closedCount() {
    int closed = 0;
    for (RecordingInstance instance : instances) {
      if (instance.closes.get() > 0) {
        closed++;
      }
    }
    return closed;
  }

  /** Instance counting closes and connections. */
  class RecordingInstance implements EngineInstance {
    final AtomicInteger closes = new AtomicInteger();
    final AtomicInteger connections = new AtomicInteger();

    @Override public EngineConnection connect() throws SQLException {
      if (closes.get() > 0) {
        throw new SQLException("instance closed");
      }
      connections.incrementAndGet();
      return new EngineConnection() {
        @Override public void run(String sql, Object... params) throws SQLException {
          String failure = failOn;
          if (failure != null && sql.contains(failure)) {
            throw new SQLException("rejected: " + failure);
          }
          statements.add(sql);
        }

        @Override public EngineResult query(String sql, long timeoutMillis) {
          return EngineResult.empty();
        }

        @Override public void close() {
        }
      };
    }

    @Override public void close() {
      closes.incrementAndGet();
    }
  }
}
