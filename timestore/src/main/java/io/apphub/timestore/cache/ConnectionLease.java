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

import io.apphub.timestore.execution.DatasetAttachment;
import io.apphub.timestore.execution.EngineConnection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A logical connection borrowed from the {@link ConnectionCache}.
 *
 * <p>Closing the lease closes the logical connection and returns the lease;
 * closing it again does nothing.
 */
public final class ConnectionLease implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionLease.class);

  private final ConnectionCache owner;
  private final CachedConnectionEntry entry;
  private final EngineConnection connection;
  private final AtomicBoolean released = new AtomicBoolean();

  ConnectionLease(ConnectionCache owner, CachedConnectionEntry entry,
      EngineConnection connection) {
    this.owner = owner;
    this.entry = entry;
    this.connection = connection;
  }

  public EngineConnection getConnection() {
    if (released.get()) {
      throw new IllegalStateException("Connection lease has already been released");
    }
    return connection;
  }

  /** Signature of the context the connection was prepared for. */
  public String getSignature() {
    return entry.getSignature();
  }

  /** Warnings raised while preparing the engine instance. */
  public List<String> getWarnings() {
    return entry.getCatalog().getWarnings();
  }

  /** Partitions of a dataset that are attached to the engine instance. */
  public List<DatasetAttachment> getAttachments(String datasetSlug) {
    return entry.getCatalog().getAttachments(datasetSlug);
  }

  @Override public void close() {
    if (!released.compareAndSet(false, true)) {
      return;
    }
    try {
      connection.close();
    } catch (SQLException e) {
      LOGGER.warn("Failed to close leased connection: {}", e.getMessage(), e);
    } finally {
      owner.release(entry);
    }
  }
}
