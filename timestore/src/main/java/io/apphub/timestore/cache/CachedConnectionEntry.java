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

import io.apphub.timestore.execution.EngineInstance;
import io.apphub.timestore.execution.RuntimeCatalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One prepared engine instance shared by every lease of a context
 * signature.
 *
 * <p>The instance is closed at most once, and only after the entry has been
 * disposed and its last lease returned. A disposed entry issues no new
 * leases.
 */
final class CachedConnectionEntry {
  private static final Logger LOGGER = LoggerFactory.getLogger(CachedConnectionEntry.class);

  private final String signature;
  private final EngineInstance instance;
  private final RuntimeCatalog catalog;
  private Instant expiresAt;
  private int activeLeases;
  private boolean disposed;
  private boolean closed;

  CachedConnectionEntry(String signature, EngineInstance instance, RuntimeCatalog catalog,
      Instant expiresAt) {
    this.signature = Objects.requireNonNull(signature, "signature");
    this.instance = Objects.requireNonNull(instance, "instance");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
  }

  String getSignature() {
    return signature;
  }

  EngineInstance getInstance() {
    return instance;
  }

  RuntimeCatalog getCatalog() {
    return catalog;
  }

  /**
   * Takes a lease and extends the expiry.
   *
   * @return false if the entry has been disposed
   */
  synchronized boolean tryAcquire(Instant now, Duration ttl) {
    if (disposed) {
      return false;
    }
    activeLeases++;
    Instant extended = now.plus(ttl);
    if (extended.isAfter(expiresAt)) {
      expiresAt = extended;
    }
    return true;
  }

  /**
   * Returns a lease.
   *
   * @return true if the caller must now close the entry
   */
  synchronized boolean release() {
    if (activeLeases > 0) {
      activeLeases--;
    }
    return disposed && activeLeases == 0;
  }

  /**
   * Stops the entry from issuing leases.
   *
   * @return true if the caller must now close the entry
   */
  synchronized boolean markDisposed() {
    disposed = true;
    return activeLeases == 0;
  }

  synchronized boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  synchronized int getActiveLeases() {
    return activeLeases;
  }

  synchronized boolean isDisposed() {
    return disposed;
  }

  synchronized Instant getExpiresAt() {
    return expiresAt;
  }

  /** Closes the engine instance unless it has been closed already. */
  void closeOnce() {
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
    }
    try {
      instance.close();
      LOGGER.info("Closed execution engine for context {}", shortSignature(signature));
    } catch (SQLException e) {
      LOGGER.warn("Failed to close execution engine for context {}: {}",
          shortSignature(signature), e.getMessage(), e);
    }
  }

  static String shortSignature(String signature) {
    return signature.length() > 12 ? signature.substring(0, 12) : signature;
  }
}
