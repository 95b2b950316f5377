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
package io.apphub.timestore.storage;

import io.apphub.timestore.metadata.StorageTargetKind;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Remote location a DuckDB connection must be configured for before it can
 * attach partitions there.
 *
 * <p>The identity (kind, bucket or container, endpoint) decides whether two
 * storage targets share one configuration; the credential secret is scoped
 * to {@link #getScope()} only.
 */
public final class RemoteBackend {
  private final StorageTargetKind kind;
  private final String identity;
  private final String scope;
  private final List<String> extensions;
  private final @Nullable String secretDefinition;

  RemoteBackend(StorageTargetKind kind, String identity, String scope,
      List<String> extensions, @Nullable String secretDefinition) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.identity = Objects.requireNonNull(identity, "identity");
    this.scope = Objects.requireNonNull(scope, "scope");
    this.extensions = ImmutableList.copyOf(extensions);
    this.secretDefinition = secretDefinition;
  }

  public StorageTargetKind getKind() {
    return kind;
  }

  public String getIdentity() {
    return identity;
  }

  /** Location prefix the credential secret is bound to. */
  public String getScope() {
    return scope;
  }

  public List<String> getExtensions() {
    return extensions;
  }

  /** Name of the DuckDB secret, stable for a given identity. */
  public String getSecretName() {
    return "timestore_" + kind.getValue() + "_"
        + Hashing.sha256().hashString(identity, StandardCharsets.UTF_8).toString()
            .substring(0, 16);
  }

  /**
   * Statements that configure a connection for this backend: extension
   * install/load, then the scoped secret if credentials are known.
   */
  public List<String> getSetupStatements() {
    ImmutableList.Builder<String> statements = ImmutableList.builder();
    for (String extension : extensions) {
      statements.add("INSTALL " + extension);
      statements.add("LOAD " + extension);
    }
    if (secretDefinition != null) {
      statements.add("CREATE OR REPLACE SECRET " + getSecretName() + " ("
          + secretDefinition + ")");
    }
    return statements.build();
  }

  public boolean hasCredentials() {
    return secretDefinition != null;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RemoteBackend)) {
      return false;
    }
    return identity.equals(((RemoteBackend) o).identity);
  }

  @Override public int hashCode() {
    return identity.hashCode();
  }

  @Override public String toString() {
    return "RemoteBackend{" + identity + "}";
  }
}
