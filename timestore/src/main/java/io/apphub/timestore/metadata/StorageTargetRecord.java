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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named backend partitions live on, with kind-specific settings
 * ({@code root}, {@code bucket}, {@code container}, credentials).
 */
public final class StorageTargetRecord {
  private final String id;
  private final String name;
  private final StorageTargetKind kind;
  private final Map<String, Object> config;

  public StorageTargetRecord(String id, String name, StorageTargetKind kind,
      Map<String, ?> config) {
    this.id = Objects.requireNonNull(id, "id");
    this.name = Objects.requireNonNull(name, "name");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.config = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(config));
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public StorageTargetKind getKind() {
    return kind;
  }

  public Map<String, Object> getConfig() {
    return config;
  }

  @Override public String toString() {
    // config can hold credentials
    return "StorageTarget{id=" + id + ", name=" + name + ", kind=" + kind.getValue() + "}";
  }
}
