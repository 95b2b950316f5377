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
package io.apphub.timestore.context;

import io.apphub.timestore.TimestoreConfig;
import io.apphub.timestore.util.Warnings;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of every dataset queryable through SQL, ordered by slug, with
 * the warnings accumulated while building it.
 */
public final class SqlContext {
  private final TimestoreConfig config;
  private final List<DatasetContext> datasets;
  private final List<String> warnings;
  private final Instant builtAt;

  SqlContext(TimestoreConfig config, List<DatasetContext> datasets, List<String> warnings,
      Instant builtAt) {
    this.config = Objects.requireNonNull(config, "config");
    this.datasets = ImmutableList.copyOf(datasets);
    this.warnings = Warnings.dedupe(warnings);
    this.builtAt = Objects.requireNonNull(builtAt, "builtAt");
  }

  /**
   * Assembles a context from per-dataset states.
   *
   * <p>States are ordered by slug. A dataset whose view name is already
   * taken by an earlier dataset is left out with a warning.
   */
  public static SqlContext assemble(TimestoreConfig config,
      Collection<DatasetCacheState> states, Instant builtAt) {
    List<DatasetCacheState> ordered = new ArrayList<>(states);
    ordered.sort((a, b) -> a.getSlug().compareTo(b.getSlug()));

    List<DatasetContext> datasets = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    Map<String, String> viewOwners = new HashMap<>();
    for (DatasetCacheState state : ordered) {
      warnings.addAll(state.getWarnings());
      DatasetContext context = state.getContext();
      if (context == null) {
        continue;
      }
      String owner = viewOwners.putIfAbsent(context.getViewName(), context.getSlug());
      if (owner != null) {
        warnings.add("Dataset " + context.getSlug() + " maps to view "
            + DatasetContext.VIEW_SCHEMA + "." + context.getViewName()
            + " which is already used by dataset " + owner + "; skipping.");
        continue;
      }
      datasets.add(context);
    }
    return new SqlContext(config, datasets, warnings, builtAt);
  }

  public TimestoreConfig getConfig() {
    return config;
  }

  public List<DatasetContext> getDatasets() {
    return datasets;
  }

  public @Nullable DatasetContext getDataset(String slug) {
    for (DatasetContext dataset : datasets) {
      if (dataset.getSlug().equals(slug)) {
        return dataset;
      }
    }
    return null;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  public Instant getBuiltAt() {
    return builtAt;
  }

  @Override public String toString() {
    return "SqlContext{datasets=" + datasets.size() + ", warnings=" + warnings.size() + "}";
  }
}
