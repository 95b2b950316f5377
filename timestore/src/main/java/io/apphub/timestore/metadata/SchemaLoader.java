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

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads the registered column schema of a dataset's published manifest.
 *
 * <p>A dataset without a usable schema still gets a view; it just has no
 * typed columns, and a warning says why.
 */
public class SchemaLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(SchemaLoader.class);

  private final MetadataStore metadataStore;

  public SchemaLoader(MetadataStore metadataStore) {
    this.metadataStore = Objects.requireNonNull(metadataStore, "metadataStore");
  }

  /**
   * Loads the columns of a dataset.
   *
   * @param dataset Dataset being built
   * @param manifest Manifest whose schema version applies, or null
   * @return Columns in schema order, plus warnings for degraded schemas
   * @throws MetadataStoreException if the catalog cannot be read
   */
  public Result loadColumns(DatasetRecord dataset, @Nullable ManifestRecord manifest) {
    List<String> warnings = new ArrayList<>();
    if (manifest == null || manifest.getSchemaVersionId() == null) {
      warnings.add("Dataset " + dataset.getSlug()
          + " has no published schema; autocomplete disabled.");
      return new Result(ImmutableList.<ColumnInfo>of(), warnings);
    }

    SchemaVersionRecord schemaVersion =
        metadataStore.getSchemaVersionById(manifest.getSchemaVersionId());
    if (schemaVersion == null) {
      warnings.add("Schema version " + manifest.getSchemaVersionId() + " for dataset "
          + dataset.getSlug() + " is unavailable.");
      return new Result(ImmutableList.<ColumnInfo>of(), warnings);
    }

    JsonNode fields = schemaVersion.getSchema().get("fields");
    if (fields == null || !fields.isArray()) {
      warnings.add("Schema for dataset " + dataset.getSlug() + " is malformed; fields missing.");
      return new Result(ImmutableList.<ColumnInfo>of(), warnings);
    }

    ImmutableList.Builder<ColumnInfo> columns = ImmutableList.builder();
    for (JsonNode field : fields) {
      String name = field.path("name").asText("").trim();
      if (name.isEmpty()) {
        warnings.add("Schema for dataset " + dataset.getSlug()
            + " contains a field without a name; skipping it.");
        continue;
      }
      JsonNode nullable = field.get("nullable");
      JsonNode description = field.get("description");
      columns.add(
          new ColumnInfo(name,
              ColumnType.of(field.path("type").asText(null)),
              nullable != null && nullable.isBoolean() ? nullable.asBoolean() : null,
              description != null && description.isTextual() ? description.asText() : null));
    }
    List<ColumnInfo> result = columns.build();
    LOGGER.debug("Loaded {} columns for dataset {} from schema version {}",
        result.size(), dataset.getSlug(), schemaVersion.getId());
    return new Result(result, warnings);
  }

  /**
   * Columns and warnings produced by {@link #loadColumns}.
   */
  public static final class Result {
    private final List<ColumnInfo> columns;
    private final List<String> warnings;

    Result(List<ColumnInfo> columns, List<String> warnings) {
      this.columns = ImmutableList.copyOf(columns);
      this.warnings = ImmutableList.copyOf(warnings);
    }

    public List<ColumnInfo> getColumns() {
      return columns;
    }

    public List<String> getWarnings() {
      return warnings;
    }
  }
}
