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

import java.util.Objects;

/**
 * A registered schema version. The payload is the JSON document the
 * ingestion path stored, normally {@code {"fields": [{"name", "type"}]}}.
 */
public final class SchemaVersionRecord {
  private final String id;
  private final String datasetId;
  private final int version;
  private final JsonNode schema;

  public SchemaVersionRecord(String id, String datasetId, int version, JsonNode schema) {
    this.id = Objects.requireNonNull(id, "id");
    this.datasetId = Objects.requireNonNull(datasetId, "datasetId");
    this.version = version;
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  public String getId() {
    return id;
  }

  public String getDatasetId() {
    return datasetId;
  }

  public int getVersion() {
    return version;
  }

  public JsonNode getSchema() {
    return schema;
  }
}
