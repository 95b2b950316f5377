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
package io.apphub.timestore.execution;

import io.apphub.timestore.partition.PartitionExecutionContext;
import io.apphub.timestore.util.SqlIdentifiers;

import java.util.Objects;

/**
 * A partition file attached to an engine instance under its own alias.
 */
public final class DatasetAttachment {
  private final String datasetSlug;
  private final String alias;
  private final PartitionExecutionContext partition;

  public DatasetAttachment(String datasetSlug, String alias,
      PartitionExecutionContext partition) {
    this.datasetSlug = Objects.requireNonNull(datasetSlug, "datasetSlug");
    this.alias = Objects.requireNonNull(alias, "alias");
    this.partition = Objects.requireNonNull(partition, "partition");
  }

  public String getDatasetSlug() {
    return datasetSlug;
  }

  public String getAlias() {
    return alias;
  }

  public String getPartitionId() {
    return partition.getId();
  }

  public PartitionExecutionContext getPartition() {
    return partition;
  }

  /** Quoted {@code alias."table"} reference to the partition's table. */
  public String getQualifiedTableName() {
    return SqlIdentifiers.qualify(alias, partition.getTableName());
  }

  @Override public String toString() {
    return alias + "(" + partition.getId() + ")";
  }
}
