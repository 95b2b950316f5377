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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * One page of {@link MetadataStore#listDatasets}; a null cursor ends the
 * listing.
 */
public final class DatasetPage {
  private final List<DatasetRecord> datasets;
  private final @Nullable String nextCursor;

  public DatasetPage(List<DatasetRecord> datasets, @Nullable String nextCursor) {
    this.datasets = ImmutableList.copyOf(datasets);
    this.nextCursor = nextCursor;
  }

  public List<DatasetRecord> getDatasets() {
    return datasets;
  }

  public @Nullable String getNextCursor() {
    return nextCursor;
  }
}
