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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * What was installed into an engine instance when its connection-cache
 * entry was built: the attached partitions per dataset, and the warnings
 * for what could not be attached.
 */
public final class RuntimeCatalog {
  private final Map<String, List<DatasetAttachment>> attachments;
  private final List<String> warnings;

  public RuntimeCatalog(Map<String, List<DatasetAttachment>> attachments,
      List<String> warnings) {
    ImmutableMap.Builder<String, List<DatasetAttachment>> copy = ImmutableMap.builder();
    for (Map.Entry<String, List<DatasetAttachment>> entry : attachments.entrySet()) {
      copy.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
    }
    this.attachments = copy.build();
    this.warnings = ImmutableList.copyOf(warnings);
  }

  public static RuntimeCatalog empty() {
    return new RuntimeCatalog(ImmutableMap.<String, List<DatasetAttachment>>of(),
        ImmutableList.<String>of());
  }

  /** Attached partitions of a dataset, keyed by slug; empty if none. */
  public List<DatasetAttachment> getAttachments(String datasetSlug) {
    List<DatasetAttachment> result = attachments.get(datasetSlug);
    return result == null ? ImmutableList.<DatasetAttachment>of() : result;
  }

  public Map<String, List<DatasetAttachment>> getAttachments() {
    return attachments;
  }

  public List<String> getWarnings() {
    return warnings;
  }
}
