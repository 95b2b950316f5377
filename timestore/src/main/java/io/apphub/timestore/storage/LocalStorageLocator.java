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

import io.apphub.timestore.metadata.PartitionRecord;
import io.apphub.timestore.metadata.StorageTargetKind;
import io.apphub.timestore.metadata.StorageTargetRecord;
import io.apphub.timestore.util.ConfigValues;

import java.nio.file.Paths;

/**
 * Partitions on the local filesystem, below the target's {@code root}.
 */
public class LocalStorageLocator implements StorageLocator {
  private final StorageDefaults defaults;

  public LocalStorageLocator(StorageDefaults defaults) {
    this.defaults = defaults;
  }

  @Override public StorageTargetKind getKind() {
    return StorageTargetKind.LOCAL;
  }

  @Override public String resolveLocation(PartitionRecord partition, StorageTargetRecord target) {
    String root = ConfigValues.getString(target.getConfig(), "root", defaults.getRoot());
    if (root == null) {
      throw new UnresolvedStorageTargetException("Local storage target " + target.getName()
          + " missing root configuration");
    }
    return Paths.get(root).resolve(partition.getFilePath()).toAbsolutePath().normalize()
        .toString();
  }
}
