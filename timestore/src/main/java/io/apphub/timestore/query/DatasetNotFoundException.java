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
package io.apphub.timestore.query;

import io.apphub.timestore.TimestoreException;

/**
 * Thrown when a query names a dataset the catalog does not know.
 */
public class DatasetNotFoundException extends TimestoreException {
  private static final long serialVersionUID = 1L;

  private final String datasetSlug;

  public DatasetNotFoundException(String datasetSlug) {
    super("Dataset " + datasetSlug + " not found");
    this.datasetSlug = datasetSlug;
  }

  public String getDatasetSlug() {
    return datasetSlug;
  }
}
