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

/**
 * Number of result rows each source contributed. Lets callers tell
 * published data from rows that are not yet part of a manifest.
 */
public final class RowSourceBreakdown {
  private final int publishedRows;
  private final int publishedPartitions;
  private final int stagingRows;
  private final int hotBufferRows;

  public RowSourceBreakdown(int publishedRows, int publishedPartitions, int stagingRows,
      int hotBufferRows) {
    this.publishedRows = publishedRows;
    this.publishedPartitions = publishedPartitions;
    this.stagingRows = stagingRows;
    this.hotBufferRows = hotBufferRows;
  }

  public int getPublishedRows() {
    return publishedRows;
  }

  /** Partitions the published rows were read from. */
  public int getPublishedPartitions() {
    return publishedPartitions;
  }

  public int getStagingRows() {
    return stagingRows;
  }

  public int getHotBufferRows() {
    return hotBufferRows;
  }

  @Override public String toString() {
    return "RowSourceBreakdown{published=" + publishedRows + "/" + publishedPartitions
        + ", staging=" + stagingRows + ", hotBuffer=" + hotBufferRows + "}";
  }
}
