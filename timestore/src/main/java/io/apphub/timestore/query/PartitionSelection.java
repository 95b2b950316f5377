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
 * How many partitions a plan kept, and why the others were pruned.
 */
public final class PartitionSelection {
  private final int total;
  private final int selected;
  private final int prunedByTime;
  private final int prunedByPartitionKey;
  private final int prunedByColumnStatistics;

  public PartitionSelection(int total, int selected, int prunedByTime,
      int prunedByPartitionKey, int prunedByColumnStatistics) {
    this.total = total;
    this.selected = selected;
    this.prunedByTime = prunedByTime;
    this.prunedByPartitionKey = prunedByPartitionKey;
    this.prunedByColumnStatistics = prunedByColumnStatistics;
  }

  public static PartitionSelection empty() {
    return new PartitionSelection(0, 0, 0, 0, 0);
  }

  public int getTotal() {
    return total;
  }

  public int getSelected() {
    return selected;
  }

  public int getPruned() {
    return total - selected;
  }

  public int getPrunedByTime() {
    return prunedByTime;
  }

  public int getPrunedByPartitionKey() {
    return prunedByPartitionKey;
  }

  public int getPrunedByColumnStatistics() {
    return prunedByColumnStatistics;
  }

  @Override public String toString() {
    return "PartitionSelection{total=" + total + ", selected=" + selected
        + ", pruned=" + getPruned() + "}";
  }
}
