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

import java.util.Locale;

/**
 * Unit of a downsampling window.
 */
public enum IntervalUnit {
  SECOND("second"),
  MINUTE("minute"),
  HOUR("hour"),
  DAY("day"),
  WEEK("week"),
  MONTH("month");

  private final String value;

  IntervalUnit(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Parses a unit name, singular or plural, case-insensitively.
   *
   * @throws InvalidQueryException if the name is not a supported unit
   */
  public static IntervalUnit of(String name) {
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    if (normalized.endsWith("s")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    for (IntervalUnit unit : values()) {
      if (unit.value.equals(normalized)) {
        return unit;
      }
    }
    throw new InvalidQueryException("Unsupported downsample interval unit: " + name);
  }
}
