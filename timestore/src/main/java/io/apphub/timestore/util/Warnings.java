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
package io.apphub.timestore.util;

import com.google.common.collect.ImmutableList;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Helpers for the warning lists carried by contexts and results.
 */
public final class Warnings {

  private Warnings() {
    // Utility class should not be instantiated
  }

  /** Removes blank and repeated warnings, keeping first-seen order. */
  public static List<String> dedupe(Iterable<String> warnings) {
    Set<String> unique = new LinkedHashSet<>();
    for (String warning : warnings) {
      if (warning != null && !warning.trim().isEmpty()) {
        unique.add(warning);
      }
    }
    return ImmutableList.copyOf(unique);
  }
}
