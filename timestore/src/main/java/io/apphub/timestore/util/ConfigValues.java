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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;

/**
 * Typed accessors over the free-form maps configuration and storage target
 * records are expressed in.
 */
public final class ConfigValues {

  private ConfigValues() {
    // Utility class should not be instantiated
  }

  public static @Nullable String getString(@Nullable Map<String, ?> map, String key) {
    if (map == null) {
      return null;
    }
    Object value = map.get(key);
    if (value == null) {
      return null;
    }
    String text = value.toString().trim();
    return text.isEmpty() ? null : text;
  }

  public static @Nullable String getString(@Nullable Map<String, ?> map, String key,
      @Nullable String defaultValue) {
    String value = getString(map, key);
    return value != null ? value : defaultValue;
  }

  public static boolean getBoolean(@Nullable Map<String, ?> map, String key,
      boolean defaultValue) {
    if (map == null || map.get(key) == null) {
      return defaultValue;
    }
    Object value = map.get(key);
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    String text = value.toString().trim().toLowerCase(Locale.ROOT);
    switch (text) {
    case "true":
    case "1":
    case "yes":
    case "on":
      return true;
    case "false":
    case "0":
    case "no":
    case "off":
      return false;
    default:
      throw new IllegalArgumentException("Invalid boolean for '" + key + "': " + value);
    }
  }

  public static int getInt(@Nullable Map<String, ?> map, String key, int defaultValue) {
    if (map == null || map.get(key) == null) {
      return defaultValue;
    }
    Object value = map.get(key);
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for '" + key + "': " + value, e);
    }
  }

  /**
   * Returns a nested map, or an empty map when the key is absent.
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> getMap(@Nullable Map<String, ?> map, String key) {
    if (map == null) {
      return Collections.emptyMap();
    }
    Object value = map.get(key);
    if (value == null) {
      return Collections.emptyMap();
    }
    if (!(value instanceof Map)) {
      throw new IllegalArgumentException("Expected an object for '" + key + "' but got "
          + value.getClass().getSimpleName());
    }
    return (Map<String, Object>) value;
  }
}
