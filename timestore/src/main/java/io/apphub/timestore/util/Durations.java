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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for parsing duration strings used in configuration.
 * Supports formats like:
 * - "250 ms"
 * - "30s" / "30 seconds"
 * - "5 minutes"
 * - "1 hour"
 * - "PT5M" (ISO 8601)
 * - a bare number, read as milliseconds
 */
public final class Durations {
  private static final Logger LOGGER = LoggerFactory.getLogger(Durations.class);

  private static final Pattern DURATION_PATTERN =
      Pattern.compile("(-?\\d+)\\s*(ms|milliseconds?|s|secs?|seconds?|m|mins?|minutes?"
          + "|h|hours?|d|days?)", Pattern.CASE_INSENSITIVE);

  private static final Pattern NUMBER_PATTERN = Pattern.compile("-?\\d+");

  private Durations() {
    // Utility class should not be instantiated
  }

  /**
   * Parses a duration string.
   *
   * @param value Duration string like "5 minutes", "30s", "PT1M" or "1500"
   * @return Parsed duration, or null if the value is blank or invalid
   */
  public static @Nullable Duration parse(@Nullable String value) {
    if (value == null || value.trim().isEmpty()) {
      return null;
    }
    String trimmed = value.trim();

    if (trimmed.startsWith("P") || trimmed.startsWith("-P")) {
      try {
        return Duration.parse(trimmed);
      } catch (DateTimeParseException e) {
        LOGGER.debug("'{}' is not an ISO-8601 duration: {}", trimmed, e.getMessage());
        return null;
      }
    }

    if (NUMBER_PATTERN.matcher(trimmed).matches()) {
      return Duration.ofMillis(Long.parseLong(trimmed));
    }

    Matcher matcher = DURATION_PATTERN.matcher(trimmed);
    if (!matcher.matches()) {
      return null;
    }

    long amount = Long.parseLong(matcher.group(1));
    String unit = matcher.group(2).toLowerCase(Locale.ROOT);
    switch (unit.charAt(0)) {
    case 's':
      return Duration.ofSeconds(amount);
    case 'h':
      return Duration.ofHours(amount);
    case 'd':
      return Duration.ofDays(amount);
    case 'm':
      if (unit.equals("ms") || unit.startsWith("milli")) {
        return Duration.ofMillis(amount);
      }
      return Duration.ofMinutes(amount);
    default:
      return null;
    }
  }

  /**
   * Reads a duration from a configuration value that is either a number of
   * milliseconds or a duration string.
   *
   * @param value Raw configuration value
   * @param defaultValue Value to use when {@code value} is absent
   * @return Parsed duration
   * @throws IllegalArgumentException if the value cannot be parsed
   */
  public static Duration fromConfigValue(@Nullable Object value, Duration defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Duration) {
      return (Duration) value;
    }
    if (value instanceof Number) {
      return Duration.ofMillis(((Number) value).longValue());
    }
    Duration parsed = parse(value.toString());
    if (parsed == null) {
      throw new IllegalArgumentException("Invalid duration: " + value);
    }
    return parsed;
  }
}
