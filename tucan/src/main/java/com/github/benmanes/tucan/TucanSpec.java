/*
 * Copyright 2026 Ben Manes. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.benmanes.tucan;

import static java.util.Locale.US;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A specification of an {@link InternStore} configuration.
 * <p>
 * {@code TucanSpec} supports parsing configuration off of a string, which makes it especially
 * useful for command-line configuration of the process-wide store through the {@code tucan.spec}
 * system property.
 * <p>
 * The string syntax is a series of comma-separated keys or key-value pairs.
 * <ul>
 *   <li>{@code initialCapacity=[integer]}: the initial table capacity of each partition.
 *   <li>{@code hash=[farmHash64|murmur3|sipHash24]}: the {@link HashStrategy} of the store.
 *   <li>{@code leakDetection=[true|false]}: whether handles that are garbage collected without
 *       being closed are released and reported. A bare {@code leakDetection} means {@code true}.
 *   <li>{@code recordStats}: records hits, misses, and reclaims.
 * </ul>
 * <p>
 * Whitespace before and after commas and equal signs is ignored. Keys may not be repeated.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class TucanSpec {
  /** The system property that configures the process-wide store. */
  public static final String SYSTEM_PROPERTY = "tucan.spec";

  static final String SPLIT_OPTIONS = ",";
  static final String SPLIT_KEY_VALUE = "=";
  static final int UNSET_INT = -1;
  static final int DEFAULT_INITIAL_CAPACITY = 16;

  final String specification;

  int initialCapacity = UNSET_INT;
  boolean recordStats;

  @Nullable HashStrategy hashStrategy;
  @Nullable Boolean leakDetection;

  private TucanSpec(String specification) {
    this.specification = requireNonNull(specification);
  }

  /**
   * Creates a TucanSpec from a string.
   *
   * @param specification the string form
   * @return the parsed specification
   * @throws IllegalArgumentException if the string is malformed
   */
  @SuppressWarnings("StringSplitter")
  public static TucanSpec parse(String specification) {
    TucanSpec spec = new TucanSpec(specification);
    for (String option : specification.split(SPLIT_OPTIONS)) {
      spec.parseOption(option.trim());
    }
    return spec;
  }

  /**
   * Returns the specification in the {@code tucan.spec} system property, or the default
   * configuration if it is not set.
   */
  static TucanSpec fromSystemProperties() {
    String property = System.getProperty(SYSTEM_PROPERTY, "");
    return parse(property);
  }

  /** Parses and applies the configuration option. */
  void parseOption(String option) {
    if (option.isEmpty()) {
      return;
    }

    @SuppressWarnings("StringSplitter")
    String[] keyAndValue = option.split(SPLIT_KEY_VALUE);
    requireArgument(keyAndValue.length <= 2,
        "key-value pair %s with more than one equals sign", option);

    String key = keyAndValue[0].trim();
    String value = (keyAndValue.length == 1) ? null : keyAndValue[1].trim();

    configure(key, value);
  }

  /** Configures the setting. */
  void configure(String key, @Nullable String value) {
    switch (key) {
      case "initialCapacity":
        initialCapacity(key, value);
        return;
      case "hash":
        hashStrategy(key, value);
        return;
      case "leakDetection":
        leakDetection(key, value);
        return;
      case "recordStats":
        recordStats(value);
        return;
      default:
        throw new IllegalArgumentException("Unknown key " + key);
    }
  }

  /** Configures the initial capacity. */
  void initialCapacity(String key, @Nullable String value) {
    requireArgument(initialCapacity == UNSET_INT,
        "initial capacity was already set to %,d", initialCapacity);
    int capacity = parseInt(key, value);
    requireArgument(capacity >= 0, "initial capacity must not be negative: %s", capacity);
    initialCapacity = capacity;
  }

  /** Configures the hash strategy. */
  void hashStrategy(String key, @Nullable String value) {
    requireArgument(hashStrategy == null, "hash was already set to %s", hashStrategy);
    requireArgument((value != null) && !value.isEmpty(), "value of key %s was omitted", key);
    hashStrategy = HashStrategy.forKey(requireNonNull(value));
  }

  /** Configures leak detection. */
  void leakDetection(String key, @Nullable String value) {
    requireArgument(leakDetection == null, "leak detection was already set to %s", leakDetection);
    if (value == null) {
      leakDetection = Boolean.TRUE;
    } else if (value.equalsIgnoreCase("true")) {
      leakDetection = Boolean.TRUE;
    } else if (value.equalsIgnoreCase("false")) {
      leakDetection = Boolean.FALSE;
    } else {
      throw new IllegalArgumentException(String.format(US,
          "key %s expects true or false but was %s", key, value));
    }
  }

  /** Configures the value as record stats. */
  void recordStats(@Nullable String value) {
    requireArgument(value == null, "record stats does not take a value");
    requireArgument(!recordStats, "record stats was already set");
    recordStats = true;
  }

  /** Returns a parsed int value. */
  static int parseInt(String key, @Nullable String value) {
    requireArgument((value != null) && !value.isEmpty(), "value of key %s was omitted", key);
    try {
      return Integer.parseInt(requireNonNull(value));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format(US,
          "key %s value was set to %s, must be an integer", key, value), e);
    }
  }

  /** Returns the initial capacity of each partition's table. */
  public int initialCapacity() {
    return (initialCapacity == UNSET_INT) ? DEFAULT_INITIAL_CAPACITY : initialCapacity;
  }

  /** Returns the hash strategy of the store. */
  public HashStrategy hashStrategy() {
    return (hashStrategy == null) ? HashStrategy.FARM_HASH_64 : hashStrategy;
  }

  /** Returns whether leaked handles are released and reported. */
  public boolean leakDetection() {
    return (leakDetection == null) || leakDetection;
  }

  /** Returns whether statistics are recorded. */
  public boolean recordStats() {
    return recordStats;
  }

  /**
   * Returns a string representation that can be used to recreate this specification.
   *
   * @return a string representation of this specification
   */
  public String toParsableString() {
    return specification;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    } else if (!(o instanceof TucanSpec)) {
      return false;
    }
    var spec = (TucanSpec) o;
    return (initialCapacity == spec.initialCapacity)
        && (recordStats == spec.recordStats)
        && (hashStrategy == spec.hashStrategy)
        && Objects.equals(leakDetection, spec.leakDetection);
  }

  @Override
  public int hashCode() {
    return Objects.hash(initialCapacity, recordStats, hashStrategy, leakDetection);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{' + toParsableString() + '}';
  }

  /** Ensures that the argument expression is true. */
  static void requireArgument(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalArgumentException(String.format(US, template, args));
    }
  }
}
