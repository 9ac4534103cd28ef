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

import com.google.common.hash.Funnel;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * The fixed 64-bit hash functions that an interner may deduplicate by. A store hashes every value
 * with the same strategy for its whole lifetime.
 * <p>
 * None of these is collision free. Values whose hashes collide are unified, so an application that
 * cannot tolerate that should intern a type whose funnel writes a collision resistant digest.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public enum HashStrategy {
  /** Google's FarmHash fingerprint, stable across releases. This is the default. */
  FARM_HASH_64("farmHash64", Hashing.farmHashFingerprint64()),
  /** The first 64 bits of MurmurHash3's x64 128-bit variant. */
  MURMUR3("murmur3", Hashing.murmur3_128()),
  /** SipHash-2-4 with the default key; slower but resistant to hash flooding. */
  SIP_HASH_24("sipHash24", Hashing.sipHash24());

  private final String key;
  private final HashFunction function;

  HashStrategy(String key, HashFunction function) {
    this.function = function;
    this.key = key;
  }

  /** Returns the key that selects this strategy in a {@link TucanSpec}. */
  public String key() {
    return key;
  }

  /**
   * Returns the 64-bit hash of the value.
   *
   * @param value the value to hash
   * @param funnel the strategy that writes the value's identifying state
   * @param <E> the type of the value
   * @return the first 64 bits of the hash
   */
  public <E> long hash(E value, Funnel<? super E> funnel) {
    return function.hashObject(value, funnel).asLong();
  }

  /**
   * Returns the strategy with the key, ignoring case.
   *
   * @throws IllegalArgumentException if no strategy has the key
   */
  static HashStrategy forKey(String key) {
    for (var strategy : values()) {
      if (strategy.key.toLowerCase(US).equals(key.toLowerCase(US))) {
        return strategy;
      }
    }
    throw new IllegalArgumentException(String.format(US, "unknown hash strategy: %s", key));
  }
}
