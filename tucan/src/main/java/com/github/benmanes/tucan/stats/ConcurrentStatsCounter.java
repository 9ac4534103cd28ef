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
package com.github.benmanes.tucan.stats;

import java.util.concurrent.atomic.LongAdder;

/**
 * A thread-safe {@link StatsCounter} implementation for use by interner implementors.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class ConcurrentStatsCounter implements StatsCounter {
  private final LongAdder hitCount;
  private final LongAdder missCount;
  private final LongAdder reclaimCount;

  /**
   * Constructs an instance with all counts initialized to zero.
   */
  public ConcurrentStatsCounter() {
    hitCount = new LongAdder();
    missCount = new LongAdder();
    reclaimCount = new LongAdder();
  }

  @Override
  public void recordHits(int count) {
    hitCount.add(count);
  }

  @Override
  public void recordMisses(int count) {
    missCount.add(count);
  }

  @Override
  public void recordReclaims(int count) {
    reclaimCount.add(count);
  }

  @Override
  public InternStats snapshot() {
    return InternStats.of(
        negativeToMaxValue(hitCount.sum()),
        negativeToMaxValue(missCount.sum()),
        negativeToMaxValue(reclaimCount.sum()));
  }

  /** Returns {@code value}, if non-negative. Otherwise, returns {@link Long#MAX_VALUE}. */
  private static long negativeToMaxValue(long value) {
    return (value >= 0) ? value : Long.MAX_VALUE;
  }

  /**
   * Increments all counters by the values in {@code other}.
   *
   * @param other the counter to increment from
   */
  public void incrementBy(StatsCounter other) {
    InternStats otherStats = other.snapshot();
    hitCount.add(otherStats.hitCount());
    missCount.add(otherStats.missCount());
    reclaimCount.add(otherStats.reclaimCount());
  }

  @Override
  public String toString() {
    return snapshot().toString();
  }
}
