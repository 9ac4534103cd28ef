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

import java.util.Objects;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.Immutable;

/**
 * Statistics about the performance of an interner.
 * <p>
 * Interning statistics are incremented according to the following rules:
 * <ul>
 *   <li>When an intern request finds a slot already listed for the value's hash,
 *       {@code hitCount} is incremented.
 *   <li>When an intern request creates a new slot, {@code missCount} is incremented.
 *   <li>When a sweep removes a slot that no handle references, {@code reclaimCount} is
 *       incremented.
 * </ul>
 * <p>
 * A lookup that hits on a slot created for a colliding but different value is still a hit.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
@Immutable
public final class InternStats {
  private static final InternStats EMPTY_STATS = InternStats.of(0L, 0L, 0L);

  private final long hitCount;
  private final long missCount;
  private final long reclaimCount;

  private InternStats(@NonNegative long hitCount, @NonNegative long missCount,
      @NonNegative long reclaimCount) {
    if ((hitCount < 0) || (missCount < 0) || (reclaimCount < 0)) {
      throw new IllegalArgumentException();
    }
    this.hitCount = hitCount;
    this.missCount = missCount;
    this.reclaimCount = reclaimCount;
  }

  /**
   * Returns an {@code InternStats} representing the specified statistics.
   *
   * @param hitCount the number of intern hits
   * @param missCount the number of intern misses
   * @param reclaimCount the number of slots reclaimed by sweeping
   * @return an {@code InternStats} representing the specified statistics
   * @throws IllegalArgumentException if any count is negative
   */
  public static InternStats of(@NonNegative long hitCount, @NonNegative long missCount,
      @NonNegative long reclaimCount) {
    return new InternStats(hitCount, missCount, reclaimCount);
  }

  /**
   * Returns a statistics instance where no interning events have been recorded.
   *
   * @return an empty statistics instance
   */
  public static InternStats empty() {
    return EMPTY_STATS;
  }

  /**
   * Returns the number of intern requests, {@code hitCount + missCount}. This is defined as
   * {@code Long.MAX_VALUE} if the sum overflows.
   *
   * @return the {@code hitCount + missCount}
   */
  public @NonNegative long requestCount() {
    return saturatedAdd(hitCount, missCount);
  }

  /**
   * Returns the number of intern requests that found an existing slot.
   *
   * @return the number of intern hits
   */
  public @NonNegative long hitCount() {
    return hitCount;
  }

  /**
   * Returns the ratio of requests that hit to all requests, or {@code 1.0} when there were no
   * requests.
   *
   * @return the ratio of intern requests that were hits
   */
  public @NonNegative double hitRate() {
    long requestCount = requestCount();
    return (requestCount == 0) ? 1.0 : (double) hitCount / requestCount;
  }

  /**
   * Returns the number of intern requests that created a new slot.
   *
   * @return the number of intern misses
   */
  public @NonNegative long missCount() {
    return missCount;
  }

  /**
   * Returns the ratio of requests that missed to all requests, or {@code 0.0} when there were no
   * requests.
   *
   * @return the ratio of intern requests that were misses
   */
  public @NonNegative double missRate() {
    long requestCount = requestCount();
    return (requestCount == 0) ? 0.0 : (double) missCount / requestCount;
  }

  /**
   * Returns the number of slots that sweeping removed because no handle referenced them.
   *
   * @return the number of reclaimed slots
   */
  public @NonNegative long reclaimCount() {
    return reclaimCount;
  }

  /**
   * Returns a new {@code InternStats} representing the difference between this and {@code other}.
   * Negative values, which aren't supported by {@code InternStats} will be rounded up to zero.
   *
   * @param other the statistics to subtract with
   * @return the difference between this instance and {@code other}
   */
  public InternStats minus(InternStats other) {
    return InternStats.of(
        Math.max(0L, saturatedSubtract(hitCount, other.hitCount)),
        Math.max(0L, saturatedSubtract(missCount, other.missCount)),
        Math.max(0L, saturatedSubtract(reclaimCount, other.reclaimCount)));
  }

  /**
   * Returns a new {@code InternStats} representing the sum of this and {@code other}. The result
   * saturates at {@code Long.MAX_VALUE}.
   *
   * @param other the statistics to add with
   * @return the sum of the statistics
   */
  public InternStats plus(InternStats other) {
    return InternStats.of(
        saturatedAdd(hitCount, other.hitCount),
        saturatedAdd(missCount, other.missCount),
        saturatedAdd(reclaimCount, other.reclaimCount));
  }

  @SuppressWarnings("ShortCircuitBoolean")
  private static long saturatedSubtract(long a, long b) {
    long naiveDifference = a - b;
    if ((a ^ b) >= 0 | (a ^ naiveDifference) >= 0) {
      return naiveDifference;
    }
    return Long.MAX_VALUE + ((naiveDifference >>> (Long.SIZE - 1)) ^ 1);
  }

  @SuppressWarnings("ShortCircuitBoolean")
  private static long saturatedAdd(long a, long b) {
    long naiveSum = a + b;
    if ((a ^ b) < 0 | (a ^ naiveSum) >= 0) {
      return naiveSum;
    }
    // overflowed, so saturate toward the sign of the operands
    return Long.MAX_VALUE + ((naiveSum >>> (Long.SIZE - 1)) ^ 1);
  }

  @Override
  public int hashCode() {
    return Objects.hash(hitCount, missCount, reclaimCount);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (o == this) {
      return true;
    } else if (!(o instanceof InternStats)) {
      return false;
    }
    InternStats other = (InternStats) o;
    return (hitCount == other.hitCount)
        && (missCount == other.missCount)
        && (reclaimCount == other.reclaimCount);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "hitCount=" + hitCount + ", "
        + "missCount=" + missCount + ", "
        + "reclaimCount=" + reclaimCount
        + '}';
  }
}
