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

import org.checkerframework.checker.index.qual.NonNegative;

/**
 * Accumulates statistics during the operation of an interner for presentation by its
 * {@code stats()} method. This is solely intended for consumption by interner implementors.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public interface StatsCounter {

  /**
   * Records interning hits. This should be called when an intern request found a slot already
   * listed for the value's hash.
   *
   * @param count the number of hits to record
   */
  void recordHits(@NonNegative int count);

  /**
   * Records interning misses. This should be called when an intern request created a new slot.
   *
   * @param count the number of misses to record
   */
  void recordMisses(@NonNegative int count);

  /**
   * Records the removal of unreferenced slots by a sweep. Slots discarded by clearing the interner
   * are not reclaims.
   *
   * @param count the number of slots reclaimed
   */
  void recordReclaims(@NonNegative int count);

  /**
   * Returns a snapshot of this counter's values. Note that this may be an inconsistent view, as it
   * may be interleaved with update operations.
   *
   * @return a snapshot of this counter's values
   */
  InternStats snapshot();

  /**
   * Returns an accumulator that does not record any interning events.
   *
   * @return an accumulator that does not record metrics
   */
  static StatsCounter disabledStatsCounter() {
    return DisabledStatsCounter.INSTANCE;
  }
}
