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

import static java.util.Objects.requireNonNull;

import java.util.concurrent.atomic.AtomicInteger;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * The backing storage of an interned value, shared by every handle that aliases it. The share
 * count includes the hold of the bucket that lists the slot, so a listed slot whose count is
 * {@link #STORE_HOLD} has no outstanding handles.
 *
 * @param <E> the type of the interned value
 * @author ben.manes@gmail.com (Ben Manes)
 */
final class Slot<E> {
  static final int STORE_HOLD = 1;

  final E value;
  final long hash;
  final AtomicInteger shares;

  Slot(E value, long hash) {
    this.value = requireNonNull(value);
    this.shares = new AtomicInteger(STORE_HOLD);
    this.hash = hash;
  }

  /** Returns the current number of holders, including the bucket while listed. */
  int shares() {
    return shares.get();
  }

  /** Returns whether the bucket's hold is the only one. */
  boolean isUnreferenced() {
    return (shares.get() == STORE_HOLD);
  }

  /** Adds a holder and returns the new count. */
  @CanIgnoreReturnValue
  int retain() {
    for (;;) {
      int current = shares.get();
      if (current <= 0) {
        throw new IllegalStateException("Slot was already destroyed: " + current);
      }
      if (shares.compareAndSet(current, current + 1)) {
        return current + 1;
      }
    }
  }

  /** Removes a holder and returns the new count. */
  @CanIgnoreReturnValue
  int release() {
    int remaining = shares.decrementAndGet();
    if (remaining < 0) {
      shares.incrementAndGet();
      throw new IllegalStateException("Slot released more times than it was retained");
    }
    return remaining;
  }

  @Override
  public String toString() {
    return String.format("Slot{value=%s, hash=%016x, shares=%d}", value, hash, shares.get());
  }
}
