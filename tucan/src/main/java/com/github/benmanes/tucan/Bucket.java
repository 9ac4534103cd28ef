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

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import com.github.benmanes.tucan.stats.StatsCounter;
import com.google.errorprone.annotations.concurrent.GuardedBy;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMaps;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectIterator;

/**
 * The slots of a single type partition, keyed by the 64-bit hash of their value. All access is
 * guarded by the bucket's lock so that a lookup that acquires a share and a sweep that removes an
 * unreferenced slot can never interleave.
 *
 * @param <E> the type of the interned values
 * @author ben.manes@gmail.com (Ben Manes)
 */
final class Bucket<E> {
  final InternType<E> type;
  final ReentrantLock lock;
  final StatsCounter statsCounter;

  @GuardedBy("lock")
  final Long2ObjectMap<Slot<E>> slots;

  Bucket(InternType<E> type, int initialCapacity, StatsCounter statsCounter) {
    this.slots = new Long2ObjectOpenHashMap<>(initialCapacity);
    this.statsCounter = requireNonNull(statsCounter);
    this.type = requireNonNull(type);
    this.lock = new ReentrantLock();
  }

  /**
   * Returns the slot listed for the hash with a new share acquired on the caller's behalf, creating
   * the slot from the value if absent. An existing slot is returned as is, without comparing its
   * value to the given one.
   */
  Slot<E> getOrInsert(long hash, E value) {
    lock.lock();
    try {
      Slot<E> slot = slots.get(hash);
      if (slot == null) {
        slot = new Slot<>(value, hash);
        slots.put(hash, slot);
        statsCounter.recordMisses(1);
      } else {
        statsCounter.recordHits(1);
      }
      slot.retain();
      return slot;
    } finally {
      lock.unlock();
    }
  }

  /** Visits every listed slot while holding the lock. */
  void forEachSlot(Consumer<? super Slot<E>> visitor) {
    requireNonNull(visitor);
    lock.lock();
    try {
      for (Slot<E> slot : slots.values()) {
        visitor.accept(slot);
      }
    } finally {
      lock.unlock();
    }
  }

  /** Removes the slots whose only holder is this bucket and returns how many were removed. */
  int sweep() {
    int removed = 0;
    lock.lock();
    try {
      ObjectIterator<Long2ObjectMap.Entry<Slot<E>>> iterator =
          Long2ObjectMaps.fastIterator(slots);
      while (iterator.hasNext()) {
        Slot<E> slot = iterator.next().getValue();
        if (slot.isUnreferenced()) {
          iterator.remove();
          slot.release();
          removed++;
        }
      }
    } finally {
      lock.unlock();
    }
    if (removed > 0) {
      statsCounter.recordReclaims(removed);
    }
    return removed;
  }

  /** Removes every slot, giving up the bucket's hold on each, and returns how many were listed. */
  int clear() {
    lock.lock();
    try {
      int removed = slots.size();
      for (Slot<E> slot : slots.values()) {
        slot.release();
      }
      slots.clear();
      return removed;
    } finally {
      lock.unlock();
    }
  }

  /** Returns the number of listed slots. */
  int size() {
    lock.lock();
    try {
      return slots.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{type=" + type + ", size=" + size() + "}";
  }
}
