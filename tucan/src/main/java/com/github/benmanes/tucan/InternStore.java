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

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.jspecify.annotations.Nullable;

import com.github.benmanes.tucan.stats.ConcurrentStatsCounter;
import com.github.benmanes.tucan.stats.InternStats;
import com.github.benmanes.tucan.stats.StatsCounter;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A registry of interned values, partitioned by {@link InternType}. Each partition is a bucket of
 * slots keyed by the 64-bit hash of their value and guarded by its own lock, so that interning
 * values of different partitions never contends. A partition's bucket is created on first use and
 * is never discarded. A store keys its partitions by value class, so each class is interned
 * through a single funnel; a partition of the same class with a different funnel is rejected.
 * <p>
 * Values are deduplicated by hash alone: {@link #intern} returns a handle to the slot already
 * listed for the value's hash without comparing the values. Slots are removed only by
 * {@link #gc()}, which reclaims every slot that no open handle references, or by {@link #clear()}.
 * <p>
 * {@link Tucan#store()} is the process-wide instance; a local store may be created for isolation.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class InternStore {
  static final Logger logger = System.getLogger(InternStore.class.getName());

  final ConcurrentMap<Class<?>, Bucket<?>> buckets;
  final StatsCounter statsCounter;
  final HashStrategy hashStrategy;
  final boolean leakDetection;
  final int initialCapacity;
  final TucanSpec spec;

  private InternStore(TucanSpec spec) {
    this.statsCounter = spec.recordStats()
        ? new ConcurrentStatsCounter()
        : StatsCounter.disabledStatsCounter();
    this.buckets = new ConcurrentHashMap<>();
    this.initialCapacity = spec.initialCapacity();
    this.leakDetection = spec.leakDetection();
    this.hashStrategy = spec.hashStrategy();
    this.spec = spec;
  }

  /** Returns a new store with the default configuration. */
  public static InternStore create() {
    return from(TucanSpec.parse(""));
  }

  /**
   * Returns a new store configured by the specification.
   *
   * @param spec the configuration
   * @return a new store
   */
  public static InternStore from(TucanSpec spec) {
    return new InternStore(requireNonNull(spec));
  }

  /**
   * Returns a new store configured by the specification string.
   *
   * @param spec a string in the format of {@link TucanSpec}
   * @return a new store
   * @throws IllegalArgumentException if the string is malformed
   */
  public static InternStore from(String spec) {
    return from(TucanSpec.parse(spec));
  }

  /**
   * Returns a handle to the shared slot for the value, creating the slot if no value with the same
   * hash was interned into the partition.
   * <p>
   * <b>Warning:</b> the values are not compared. If a different value of the partition with the
   * same hash is listed then the returned handle aliases that value, not this one.
   *
   * @param type the partition of the value
   * @param value the immutable value to intern
   * @param <E> the type of the value
   * @return a handle holding a new share of the slot
   * @throws NullPointerException if the type or value is null
   * @throws ClassCastException if the value is not an instance of the partition's class
   * @throws IllegalStateException if the partition's class was interned with a different funnel
   */
  public <E> Interned<E> intern(InternType<E> type, E value) {
    requireNonNull(type);
    E sample = type.checkValue(value);
    long hash = hashStrategy.hash(sample, type.funnel());
    Slot<E> slot = bucketFor(type).getOrInsert(hash, sample);
    return new Interned<>(type, slot, leakDetection);
  }

  /**
   * Removes every slot that no open handle references and returns the number removed. Each
   * partition is swept under its own lock in a single pass; slots whose last handle is closed while
   * the sweep is underway may be left for the next sweep.
   *
   * @return the number of reclaimed slots
   */
  @CanIgnoreReturnValue
  public int gc() {
    int reclaimed = 0;
    int remaining = 0;
    for (Bucket<?> bucket : buckets.values()) {
      reclaimed += bucket.sweep();
      remaining += bucket.size();
    }
    if (reclaimed > 0) {
      int retained = remaining;
      int removed = reclaimed;
      logger.log(Level.DEBUG, () -> String.format(US,
          "Reclaimed %,d interned values, %,d remain referenced", removed, retained));
    }
    return reclaimed;
  }

  /**
   * Removes every slot from the store. Open handles remain valid, but interning their values again
   * creates new slots.
   */
  public void clear() {
    int removed = 0;
    for (Bucket<?> bucket : buckets.values()) {
      removed += bucket.clear();
    }
    int cleared = removed;
    logger.log(Level.DEBUG, () -> String.format(US, "Cleared %,d interned values", cleared));
  }

  /** Returns the number of slots listed across all partitions. */
  public int size() {
    int size = 0;
    for (Bucket<?> bucket : buckets.values()) {
      size += bucket.size();
    }
    return size;
  }

  /** Returns the number of slots listed in the partition. */
  public int size(InternType<?> type) {
    Bucket<?> bucket = existingBucket(requireNonNull(type));
    return (bucket == null) ? 0 : bucket.size();
  }

  /**
   * Returns the values listed in the partition, in no particular order. Each value is the one that
   * created its slot.
   *
   * @param type the partition
   * @param <E> the type of the values
   * @return a snapshot of the partition's values
   * @throws IllegalStateException if the partition's class was interned with a different funnel
   */
  public <E> ImmutableList<E> values(InternType<E> type) {
    Bucket<E> bucket = existingBucket(requireNonNull(type));
    if (bucket == null) {
      return ImmutableList.of();
    }
    var values = ImmutableList.<E>builder();
    bucket.forEachSlot(slot -> values.add(slot.value));
    return values.build();
  }

  /**
   * Returns a snapshot of the statistics, or {@link InternStats#empty()} if the store does not
   * record them.
   */
  public InternStats stats() {
    return statsCounter.snapshot();
  }

  /** Returns the configuration of this store. */
  public TucanSpec spec() {
    return spec;
  }

  /** Returns the partition's bucket, creating it if absent. */
  <E> Bucket<E> bucketFor(InternType<E> type) {
    Bucket<?> bucket = buckets.get(type.valueClass());
    if (bucket == null) {
      bucket = buckets.computeIfAbsent(type.valueClass(), key -> {
        logger.log(Level.DEBUG, () -> "Created the interned partition for " + type);
        return new Bucket<>(type, initialCapacity, statsCounter);
      });
    }
    return checkPartition(type, bucket);
  }

  /** Returns the partition's bucket, or null if nothing of its class was interned. */
  <E> @Nullable Bucket<E> existingBucket(InternType<E> type) {
    Bucket<?> bucket = buckets.get(type.valueClass());
    return (bucket == null) ? null : checkPartition(type, bucket);
  }

  /**
   * Returns the bucket as the partition's type.
   *
   * @throws IllegalStateException if the class was registered with a different funnel
   */
  @SuppressWarnings("unchecked")
  static <E> Bucket<E> checkPartition(InternType<E> type, Bucket<?> bucket) {
    if (!bucket.type.equals(type)) {
      throw new IllegalStateException(String.format(US,
          "%s values are interned with the funnel %s, not %s",
          type, bucket.type.funnel(), type.funnel()));
    }
    return (Bucket<E>) bucket;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{spec=" + spec.toParsableString()
        + ", partitions=" + buckets.size() + ", size=" + size() + "}";
  }
}
