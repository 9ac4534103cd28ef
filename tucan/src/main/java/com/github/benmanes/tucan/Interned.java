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

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.lang.ref.Cleaner;
import java.lang.ref.Cleaner.Cleanable;
import java.lang.ref.Reference;
import java.util.Comparator;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A shared, read-only handle to an interned value. Every handle holds one share of the slot that
 * stores the value, and the slot cannot be reclaimed by {@link InternStore#gc()} until all of its
 * handles are closed. A handle stays valid for as long as it is open, even if the slot is no
 * longer listed by the store.
 * <p>
 * Two handles are equal if and only if they alias the same slot. This is the identity of interned
 * data; use {@link #valueEquals} to compare the contents instead.
 * <p>
 * Handles are thread-safe. A handle that becomes unreachable without being closed pins its slot,
 * unless the store detects leaks, in which case the share is released when the handle is garbage
 * collected and a warning is logged.
 *
 * @param <E> the type of the interned value
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class Interned<E> implements Supplier<E>, AutoCloseable {
  static final Logger logger = System.getLogger(Interned.class.getName());

  final InternType<E> type;
  final Slot<E> slot;
  final Lease lease;
  final @Nullable Cleanable cleanable;

  /** Creates a handle for a share that was already acquired on the slot. */
  Interned(InternType<E> type, Slot<E> slot, boolean leakDetection) {
    this.type = requireNonNull(type);
    this.slot = requireNonNull(slot);
    this.lease = new Lease(slot, type);
    this.cleanable = leakDetection ? LeakDetector.CLEANER.register(this, lease) : null;
  }

  /**
   * Returns the interned value. If the value collided with an earlier value of the same partition
   * then the earlier value is returned.
   *
   * @return the shared value
   * @throws IllegalStateException if this handle was closed
   */
  @Override
  public E get() {
    requireOpen();
    return slot.value;
  }

  /** Returns the partition of the interned value. */
  public InternType<E> type() {
    return type;
  }

  /**
   * Returns a new handle to the same slot. This acquires another share and does not contend with
   * the store's locks.
   *
   * @return a handle that aliases the same slot
   * @throws IllegalStateException if this handle was closed
   */
  public Interned<E> duplicate() {
    try {
      requireOpen();
      slot.retain();
      return new Interned<>(type, slot, (cleanable != null));
    } finally {
      Reference.reachabilityFence(this);
    }
  }

  /**
   * Returns the number of holders of the slot: its open handles and, while the store lists it, the
   * store itself.
   */
  public int shareCount() {
    return slot.shares();
  }

  /** Returns whether this handle was closed. */
  public boolean isClosed() {
    return lease.released.get();
  }

  /**
   * Releases this handle's share of the slot. The slot becomes eligible for reclamation by the
   * next sweep once every handle to it is closed. Closing a handle more than once has no effect.
   */
  @Override
  public void close() {
    if (lease.release() && (cleanable != null)) {
      cleanable.clean();
    }
  }

  /** Returns whether both handles alias the same slot. */
  public boolean isSameSlot(Interned<?> other) {
    return (slot == other.slot);
  }

  /**
   * Returns whether the interned value is equal to the given value, as determined by
   * {@link Object#equals}.
   */
  public boolean valueEquals(@Nullable Object value) {
    return Objects.equals(slot.value, value);
  }

  /**
   * Compares the interned value with the given value.
   *
   * @param value the value to compare with
   * @param comparator the ordering of the values
   * @return a negative integer, zero, or a positive integer as the interned value is less than,
   *     equal to, or greater than the given value
   * @throws IllegalStateException if this handle was closed
   */
  public int compareValue(E value, Comparator<? super E> comparator) {
    return comparator.compare(get(), value);
  }

  /**
   * Returns a comparator that orders handles by the natural ordering of their values. Handles of
   * the same slot compare as equal; closed handles cannot be compared.
   *
   * @param <E> the type of the interned values
   * @return a comparator of handles by value
   */
  public static <E extends Comparable<? super E>> Comparator<Interned<E>> byValue() {
    return byValue(Comparator.<E>naturalOrder());
  }

  /**
   * Returns a comparator that orders handles by their values.
   *
   * @param comparator the ordering of the values
   * @param <E> the type of the interned values
   * @return a comparator of handles by value
   */
  public static <E> Comparator<Interned<E>> byValue(Comparator<? super E> comparator) {
    requireNonNull(comparator);
    return (a, b) -> comparator.compare(a.get(), b.get());
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return (o == this) || ((o instanceof Interned<?>) && (slot == ((Interned<?>) o).slot));
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(slot);
  }

  @Override
  public String toString() {
    return "Interned[" + slot.value + "]";
  }

  private void requireOpen() {
    if (lease.released.get()) {
      throw new IllegalStateException("Interned " + type + " handle was closed");
    }
  }

  /**
   * The share that a handle holds, released at most once either by closing the handle or by the
   * cleaner after the handle became unreachable. It must not refer to the handle.
   */
  static final class Lease implements Runnable {
    final AtomicBoolean released;
    final InternType<?> type;
    final Slot<?> slot;

    Lease(Slot<?> slot, InternType<?> type) {
      this.released = new AtomicBoolean();
      this.slot = slot;
      this.type = type;
    }

    /** Releases the share and returns whether this call did so. */
    @CanIgnoreReturnValue
    boolean release() {
      if (released.compareAndSet(false, true)) {
        slot.release();
        return true;
      }
      return false;
    }

    @Override
    public void run() {
      if (release()) {
        logger.log(Level.WARNING, () -> "Interned " + type
            + " handle was garbage collected without being closed; released its share");
      }
    }
  }

  static final class LeakDetector {
    static final Cleaner CLEANER = Cleaner.create();

    private LeakDetector() {}
  }
}
