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

import com.github.benmanes.tucan.stats.InternStats;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Static entry points to the process-wide {@link InternStore}. The store is created on first use,
 * configured by the {@value TucanSpec#SYSTEM_PROPERTY} system property, and lives until the process
 * exits.
 * <pre>{@code
 * try (Interned<String> name = Tucan.intern(userName)) {
 *   render(name.get());
 * }
 * Tucan.gc();
 * }</pre>
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class Tucan {

  private Tucan() {}

  /** Returns the process-wide store. */
  public static InternStore store() {
    return GlobalStore.INSTANCE;
  }

  /**
   * Returns the calling thread's store, created on first use with the configuration of the
   * process-wide store. It shares no slots with {@link #store()} or with other threads' stores, so
   * its locks are never contended; handles from it may still be read and closed by any thread.
   */
  public static InternStore localStore() {
    return ThreadLocalStore.INSTANCE.get();
  }

  /**
   * Interns the value into the partition of its runtime class.
   *
   * @param value the immutable value to intern
   * @param <E> the type of the value
   * @return a handle to the shared slot
   * @throws NullPointerException if the value is null
   */
  @SuppressWarnings("unchecked")
  public static <E extends Internable> Interned<E> intern(E value) {
    var type = InternType.internable((Class<E>) value.getClass());
    return store().intern(type, value);
  }

  /**
   * Interns the string into the {@link InternType#STRINGS} partition.
   *
   * @param value the string to intern
   * @return a handle to the shared slot
   * @throws NullPointerException if the value is null
   */
  public static Interned<String> intern(String value) {
    return store().intern(InternType.STRINGS, value);
  }

  /**
   * Interns the value into the partition.
   *
   * @param type the partition of the value
   * @param value the immutable value to intern
   * @param <E> the type of the value
   * @return a handle to the shared slot
   * @throws NullPointerException if the type or value is null
   */
  public static <E> Interned<E> intern(InternType<E> type, E value) {
    return store().intern(type, value);
  }

  /**
   * Removes every slot that no open handle references.
   *
   * @return the number of reclaimed slots
   */
  @CanIgnoreReturnValue
  public static int gc() {
    return store().gc();
  }

  /** Removes every slot; open handles remain valid. */
  public static void clear() {
    store().clear();
  }

  /** Returns the number of slots listed across all partitions. */
  public static int size() {
    return store().size();
  }

  /** Returns a snapshot of the process-wide statistics. */
  public static InternStats stats() {
    return store().stats();
  }

  static final class GlobalStore {
    static final InternStore INSTANCE = InternStore.from(TucanSpec.fromSystemProperties());

    private GlobalStore() {}
  }

  static final class ThreadLocalStore {
    static final ThreadLocal<InternStore> INSTANCE =
        ThreadLocal.withInitial(() -> InternStore.from(store().spec()));

    private ThreadLocalStore() {}
  }
}
