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

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.google.common.hash.Funnel;
import com.google.common.hash.Funnels;
import com.google.common.hash.PrimitiveSink;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A type partition of an interner, made of the class of its values and the funnel that feeds a
 * value into the interner's hash function. Each partition is stored separately so that equal hashes
 * of unrelated types are never unified. Two instances denote the same partition if both their
 * classes and their funnels are equal.
 *
 * @param <E> the type of the interned values
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class InternType<E> {
  /** The partition of strings, hashed by their UTF-16 code units. */
  public static final InternType<String> STRINGS =
      new InternType<>(String.class, Funnels.unencodedCharsFunnel());
  /** The partition of boxed integers. */
  public static final InternType<Integer> INTEGERS =
      new InternType<>(Integer.class, Funnels.integerFunnel());
  /** The partition of boxed longs. */
  public static final InternType<Long> LONGS =
      new InternType<>(Long.class, Funnels.longFunnel());

  private final Class<E> valueClass;
  private final Funnel<? super E> funnel;

  private InternType(Class<E> valueClass, Funnel<? super E> funnel) {
    this.valueClass = requireNonNull(valueClass);
    this.funnel = requireNonNull(funnel);
  }

  /**
   * Returns the partition for values of the given class that are hashed by the funnel. A store
   * accepts one funnel per class, so the funnel should be a shared constant or implement
   * {@code equals}; two lambdas are different funnels even if their code is the same.
   *
   * @param valueClass the class of the interned values
   * @param funnel the strategy that writes a value's identifying state into the hash function
   * @param <E> the type of the interned values
   * @return the partition
   */
  public static <E> InternType<E> of(Class<E> valueClass, Funnel<? super E> funnel) {
    return new InternType<>(valueClass, funnel);
  }

  /**
   * Returns the partition for an {@link Internable} class, hashed by its own
   * {@link Internable#funnel} method.
   *
   * @param valueClass the class of the interned values
   * @param <E> the type of the interned values
   * @return the partition
   */
  public static <E extends Internable> InternType<E> internable(Class<E> valueClass) {
    return new InternType<>(valueClass, InternableFunnel.INSTANCE);
  }

  /** Returns the class of the values in this partition. */
  public Class<E> valueClass() {
    return valueClass;
  }

  /** Returns the funnel that feeds a value into the interner's hash function. */
  public Funnel<? super E> funnel() {
    return funnel;
  }

  /**
   * Returns the value if it belongs to this partition.
   *
   * @throws NullPointerException if the value is null
   * @throws ClassCastException if the value is not an instance of this partition's class
   */
  @CanIgnoreReturnValue
  E checkValue(@Nullable Object value) {
    return valueClass.cast(requireNonNull(value));
  }

  /**
   * Interns the value into the process-wide store, as if by {@code Tucan.intern(this, value)}.
   *
   * @param value the value to intern
   * @return a handle to the shared slot
   * @throws NullPointerException if the value is null
   */
  public Interned<E> intern(E value) {
    return Tucan.store().intern(this, value);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (o == this) {
      return true;
    } else if (!(o instanceof InternType<?>)) {
      return false;
    }
    var other = (InternType<?>) o;
    return valueClass.equals(other.valueClass) && funnel.equals(other.funnel);
  }

  @Override
  public int hashCode() {
    return Objects.hash(valueClass, funnel);
  }

  @Override
  public String toString() {
    return valueClass.getName();
  }

  /** Feeds an {@link Internable} through its own method. */
  enum InternableFunnel implements Funnel<Internable> {
    INSTANCE;

    @Override public void funnel(Internable from, PrimitiveSink into) {
      from.funnel(into);
    }
  }
}
