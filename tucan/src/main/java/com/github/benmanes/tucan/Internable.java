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

import com.google.common.hash.PrimitiveSink;

/**
 * A value that may be interned by its own type, for example with {@link Tucan#intern(Internable)}.
 * <p>
 * Implementations must be immutable and safe to share across threads, and should define
 * {@link Object#equals} and {@link Object#hashCode} consistently with the state written by
 * {@link #funnel}. The interner never calls {@code equals}; two values that funnel the same
 * content are treated as the same interned value.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public interface Internable {

  /**
   * Writes the state that identifies this value into the sink. The same value must always write
   * the same content.
   *
   * @param into the sink to write to
   */
  void funnel(PrimitiveSink into);
}
