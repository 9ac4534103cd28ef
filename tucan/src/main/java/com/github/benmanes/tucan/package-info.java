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
/**
 * This package contains a reference counted interner for immutable values.
 * <p>
 * {@link com.github.benmanes.tucan.Tucan#intern} deduplicates a value into a shared slot and
 * returns an {@link com.github.benmanes.tucan.Interned} handle to it. Interning a value whose hash
 * is already present in the value's {@link com.github.benmanes.tucan.InternType partition} returns
 * a handle to the existing slot. Slots are never evicted; a slot is only removed by
 * {@link com.github.benmanes.tucan.Tucan#gc} once every handle to it has been closed.
 * <p>
 * Deduplication is decided by the 64-bit hash alone. Two different values of the same partition
 * whose hashes collide are unified into the first one interned.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
@NullMarked
@CheckReturnValue
package com.github.benmanes.tucan;

import org.jspecify.annotations.NullMarked;

import com.google.errorprone.annotations.CheckReturnValue;
