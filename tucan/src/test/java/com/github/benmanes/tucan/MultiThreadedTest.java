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

import static com.google.common.truth.Truth.assertThat;

import java.util.List;
import java.util.function.BiConsumer;

import org.testng.annotations.Test;

import com.github.benmanes.tucan.testing.ConcurrentTestHarness;
import com.github.benmanes.tucan.testing.Threads;
import com.github.benmanes.tucan.testing.Word;

/**
 * A test to assert the concurrency characteristics of interning, duplicating, closing, and
 * sweeping by validating the store's state after load.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class MultiThreadedTest {
  static final InternType<Word> WORDS = InternType.internable(Word.class);

  @Test(invocationCount = 5)
  public void intern_race_sharesOneSlot() {
    var store = InternStore.from("leakDetection=false, recordStats");
    var result = ConcurrentTestHarness.timeTasks(Threads.NTHREADS,
        () -> store.intern(WORDS, new Word("contended")));

    var handles = result.results();
    var first = handles.get(0);
    for (var handle : handles) {
      assertThat(handle.isSameSlot(first)).isTrue();
      assertThat(handle.get()).isSameInstanceAs(first.get());
    }
    assertThat(store.size(WORDS)).isEqualTo(1);
    assertThat(first.shareCount()).isEqualTo(Threads.NTHREADS + Slot.STORE_HOLD);
    assertThat(store.stats().missCount()).isEqualTo(1);
    assertThat(store.stats().hitCount()).isEqualTo(Threads.NTHREADS - 1);
  }

  @Test
  public void intern_raceWithGc() {
    var store = InternStore.from("leakDetection=false");
    var result = ConcurrentTestHarness.timeTasks(Threads.NTHREADS, () -> {
      for (int i = 0; i < 1_000; i++) {
        try (var handle = store.intern(WORDS, new Word("churn"))) {
          assertThat(handle.get()).isEqualTo(new Word("churn"));
        }
        store.gc();
      }
      return store.intern(WORDS, new Word("churn"));
    });

    var handles = result.results();
    for (var handle : handles) {
      assertThat(handle.isSameSlot(handles.get(0))).isTrue();
    }
    assertThat(handles.get(0).shareCount()).isEqualTo(Threads.NTHREADS + Slot.STORE_HOLD);

    handles.forEach(Interned::close);
    assertThat(store.gc()).isEqualTo(1);
    assertThat(store.size()).isEqualTo(0);
  }

  @Test
  public void concurrent() {
    var store = InternStore.from("leakDetection=false");
    var pinned = store.intern(WORDS, new Word("pinned"));

    Threads.runTest(store, operations(pinned));

    store.gc();
    assertThat(store.size()).isEqualTo(1);
    assertThat(store.values(WORDS)).containsExactly(new Word("pinned"));
    assertThat(pinned.shareCount()).isEqualTo(2);

    pinned.close();
    assertThat(store.gc()).isEqualTo(1);
    assertThat(store.size()).isEqualTo(0);
  }

  private static List<BiConsumer<InternStore, Integer>> operations(Interned<Word> pinned) {
    return List.of(
        // intern and close
        (store, key) -> {
          try (var handle = store.intern(WORDS, new Word(key.toString()))) {
            assertThat(handle.get().text()).isEqualTo(key.toString());
          }
        },
        // intern, duplicate, and close both
        (store, key) -> {
          var handle = store.intern(InternType.INTEGERS, key);
          var copy = handle.duplicate();
          handle.close();
          assertThat(copy.get()).isEqualTo(key);
          assertThat(copy.shareCount()).isAtLeast(1);
          copy.close();
        },
        // sweep while others intern
        (store, key) -> store.gc(),
        // the pinned slot survives every sweep
        (store, key) -> {
          assertThat(pinned.get()).isEqualTo(new Word("pinned"));
          try (var handle = store.intern(WORDS, new Word("pinned"))) {
            assertThat(handle.isSameSlot(pinned)).isTrue();
          }
        },
        (store, key) -> assertThat(store.size()).isAtLeast(0));
  }
}
