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
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.expectThrows;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import com.github.benmanes.tucan.stats.InternStats;
import com.github.benmanes.tucan.testing.Collider;
import com.github.benmanes.tucan.testing.Label;
import com.github.benmanes.tucan.testing.Word;
import com.google.common.hash.Funnel;
import com.google.common.hash.Funnels;
import com.google.common.hash.PrimitiveSink;

/**
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class InternStoreTest {
  static final InternType<Word> WORDS = InternType.internable(Word.class);
  static final InternType<Label> LABELS = InternType.internable(Label.class);
  static final InternType<Collider> COLLIDERS = InternType.internable(Collider.class);

  InternStore store;

  @BeforeMethod
  public void beforeMethod() {
    store = InternStore.from("leakDetection=false, recordStats");
  }

  @Test
  @SuppressWarnings("NullAway")
  public void intern_null() {
    assertThrows(NullPointerException.class, () -> store.intern(WORDS, null));
    assertThrows(NullPointerException.class, () -> store.intern(null, new Word("a")));
    assertThat(store.size()).isEqualTo(0);
  }

  @Test
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void intern_wrongClass() {
    InternType raw = InternType.STRINGS;
    assertThrows(ClassCastException.class, () -> store.intern(raw, 1));
    assertThat(store.size()).isEqualTo(0);
  }

  @Test
  public void intern_repeat_aliasesSlot() {
    var canonical = new Word("hello");
    var other = new Word("hello");

    var first = store.intern(WORDS, canonical);
    var second = store.intern(WORDS, other);

    assertThat(second.isSameSlot(first)).isTrue();
    assertThat(second).isEqualTo(first);
    assertThat(second.get()).isSameInstanceAs(canonical);
    assertThat(store.size(WORDS)).isEqualTo(1);
  }

  @Test
  public void intern_distinct() {
    var hello = store.intern(WORDS, new Word("hello"));
    var world = store.intern(WORDS, new Word("world"));

    assertThat(hello).isNotEqualTo(world);
    assertThat(hello.isSameSlot(world)).isFalse();
    assertThat(store.size(WORDS)).isEqualTo(2);
  }

  @Test
  public void intern_shareCounts() {
    var a = store.intern(WORDS, new Word("hello"));
    var b = store.intern(WORDS, new Word("hello"));
    var c = store.intern(WORDS, new Word("world"));

    assertThat(a.shareCount()).isEqualTo(3);
    assertThat(b.shareCount()).isEqualTo(3);
    assertThat(c.shareCount()).isEqualTo(2);

    var aa = a.duplicate();
    var bb = b.duplicate();
    var cc = c.duplicate();

    assertThat(a.shareCount()).isEqualTo(5);
    assertThat(b.shareCount()).isEqualTo(5);
    assertThat(c.shareCount()).isEqualTo(3);

    aa.close();
    bb.close();
    cc.close();

    assertThat(a.shareCount()).isEqualTo(3);
    assertThat(c.shareCount()).isEqualTo(2);

    a.close();
    assertThat(b.shareCount()).isEqualTo(2);

    b.close();
    c.close();
    assertThat(store.size()).isEqualTo(2);

    assertThat(store.gc()).isEqualTo(2);
    assertThat(store.size()).isEqualTo(0);
  }

  @Test
  public void intern_partitionIsolation() {
    var strategy = store.spec().hashStrategy();
    var word = new Word("x");
    var label = new Label("x");
    assertThat(strategy.hash(word, WORDS.funnel()))
        .isEqualTo(strategy.hash(label, LABELS.funnel()));

    var internedWord = store.intern(WORDS, word);
    var internedLabel = store.intern(LABELS, label);

    assertThat(internedWord.get()).isSameInstanceAs(word);
    assertThat(internedLabel.get()).isSameInstanceAs(label);
    assertThat(internedWord.shareCount()).isEqualTo(2);
    assertThat(internedLabel.shareCount()).isEqualTo(2);
    assertThat(store.size(WORDS)).isEqualTo(1);
    assertThat(store.size(LABELS)).isEqualTo(1);
  }

  @Test
  public void intern_sameClassDifferentFunnel_rejected() {
    Funnel<String> lengthOnly = (value, into) -> into.putInt(value.length());
    var byLength = InternType.of(String.class, lengthOnly);

    var full = store.intern(InternType.STRINGS, "ab");
    var thrown = expectThrows(IllegalStateException.class, () -> store.intern(byLength, "ab"));
    assertThat(thrown).hasMessageThat().contains(String.class.getName());
    assertThat(full.shareCount()).isEqualTo(2);
    assertThat(store.size()).isEqualTo(1);

    assertThrows(IllegalStateException.class, () -> store.size(byLength));
    assertThrows(IllegalStateException.class, () -> store.values(byLength));
  }

  @Test
  public void intern_equalLambdaFunnels_rejected() {
    var first = InternType.of(Word.class, (Word word, PrimitiveSink into) -> word.funnel(into));
    var second = InternType.of(Word.class, (Word word, PrimitiveSink into) -> word.funnel(into));
    assertThat(first).isNotEqualTo(second);

    var handle = store.intern(first, new Word("a"));
    assertThrows(IllegalStateException.class, () -> store.intern(second, new Word("a")));
    assertThat(store.intern(first, new Word("a")).isSameSlot(handle)).isTrue();
    assertThat(store.size(first)).isEqualTo(1);
  }

  @Test
  public void intern_equalTypes_sharePartition() {
    var copy = InternType.of(String.class, Funnels.unencodedCharsFunnel());
    var handle = store.intern(InternType.STRINGS, "ab");

    assertThat(store.intern(copy, "ab").isSameSlot(handle)).isTrue();
    assertThat(store.size(copy)).isEqualTo(1);
    assertThat(store.values(copy)).containsExactly("ab");
  }

  @Test
  public void intern_collision_unifiesIntoFirst() {
    var first = new Collider(7, "first");
    var second = new Collider(7, "second");
    assertThat(first).isNotEqualTo(second);

    var h1 = store.intern(COLLIDERS, first);
    var h2 = store.intern(COLLIDERS, second);

    assertThat(h2.isSameSlot(h1)).isTrue();
    assertThat(h2.get()).isSameInstanceAs(first);
    assertThat(h2.get().payload()).isEqualTo("first");
    assertThat(h2.valueEquals(second)).isFalse();
    assertThat(store.size(COLLIDERS)).isEqualTo(1);
  }

  @Test
  public void intern_funnelFailure_propagates() {
    var failure = new IllegalStateException();
    Funnel<String> broken = (value, into) -> {
      throw failure;
    };
    var type = InternType.of(String.class, broken);

    var thrown = expectThrows(IllegalStateException.class, () -> store.intern(type, "a"));
    assertThat(thrown).isSameInstanceAs(failure);
    assertThat(store.size()).isEqualTo(0);
  }

  @Test(dataProvider = "strategies")
  public void intern_hashStrategy(HashStrategy strategy) {
    var local = InternStore.from("leakDetection=false, hash=" + strategy.key());
    assertThat(local.spec().hashStrategy()).isEqualTo(strategy);

    var a = local.intern(InternType.STRINGS, "alpha");
    var b = local.intern(InternType.STRINGS, new String("alpha"));
    var c = local.intern(InternType.STRINGS, "beta");
    assertThat(a.isSameSlot(b)).isTrue();
    assertThat(a.isSameSlot(c)).isFalse();
  }

  @Test
  public void gc_empty() {
    assertThat(store.gc()).isEqualTo(0);
    assertThat(store.size()).isEqualTo(0);
  }

  @Test
  public void gc_noHandles_removesAll() {
    store.intern(WORDS, new Word("a")).close();
    store.intern(LABELS, new Label("b")).close();
    store.intern(InternType.LONGS, 1L).close();

    assertThat(store.gc()).isEqualTo(3);
    assertThat(store.size()).isEqualTo(0);
    assertThat(store.size(WORDS)).isEqualTo(0);
  }

  @Test
  public void gc_reclaim_thenIntern_createsNewSlot() {
    var first = store.intern(WORDS, new Word("a"));
    first.close();
    assertThat(store.size(WORDS)).isEqualTo(1);

    assertThat(store.gc()).isEqualTo(1);
    assertThat(store.size(WORDS)).isEqualTo(0);

    var replacement = new Word("a");
    var second = store.intern(WORDS, replacement);
    assertThat(store.size(WORDS)).isEqualTo(1);
    assertThat(second.isSameSlot(first)).isFalse();
    assertThat(second.get()).isSameInstanceAs(replacement);
  }

  @Test
  public void gc_keepsReferenced() {
    var held = store.intern(WORDS, new Word("held"));
    store.intern(WORDS, new Word("free")).close();

    assertThat(store.gc()).isEqualTo(1);
    assertThat(store.values(WORDS)).containsExactly(new Word("held"));
    assertThat(held.shareCount()).isEqualTo(2);
  }

  @Test
  public void gc_handleRemainsValid() {
    var value = new Word("alive");
    var handle = store.intern(WORDS, value);
    for (int i = 0; i < 5; i++) {
      assertThat(store.gc()).isEqualTo(0);
      assertThat(handle.get()).isSameInstanceAs(value);
    }
    assertThat(store.intern(WORDS, new Word("alive")).isSameSlot(handle)).isTrue();
  }

  @Test
  public void clear_handlesRemainValid() {
    var value = new Word("a");
    var handle = store.intern(WORDS, value);
    assertThat(handle.shareCount()).isEqualTo(2);

    store.clear();
    assertThat(store.size()).isEqualTo(0);
    assertThat(handle.shareCount()).isEqualTo(1);
    assertThat(handle.get()).isSameInstanceAs(value);

    var next = store.intern(WORDS, new Word("a"));
    assertThat(next.isSameSlot(handle)).isFalse();
    assertThat(store.size(WORDS)).isEqualTo(1);

    handle.close();
    assertThat(handle.shareCount()).isEqualTo(0);
    assertThat(store.gc()).isEqualTo(0);
  }

  @Test
  public void size_unknownPartition() {
    assertThat(store.size(InternType.INTEGERS)).isEqualTo(0);
    assertThat(store.values(InternType.INTEGERS)).isEmpty();
  }

  @Test
  public void values() {
    var a = new Word("a");
    store.intern(WORDS, a);
    store.intern(WORDS, new Word("a"));
    store.intern(WORDS, new Word("b"));

    assertThat(store.values(WORDS)).hasSize(2);
    assertThat(store.values(WORDS)).contains(a);
    assertThat(store.values(LABELS)).isEmpty();
  }

  @Test
  public void stats() {
    var a = store.intern(WORDS, new Word("a"));
    store.intern(WORDS, new Word("a")).close();
    store.intern(WORDS, new Word("b")).close();
    assertThat(store.stats()).isEqualTo(InternStats.of(1, 2, 0));

    assertThat(store.gc()).isEqualTo(1);
    assertThat(store.stats()).isEqualTo(InternStats.of(1, 2, 1));
    a.close();
  }

  @Test
  public void stats_disabled() {
    var local = InternStore.create();
    local.intern(WORDS, new Word("a")).close();
    assertThat(local.stats()).isEqualTo(InternStats.empty());
  }

  @Test
  public void create_defaults() {
    var local = InternStore.create();
    assertThat(local.spec().hashStrategy()).isEqualTo(HashStrategy.FARM_HASH_64);
    assertThat(local.spec().leakDetection()).isTrue();
    assertThat(local.spec().recordStats()).isFalse();
    assertThat(local.toString()).isEqualTo("InternStore{spec=, partitions=0, size=0}");
  }

  @Test
  public void from_malformed() {
    assertThrows(IllegalArgumentException.class, () -> InternStore.from("hash=md5"));
  }

  @DataProvider(name = "strategies")
  public Object[] providesStrategies() {
    return HashStrategy.values();
  }
}
