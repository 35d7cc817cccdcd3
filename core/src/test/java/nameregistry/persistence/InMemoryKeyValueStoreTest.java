// Copyright 2026 The Name Registry Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package nameregistry.persistence;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableSortedMap;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link InMemoryKeyValueStore}. */
class InMemoryKeyValueStoreTest {

  private final InMemoryKeyValueStore<String> store = new InMemoryKeyValueStore<>();

  @Test
  void testPutGetRemove() {
    assertThat(store.get("key")).isEmpty();
    store.put("key", "value");
    assertThat(store.get("key")).hasValue("value");
    assertThat(store.containsKey("key")).isTrue();
    store.put("key", "other");
    assertThat(store.get("key")).hasValue("other");
    store.remove("key");
    assertThat(store.containsKey("key")).isFalse();
  }

  @Test
  void testEntries_inKeyOrderAndDetached() {
    store.put("c", "3");
    store.put("a", "1");
    store.put("b", "2");
    ImmutableSortedMap<String, String> snapshot = store.entries();
    store.remove("a");
    assertThat(snapshot.keySet()).containsExactly("a", "b", "c").inOrder();
    assertThat(store.entries().keySet()).containsExactly("b", "c").inOrder();
  }

  @Test
  void testNullsRejected() {
    assertThrows(NullPointerException.class, () -> store.put("key", null));
    assertThrows(NullPointerException.class, () -> store.get(null));
  }
}
