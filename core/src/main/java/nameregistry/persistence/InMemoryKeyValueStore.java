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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSortedMap;
import java.util.Optional;
import java.util.TreeMap;

/** A {@link KeyValueStore} held in memory; its contents do not survive a restart. */
public class InMemoryKeyValueStore<V> implements KeyValueStore<V> {

  private final TreeMap<String, V> entries = new TreeMap<>();

  @Override
  public synchronized Optional<V> get(String key) {
    return Optional.ofNullable(entries.get(checkNotNull(key, "key")));
  }

  @Override
  public synchronized void put(String key, V value) {
    entries.put(checkNotNull(key, "key"), checkNotNull(value, "value"));
  }

  @Override
  public synchronized void remove(String key) {
    entries.remove(checkNotNull(key, "key"));
  }

  @Override
  public synchronized ImmutableSortedMap<String, V> entries() {
    return ImmutableSortedMap.copyOfSorted(entries);
  }
}
