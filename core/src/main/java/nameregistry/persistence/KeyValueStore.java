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

import com.google.common.collect.ImmutableSortedMap;
import java.util.Optional;

/**
 * An ordered map from string keys to values that outlives the registry process.
 *
 * <p>There are no multi-key transactions and no secondary indexes; callers serialize access
 * through {@link nameregistry.persistence.transaction.TransactionManager}. Implementations must
 * not hand out values that can be mutated behind the store's back, so values are expected to be
 * immutable.
 */
public interface KeyValueStore<V> {

  /** Returns the value stored under {@code key}, if any. */
  Optional<V> get(String key);

  /** Whether a value is stored under {@code key}. */
  default boolean containsKey(String key) {
    return get(key).isPresent();
  }

  /** Inserts or replaces the value stored under {@code key}. */
  void put(String key, V value);

  /** Removes the value stored under {@code key}; a no-op if there is none. */
  void remove(String key);

  /** Returns a snapshot of every entry, in key order. */
  ImmutableSortedMap<String, V> entries();
}
