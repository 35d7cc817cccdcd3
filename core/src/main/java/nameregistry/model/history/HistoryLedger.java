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

package nameregistry.model.history;

import com.google.common.collect.ImmutableList;
import jakarta.inject.Inject;
import java.util.Optional;
import nameregistry.persistence.KeyValueStore;

/**
 * Append-only store of {@link DomainHistory} entries, one list per domain name.
 *
 * <p>Entries are kept in the order they were appended. They are never edited or removed, except
 * when {@link #restore} undoes the appends of a commit that failed part-way. The store has no
 * partial-update primitive, so each append reads the list and writes the whole of it back; this is
 * linear in the length of a domain's history.
 */
public class HistoryLedger {

  private final KeyValueStore<ImmutableList<DomainHistory>> store;

  @Inject
  public HistoryLedger(KeyValueStore<ImmutableList<DomainHistory>> store) {
    this.store = store;
  }

  /** Appends {@code entry} to the history of its domain. */
  public void append(DomainHistory entry) {
    ImmutableList<DomainHistory> existing =
        store.get(entry.domainName()).orElse(ImmutableList.of());
    store.put(
        entry.domainName(),
        ImmutableList.<DomainHistory>builderWithExpectedSize(existing.size() + 1)
            .addAll(existing)
            .add(entry)
            .build());
  }

  /**
   * Sets the history of {@code domainName} back to {@code previous}, as read before a failed
   * commit, removing it entirely if {@code previous} is empty.
   */
  public void restore(String domainName, Optional<ImmutableList<DomainHistory>> previous) {
    if (previous.isPresent()) {
      store.put(domainName, previous.get());
    } else {
      store.remove(domainName);
    }
  }

  /** Returns the full history of a domain, or empty if it has never been claimed. */
  public Optional<ImmutableList<DomainHistory>> read(String domainName) {
    return store.get(domainName);
  }
}
