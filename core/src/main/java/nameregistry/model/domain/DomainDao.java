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

package nameregistry.model.domain;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import jakarta.inject.Inject;
import java.util.Optional;
import nameregistry.model.Identity;
import nameregistry.persistence.KeyValueStore;

/** Data access object for {@link Domain} records, keyed by canonical domain name. */
public class DomainDao {

  private final KeyValueStore<Domain> store;

  @Inject
  public DomainDao(KeyValueStore<Domain> store) {
    this.store = store;
  }

  public Optional<Domain> load(String domainName) {
    return store.get(domainName);
  }

  public boolean exists(String domainName) {
    return store.containsKey(domainName);
  }

  public void put(Domain domain) {
    store.put(domain.domainName(), domain);
  }

  /** Puts back {@code previous} under {@code domainName}, or removes the record if it is empty. */
  public void restore(String domainName, Optional<Domain> previous) {
    if (previous.isPresent()) {
      store.put(domainName, previous.get());
    } else {
      store.remove(domainName);
    }
  }

  /**
   * Returns the names of all domains currently recorded as owned by {@code owner}, in key order.
   *
   * <p>Expired and revoked domains keep their last owner until they are claimed again, so they are
   * included. This scans every record.
   */
  public ImmutableList<String> loadDomainNamesOwnedBy(Identity owner) {
    return store.entries().values().stream()
        .filter(domain -> domain.owner().equals(owner))
        .map(Domain::domainName)
        .collect(toImmutableList());
  }
}
