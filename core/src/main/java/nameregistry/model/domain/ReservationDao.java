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

import jakarta.inject.Inject;
import java.util.Optional;
import nameregistry.persistence.KeyValueStore;

/** Data access object for {@link Reservation}s. */
public class ReservationDao {

  private final KeyValueStore<Reservation> store;

  @Inject
  public ReservationDao(KeyValueStore<Reservation> store) {
    this.store = store;
  }

  public Optional<Reservation> load(String domainName) {
    return store.get(domainName);
  }

  public void put(Reservation reservation) {
    store.put(reservation.domainName(), reservation);
  }

  public void delete(String domainName) {
    store.remove(domainName);
  }

  public void restore(String domainName, Optional<Reservation> previous) {
    if (previous.isPresent()) {
      store.put(domainName, previous.get());
    } else {
      store.remove(domainName);
    }
  }
}
