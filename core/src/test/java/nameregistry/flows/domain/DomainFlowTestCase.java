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

package nameregistry.flows.domain;

import static org.joda.time.DateTimeZone.UTC;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import nameregistry.flows.CallContext;
import nameregistry.flows.RegistryException;
import nameregistry.model.Identity;
import nameregistry.model.RegistryAdmin;
import nameregistry.model.domain.Domain;
import nameregistry.model.domain.DomainDao;
import nameregistry.model.domain.Reservation;
import nameregistry.model.domain.ReservationDao;
import nameregistry.model.history.DomainHistory;
import nameregistry.model.history.HistoryLedger;
import nameregistry.persistence.InMemoryKeyValueStore;
import nameregistry.persistence.transaction.TransactionManager;
import nameregistry.persistence.transaction.TransactionManager.TransactionalWork;
import nameregistry.testing.FakeClock;
import org.joda.time.DateTime;

/** Base class for tests of individual domain flows, backed by in-memory stores. */
abstract class DomainFlowTestCase {

  static final Identity ADMIN = Identity.of("admin");
  static final Identity ALICE = Identity.of("alice");
  static final Identity BOB = Identity.of("bob");

  static final DateTime START = new DateTime(2026, 1, 1, 0, 0, UTC);

  final FakeClock clock = new FakeClock(START);

  final InMemoryKeyValueStore<Domain> domainStore = new InMemoryKeyValueStore<>();
  final InMemoryKeyValueStore<ImmutableList<DomainHistory>> historyStore =
      new InMemoryKeyValueStore<>();
  final InMemoryKeyValueStore<Reservation> reservationStore = new InMemoryKeyValueStore<>();

  final DomainDao domainDao = new DomainDao(domainStore);
  final ReservationDao reservationDao = new ReservationDao(reservationStore);
  final HistoryLedger historyLedger = new HistoryLedger(historyStore);
  final RegistryAdmin registryAdmin = new RegistryAdmin(new InMemoryKeyValueStore<>());
  final TransactionManager tm = new TransactionManager(domainDao, reservationDao, historyLedger);
  final DomainKeyValidator domainKeyValidator =
      new DomainKeyValidator(ImmutableSet.of("icp", "ic", "moon"), 3, 40);

  CallContext callAs(Identity caller) {
    return CallContext.create(caller, clock);
  }

  /** Runs {@code work} the way the registry does, inside a transaction. */
  <T> T runFlow(TransactionalWork<T, RegistryException> work) throws RegistryException {
    return tm.transact("test", work);
  }

  /** Writes a domain record directly, bypassing flows, along with a matching claim entry. */
  Domain persistDomain(String domainKey, Identity owner, DateTime validUntil) {
    Domain domain = new Domain(domainKey, owner, validUntil, clock.nowUtc());
    historyLedger.append(
        new DomainHistory(
            domainKey,
            DomainHistory.Type.CLAIM,
            owner,
            null,
            owner,
            validUntil,
            clock.nowUtc()));
    domainDao.put(domain);
    return domain;
  }

  ImmutableList<DomainHistory> historyOf(String domainKey) {
    return historyLedger.read(domainKey).orElse(ImmutableList.of());
  }
}
