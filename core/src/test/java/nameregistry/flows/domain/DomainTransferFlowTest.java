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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import nameregistry.flows.exceptions.CallerNotDomainOwnerException;
import nameregistry.flows.exceptions.DomainNotFoundException;
import nameregistry.flows.exceptions.DomainOwnershipExpiredException;
import nameregistry.flows.exceptions.InvalidDomainKeyException;
import nameregistry.model.Identity;
import nameregistry.model.domain.Domain;
import nameregistry.model.history.DomainHistory;
import org.joda.time.Duration;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link DomainTransferFlow}. */
class DomainTransferFlowTest extends DomainFlowTestCase {

  private final DomainTransferFlow flow =
      new DomainTransferFlow(domainKeyValidator, domainDao, tm);

  private String transfer(Identity caller, String domainKey, Identity newOwner) throws Exception {
    return runFlow(() -> flow.run(callAs(caller), domainKey, newOwner));
  }

  @Test
  void testSuccess() throws Exception {
    persistDomain("alice.icp", ALICE, START.plusDays(30));
    clock.advanceBy(Duration.standardDays(1));

    assertThat(transfer(ALICE, "alice.icp", BOB)).isEqualTo("alice.icp");

    assertThat(domainDao.load("alice.icp"))
        .hasValue(new Domain("alice.icp", BOB, START.plusDays(30), clock.nowUtc()));
    DomainHistory entry = historyOf("alice.icp").get(1);
    assertThat(entry.type()).isEqualTo(DomainHistory.Type.TRANSFER);
    assertThat(entry.actor()).isEqualTo(ALICE);
    assertThat(entry.getPreviousOwner()).hasValue(ALICE);
    assertThat(entry.owner()).isEqualTo(BOB);
    assertThat(entry.validUntil()).isEqualTo(START.plusDays(30));
  }

  @Test
  void testSuccess_exactlyAtExpiry() throws Exception {
    persistDomain("alice.icp", ALICE, START);
    transfer(ALICE, "alice.icp", BOB);
    assertThat(domainDao.load("alice.icp").get().owner()).isEqualTo(BOB);
  }

  @Test
  void testSuccess_toSelf() throws Exception {
    persistDomain("alice.icp", ALICE, START.plusDays(1));
    transfer(ALICE, "alice.icp", ALICE);
    assertThat(domainDao.load("alice.icp").get().owner()).isEqualTo(ALICE);
    assertThat(historyOf("alice.icp")).hasSize(2);
  }

  @Test
  void testFailure_notOwner() {
    Domain existing = persistDomain("alice.icp", ALICE, START.plusDays(1));
    CallerNotDomainOwnerException thrown =
        assertThrows(
            CallerNotDomainOwnerException.class, () -> transfer(BOB, "alice.icp", BOB));
    assertThat(thrown.getCaller()).isEqualTo(BOB);
    assertThat(domainDao.load("alice.icp")).hasValue(existing);
    assertThat(historyOf("alice.icp")).hasSize(1);
  }

  @Test
  void testFailure_expired() {
    persistDomain("alice.icp", ALICE, START);
    clock.advanceOneMilli();
    DomainOwnershipExpiredException thrown =
        assertThrows(
            DomainOwnershipExpiredException.class, () -> transfer(ALICE, "alice.icp", BOB));
    assertThat(thrown.getOwner()).isEqualTo(ALICE);
  }

  @Test
  void testFailure_notOwnerCheckedBeforeExpiry() {
    persistDomain("alice.icp", ALICE, START.minusDays(1));
    assertThrows(CallerNotDomainOwnerException.class, () -> transfer(BOB, "alice.icp", BOB));
  }

  @Test
  void testFailure_notFound() {
    assertThrows(DomainNotFoundException.class, () -> transfer(ALICE, "alice.icp", BOB));
  }

  @Test
  void testFailure_invalidKey() {
    assertThrows(InvalidDomainKeyException.class, () -> transfer(ALICE, "ab.icp", BOB));
  }
}
