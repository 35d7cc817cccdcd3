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
import static nameregistry.util.DateTimeUtils.START_OF_TIME;
import static org.junit.jupiter.api.Assertions.assertThrows;

import nameregistry.flows.exceptions.DomainNotFoundException;
import nameregistry.flows.exceptions.InvalidDomainKeyException;
import nameregistry.model.domain.Reservation;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link DomainCheckFlow}. */
class DomainCheckFlowTest extends DomainFlowTestCase {

  private final DomainCheckFlow flow = new DomainCheckFlow(domainKeyValidator, domainDao);

  @Test
  void testActiveDomain() throws Exception {
    persistDomain("alice.icp", ALICE, START.plusMillis(1));
    assertThat(flow.run(callAs(BOB), "alice.icp")).isFalse();
  }

  @Test
  void testExactlyAtExpiry() throws Exception {
    persistDomain("alice.icp", ALICE, START);
    assertThat(flow.run(callAs(BOB), "alice.icp")).isFalse();
    clock.advanceOneMilli();
    assertThat(flow.run(callAs(BOB), "alice.icp")).isTrue();
  }

  @Test
  void testRevokedDomain() throws Exception {
    persistDomain("alice.icp", ALICE, START_OF_TIME);
    assertThat(flow.run(callAs(ALICE), "alice.icp")).isTrue();
  }

  @Test
  void testFailure_neverClaimed() {
    reservationDao.put(new Reservation("alice.icp", ALICE));
    assertThrows(DomainNotFoundException.class, () -> flow.run(callAs(ALICE), "alice.icp"));
  }

  @Test
  void testFailure_invalidKey() {
    assertThrows(InvalidDomainKeyException.class, () -> flow.run(callAs(ALICE), "aliceicp"));
  }
}
