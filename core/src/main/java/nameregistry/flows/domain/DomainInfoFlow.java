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

import static nameregistry.flows.domain.DomainFlowUtils.loadAndVerifyExistence;

import com.google.common.collect.ImmutableList;
import jakarta.inject.Inject;
import nameregistry.flows.RegistryException;
import nameregistry.flows.exceptions.DomainNotFoundException;
import nameregistry.model.Identity;
import nameregistry.model.domain.Domain;
import nameregistry.model.domain.DomainDao;
import nameregistry.model.history.DomainHistory;
import nameregistry.model.history.HistoryLedger;

/**
 * A flow that returns information about a domain.
 *
 * <p>Reads are open to everyone and return records whether or not they have expired.
 *
 * @error {@link nameregistry.flows.exceptions.InvalidDomainKeyException}
 * @error {@link nameregistry.flows.exceptions.DomainNotFoundException}
 */
public final class DomainInfoFlow {

  private final DomainKeyValidator domainKeyValidator;
  private final DomainDao domainDao;
  private final HistoryLedger historyLedger;

  @Inject
  DomainInfoFlow(
      DomainKeyValidator domainKeyValidator, DomainDao domainDao, HistoryLedger historyLedger) {
    this.domainKeyValidator = domainKeyValidator;
    this.domainDao = domainDao;
    this.historyLedger = historyLedger;
  }

  /** Returns the current record of the domain. */
  public Domain getDomain(String domainKey) throws RegistryException {
    domainKeyValidator.validateKey(domainKey);
    return loadAndVerifyExistence(domainDao, domainKey);
  }

  /** Returns every history entry of the domain, oldest first. */
  public ImmutableList<DomainHistory> getDomainHistory(String domainKey)
      throws RegistryException {
    domainKeyValidator.validateKey(domainKey);
    return historyLedger
        .read(domainKey)
        .orElseThrow(() -> new DomainNotFoundException(domainKey));
  }

  /** Returns the owner recorded on the domain, which for a lapsed domain is its last owner. */
  public Identity lookup(String domainKey) throws RegistryException {
    return getDomain(domainKey).owner();
  }
}
