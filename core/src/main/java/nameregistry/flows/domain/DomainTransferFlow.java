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

import static nameregistry.flows.domain.DomainAuthorizationGuard.verifyCanTransfer;
import static nameregistry.flows.domain.DomainFlowUtils.loadAndVerifyExistence;

import com.google.common.flogger.FluentLogger;
import jakarta.inject.Inject;
import java.util.Optional;
import nameregistry.flows.CallContext;
import nameregistry.flows.RegistryException;
import nameregistry.model.Identity;
import nameregistry.model.domain.Domain;
import nameregistry.model.domain.DomainDao;
import nameregistry.model.history.DomainHistory;
import nameregistry.persistence.transaction.EntityChanges;
import nameregistry.persistence.transaction.TransactionManager;

/**
 * A flow that hands an unexpired domain over to a new owner.
 *
 * <p>The registration period is unchanged. Transferring to the current owner is allowed and is
 * recorded like any other transfer.
 *
 * @error {@link nameregistry.flows.exceptions.InvalidDomainKeyException}
 * @error {@link nameregistry.flows.exceptions.DomainNotFoundException}
 * @error {@link nameregistry.flows.exceptions.CallerNotDomainOwnerException}
 * @error {@link nameregistry.flows.exceptions.DomainOwnershipExpiredException}
 */
public final class DomainTransferFlow {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final DomainKeyValidator domainKeyValidator;
  private final DomainDao domainDao;
  private final TransactionManager tm;

  @Inject
  DomainTransferFlow(
      DomainKeyValidator domainKeyValidator, DomainDao domainDao, TransactionManager tm) {
    this.domainKeyValidator = domainKeyValidator;
    this.domainDao = domainDao;
    this.tm = tm;
  }

  /** Transfers the domain with the given key to {@code newOwner} and returns the key. */
  public String run(CallContext ctx, String domainKey, Identity newOwner)
      throws RegistryException {
    domainKeyValidator.validateKey(domainKey);
    Domain existing = loadAndVerifyExistence(domainDao, domainKey);
    verifyCanTransfer(ctx, existing);

    Domain newDomain = existing.withOwner(newOwner, ctx.now());
    tm.commit(
        EntityChanges.newBuilder()
            .addHistoryEntry(
                DomainHistory.of(
                    DomainHistory.Type.TRANSFER, ctx.caller(), Optional.of(existing), newDomain))
            .addDomainUpdate(newDomain)
            .build());
    logger.atInfo().log("Transferred %s from %s to %s.", domainKey, existing.owner(), newOwner);
    return domainKey;
  }
}
