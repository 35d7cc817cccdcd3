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

import static nameregistry.flows.domain.DomainAuthorizationGuard.verifyCanRevoke;
import static nameregistry.flows.domain.DomainFlowUtils.loadAndVerifyExistence;
import static nameregistry.util.DateTimeUtils.START_OF_TIME;

import com.google.common.flogger.FluentLogger;
import jakarta.inject.Inject;
import java.util.Optional;
import nameregistry.flows.CallContext;
import nameregistry.flows.RegistryException;
import nameregistry.model.domain.Domain;
import nameregistry.model.domain.DomainDao;
import nameregistry.model.history.DomainHistory;
import nameregistry.persistence.transaction.EntityChanges;
import nameregistry.persistence.transaction.TransactionManager;

/**
 * A flow that ends a domain's registration immediately.
 *
 * <p>The owner may revoke at any time; anyone else only once the registration has lapsed. The
 * record keeps its owner, so lookups still return it, but its validity is set to {@link
 * nameregistry.util.DateTimeUtils#START_OF_TIME} and the key becomes claimable at once.
 *
 * @error {@link nameregistry.flows.exceptions.InvalidDomainKeyException}
 * @error {@link nameregistry.flows.exceptions.DomainNotFoundException}
 * @error {@link nameregistry.flows.exceptions.DomainStillValidException}
 */
public final class DomainRevokeFlow {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final DomainKeyValidator domainKeyValidator;
  private final DomainDao domainDao;
  private final TransactionManager tm;

  @Inject
  DomainRevokeFlow(
      DomainKeyValidator domainKeyValidator, DomainDao domainDao, TransactionManager tm) {
    this.domainKeyValidator = domainKeyValidator;
    this.domainDao = domainDao;
    this.tm = tm;
  }

  /** Revokes the domain with the given key and returns the key. */
  public String run(CallContext ctx, String domainKey) throws RegistryException {
    domainKeyValidator.validateKey(domainKey);
    Domain existing = loadAndVerifyExistence(domainDao, domainKey);
    verifyCanRevoke(ctx, existing);

    Domain newDomain = existing.withValidUntil(START_OF_TIME, ctx.now());
    tm.commit(
        EntityChanges.newBuilder()
            .addHistoryEntry(
                DomainHistory.of(
                    DomainHistory.Type.REVOKE, ctx.caller(), Optional.of(existing), newDomain))
            .addDomainUpdate(newDomain)
            .build());
    logger.atInfo().log("Revoked %s (owner %s) by %s.", domainKey, existing.owner(), ctx.caller());
    return domainKey;
  }
}
