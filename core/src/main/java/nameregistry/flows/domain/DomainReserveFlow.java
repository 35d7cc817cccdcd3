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

import static nameregistry.flows.domain.DomainAuthorizationGuard.verifyCallerIsAdmin;
import static nameregistry.flows.domain.DomainAuthorizationGuard.verifyReservable;

import com.google.common.flogger.FluentLogger;
import jakarta.inject.Inject;
import nameregistry.flows.CallContext;
import nameregistry.flows.RegistryException;
import nameregistry.model.Identity;
import nameregistry.model.RegistryAdmin;
import nameregistry.model.domain.DomainDao;
import nameregistry.model.domain.Reservation;
import nameregistry.persistence.transaction.EntityChanges;
import nameregistry.persistence.transaction.TransactionManager;

/**
 * A flow that holds an unclaimed domain for one identity's exclusive future claim.
 *
 * <p>Only the administrative identity may reserve. A key that has ever been claimed cannot be
 * reserved, even after it expires. Reserving an already reserved key replaces its target.
 *
 * @error {@link nameregistry.flows.exceptions.CallerNotCanisterOwnerException}
 * @error {@link nameregistry.flows.exceptions.InvalidDomainNameLengthException}
 * @error {@link nameregistry.flows.exceptions.InvalidDomainExtensionException}
 * @error {@link nameregistry.flows.exceptions.InvalidDomainKeyException}
 * @error {@link nameregistry.flows.exceptions.DomainAlreadyClaimedException}
 */
public final class DomainReserveFlow {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final DomainKeyValidator domainKeyValidator;
  private final RegistryAdmin registryAdmin;
  private final DomainDao domainDao;
  private final TransactionManager tm;

  @Inject
  DomainReserveFlow(
      DomainKeyValidator domainKeyValidator,
      RegistryAdmin registryAdmin,
      DomainDao domainDao,
      TransactionManager tm) {
    this.domainKeyValidator = domainKeyValidator;
    this.registryAdmin = registryAdmin;
    this.domainDao = domainDao;
    this.tm = tm;
  }

  /** Reserves {@code name.extension} for {@code reservedFor} and returns the canonical key. */
  public String run(CallContext ctx, String name, String extension, Identity reservedFor)
      throws RegistryException {
    verifyCallerIsAdmin(ctx, registryAdmin);
    String domainKey = domainKeyValidator.validate(name, extension);
    verifyReservable(domainDao.load(domainKey));
    tm.commit(
        EntityChanges.newBuilder()
            .addReservationInsert(new Reservation(domainKey, reservedFor))
            .build());
    logger.atInfo().log("Reserved %s for %s.", domainKey, reservedFor);
    return domainKey;
  }
}
