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

import static com.google.common.base.Preconditions.checkArgument;
import static nameregistry.flows.domain.DomainAuthorizationGuard.verifyCanClaim;

import com.google.common.flogger.FluentLogger;
import jakarta.inject.Inject;
import java.util.Optional;
import nameregistry.config.RegistryConfig.Config;
import nameregistry.flows.CallContext;
import nameregistry.flows.RegistryException;
import nameregistry.flows.exceptions.InvalidDurationException;
import nameregistry.model.domain.Domain;
import nameregistry.model.domain.DomainDao;
import nameregistry.model.domain.Reservation;
import nameregistry.model.domain.ReservationDao;
import nameregistry.model.history.DomainHistory;
import nameregistry.persistence.transaction.EntityChanges;
import nameregistry.persistence.transaction.TransactionManager;
import org.joda.time.Duration;

/**
 * A flow that registers a domain to the caller for a period of time.
 *
 * <p>A key can be claimed if it has no record, or if its previous registration has lapsed; the
 * previous owner keeps no privilege over it. If the key is reserved it can only be claimed by the
 * identity it is reserved for, and the reservation is removed by the claim.
 *
 * @error {@link nameregistry.flows.exceptions.InvalidDurationException}
 * @error {@link nameregistry.flows.exceptions.InvalidDomainNameLengthException}
 * @error {@link nameregistry.flows.exceptions.InvalidDomainExtensionException}
 * @error {@link nameregistry.flows.exceptions.InvalidDomainKeyException}
 * @error {@link nameregistry.flows.exceptions.DomainAlreadyClaimedException}
 * @error {@link nameregistry.flows.exceptions.DomainReservedException}
 */
public final class DomainClaimFlow {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final DomainKeyValidator domainKeyValidator;
  private final DomainDao domainDao;
  private final ReservationDao reservationDao;
  private final TransactionManager tm;
  private final Duration minClaimDuration;
  private final Duration maxClaimDuration;

  @Inject
  DomainClaimFlow(
      DomainKeyValidator domainKeyValidator,
      DomainDao domainDao,
      ReservationDao reservationDao,
      TransactionManager tm,
      @Config("minClaimDuration") Duration minClaimDuration,
      @Config("maxClaimDuration") Duration maxClaimDuration) {
    checkArgument(
        minClaimDuration.isLongerThan(Duration.ZERO)
            && !minClaimDuration.isLongerThan(maxClaimDuration),
        "Invalid claim duration bounds [%s, %s]",
        minClaimDuration,
        maxClaimDuration);
    this.domainKeyValidator = domainKeyValidator;
    this.domainDao = domainDao;
    this.reservationDao = reservationDao;
    this.tm = tm;
    this.minClaimDuration = minClaimDuration;
    this.maxClaimDuration = maxClaimDuration;
  }

  /** Claims {@code name.extension} for the caller until {@code now + duration}. */
  public String run(CallContext ctx, String name, String extension, Duration duration)
      throws RegistryException {
    verifyDuration(duration);
    String domainKey = domainKeyValidator.validate(name, extension);
    Optional<Domain> existing = domainDao.load(domainKey);
    Optional<Reservation> reservation = reservationDao.load(domainKey);
    verifyCanClaim(ctx, existing, reservation);

    Domain newDomain = new Domain(domainKey, ctx.caller(), ctx.now().plus(duration), ctx.now());
    EntityChanges.Builder changes =
        EntityChanges.newBuilder()
            .addHistoryEntry(
                DomainHistory.of(DomainHistory.Type.CLAIM, ctx.caller(), existing, newDomain))
            .addDomainUpdate(newDomain);
    if (reservation.isPresent()) {
      changes.addReservationDelete(domainKey);
    }
    tm.commit(changes.build());
    logger.atInfo().log(
        "Claimed %s for %s until %s.", domainKey, ctx.caller(), newDomain.validUntil());
    return domainKey;
  }

  private void verifyDuration(Duration duration) throws InvalidDurationException {
    if (duration.isShorterThan(minClaimDuration) || duration.isLongerThan(maxClaimDuration)) {
      throw new InvalidDurationException(duration);
    }
  }
}
