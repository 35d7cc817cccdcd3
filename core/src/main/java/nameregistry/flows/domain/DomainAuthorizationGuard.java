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

import static nameregistry.util.DateTimeUtils.isAtOrAfter;
import static nameregistry.util.DateTimeUtils.isBeforeOrAt;

import java.util.Optional;
import nameregistry.flows.CallContext;
import nameregistry.flows.exceptions.CallerNotCanisterOwnerException;
import nameregistry.flows.exceptions.CallerNotDomainOwnerException;
import nameregistry.flows.exceptions.DomainAlreadyClaimedException;
import nameregistry.flows.exceptions.DomainOwnershipExpiredException;
import nameregistry.flows.exceptions.DomainReservedException;
import nameregistry.flows.exceptions.DomainStillValidException;
import nameregistry.model.RegistryAdmin;
import nameregistry.model.domain.Domain;
import nameregistry.model.domain.Reservation;
import org.joda.time.DateTime;

/**
 * Static utility functions deciding whether a caller may perform an operation on a domain.
 *
 * <p>None of these write anything. Note that the three time comparisons differ at the instant a
 * domain's validity ends: at exactly {@code validUntil} it can no longer be claimed by someone
 * else, it can already be revoked by anyone, and it can still be transferred by its owner.
 */
public final class DomainAuthorizationGuard {

  private DomainAuthorizationGuard() {}

  /** Verifies that the caller is the registry's administrative identity. */
  public static void verifyCallerIsAdmin(CallContext ctx, RegistryAdmin admin)
      throws CallerNotCanisterOwnerException {
    if (!admin.isAdmin(ctx.caller())) {
      throw new CallerNotCanisterOwnerException(ctx.caller());
    }
  }

  /** Verifies that a key can be reserved, which is only the case if it has never been claimed. */
  public static void verifyReservable(Optional<Domain> existing)
      throws DomainAlreadyClaimedException {
    if (existing.isPresent()) {
      throw new DomainAlreadyClaimedException(existing.get().owner());
    }
  }

  /**
   * Verifies that the caller can claim a key.
   *
   * <p>The key must not be held by an unexpired registration, and any reservation on it must be for
   * the caller.
   */
  public static void verifyCanClaim(
      CallContext ctx, Optional<Domain> existing, Optional<Reservation> reservation)
      throws DomainAlreadyClaimedException, DomainReservedException {
    if (existing.isPresent() && !isClaimable(existing.get(), ctx.now())) {
      throw new DomainAlreadyClaimedException(existing.get().owner());
    }
    if (reservation.isPresent() && !reservation.get().isHeldFor(ctx.caller())) {
      throw new DomainReservedException(reservation.get().reservedFor());
    }
  }

  /** Verifies that the caller can revoke a domain: its owner always can, others once it lapsed. */
  public static void verifyCanRevoke(CallContext ctx, Domain domain)
      throws DomainStillValidException {
    if (!domain.owner().equals(ctx.caller()) && !isBeforeOrAt(domain.validUntil(), ctx.now())) {
      throw new DomainStillValidException(domain.owner());
    }
  }

  /** Verifies that the caller owns a domain that has not expired. */
  public static void verifyCanTransfer(CallContext ctx, Domain domain)
      throws CallerNotDomainOwnerException, DomainOwnershipExpiredException {
    if (!domain.owner().equals(ctx.caller())) {
      throw new CallerNotDomainOwnerException(ctx.caller());
    }
    if (domain.validUntil().isBefore(ctx.now())) {
      throw new DomainOwnershipExpiredException(domain.owner());
    }
  }

  /** Returns whether the registration has lapsed, so that anyone may claim the key. */
  public static boolean isClaimable(Domain domain, DateTime now) {
    return !isAtOrAfter(domain.validUntil(), now);
  }
}
