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

package nameregistry.flows;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.logging.Level;
import nameregistry.flows.domain.DomainCheckFlow;
import nameregistry.flows.domain.DomainClaimFlow;
import nameregistry.flows.domain.DomainInfoFlow;
import nameregistry.flows.domain.DomainReserveFlow;
import nameregistry.flows.domain.DomainReverseLookupFlow;
import nameregistry.flows.domain.DomainRevokeFlow;
import nameregistry.flows.domain.DomainTransferFlow;
import nameregistry.flows.exceptions.UnknownErrorException;
import nameregistry.model.Identity;
import nameregistry.model.RegistryAdmin;
import nameregistry.model.domain.Domain;
import nameregistry.model.history.DomainHistory;
import nameregistry.persistence.transaction.TransactionManager;
import nameregistry.persistence.transaction.TransactionManager.TransactionalWork;
import org.joda.time.Duration;

/**
 * The registry engine: every operation the registry offers to its callers.
 *
 * <p>Each operation runs in its own transaction, so operations never interleave. An operation
 * either succeeds and commits all of its changes, or throws a {@link RegistryException} and
 * changes nothing. Unexpected runtime failures are reported as {@link UnknownErrorException}.
 *
 * <p>Null arguments and misuse of {@link #init} are programming errors and fail fast with the usual
 * unchecked exceptions.
 */
@Singleton
public class DomainRegistry {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final TransactionManager tm;
  private final RegistryAdmin registryAdmin;
  private final DomainReserveFlow reserveFlow;
  private final DomainClaimFlow claimFlow;
  private final DomainRevokeFlow revokeFlow;
  private final DomainTransferFlow transferFlow;
  private final DomainInfoFlow infoFlow;
  private final DomainCheckFlow checkFlow;
  private final DomainReverseLookupFlow reverseLookupFlow;

  @Inject
  public DomainRegistry(
      TransactionManager tm,
      RegistryAdmin registryAdmin,
      DomainReserveFlow reserveFlow,
      DomainClaimFlow claimFlow,
      DomainRevokeFlow revokeFlow,
      DomainTransferFlow transferFlow,
      DomainInfoFlow infoFlow,
      DomainCheckFlow checkFlow,
      DomainReverseLookupFlow reverseLookupFlow) {
    this.tm = tm;
    this.registryAdmin = registryAdmin;
    this.reserveFlow = reserveFlow;
    this.claimFlow = claimFlow;
    this.revokeFlow = revokeFlow;
    this.transferFlow = transferFlow;
    this.infoFlow = infoFlow;
    this.checkFlow = checkFlow;
    this.reverseLookupFlow = reverseLookupFlow;
  }

  /**
   * Makes the caller the administrative identity of a newly created registry.
   *
   * @throws IllegalStateException if the registry has already been initialized
   */
  public void init(CallContext ctx) {
    checkNotNull(ctx, "ctx");
    tm.transact(
        "init",
        () -> {
          registryAdmin.initialize(ctx.caller());
          return null;
        });
  }

  /** Whether an administrative identity has been recorded, here or in the persisted state. */
  public boolean isInitialized() {
    return tm.transact("isInitialized", registryAdmin::isInitialized);
  }

  /** Reserves {@code name.extension} for {@code reservedFor}. Only the administrator may do so. */
  public String reserve(CallContext ctx, String name, String extension, Identity reservedFor)
      throws RegistryException {
    checkNotNull(ctx, "ctx");
    checkNotNull(name, "name");
    checkNotNull(extension, "extension");
    checkNotNull(reservedFor, "reservedFor");
    return runMutation("reserve", () -> reserveFlow.run(ctx, name, extension, reservedFor));
  }

  /** Claims {@code name.extension} for the caller for {@code duration}. */
  public String claim(CallContext ctx, String name, String extension, Duration duration)
      throws RegistryException {
    checkNotNull(ctx, "ctx");
    checkNotNull(name, "name");
    checkNotNull(extension, "extension");
    checkNotNull(duration, "duration");
    return runMutation("claim", () -> claimFlow.run(ctx, name, extension, duration));
  }

  /** Ends the registration of a domain immediately. */
  public String revoke(CallContext ctx, String domainKey) throws RegistryException {
    checkNotNull(ctx, "ctx");
    checkNotNull(domainKey, "domainKey");
    return runMutation("revoke", () -> revokeFlow.run(ctx, domainKey));
  }

  /** Hands a domain owned by the caller over to {@code newOwner}. */
  public String transfer(CallContext ctx, String domainKey, Identity newOwner)
      throws RegistryException {
    checkNotNull(ctx, "ctx");
    checkNotNull(domainKey, "domainKey");
    checkNotNull(newOwner, "newOwner");
    return runMutation("transfer", () -> transferFlow.run(ctx, domainKey, newOwner));
  }

  public Domain getDomain(String domainKey) throws RegistryException {
    checkNotNull(domainKey, "domainKey");
    return runRead("getDomain", () -> infoFlow.getDomain(domainKey));
  }

  public ImmutableList<DomainHistory> getDomainHistory(String domainKey)
      throws RegistryException {
    checkNotNull(domainKey, "domainKey");
    return runRead("getDomainHistory", () -> infoFlow.getDomainHistory(domainKey));
  }

  /** Returns the owner recorded for a domain, whether or not its registration has lapsed. */
  public Identity lookup(String domainKey) throws RegistryException {
    checkNotNull(domainKey, "domainKey");
    return runRead("lookup", () -> infoFlow.lookup(domainKey));
  }

  /** Returns the keys of every domain recorded as owned by {@code owner}, in key order. */
  public ImmutableList<String> reverseLookup(Identity owner) throws RegistryException {
    checkNotNull(owner, "owner");
    return runRead("reverseLookup", () -> reverseLookupFlow.run(owner));
  }

  /** Returns whether an existing domain's registration has lapsed at the time of the call. */
  public boolean getIsClaimable(CallContext ctx, String domainKey) throws RegistryException {
    checkNotNull(ctx, "ctx");
    checkNotNull(domainKey, "domainKey");
    return runRead("getIsClaimable", () -> checkFlow.run(ctx, domainKey));
  }

  /**
   * Returns the administrative identity.
   *
   * <p>A registry obtained from {@link nameregistry.module.RegistryComponent#create(Identity)} is
   * always initialized.
   *
   * @throws IllegalStateException if the registry has not been initialized
   */
  public Identity getCanisterOwner() {
    return tm.transact(
        "getCanisterOwner",
        () ->
            registryAdmin
                .get()
                .orElseThrow(() -> new IllegalStateException("Registry has not been initialized")));
  }

  /** Returns the identity the execution environment attributes the call to. */
  public Identity getCaller(CallContext ctx) {
    return checkNotNull(ctx, "ctx").caller();
  }

  private <T> T runMutation(String operation, TransactionalWork<T, RegistryException> work)
      throws RegistryException {
    return runFlow(operation, Level.WARNING, work);
  }

  private <T> T runRead(String operation, TransactionalWork<T, RegistryException> work)
      throws RegistryException {
    return runFlow(operation, Level.FINE, work);
  }

  private <T> T runFlow(
      String operation, Level rejectionLevel, TransactionalWork<T, RegistryException> work)
      throws RegistryException {
    try {
      return tm.transact(operation, work);
    } catch (RegistryException e) {
      logger.at(rejectionLevel).log(
          "%s rejected with %s: %s", operation, e.getErrorCode(), e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      logger.atSevere().withCause(e).log("Unexpected error during %s.", operation);
      throw UnknownErrorException.wrap(operation, e);
    }
  }
}
