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

package nameregistry.model.history;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Optional;
import javax.annotation.Nullable;
import nameregistry.model.Identity;
import nameregistry.model.domain.Domain;
import org.joda.time.DateTime;

/**
 * An immutable audit record of one ownership-affecting change to a {@link Domain}.
 *
 * <p>{@code owner} and {@code validUntil} are the values on the domain after the change. {@code
 * actor} is whoever performed it, which for a revocation of an expired domain is not necessarily
 * the owner.
 */
public record DomainHistory(
    String domainName,
    Type type,
    Identity actor,
    @Nullable Identity previousOwner,
    Identity owner,
    DateTime validUntil,
    DateTime createdAt) {

  /** The kind of change a history entry records. */
  public enum Type {
    CLAIM,
    TRANSFER,
    REVOKE
  }

  public DomainHistory {
    checkNotNull(domainName, "domainName");
    checkNotNull(type, "type");
    checkNotNull(actor, "actor");
    checkNotNull(owner, "owner");
    checkNotNull(validUntil, "validUntil");
    checkNotNull(createdAt, "createdAt");
  }

  /** Creates the entry describing {@code newDomain}, the result of a change by {@code actor}. */
  public static DomainHistory of(
      Type type, Identity actor, Optional<Domain> previousDomain, Domain newDomain) {
    return new DomainHistory(
        newDomain.domainName(),
        type,
        actor,
        previousDomain.map(Domain::owner).orElse(null),
        newDomain.owner(),
        newDomain.validUntil(),
        newDomain.updatedAt());
  }

  public Optional<Identity> getPreviousOwner() {
    return Optional.ofNullable(previousOwner);
  }
}
