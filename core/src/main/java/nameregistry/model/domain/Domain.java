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

package nameregistry.model.domain;

import static com.google.common.base.Preconditions.checkNotNull;

import nameregistry.model.Identity;
import org.joda.time.DateTime;

/**
 * The current registration of a canonical domain key.
 *
 * <p>A domain is never partially updated: every claim, transfer and revocation replaces the whole
 * record. Whether the registration is still in force depends on the time it is looked at, so the
 * record itself carries no status; see {@code DomainAuthorizationGuard} for the comparisons each
 * operation uses against {@link #validUntil()}.
 */
public record Domain(String domainName, Identity owner, DateTime validUntil, DateTime updatedAt) {

  public Domain {
    checkNotNull(domainName, "domainName");
    checkNotNull(owner, "owner");
    checkNotNull(validUntil, "validUntil");
    checkNotNull(updatedAt, "updatedAt");
  }

  /** Returns a copy of this domain owned by {@code newOwner}, updated at {@code now}. */
  public Domain withOwner(Identity newOwner, DateTime now) {
    return new Domain(domainName, newOwner, validUntil, now);
  }

  /** Returns a copy of this domain whose validity ends at {@code newValidUntil}. */
  public Domain withValidUntil(DateTime newValidUntil, DateTime now) {
    return new Domain(domainName, owner, newValidUntil, now);
  }
}
