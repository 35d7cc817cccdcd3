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

/** An administrative hold on a domain key for one identity's exclusive future claim. */
public record Reservation(String domainName, Identity reservedFor) {

  public Reservation {
    checkNotNull(domainName, "domainName");
    checkNotNull(reservedFor, "reservedFor");
  }

  /** Whether this reservation lets {@code caller} claim the domain. */
  public boolean isHeldFor(Identity caller) {
    return reservedFor.equals(caller);
  }
}
