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

package nameregistry.flows.exceptions;

import static nameregistry.flows.RegistryException.ErrorCode.DOMAIN_STILL_VALID;

import nameregistry.flows.RegistryException;
import nameregistry.flows.RegistryException.RegistryErrorCode;
import nameregistry.model.Identity;

/** Thrown when someone other than the owner tries to revoke a domain that has not expired. */
@RegistryErrorCode(DOMAIN_STILL_VALID)
public class DomainStillValidException extends RegistryException {

  private final Identity owner;

  public DomainStillValidException(Identity owner) {
    super(String.format("Domain is still validly owned by %s", owner));
    this.owner = owner;
  }

  public Identity getOwner() {
    return owner;
  }

  @Override
  public Identity getDetail() {
    return owner;
  }
}
