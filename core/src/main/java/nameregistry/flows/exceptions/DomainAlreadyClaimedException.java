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

import static nameregistry.flows.RegistryException.ErrorCode.DOMAIN_ALREADY_CLAIMED;

import nameregistry.flows.RegistryException;
import nameregistry.flows.RegistryException.RegistryErrorCode;
import nameregistry.model.Identity;

/** Thrown when claiming an active domain, or reserving one that has ever been claimed. */
@RegistryErrorCode(DOMAIN_ALREADY_CLAIMED)
public class DomainAlreadyClaimedException extends RegistryException {

  private final Identity owner;

  public DomainAlreadyClaimedException(Identity owner) {
    super(String.format("Domain is already claimed by %s", owner));
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
