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

import static nameregistry.flows.RegistryException.ErrorCode.CALLER_NOT_DOMAIN_OWNER;

import nameregistry.flows.RegistryException;
import nameregistry.flows.RegistryException.RegistryErrorCode;
import nameregistry.model.Identity;

/** Thrown when someone other than the current owner tries to transfer a domain. */
@RegistryErrorCode(CALLER_NOT_DOMAIN_OWNER)
public class CallerNotDomainOwnerException extends RegistryException {

  private final Identity caller;

  public CallerNotDomainOwnerException(Identity caller) {
    super(String.format("Caller %s does not own the domain", caller));
    this.caller = caller;
  }

  public Identity getCaller() {
    return caller;
  }

  @Override
  public Identity getDetail() {
    return caller;
  }
}
