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

import static nameregistry.flows.RegistryException.ErrorCode.INVALID_DOMAIN_NAME_LENGTH;

import nameregistry.flows.RegistryException;
import nameregistry.flows.RegistryException.RegistryErrorCode;

/**
 * Thrown when a domain name is shorter or longer than the registry allows.
 *
 * <p>The length is counted in Unicode code points, not UTF-16 chars.
 */
@RegistryErrorCode(INVALID_DOMAIN_NAME_LENGTH)
public class InvalidDomainNameLengthException extends RegistryException {

  private final int length;

  public InvalidDomainNameLengthException(int length) {
    super(String.format("Invalid domain name length %d", length));
    this.length = length;
  }

  public int getLength() {
    return length;
  }

  @Override
  public Integer getDetail() {
    return length;
  }
}
