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

import static nameregistry.flows.RegistryException.ErrorCode.INVALID_DOMAIN_KEY;

import javax.annotation.Nullable;
import nameregistry.flows.RegistryException;
import nameregistry.flows.RegistryException.RegistryErrorCode;

/**
 * Thrown when a combined domain key is malformed.
 *
 * <p>A key is malformed if it has no separator, if either side of its first separator fails
 * validation, or if it was assembled from a name that itself contains the separator.
 */
@RegistryErrorCode(INVALID_DOMAIN_KEY)
public class InvalidDomainKeyException extends RegistryException {

  private final String domainKey;

  public InvalidDomainKeyException(String domainKey) {
    this(domainKey, null);
  }

  public InvalidDomainKeyException(String domainKey, @Nullable RegistryException cause) {
    super(String.format("Invalid domain key '%s'", domainKey), cause);
    this.domainKey = domainKey;
  }

  public String getDomainKey() {
    return domainKey;
  }

  @Override
  public String getDetail() {
    return domainKey;
  }
}
