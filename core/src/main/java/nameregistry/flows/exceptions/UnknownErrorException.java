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

import static nameregistry.flows.RegistryException.ErrorCode.UNKNOWN_ERROR;

import nameregistry.flows.RegistryException;
import nameregistry.flows.RegistryException.RegistryErrorCode;

/**
 * Reports an unexpected internal fault instead of letting it escape the registry.
 *
 * <p>The operation that hit the fault made no changes before it was raised, unless the fault came
 * from the storage layer while committing.
 */
@RegistryErrorCode(UNKNOWN_ERROR)
public class UnknownErrorException extends RegistryException {

  private final String diagnostic;

  public UnknownErrorException(String diagnostic, Throwable cause) {
    super(diagnostic, cause);
    this.diagnostic = diagnostic;
  }

  /** Wraps an unexpected exception raised while running {@code operation}. */
  public static UnknownErrorException wrap(String operation, RuntimeException cause) {
    return new UnknownErrorException(
        String.format("Unexpected error during %s: %s", operation, cause), cause);
  }

  public String getDiagnostic() {
    return diagnostic;
  }

  @Override
  public String getDetail() {
    return diagnostic;
  }
}
