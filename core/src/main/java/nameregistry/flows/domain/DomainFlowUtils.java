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

package nameregistry.flows.domain;

import nameregistry.flows.exceptions.DomainNotFoundException;
import nameregistry.model.domain.Domain;
import nameregistry.model.domain.DomainDao;

/** Static utility functions shared by domain flows. */
public final class DomainFlowUtils {

  private DomainFlowUtils() {}

  /** Loads the domain with the given (already validated) key, failing if it has no record. */
  public static Domain loadAndVerifyExistence(DomainDao domainDao, String domainKey)
      throws DomainNotFoundException {
    return domainDao
        .load(domainKey)
        .orElseThrow(() -> new DomainNotFoundException(domainKey));
  }
}
