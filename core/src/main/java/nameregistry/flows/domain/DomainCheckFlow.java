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

import static nameregistry.flows.domain.DomainAuthorizationGuard.isClaimable;
import static nameregistry.flows.domain.DomainFlowUtils.loadAndVerifyExistence;

import jakarta.inject.Inject;
import nameregistry.flows.CallContext;
import nameregistry.flows.RegistryException;
import nameregistry.model.domain.DomainDao;

/**
 * A flow that checks whether an existing domain's registration has lapsed.
 *
 * <p>A key that has never been claimed is reported as not found rather than claimable. Whether a
 * reservation would stop the caller from claiming the key is not taken into account.
 *
 * @error {@link nameregistry.flows.exceptions.InvalidDomainKeyException}
 * @error {@link nameregistry.flows.exceptions.DomainNotFoundException}
 */
public final class DomainCheckFlow {

  private final DomainKeyValidator domainKeyValidator;
  private final DomainDao domainDao;

  @Inject
  DomainCheckFlow(DomainKeyValidator domainKeyValidator, DomainDao domainDao) {
    this.domainKeyValidator = domainKeyValidator;
    this.domainDao = domainDao;
  }

  public boolean run(CallContext ctx, String domainKey) throws RegistryException {
    domainKeyValidator.validateKey(domainKey);
    return isClaimable(loadAndVerifyExistence(domainDao, domainKey), ctx.now());
  }
}
