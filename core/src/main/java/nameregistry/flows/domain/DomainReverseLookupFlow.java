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

import com.google.common.collect.ImmutableList;
import jakarta.inject.Inject;
import nameregistry.model.Identity;
import nameregistry.model.domain.DomainDao;

/**
 * A flow that lists the keys of all domains recorded as owned by an identity, in key order.
 *
 * <p>Lapsed and revoked domains keep their last owner until they are claimed again, so they are
 * listed too.
 */
public final class DomainReverseLookupFlow {

  private final DomainDao domainDao;

  @Inject
  DomainReverseLookupFlow(DomainDao domainDao) {
    this.domainDao = domainDao;
  }

  public ImmutableList<String> run(Identity owner) {
    return domainDao.loadDomainNamesOwnedBy(owner);
  }
}
