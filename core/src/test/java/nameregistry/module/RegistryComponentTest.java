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

package nameregistry.module;

import static com.google.common.truth.Truth.assertThat;

import nameregistry.flows.CallContext;
import nameregistry.flows.DomainRegistry;
import nameregistry.model.Identity;
import nameregistry.util.SystemClock;
import org.joda.time.Duration;
import org.junit.jupiter.api.Test;

/** Tests that {@link RegistryComponent} wires a working registry from the default config. */
class RegistryComponentTest {

  @Test
  void testCreate_wiresWorkingRegistry() throws Exception {
    RegistryComponent component = RegistryComponent.create();
    assertThat(component.clock()).isInstanceOf(SystemClock.class);
    assertThat(component.domainRegistry()).isSameInstanceAs(component.domainRegistry());

    DomainRegistry registry = component.domainRegistry();
    Identity admin = Identity.of("admin");
    registry.init(CallContext.create(admin, component.clock()));
    assertThat(registry.getCanisterOwner()).isEqualTo(admin);

    String key =
        registry.claim(
            CallContext.create(Identity.of("alice"), component.clock()),
            "alice",
            "icp",
            Duration.standardDays(1));
    assertThat(registry.lookup(key)).isEqualTo(Identity.of("alice"));
  }

  @Test
  void testCreate_withCreator_initializesAdministrator() {
    Identity creator = Identity.of("creator");
    DomainRegistry registry = RegistryComponent.create(creator).domainRegistry();

    assertThat(registry.isInitialized()).isTrue();
    assertThat(registry.getCanisterOwner()).isEqualTo(creator);
  }

  @Test
  void testCreate_withoutCreator_isUninitialized() {
    assertThat(RegistryComponent.create().domainRegistry().isInitialized()).isFalse();
  }
}
