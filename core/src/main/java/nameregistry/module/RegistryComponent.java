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

import dagger.Component;
import jakarta.inject.Singleton;
import nameregistry.config.RegistryConfig.ConfigModule;
import nameregistry.flows.CallContext;
import nameregistry.flows.DomainRegistry;
import nameregistry.model.Identity;
import nameregistry.persistence.PersistenceModule;
import nameregistry.util.Clock;
import nameregistry.util.UtilsModule;

/** Dagger component with instance lifetime for the registry engine. */
@Singleton
@Component(modules = {ConfigModule.class, PersistenceModule.class, UtilsModule.class})
public interface RegistryComponent {

  DomainRegistry domainRegistry();

  /** The clock callers use to timestamp a {@link nameregistry.flows.CallContext}. */
  Clock clock();

  /**
   * Creates a component over the configured stores.
   *
   * <p>Unless the stores already record an administrator, the registry must be initialized with
   * {@link DomainRegistry#init} before {@link DomainRegistry#getCanisterOwner} is called. Use
   * {@link #create(Identity)} to do both at once.
   */
  static RegistryComponent create() {
    return DaggerRegistryComponent.create();
  }

  /**
   * Creates a component whose registry is administered by {@code creator}.
   *
   * <p>If the configured stores already record an administrator, from an earlier run over the same
   * storage directory, that administrator is kept and {@code creator} is ignored.
   */
  static RegistryComponent create(Identity creator) {
    RegistryComponent component = create();
    DomainRegistry registry = component.domainRegistry();
    if (!registry.isInitialized()) {
      registry.init(CallContext.create(creator, component.clock()));
    }
    return component;
  }
}
