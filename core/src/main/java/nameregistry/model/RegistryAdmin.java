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

package nameregistry.model;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.flogger.FluentLogger;
import jakarta.inject.Inject;
import java.util.Optional;
import nameregistry.persistence.KeyValueStore;

/**
 * The administrative identity of the registry, the only one allowed to reserve domains.
 *
 * <p>It is set exactly once, to the identity that created the registry, and never changes or
 * expires afterwards. It is persisted so that it survives restarts.
 */
public class RegistryAdmin {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String ADMIN_KEY = "canisterOwner";

  private final KeyValueStore<Identity> store;

  @Inject
  public RegistryAdmin(KeyValueStore<Identity> store) {
    this.store = store;
  }

  /**
   * Records {@code creator} as the administrative identity.
   *
   * @throws IllegalStateException if an administrative identity has already been set
   */
  public void initialize(Identity creator) {
    checkNotNull(creator, "creator");
    Optional<Identity> existing = store.get(ADMIN_KEY);
    checkState(
        existing.isEmpty(),
        "Registry is already initialized with administrator %s",
        existing.orElse(null));
    store.put(ADMIN_KEY, creator);
    logger.atInfo().log("Registry initialized with administrator %s.", creator);
  }

  public boolean isInitialized() {
    return store.containsKey(ADMIN_KEY);
  }

  /** Returns the administrative identity, or empty if the registry has not been initialized. */
  public Optional<Identity> get() {
    return store.get(ADMIN_KEY);
  }

  /** Whether {@code caller} is the administrative identity. */
  public boolean isAdmin(Identity caller) {
    return get().map(caller::equals).orElse(false);
  }
}
