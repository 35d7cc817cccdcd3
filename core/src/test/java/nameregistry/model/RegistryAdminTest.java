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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import nameregistry.persistence.InMemoryKeyValueStore;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link RegistryAdmin} and {@link Identity}. */
class RegistryAdminTest {

  private final InMemoryKeyValueStore<Identity> store = new InMemoryKeyValueStore<>();
  private final RegistryAdmin admin = new RegistryAdmin(store);

  @Test
  void testUninitialized() {
    assertThat(admin.isInitialized()).isFalse();
    assertThat(admin.get()).isEmpty();
    assertThat(admin.isAdmin(Identity.of("anyone"))).isFalse();
  }

  @Test
  void testInitialize() {
    admin.initialize(Identity.of("creator"));
    assertThat(admin.isInitialized()).isTrue();
    assertThat(admin.get()).hasValue(Identity.of("creator"));
    assertThat(admin.isAdmin(Identity.of("creator"))).isTrue();
    assertThat(admin.isAdmin(Identity.of("someone"))).isFalse();
  }

  @Test
  void testInitialize_onlyOnce() {
    admin.initialize(Identity.of("creator"));
    IllegalStateException thrown =
        assertThrows(IllegalStateException.class, () -> admin.initialize(Identity.of("usurper")));
    assertThat(thrown)
        .hasMessageThat()
        .isEqualTo("Registry is already initialized with administrator creator");
    assertThat(admin.get()).hasValue(Identity.of("creator"));
  }

  @Test
  void testPersistedInStore() {
    admin.initialize(Identity.of("creator"));
    assertThat(new RegistryAdmin(store).get()).hasValue(Identity.of("creator"));
    assertThat(store.get(RegistryAdmin.ADMIN_KEY)).hasValue(Identity.of("creator"));
  }

  @Test
  void testIdentity_rejectsBlank() {
    assertThrows(IllegalArgumentException.class, () -> Identity.of(" "));
    assertThat(Identity.of("x").toString()).isEqualTo("x");
  }
}
