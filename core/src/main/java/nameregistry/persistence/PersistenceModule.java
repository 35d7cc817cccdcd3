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

package nameregistry.persistence;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.gson.reflect.TypeToken;
import dagger.Module;
import dagger.Provides;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import nameregistry.config.RegistryConfig.Config;
import nameregistry.model.Identity;
import nameregistry.model.domain.Domain;
import nameregistry.model.domain.Reservation;
import nameregistry.model.history.DomainHistory;

/** Dagger module providing the stores that back each kind of registry state. */
@Module
public final class PersistenceModule {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String DOMAINS_FILE = "domains.json";
  static final String HISTORIES_FILE = "histories.json";
  static final String RESERVATIONS_FILE = "reservations.json";
  static final String ADMIN_FILE = "admin.json";

  private PersistenceModule() {}

  @Provides
  @Singleton
  static KeyValueStore<Domain> provideDomainStore(
      @Config("storageType") StorageType storageType,
      @Config("storageDirectory") Path storageDirectory) {
    return createStore(storageType, storageDirectory, DOMAINS_FILE, Domain.class);
  }

  @Provides
  @Singleton
  static KeyValueStore<ImmutableList<DomainHistory>> provideHistoryStore(
      @Config("storageType") StorageType storageType,
      @Config("storageDirectory") Path storageDirectory) {
    return createStore(
        storageType,
        storageDirectory,
        HISTORIES_FILE,
        TypeToken.getParameterized(ImmutableList.class, DomainHistory.class).getType());
  }

  @Provides
  @Singleton
  static KeyValueStore<Reservation> provideReservationStore(
      @Config("storageType") StorageType storageType,
      @Config("storageDirectory") Path storageDirectory) {
    return createStore(storageType, storageDirectory, RESERVATIONS_FILE, Reservation.class);
  }

  @Provides
  @Singleton
  static KeyValueStore<Identity> provideAdminStore(
      @Config("storageType") StorageType storageType,
      @Config("storageDirectory") Path storageDirectory) {
    return createStore(storageType, storageDirectory, ADMIN_FILE, Identity.class);
  }

  private static <V> KeyValueStore<V> createStore(
      StorageType storageType, Path storageDirectory, String fileName, Type valueType) {
    switch (storageType) {
      case IN_MEMORY:
        return new InMemoryKeyValueStore<>();
      case JSON_FILE:
        try {
          Files.createDirectories(storageDirectory);
        } catch (IOException e) {
          throw new UncheckedIOException(
              String.format("Could not create storage directory %s", storageDirectory), e);
        }
        Path file = storageDirectory.resolve(fileName);
        logger.atInfo().log("Using JSON file store at %s.", file);
        return new JsonFileKeyValueStore<>(file, valueType);
    }
    throw new IllegalArgumentException("Unknown storage type " + storageType);
  }
}
