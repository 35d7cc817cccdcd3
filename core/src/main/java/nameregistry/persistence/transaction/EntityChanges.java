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

package nameregistry.persistence.transaction;

import com.google.auto.value.AutoBuilder;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import nameregistry.model.domain.Domain;
import nameregistry.model.domain.Reservation;
import nameregistry.model.history.DomainHistory;

/**
 * A record that encapsulates the writes one flow makes: history entries to append, domains to
 * put, and reservations to insert or delete.
 *
 * <p>Flows build this only after every check has passed, then hand it to {@link
 * TransactionManager#commit}, so a failing flow never writes anything.
 */
public record EntityChanges(
    ImmutableList<DomainHistory> historyEntries,
    ImmutableSet<Domain> domainUpdates,
    ImmutableSet<Reservation> reservationInserts,
    ImmutableSet<String> reservationDeletes) {

  public boolean isEmpty() {
    return historyEntries.isEmpty()
        && domainUpdates.isEmpty()
        && reservationInserts.isEmpty()
        && reservationDeletes.isEmpty();
  }

  public static Builder newBuilder() {
    // Default everything to empty, so that the build() method won't subsequently throw an
    // exception if one doesn't end up being applicable.
    return new AutoBuilder_EntityChanges_Builder()
        .setHistoryEntries(ImmutableList.of())
        .setDomainUpdates(ImmutableSet.of())
        .setReservationInserts(ImmutableSet.of())
        .setReservationDeletes(ImmutableSet.of());
  }

  /** Builder for {@link EntityChanges}. */
  @AutoBuilder
  public interface Builder {

    Builder setHistoryEntries(ImmutableList<DomainHistory> historyEntries);

    ImmutableList.Builder<DomainHistory> historyEntriesBuilder();

    default Builder addHistoryEntry(DomainHistory historyEntry) {
      historyEntriesBuilder().add(historyEntry);
      return this;
    }

    Builder setDomainUpdates(ImmutableSet<Domain> domainUpdates);

    ImmutableSet.Builder<Domain> domainUpdatesBuilder();

    default Builder addDomainUpdate(Domain domain) {
      domainUpdatesBuilder().add(domain);
      return this;
    }

    Builder setReservationInserts(ImmutableSet<Reservation> reservationInserts);

    ImmutableSet.Builder<Reservation> reservationInsertsBuilder();

    default Builder addReservationInsert(Reservation reservation) {
      reservationInsertsBuilder().add(reservation);
      return this;
    }

    Builder setReservationDeletes(ImmutableSet<String> reservationDeletes);

    ImmutableSet.Builder<String> reservationDeletesBuilder();

    default Builder addReservationDelete(String domainName) {
      reservationDeletesBuilder().add(domainName);
      return this;
    }

    EntityChanges build();
  }
}
