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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import nameregistry.model.domain.Domain;
import nameregistry.model.domain.DomainDao;
import nameregistry.model.domain.Reservation;
import nameregistry.model.domain.ReservationDao;
import nameregistry.model.history.DomainHistory;
import nameregistry.model.history.HistoryLedger;
import nameregistry.util.StopwatchLogger;

/**
 * Runs registry work one unit at a time and applies its {@link EntityChanges}.
 *
 * <p>The registry's rules assume that each operation runs to completion before the next one
 * starts, so every transaction holds a single registry-wide lock. Transactions are reentrant on the
 * same thread; a nested call simply joins the outer one.
 */
@Singleton
public class TransactionManager {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ReentrantLock lock = new ReentrantLock();
  private final DomainDao domainDao;
  private final ReservationDao reservationDao;
  private final HistoryLedger historyLedger;

  @Inject
  public TransactionManager(
      DomainDao domainDao, ReservationDao reservationDao, HistoryLedger historyLedger) {
    this.domainDao = domainDao;
    this.reservationDao = reservationDao;
    this.historyLedger = historyLedger;
  }

  /** A unit of work that may fail with a checked exception of type {@code E}. */
  @FunctionalInterface
  public interface TransactionalWork<T, E extends Exception> {
    T run() throws E;
  }

  /** Runs {@code work} while holding the registry lock and returns its result. */
  public <T, E extends Exception> T transact(String description, TransactionalWork<T, E> work)
      throws E {
    lock.lock();
    StopwatchLogger stopwatch = new StopwatchLogger();
    try {
      return work.run();
    } finally {
      stopwatch.tick(String.format("Slow transaction: %s", description));
      lock.unlock();
    }
  }

  public boolean inTransaction() {
    return lock.isHeldByCurrentThread();
  }

  /**
   * Writes {@code changes} to the stores.
   *
   * <p>History entries are appended before the domain records they describe are written, so that
   * a committed domain change always has its history entry.
   *
   * <p>If any write fails, the writes already made are undone in reverse order, restoring the
   * values each touched key held before the commit, and the failure is rethrown. Failures while
   * undoing are attached to it as suppressed exceptions.
   */
  public void commit(EntityChanges changes) {
    checkState(inTransaction(), "Changes must be committed inside a transaction");
    Deque<Runnable> undoLog = new ArrayDeque<>();
    try {
      for (DomainHistory entry : changes.historyEntries()) {
        Optional<ImmutableList<DomainHistory>> previous = historyLedger.read(entry.domainName());
        historyLedger.append(entry);
        undoLog.push(() -> historyLedger.restore(entry.domainName(), previous));
      }
      for (Domain domain : changes.domainUpdates()) {
        Optional<Domain> previous = domainDao.load(domain.domainName());
        domainDao.put(domain);
        undoLog.push(() -> domainDao.restore(domain.domainName(), previous));
      }
      for (Reservation reservation : changes.reservationInserts()) {
        Optional<Reservation> previous = reservationDao.load(reservation.domainName());
        reservationDao.put(reservation);
        undoLog.push(() -> reservationDao.restore(reservation.domainName(), previous));
      }
      for (String domainName : changes.reservationDeletes()) {
        Optional<Reservation> previous = reservationDao.load(domainName);
        reservationDao.delete(domainName);
        undoLog.push(() -> reservationDao.restore(domainName, previous));
      }
    } catch (RuntimeException e) {
      rollBack(undoLog, e);
      throw e;
    }
    logger.atFine().log(
        "Committed %d history entries, %d domains, %d reservation inserts, %d reservation deletes.",
        changes.historyEntries().size(),
        changes.domainUpdates().size(),
        changes.reservationInserts().size(),
        changes.reservationDeletes().size());
  }

  private static void rollBack(Deque<Runnable> undoLog, RuntimeException cause) {
    logger.atWarning().log("Commit failed after %d writes; rolling them back.", undoLog.size());
    while (!undoLog.isEmpty()) {
      try {
        undoLog.pop().run();
      } catch (RuntimeException e) {
        cause.addSuppressed(e);
      }
    }
  }
}
