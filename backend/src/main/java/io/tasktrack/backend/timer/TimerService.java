package io.tasktrack.backend.timer;

import io.tasktrack.backend.exception.ResourceConflictException;
import io.tasktrack.backend.exception.ResourceNotFoundException;
import io.tasktrack.backend.timeentry.EntityKey;
import io.tasktrack.backend.timeentry.NewTimeEntry;
import io.tasktrack.backend.timeentry.TimeEntry;
import io.tasktrack.backend.timeentry.TimeEntryStore;
import io.tasktrack.backend.timeentry.TrackedEntityResolver;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Timer state machine. Each task or project is either idle or has exactly one running entry.
 *
 * <p>Transitions take the entity's lock before opening their transaction and release it after
 * commit, so two starts on the same entity can never both see it idle.
 */
@Service
public class TimerService {

  private static final Logger log = LoggerFactory.getLogger(TimerService.class);

  private final TimeEntryStore timeEntryStore;
  private final TrackedEntityResolver trackedEntityResolver;
  private final EntityLockRegistry entityLockRegistry;
  private final TransactionOperations transactionOperations;
  private final Clock clock;

  public TimerService(
      TimeEntryStore timeEntryStore,
      TrackedEntityResolver trackedEntityResolver,
      EntityLockRegistry entityLockRegistry,
      TransactionOperations transactionOperations,
      Clock clock) {
    this.timeEntryStore = timeEntryStore;
    this.trackedEntityResolver = trackedEntityResolver;
    this.entityLockRegistry = entityLockRegistry;
    this.transactionOperations = transactionOperations;
    this.clock = clock;
  }

  /**
   * Starts a timer on the entity. A timer already running there is stopped first and keeps its
   * elapsed time; starting is never rejected because one is running.
   */
  public TimeEntry start(EntityKey key, UUID personId, String description) {
    return entityLockRegistry.withLock(
        key,
        () ->
            transactionOperations.execute(
                status -> {
                  trackedEntityResolver.requireExists(key);
                  for (var running : timeEntryStore.listRunning(key)) {
                    var stopped = timeEntryStore.stop(running.getId());
                    log.info(
                        "Replaced running timer {} on {} after {}us",
                        stopped.getId(),
                        key,
                        stopped.getDurationUs());
                  }
                  var entry =
                      timeEntryStore.create(
                          NewTimeEntry.running(key, personId, description, clock.instant()));
                  log.info("Started timer {} on {}", entry.getId(), key);
                  return entry;
                }));
  }

  /**
   * Stops the running timer on the entity.
   *
   * @throws ResourceNotFoundException if no timer is running there
   */
  public TimeEntry stop(EntityKey key) {
    return entityLockRegistry.withLock(
        key,
        () ->
            transactionOperations.execute(
                status -> {
                  var running = timeEntryStore.listRunning(key);
                  if (running.isEmpty()) {
                    throw ResourceNotFoundException.withDetail(
                        "No running timer", "No running timer found for " + key);
                  }
                  // Newest first; anything older is leftover from malformed data
                  TimeEntry latest = null;
                  for (var entry : running) {
                    var stopped = timeEntryStore.stop(entry.getId());
                    if (latest == null) {
                      latest = stopped;
                    }
                  }
                  log.info(
                      "Stopped timer {} on {} after {}us",
                      latest.getId(),
                      key,
                      latest.getDurationUs());
                  return latest;
                }));
  }

  /**
   * Stops every timer that was running when the call began. Each entry is stopped under its own
   * entity lock; timers started after the initial scan are left running. A timer whose entity
   * stays busy is skipped and left out of the result rather than failing the whole call.
   */
  public StopAllResult stopAll() {
    var snapshot = timeEntryStore.listAllRunning();
    List<UUID> stoppedIds = new ArrayList<>();
    for (var entry : snapshot) {
      try {
        var stopped =
            entityLockRegistry.withLock(
                entry.entityKey(), () -> timeEntryStore.stopIfRunning(entry.getId()));
        stopped.ifPresent(e -> stoppedIds.add(e.getId()));
      } catch (ResourceConflictException e) {
        log.warn(
            "Skipped timer {} on {} during stop-all: {}",
            entry.getId(),
            entry.entityKey(),
            e.getBody().getDetail());
      }
    }
    log.info("Stopped {} of {} running timers", stoppedIds.size(), snapshot.size());
    return StopAllResult.of(stoppedIds);
  }
}
