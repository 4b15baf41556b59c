package io.tasktrack.backend.tracking;

import io.tasktrack.backend.duration.DurationCodec;
import io.tasktrack.backend.exception.InvalidStateException;
import io.tasktrack.backend.rollup.TimeRollupService;
import io.tasktrack.backend.rollup.TimeSummary;
import io.tasktrack.backend.timeentry.EntityKey;
import io.tasktrack.backend.timeentry.NewTimeEntry;
import io.tasktrack.backend.timeentry.TimeEntry;
import io.tasktrack.backend.timeentry.TimeEntryPatch;
import io.tasktrack.backend.timeentry.TimeEntryStore;
import io.tasktrack.backend.timeentry.TrackedEntityResolver;
import io.tasktrack.backend.timer.StopAllResult;
import io.tasktrack.backend.timer.TimerService;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Entry point for time tracking on tasks and projects. Delegates timer transitions to {@link
 * TimerService}, persistence to {@link TimeEntryStore} and totals to {@link TimeRollupService}.
 */
@Service
public class TimeTrackingService {

  private final TimerService timerService;
  private final TimeEntryStore timeEntryStore;
  private final TimeRollupService timeRollupService;
  private final TrackedEntityResolver trackedEntityResolver;
  private final Clock clock;

  public TimeTrackingService(
      TimerService timerService,
      TimeEntryStore timeEntryStore,
      TimeRollupService timeRollupService,
      TrackedEntityResolver trackedEntityResolver,
      Clock clock) {
    this.timerService = timerService;
    this.timeEntryStore = timeEntryStore;
    this.timeRollupService = timeRollupService;
    this.trackedEntityResolver = trackedEntityResolver;
    this.clock = clock;
  }

  public TimeEntry startTaskTimer(UUID taskId, UUID personId, String description) {
    return timerService.start(EntityKey.task(taskId), personId, description);
  }

  public TimeEntry stopTaskTimer(UUID taskId) {
    return timerService.stop(EntityKey.task(taskId));
  }

  public TimeEntry startProjectTimer(UUID projectId, UUID personId, String description) {
    return timerService.start(EntityKey.project(projectId), personId, description);
  }

  public TimeEntry stopProjectTimer(UUID projectId) {
    return timerService.stop(EntityKey.project(projectId));
  }

  @Transactional
  public TimeEntry addManualEntry(EntityKey owner, ManualTimeEntry request) {
    trackedEntityResolver.requireExists(owner);
    Long durationUs =
        request.durationUs() != null ? request.durationUs() : parseDuration(request.duration());
    return timeEntryStore.create(
        NewTimeEntry.manual(
            owner,
            request.personId(),
            request.description(),
            request.startTime(),
            request.endTime(),
            durationUs,
            request.durationMinutes()));
  }

  /**
   * Applies a partial update. {@code duration} is a human-readable alternative to {@code
   * patch.durationUs()} and is ignored when the latter is set.
   */
  public TimeEntry updateEntry(UUID id, TimeEntryPatch patch, String duration) {
    if (patch.durationUs() == null) {
      Long parsed = parseDuration(duration);
      if (parsed != null) {
        patch =
            new TimeEntryPatch(
                patch.startTime(),
                patch.endTime(),
                parsed,
                patch.durationMinutes(),
                patch.description(),
                patch.personId());
      }
    }
    return timeEntryStore.update(id, patch);
  }

  public void deleteEntry(UUID id) {
    timeEntryStore.delete(id);
  }

  public TimeEntry getEntry(UUID id) {
    return timeEntryStore.get(id);
  }

  @Transactional(readOnly = true)
  public List<TimeEntry> listEntries(EntityKey owner) {
    trackedEntityResolver.requireExists(owner);
    return timeEntryStore.listByEntity(owner);
  }

  public TimeSummary getTaskSummary(UUID taskId) {
    return timeRollupService.summarizeTask(taskId);
  }

  public TimeSummary getProjectSummary(UUID projectId) {
    return timeRollupService.summarizeProject(projectId);
  }

  /** All running timers, most recently started first, with live elapsed time computed now. */
  @Transactional(readOnly = true)
  public List<RunningTimer> listRunningTimers() {
    var running = timeEntryStore.listAllRunning();
    var labels =
        trackedEntityResolver.resolveLabels(
            running.stream().map(TimeEntry::entityKey).distinct().toList());
    var now = clock.instant();
    return running.stream()
        .map(e -> new RunningTimer(e, labels.get(e.entityKey()), e.elapsedUs(now)))
        .toList();
  }

  public StopAllResult stopAllTimers() {
    return timerService.stopAll();
  }

  private static Long parseDuration(String duration) {
    if (duration == null || duration.isBlank()) {
      return null;
    }
    try {
      return DurationCodec.parse(duration);
    } catch (IllegalArgumentException | ArithmeticException e) {
      throw new InvalidStateException("Invalid duration", e.getMessage(), e);
    }
  }
}
