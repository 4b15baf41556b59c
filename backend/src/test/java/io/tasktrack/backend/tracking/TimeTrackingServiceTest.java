package io.tasktrack.backend.tracking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.tasktrack.backend.exception.InvalidStateException;
import io.tasktrack.backend.exception.ResourceNotFoundException;
import io.tasktrack.backend.rollup.TimeRollupService;
import io.tasktrack.backend.timeentry.EntityKey;
import io.tasktrack.backend.timeentry.NewTimeEntry;
import io.tasktrack.backend.timeentry.TimeEntry;
import io.tasktrack.backend.timeentry.TimeEntryPatch;
import io.tasktrack.backend.timeentry.TimeEntryStore;
import io.tasktrack.backend.timeentry.TrackedEntityResolver;
import io.tasktrack.backend.timer.TimerService;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TimeTrackingServiceTest {

  private static final Instant NOW = Instant.parse("2024-02-01T10:00:00Z");
  private static final Instant START = Instant.parse("2024-02-01T08:00:00Z");
  private static final EntityKey TASK = EntityKey.task(UUID.randomUUID());

  @Mock private TimerService timerService;
  @Mock private TimeEntryStore timeEntryStore;
  @Mock private TimeRollupService timeRollupService;
  @Mock private TrackedEntityResolver trackedEntityResolver;

  private TimeTrackingService service;

  @BeforeEach
  void setUp() {
    service =
        new TimeTrackingService(
            timerService,
            timeEntryStore,
            timeRollupService,
            trackedEntityResolver,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void addManualEntry_parsesHumanDuration() {
    var saved = TimeEntry.closed(TASK, null, null, START, START.plusSeconds(5_400), 1L, NOW);
    var expected = NewTimeEntry.manual(TASK, null, "Design", START, null, 5_400_000_000L, null);
    when(timeEntryStore.create(expected)).thenReturn(saved);

    var result =
        service.addManualEntry(
            TASK, new ManualTimeEntry(START, null, null, "1h30m", null, null, "Design"));

    assertThat(result).isSameAs(saved);
    verify(trackedEntityResolver).requireExists(TASK);
  }

  @Test
  void addManualEntry_prefersMicrosecondsOverDurationString() {
    var saved = TimeEntry.closed(TASK, null, null, START, START.plusSeconds(1), 1L, NOW);
    when(timeEntryStore.create(NewTimeEntry.manual(TASK, null, null, START, null, 42L, null)))
        .thenReturn(saved);

    service.addManualEntry(TASK, new ManualTimeEntry(START, null, 42L, "1h", null, null, null));

    verify(timeEntryStore).create(NewTimeEntry.manual(TASK, null, null, START, null, 42L, null));
  }

  @Test
  void addManualEntry_rejectsUnparseableDuration() {
    assertThatThrownBy(
            () ->
                service.addManualEntry(
                    TASK, new ManualTimeEntry(START, null, null, "soon", null, null, null)))
        .isInstanceOf(InvalidStateException.class);
    verify(timeEntryStore, never()).create(any());
  }

  @Test
  void addManualEntry_rejectsUnknownEntity() {
    doThrow(new ResourceNotFoundException("Task", TASK.id()))
        .when(trackedEntityResolver)
        .requireExists(TASK);

    assertThatThrownBy(
            () ->
                service.addManualEntry(
                    TASK, new ManualTimeEntry(START, null, null, "1h", null, null, null)))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(timeEntryStore, never()).create(any());
  }

  @Test
  void updateEntry_parsesDurationIntoPatch() {
    var id = UUID.randomUUID();
    var saved = TimeEntry.closed(TASK, null, null, START, START.plusSeconds(900), 1L, NOW);
    var expected = new TimeEntryPatch(null, null, 900_000_000L, null, null, null);
    when(timeEntryStore.update(id, expected)).thenReturn(saved);

    var result =
        service.updateEntry(id, new TimeEntryPatch(null, null, null, null, null, null), "15m");

    assertThat(result).isSameAs(saved);
  }

  @Test
  void listRunningTimers_attachesLabelAndLiveElapsed() {
    var entry = TimeEntry.running(TASK, null, null, NOW.minusSeconds(75), NOW.minusSeconds(75));
    when(timeEntryStore.listAllRunning()).thenReturn(List.of(entry));
    when(trackedEntityResolver.resolveLabels(List.of(TASK))).thenReturn(Map.of(TASK, "Write docs"));

    var timers = service.listRunningTimers();

    assertThat(timers).hasSize(1);
    assertThat(timers.get(0).label()).isEqualTo("Write docs");
    assertThat(timers.get(0).currentSessionUs()).isEqualTo(75_000_000L);
    assertThat(timers.get(0).entry()).isSameAs(entry);
  }

  @Test
  void listEntries_requiresExistingEntity() {
    when(timeEntryStore.listByEntity(TASK)).thenReturn(List.of());

    assertThat(service.listEntries(TASK)).isEmpty();
    verify(trackedEntityResolver).requireExists(TASK);
  }
}
