package io.tasktrack.backend.tracking;

import io.tasktrack.backend.duration.DurationCodec;
import io.tasktrack.backend.rollup.ChildTimeBreakdown;
import io.tasktrack.backend.rollup.TimeSummary;
import io.tasktrack.backend.timeentry.EntityKey;
import io.tasktrack.backend.timeentry.TimeEntry;
import io.tasktrack.backend.timeentry.TimeEntryPatch;
import io.tasktrack.backend.timer.StopAllResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TimeTrackingController {

  private final TimeTrackingService timeTrackingService;

  public TimeTrackingController(TimeTrackingService timeTrackingService) {
    this.timeTrackingService = timeTrackingService;
  }

  // --- Timers ---

  @PostMapping("/api/tasks/{taskId}/timer/start")
  public ResponseEntity<TimeEntryResponse> startTaskTimer(
      @PathVariable UUID taskId, @RequestBody(required = false) StartTimerRequest request) {
    var body = request != null ? request : StartTimerRequest.EMPTY;
    var entry = timeTrackingService.startTaskTimer(taskId, body.personId(), body.description());
    return created(entry);
  }

  @PostMapping("/api/tasks/{taskId}/timer/stop")
  public ResponseEntity<TimeEntryResponse> stopTaskTimer(@PathVariable UUID taskId) {
    return ResponseEntity.ok(TimeEntryResponse.from(timeTrackingService.stopTaskTimer(taskId)));
  }

  @PostMapping("/api/projects/{projectId}/timer/start")
  public ResponseEntity<TimeEntryResponse> startProjectTimer(
      @PathVariable UUID projectId,
      @RequestBody(required = false) StartTimerRequest request) {
    var body = request != null ? request : StartTimerRequest.EMPTY;
    var entry =
        timeTrackingService.startProjectTimer(projectId, body.personId(), body.description());
    return created(entry);
  }

  @PostMapping("/api/projects/{projectId}/timer/stop")
  public ResponseEntity<TimeEntryResponse> stopProjectTimer(@PathVariable UUID projectId) {
    return ResponseEntity.ok(
        TimeEntryResponse.from(timeTrackingService.stopProjectTimer(projectId)));
  }

  @GetMapping("/api/time-entries/running")
  public ResponseEntity<List<RunningTimerResponse>> listRunningTimers() {
    var response =
        timeTrackingService.listRunningTimers().stream().map(RunningTimerResponse::from).toList();
    return ResponseEntity.ok(response);
  }

  @PostMapping("/api/time-entries/stop-all")
  public ResponseEntity<StopAllResponse> stopAllTimers() {
    return ResponseEntity.ok(StopAllResponse.from(timeTrackingService.stopAllTimers()));
  }

  // --- Entries ---

  @PostMapping("/api/tasks/{taskId}/time-entries")
  public ResponseEntity<TimeEntryResponse> createTaskTimeEntry(
      @PathVariable UUID taskId, @Valid @RequestBody ManualTimeEntryRequest request) {
    return created(timeTrackingService.addManualEntry(EntityKey.task(taskId), request.toEntry()));
  }

  @PostMapping("/api/projects/{projectId}/time-entries")
  public ResponseEntity<TimeEntryResponse> createProjectTimeEntry(
      @PathVariable UUID projectId, @Valid @RequestBody ManualTimeEntryRequest request) {
    return created(
        timeTrackingService.addManualEntry(EntityKey.project(projectId), request.toEntry()));
  }

  @GetMapping("/api/tasks/{taskId}/time-entries")
  public ResponseEntity<List<TimeEntryResponse>> listTaskTimeEntries(@PathVariable UUID taskId) {
    return ResponseEntity.ok(toResponses(timeTrackingService.listEntries(EntityKey.task(taskId))));
  }

  @GetMapping("/api/projects/{projectId}/time-entries")
  public ResponseEntity<List<TimeEntryResponse>> listProjectTimeEntries(
      @PathVariable UUID projectId) {
    return ResponseEntity.ok(
        toResponses(timeTrackingService.listEntries(EntityKey.project(projectId))));
  }

  @GetMapping("/api/time-entries/{id}")
  public ResponseEntity<TimeEntryResponse> getTimeEntry(@PathVariable UUID id) {
    return ResponseEntity.ok(TimeEntryResponse.from(timeTrackingService.getEntry(id)));
  }

  @PutMapping("/api/time-entries/{id}")
  public ResponseEntity<TimeEntryResponse> updateTimeEntry(
      @PathVariable UUID id, @Valid @RequestBody UpdateTimeEntryRequest request) {
    var entry = timeTrackingService.updateEntry(id, request.toPatch(), request.duration());
    return ResponseEntity.ok(TimeEntryResponse.from(entry));
  }

  @DeleteMapping("/api/time-entries/{id}")
  public ResponseEntity<Void> deleteTimeEntry(@PathVariable UUID id) {
    timeTrackingService.deleteEntry(id);
    return ResponseEntity.noContent().build();
  }

  // --- Summaries ---

  @GetMapping("/api/tasks/{taskId}/time-summary")
  public ResponseEntity<TimeSummaryResponse> getTaskSummary(@PathVariable UUID taskId) {
    return ResponseEntity.ok(TimeSummaryResponse.from(timeTrackingService.getTaskSummary(taskId)));
  }

  @GetMapping("/api/projects/{projectId}/time-summary")
  public ResponseEntity<TimeSummaryResponse> getProjectSummary(@PathVariable UUID projectId) {
    return ResponseEntity.ok(
        TimeSummaryResponse.from(timeTrackingService.getProjectSummary(projectId)));
  }

  private static ResponseEntity<TimeEntryResponse> created(TimeEntry entry) {
    return ResponseEntity.created(URI.create("/api/time-entries/" + entry.getId()))
        .body(TimeEntryResponse.from(entry));
  }

  private static List<TimeEntryResponse> toResponses(List<TimeEntry> entries) {
    return entries.stream().map(TimeEntryResponse::from).toList();
  }

  private static String formatted(Long micros) {
    return micros != null ? DurationCodec.format(micros) : null;
  }

  // --- DTOs ---

  public record StartTimerRequest(UUID personId, String description) {

    static final StartTimerRequest EMPTY = new StartTimerRequest(null, null);
  }

  public record ManualTimeEntryRequest(
      @NotNull(message = "startTime is required") Instant startTime,
      Instant endTime,
      @PositiveOrZero(message = "durationUs must not be negative") Long durationUs,
      String duration,
      @PositiveOrZero(message = "durationMinutes must not be negative") Integer durationMinutes,
      UUID personId,
      String description) {

    ManualTimeEntry toEntry() {
      return new ManualTimeEntry(
          startTime, endTime, durationUs, duration, durationMinutes, personId, description);
    }
  }

  public record UpdateTimeEntryRequest(
      Instant startTime,
      Instant endTime,
      @PositiveOrZero(message = "durationUs must not be negative") Long durationUs,
      String duration,
      @PositiveOrZero(message = "durationMinutes must not be negative") Integer durationMinutes,
      UUID personId,
      String description) {

    TimeEntryPatch toPatch() {
      return new TimeEntryPatch(
          startTime, endTime, durationUs, durationMinutes, description, personId);
    }
  }

  public record TimeEntryResponse(
      UUID id,
      String entityType,
      UUID entityId,
      UUID personId,
      String description,
      Instant startTime,
      Instant endTime,
      Long durationUs,
      String durationFormatted,
      boolean running,
      Instant createdAt,
      Instant updatedAt) {

    public static TimeEntryResponse from(TimeEntry entry) {
      return new TimeEntryResponse(
          entry.getId(),
          entry.getEntityType().value(),
          entry.getEntityId(),
          entry.getPersonId(),
          entry.getDescription(),
          entry.getStartTime(),
          entry.getEndTime(),
          entry.getDurationUs(),
          formatted(entry.getDurationUs()),
          entry.isRunning(),
          entry.getCreatedAt(),
          entry.getUpdatedAt());
    }
  }

  public record RunningTimerResponse(
      UUID id,
      String entityType,
      UUID entityId,
      String label,
      UUID personId,
      String description,
      Instant startTime,
      long currentSessionUs,
      String currentSessionDisplay) {

    public static RunningTimerResponse from(RunningTimer timer) {
      var entry = timer.entry();
      return new RunningTimerResponse(
          entry.getId(),
          entry.getEntityType().value(),
          entry.getEntityId(),
          timer.label(),
          entry.getPersonId(),
          entry.getDescription(),
          entry.getStartTime(),
          timer.currentSessionUs(),
          DurationCodec.formatTimerDisplay(timer.currentSessionUs(), false));
    }
  }

  public record StopAllResponse(int stoppedCount, List<UUID> stoppedIds) {

    public static StopAllResponse from(StopAllResult result) {
      return new StopAllResponse(result.stoppedCount(), result.stoppedIds());
    }
  }

  public record ChildTimeResponse(
      UUID id,
      String entityType,
      UUID parentId,
      String label,
      long directUs,
      long totalUs,
      String totalFormatted) {

    public static ChildTimeResponse from(ChildTimeBreakdown child) {
      return new ChildTimeResponse(
          child.id(),
          child.entityType().value(),
          child.parentId(),
          child.label(),
          child.directUs(),
          child.totalUs(),
          DurationCodec.format(child.totalUs()));
    }
  }

  public record TimeSummaryResponse(
      String entityType,
      UUID entityId,
      String label,
      long directTimeUs,
      String directTimeFormatted,
      long childrenTimeUs,
      String childrenTimeFormatted,
      long totalTimeUs,
      String totalTimeFormatted,
      Long tasksTimeUs,
      Long subprojectsTimeUs,
      long currentSessionUs,
      String currentSessionFormatted,
      boolean hasRunningTimer,
      TimeEntryResponse runningTimer,
      List<TimeEntryResponse> entries,
      List<ChildTimeResponse> childrenBreakdown) {

    public static TimeSummaryResponse from(TimeSummary summary) {
      return new TimeSummaryResponse(
          summary.entityType().value(),
          summary.entityId(),
          summary.label(),
          summary.directTimeUs(),
          DurationCodec.format(summary.directTimeUs()),
          summary.childrenTimeUs(),
          DurationCodec.format(summary.childrenTimeUs()),
          summary.totalTimeUs(),
          DurationCodec.format(summary.totalTimeUs()),
          summary.tasksTimeUs(),
          summary.subprojectsTimeUs(),
          summary.currentSessionUs(),
          DurationCodec.format(summary.currentSessionUs()),
          summary.hasRunningTimer(),
          summary.runningTimer() != null ? TimeEntryResponse.from(summary.runningTimer()) : null,
          toResponses(summary.entries()),
          summary.childrenBreakdown().stream().map(ChildTimeResponse::from).toList());
    }
  }
}
