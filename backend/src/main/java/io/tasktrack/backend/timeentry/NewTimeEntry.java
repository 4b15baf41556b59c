package io.tasktrack.backend.timeentry;

import java.time.Instant;
import java.util.UUID;

/**
 * Input for {@link TimeEntryStore#create(NewTimeEntry)}. For a closed entry at most one of {@code
 * durationUs} and {@code durationMinutes} is normally set; {@code durationUs} wins when both are.
 */
public record NewTimeEntry(
    EntityType entityType,
    UUID entityId,
    UUID personId,
    String description,
    Instant startTime,
    Instant endTime,
    Long durationUs,
    Integer durationMinutes,
    boolean running) {

  public static NewTimeEntry running(
      EntityKey owner, UUID personId, String description, Instant startTime) {
    return new NewTimeEntry(
        owner.type(), owner.id(), personId, description, startTime, null, null, null, true);
  }

  public static NewTimeEntry manual(
      EntityKey owner,
      UUID personId,
      String description,
      Instant startTime,
      Instant endTime,
      Long durationUs,
      Integer durationMinutes) {
    return new NewTimeEntry(
        owner.type(),
        owner.id(),
        personId,
        description,
        startTime,
        endTime,
        durationUs,
        durationMinutes,
        false);
  }
}
