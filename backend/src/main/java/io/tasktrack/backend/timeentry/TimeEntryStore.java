package io.tasktrack.backend.timeentry;

import io.tasktrack.backend.exception.InvalidStateException;
import io.tasktrack.backend.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable CRUD over {@link TimeEntry}. Validates entries on the way in and keeps {@code
 * durationUs} consistent with the start and end times unless a duration was given explicitly.
 */
@Service
public class TimeEntryStore {

  private static final Logger log = LoggerFactory.getLogger(TimeEntryStore.class);

  private static final long MICROS_PER_MINUTE = 60_000_000L;

  // Years 1 to 9999, well inside what a timestamptz column holds
  static final Instant EARLIEST_SUPPORTED = Instant.parse("0001-01-01T00:00:00Z");
  static final Instant LATEST_SUPPORTED = Instant.parse("9999-12-31T23:59:59.999999Z");

  private final TimeEntryRepository timeEntryRepository;
  private final Clock clock;

  public TimeEntryStore(TimeEntryRepository timeEntryRepository, Clock clock) {
    this.timeEntryRepository = timeEntryRepository;
    this.clock = clock;
  }

  @Transactional
  public TimeEntry create(NewTimeEntry request) {
    if (request.entityType() == null) {
      throw new InvalidStateException("Missing entity type", "entityType is required");
    }
    if (request.entityId() == null) {
      throw new InvalidStateException("Missing entity id", "entityId is required");
    }
    if (request.startTime() == null) {
      throw new InvalidStateException("Missing start time", "startTime is required");
    }

    requireSupported("startTime", request.startTime());
    requireSupported("endTime", request.endTime());

    var owner = new EntityKey(request.entityType(), request.entityId());
    Instant now = clock.instant();
    Long explicitDuration =
        resolveExplicitDuration(request.durationUs(), request.durationMinutes());

    TimeEntry entry;
    if (request.running()) {
      if (request.endTime() != null || explicitDuration != null) {
        throw new InvalidStateException(
            "Invalid running entry", "A running entry cannot have an end time or duration");
      }
      entry =
          TimeEntry.running(
              owner, request.personId(), request.description(), request.startTime(), now);
    } else {
      requireEndNotBeforeStart(request.startTime(), request.endTime());
      Instant endTime = request.endTime();
      long durationUs;
      if (explicitDuration != null) {
        durationUs = explicitDuration;
        if (endTime == null) {
          endTime = endAfter(request.startTime(), durationUs);
        }
      } else if (endTime != null) {
        durationUs = TimeEntry.microsBetween(request.startTime(), endTime);
      } else {
        throw new InvalidStateException(
            "Missing end time", "endTime or a duration is required for a manual entry");
      }
      entry =
          TimeEntry.closed(
              owner,
              request.personId(),
              request.description(),
              request.startTime(),
              endTime,
              durationUs,
              now);
    }

    var saved = timeEntryRepository.save(entry);
    log.info(
        "Created {} time entry {} for {}",
        saved.isRunning() ? "running" : "closed",
        saved.getId(),
        owner);
    return saved;
  }

  @Transactional
  public TimeEntry update(UUID id, TimeEntryPatch patch) {
    var entry = requireEntry(id);
    Long explicitDuration = resolveExplicitDuration(patch.durationUs(), patch.durationMinutes());

    if (entry.isRunning() && (patch.endTime() != null || explicitDuration != null)) {
      throw new InvalidStateException(
          "Timer is running",
          "Stop the running timer before setting an end time or duration on entry " + id);
    }

    Instant startTime = patch.startTime() != null ? patch.startTime() : entry.getStartTime();
    Instant endTime = patch.endTime() != null ? patch.endTime() : entry.getEndTime();
    requireSupported("startTime", patch.startTime());
    requireSupported("endTime", patch.endTime());
    requireEndNotBeforeStart(startTime, endTime);

    if (patch.startTime() != null) {
      entry.setStartTime(startTime);
    }
    if (patch.endTime() != null) {
      entry.setEndTime(endTime);
    }
    if (!entry.isRunning()) {
      if (explicitDuration != null) {
        entry.setDurationUs(explicitDuration);
      } else if (entry.getEndTime() != null) {
        entry.setDurationUs(TimeEntry.microsBetween(entry.getStartTime(), entry.getEndTime()));
      }
    }
    if (patch.description() != null) {
      entry.setDescription(patch.description());
    }
    if (patch.personId() != null) {
      entry.setPersonId(patch.personId());
    }
    entry.setUpdatedAt(clock.instant());

    var saved = timeEntryRepository.save(entry);
    log.info("Updated time entry {} for {}", id, saved.entityKey());
    return saved;
  }

  /** Deletes an entry. A running entry simply disappears without leaving a duration behind. */
  @Transactional
  public void delete(UUID id) {
    var entry = requireEntry(id);
    timeEntryRepository.delete(entry);
    log.info("Deleted time entry {} for {}", id, entry.entityKey());
  }

  /**
   * Closes a running entry at the current time.
   *
   * @throws ResourceNotFoundException if the entry does not exist
   * @throws InvalidStateException if the entry is already closed
   */
  @Transactional
  public TimeEntry stop(UUID id) {
    var entry = requireEntry(id);
    entry.stop(clock.instant());
    // Flushed now so the row is no longer running before a replacement is inserted
    var saved = timeEntryRepository.saveAndFlush(entry);
    log.debug("Closed time entry {} with {}us", id, saved.getDurationUs());
    return saved;
  }

  /** Closes the entry if it still exists and is still running; otherwise does nothing. */
  @Transactional
  public Optional<TimeEntry> stopIfRunning(UUID id) {
    var entry = timeEntryRepository.findById(id).filter(TimeEntry::isRunning);
    if (entry.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(stop(id));
  }

  @Transactional(readOnly = true)
  public TimeEntry get(UUID id) {
    return requireEntry(id);
  }

  @Transactional(readOnly = true)
  public List<TimeEntry> listByEntity(EntityKey owner) {
    return timeEntryRepository.findByEntity(owner.type(), owner.id());
  }

  @Transactional(readOnly = true)
  public List<TimeEntry> listByEntities(EntityType entityType, Collection<UUID> entityIds) {
    if (entityIds.isEmpty()) {
      return List.of();
    }
    return timeEntryRepository.findByEntities(entityType, entityIds);
  }

  @Transactional(readOnly = true)
  public Optional<TimeEntry> findRunning(EntityKey owner) {
    return listRunning(owner).stream().findFirst();
  }

  @Transactional(readOnly = true)
  public List<TimeEntry> listRunning(EntityKey owner) {
    return timeEntryRepository.findRunningByEntity(owner.type(), owner.id());
  }

  @Transactional(readOnly = true)
  public List<TimeEntry> listAllRunning() {
    return timeEntryRepository.findAllRunning();
  }

  private TimeEntry requireEntry(UUID id) {
    return timeEntryRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("TimeEntry", id));
  }

  private static Long resolveExplicitDuration(Long durationUs, Integer durationMinutes) {
    if (durationUs != null) {
      if (durationUs < 0) {
        throw new InvalidStateException("Invalid duration", "durationUs must not be negative");
      }
      return durationUs;
    }
    if (durationMinutes != null) {
      if (durationMinutes < 0) {
        throw new InvalidStateException("Invalid duration", "durationMinutes must not be negative");
      }
      return durationMinutes * MICROS_PER_MINUTE;
    }
    return null;
  }

  private static Instant endAfter(Instant startTime, long durationUs) {
    Instant endTime;
    try {
      endTime = startTime.plus(durationUs, ChronoUnit.MICROS);
    } catch (DateTimeException | ArithmeticException e) {
      throw new InvalidStateException(
          "Invalid duration", "Duration of " + durationUs + "us is too large", e);
    }
    if (endTime.isAfter(LATEST_SUPPORTED)) {
      throw new InvalidStateException(
          "Invalid duration", "Duration of " + durationUs + "us ends after " + LATEST_SUPPORTED);
    }
    return endTime;
  }

  private static void requireSupported(String field, Instant value) {
    if (value != null && (value.isBefore(EARLIEST_SUPPORTED) || value.isAfter(LATEST_SUPPORTED))) {
      throw new InvalidStateException(
          "Invalid time", field + " " + value + " is outside the supported range");
    }
  }

  private static void requireEndNotBeforeStart(Instant startTime, Instant endTime) {
    if (endTime != null && endTime.isBefore(startTime)) {
      throw new InvalidStateException(
          "Invalid time range", "endTime " + endTime + " is before startTime " + startTime);
    }
  }
}
