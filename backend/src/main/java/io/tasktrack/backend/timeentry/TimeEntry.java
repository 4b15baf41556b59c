package io.tasktrack.backend.timeentry;

import io.tasktrack.backend.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * A recorded interval of work on a task or project. A running entry has no end time and no
 * duration; a closed entry has both.
 */
@Entity
@Table(name = "time_entries")
public class TimeEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(name = "entity_type", nullable = false, updatable = false, length = 20)
  private EntityType entityType;

  @Column(name = "entity_id", nullable = false, updatable = false)
  private UUID entityId;

  @Column(name = "person_id")
  private UUID personId;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "start_time", nullable = false)
  private Instant startTime;

  @Column(name = "end_time")
  private Instant endTime;

  @Column(name = "duration_us")
  private Long durationUs;

  @Column(name = "is_running", nullable = false)
  private boolean running;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TimeEntry() {}

  private TimeEntry(
      EntityKey owner,
      UUID personId,
      String description,
      Instant startTime,
      Instant endTime,
      Long durationUs,
      boolean running,
      Instant now) {
    this.entityType = owner.type();
    this.entityId = owner.id();
    this.personId = personId;
    this.description = description;
    this.startTime = micros(startTime);
    this.endTime = micros(endTime);
    this.durationUs = durationUs;
    this.running = running;
    this.createdAt = now;
    this.updatedAt = now;
  }

  /** A timer that started at {@code startTime} and is still running. */
  public static TimeEntry running(
      EntityKey owner, UUID personId, String description, Instant startTime, Instant now) {
    return new TimeEntry(owner, personId, description, startTime, null, null, true, now);
  }

  /** A finished interval, typically entered by hand. */
  public static TimeEntry closed(
      EntityKey owner,
      UUID personId,
      String description,
      Instant startTime,
      Instant endTime,
      long durationUs,
      Instant now) {
    return new TimeEntry(owner, personId, description, startTime, endTime, durationUs, false, now);
  }

  /**
   * Stops this running entry at {@code now}. The duration is the elapsed time since start, clamped
   * at zero when the start lies in the future.
   */
  public void stop(Instant now) {
    if (!running) {
      throw new InvalidStateException("Timer not running", "Time entry " + id + " is not running");
    }
    Instant end = now.isBefore(startTime) ? startTime : micros(now);
    this.endTime = end;
    this.durationUs = microsBetween(startTime, end);
    this.running = false;
    this.updatedAt = now;
  }

  /** Live elapsed time of a running entry, or the recorded duration of a closed one. */
  public long elapsedUs(Instant now) {
    if (running) {
      return Math.max(0, microsBetween(startTime, now));
    }
    return durationUs != null ? durationUs : 0;
  }

  public EntityKey entityKey() {
    return new EntityKey(entityType, entityId);
  }

  public static long microsBetween(Instant start, Instant end) {
    return ChronoUnit.MICROS.between(start, end);
  }

  private static Instant micros(Instant instant) {
    return instant != null ? instant.truncatedTo(ChronoUnit.MICROS) : null;
  }

  public UUID getId() {
    return id;
  }

  public EntityType getEntityType() {
    return entityType;
  }

  public UUID getEntityId() {
    return entityId;
  }

  public UUID getPersonId() {
    return personId;
  }

  public String getDescription() {
    return description;
  }

  public Instant getStartTime() {
    return startTime;
  }

  public Instant getEndTime() {
    return endTime;
  }

  public Long getDurationUs() {
    return durationUs;
  }

  public boolean isRunning() {
    return running;
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setPersonId(UUID personId) {
    this.personId = personId;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public void setStartTime(Instant startTime) {
    this.startTime = micros(startTime);
  }

  public void setEndTime(Instant endTime) {
    this.endTime = micros(endTime);
  }

  public void setDurationUs(Long durationUs) {
    this.durationUs = durationUs;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }
}
