package io.tasktrack.backend.timeentry;

import java.time.Instant;
import java.util.UUID;

/** Partial update of a time entry. Null fields are left unchanged. */
public record TimeEntryPatch(
    Instant startTime,
    Instant endTime,
    Long durationUs,
    Integer durationMinutes,
    String description,
    UUID personId) {}
