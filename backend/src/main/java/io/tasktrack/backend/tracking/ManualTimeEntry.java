package io.tasktrack.backend.tracking;

import java.time.Instant;
import java.util.UUID;

/**
 * A manually logged period of work. The duration may be given in microseconds, as a
 * human-readable string such as {@code "1h30m"}, in whole minutes, or left out when an end time is
 * given. The first of these that is present wins.
 */
public record ManualTimeEntry(
    Instant startTime,
    Instant endTime,
    Long durationUs,
    String duration,
    Integer durationMinutes,
    UUID personId,
    String description) {}
