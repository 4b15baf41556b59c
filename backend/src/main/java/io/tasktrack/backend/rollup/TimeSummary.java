package io.tasktrack.backend.rollup;

import io.tasktrack.backend.timeentry.EntityType;
import io.tasktrack.backend.timeentry.TimeEntry;
import java.util.List;
import java.util.UUID;

/**
 * Time rolled up over a task or project and everything below it.
 *
 * <p>Durations only count closed entries. A timer running on the entity itself is reported
 * through {@code currentSessionUs} and {@code runningTimer} instead. {@code tasksTimeUs} and
 * {@code subprojectsTimeUs} split {@code childrenTimeUs} for projects and are null for tasks.
 */
public record TimeSummary(
    EntityType entityType,
    UUID entityId,
    String label,
    long directTimeUs,
    long childrenTimeUs,
    long totalTimeUs,
    Long tasksTimeUs,
    Long subprojectsTimeUs,
    long currentSessionUs,
    boolean hasRunningTimer,
    TimeEntry runningTimer,
    List<TimeEntry> entries,
    List<ChildTimeBreakdown> childrenBreakdown) {}
