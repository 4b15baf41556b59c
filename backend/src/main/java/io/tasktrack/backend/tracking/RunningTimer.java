package io.tasktrack.backend.tracking;

import io.tasktrack.backend.timeentry.TimeEntry;

/** A running entry with its owner's label and the time elapsed so far. */
public record RunningTimer(TimeEntry entry, String label, long currentSessionUs) {}
