package io.tasktrack.backend.duration;

/**
 * A non-negative microsecond count split into calendar-ish units. Each field holds what is left
 * after all coarser units have been taken out, so no field reaches its unit's capacity.
 */
public record DurationBreakdown(
    long years,
    long months,
    long weeks,
    long days,
    long hours,
    long minutes,
    long seconds,
    long milliseconds,
    long microseconds) {}
