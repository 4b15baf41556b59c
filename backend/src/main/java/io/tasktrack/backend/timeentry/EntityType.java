package io.tasktrack.backend.timeentry;

import java.util.Locale;

/** The two hierarchies a time entry can belong to. */
public enum EntityType {
  TASK,
  PROJECT;

  /** Lowercase form used in API payloads. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
