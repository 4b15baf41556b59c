package io.tasktrack.backend.timeentry;

import java.util.Objects;
import java.util.UUID;

/** Identifies a task or project that owns time entries. */
public record EntityKey(EntityType type, UUID id) {

  public EntityKey {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(id, "id");
  }

  public static EntityKey task(UUID taskId) {
    return new EntityKey(EntityType.TASK, taskId);
  }

  public static EntityKey project(UUID projectId) {
    return new EntityKey(EntityType.PROJECT, projectId);
  }

  @Override
  public String toString() {
    return type.value() + ":" + id;
  }
}
