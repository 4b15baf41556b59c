package io.tasktrack.backend.timeentry;

import io.tasktrack.backend.exception.ResourceNotFoundException;
import io.tasktrack.backend.project.Project;
import io.tasktrack.backend.project.ProjectRepository;
import io.tasktrack.backend.task.Task;
import io.tasktrack.backend.task.TaskRepository;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Existence checks and display labels for the tasks and projects that own time entries. */
@Service
public class TrackedEntityResolver {

  private final TaskRepository taskRepository;
  private final ProjectRepository projectRepository;

  public TrackedEntityResolver(
      TaskRepository taskRepository, ProjectRepository projectRepository) {
    this.taskRepository = taskRepository;
    this.projectRepository = projectRepository;
  }

  @Transactional(readOnly = true)
  public void requireExists(EntityKey key) {
    boolean exists =
        switch (key.type()) {
          case TASK -> taskRepository.existsById(key.id());
          case PROJECT -> projectRepository.existsById(key.id());
        };
    if (!exists) {
      throw new ResourceNotFoundException(resourceName(key.type()), key.id());
    }
  }

  /**
   * Batch-loads task titles and project names. Entities that no longer exist are missing from the
   * returned map.
   */
  @Transactional(readOnly = true)
  public Map<EntityKey, String> resolveLabels(Collection<EntityKey> keys) {
    if (keys.isEmpty()) return Map.of();

    List<UUID> taskIds = idsOf(keys, EntityType.TASK);
    List<UUID> projectIds = idsOf(keys, EntityType.PROJECT);

    var labels = new HashMap<EntityKey, String>();
    if (!taskIds.isEmpty()) {
      for (Task task : taskRepository.findAllById(taskIds)) {
        labels.put(EntityKey.task(task.getId()), task.getTitle());
      }
    }
    if (!projectIds.isEmpty()) {
      for (Project project : projectRepository.findAllById(projectIds)) {
        labels.put(EntityKey.project(project.getId()), project.getName());
      }
    }
    return labels;
  }

  public static String resourceName(EntityType type) {
    return switch (type) {
      case TASK -> "Task";
      case PROJECT -> "Project";
    };
  }

  private static List<UUID> idsOf(Collection<EntityKey> keys, EntityType type) {
    return keys.stream().filter(k -> k.type() == type).map(EntityKey::id).distinct().toList();
  }
}
