package io.tasktrack.backend.rollup;

import io.tasktrack.backend.exception.ResourceNotFoundException;
import io.tasktrack.backend.project.Project;
import io.tasktrack.backend.project.ProjectRepository;
import io.tasktrack.backend.task.Task;
import io.tasktrack.backend.task.TaskRepository;
import io.tasktrack.backend.timeentry.EntityKey;
import io.tasktrack.backend.timeentry.EntityType;
import io.tasktrack.backend.timeentry.TimeEntry;
import io.tasktrack.backend.timeentry.TimeEntryStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Computes direct, descendant and total time for a task or project.
 *
 * <p>Each request loads the subtree's nodes and their time entries in bulk, then rolls totals up
 * in memory, so the cost is proportional to the subtree alone.
 */
@Service
public class TimeRollupService {

  private static final Logger log = LoggerFactory.getLogger(TimeRollupService.class);

  private final TaskRepository taskRepository;
  private final ProjectRepository projectRepository;
  private final TimeEntryStore timeEntryStore;
  private final Clock clock;

  public TimeRollupService(
      TaskRepository taskRepository,
      ProjectRepository projectRepository,
      TimeEntryStore timeEntryStore,
      Clock clock) {
    this.taskRepository = taskRepository;
    this.projectRepository = projectRepository;
    this.timeEntryStore = timeEntryStore;
    this.clock = clock;
  }

  /** Task time: its own entries plus those of every task below it along parent links. */
  @Transactional(readOnly = true)
  public TimeSummary summarizeTask(UUID taskId) {
    List<Task> tasks = taskRepository.findSubtree(taskId);
    if (tasks.isEmpty()) {
      throw new ResourceNotFoundException("Task", taskId);
    }

    var root = EntityKey.task(taskId);
    List<RollupNode> nodes = tasks.stream().map(TimeRollupService::taskNode).toList();
    var entries =
        timeEntryStore.listByEntities(EntityType.TASK, tasks.stream().map(Task::getId).toList());

    var tree = new RollupTree(root, nodes, settledDurations(entries));
    log.debug("Task rollup for {}: {} tasks, {} entries", taskId, tree.size(), entries.size());

    var breakdown =
        tree.descendantsPreOrder().stream()
            .filter(node -> tree.total(node.key()) > 0)
            .map(
                node ->
                    breakdownOf(
                        node, node.parent(), tree.direct(node.key()), tree.total(node.key())))
            .toList();
    return summarize(
        root,
        tree.node(root).label(),
        entries,
        tree.direct(root),
        tree.total(root),
        null,
        null,
        breakdown);
  }

  /**
   * Project time: its own entries, the full rollup of every task assigned to it, and the totals of
   * its child projects, recursively.
   *
   * <p>Each task of a project contributes its whole task total, subtasks included, whatever their
   * depth. A subtask assigned to the same project therefore also counts on its own, and one
   * assigned to a child project also counts there.
   */
  @Transactional(readOnly = true)
  public TimeSummary summarizeProject(UUID projectId) {
    List<Project> projects = projectRepository.findSubtree(projectId);
    if (projects.isEmpty()) {
      throw new ResourceNotFoundException("Project", projectId);
    }
    var projectIds = projects.stream().map(Project::getId).toList();
    List<Task> tasks = taskRepository.findTaskTreesOfProjects(projectIds);

    List<TimeEntry> entries =
        new ArrayList<>(timeEntryStore.listByEntities(EntityType.PROJECT, projectIds));
    entries.addAll(
        timeEntryStore.listByEntities(EntityType.TASK, tasks.stream().map(Task::getId).toList()));
    var direct = settledDurations(entries);

    var taskTree =
        RollupTree.forest(tasks.stream().map(TimeRollupService::taskNode).toList(), direct);

    // A project's own time plus the full total of each task assigned to it
    Map<EntityKey, Long> projectDirect = new HashMap<>();
    List<RollupNode> projectNodes = new ArrayList<>(projects.size());
    for (var project : projects) {
      var key = EntityKey.project(project.getId());
      projectDirect.put(key, direct.getOrDefault(key, 0L));
      projectNodes.add(
          new RollupNode(
              key,
              project.getParentProjectId() != null
                  ? EntityKey.project(project.getParentProjectId())
                  : null,
              project.getName()));
    }
    Map<EntityKey, List<RollupNode>> tasksOf = new HashMap<>();
    for (var task : tasks) {
      var owner = EntityKey.project(task.getProjectId());
      // Tasks of outside projects were fetched only as subtasks
      if (!projectDirect.containsKey(owner)) {
        continue;
      }
      var node = taskTree.node(EntityKey.task(task.getId()));
      tasksOf.computeIfAbsent(owner, k -> new ArrayList<>()).add(node);
      projectDirect.merge(owner, taskTree.total(node.key()), Long::sum);
    }

    var root = EntityKey.project(projectId);
    var projectTree = new RollupTree(root, projectNodes, projectDirect);
    log.debug(
        "Project rollup for {}: {} projects, {} tasks, {} entries",
        projectId,
        projects.size(),
        tasks.size(),
        entries.size());

    long tasksTimeUs = 0;
    for (var task : tasksOf.getOrDefault(root, List.of())) {
      tasksTimeUs += taskTree.total(task.key());
    }
    long subprojectsTimeUs = 0;
    for (var child : projectTree.childrenOf(root)) {
      subprojectsTimeUs += projectTree.total(child);
    }

    List<RollupNode> projectOrder = new ArrayList<>();
    projectOrder.add(projectTree.node(root));
    projectOrder.addAll(projectTree.descendantsPreOrder());
    List<ChildTimeBreakdown> breakdown = new ArrayList<>();
    for (var project : projectOrder) {
      var key = project.key();
      if (!key.equals(root) && projectTree.total(key) > 0) {
        breakdown.add(
            breakdownOf(
                project, project.parent(), direct.getOrDefault(key, 0L), projectTree.total(key)));
      }
      var projectTasks = new ArrayList<>(tasksOf.getOrDefault(key, List.of()));
      projectTasks.sort(RollupTree.CHILD_ORDER);
      for (var task : projectTasks) {
        long taskTotal = taskTree.total(task.key());
        if (taskTotal > 0) {
          breakdown.add(breakdownOf(task, key, taskTree.direct(task.key()), taskTotal));
        }
      }
    }

    return summarize(
        root,
        projectTree.node(root).label(),
        entries,
        direct.getOrDefault(root, 0L),
        projectTree.total(root),
        tasksTimeUs,
        subprojectsTimeUs,
        breakdown);
  }

  private static RollupNode taskNode(Task task) {
    return new RollupNode(
        EntityKey.task(task.getId()),
        task.getParentTaskId() != null ? EntityKey.task(task.getParentTaskId()) : null,
        task.getTitle());
  }

  private static ChildTimeBreakdown breakdownOf(
      RollupNode node, EntityKey parent, long directUs, long totalUs) {
    return new ChildTimeBreakdown(
        node.key().id(),
        node.key().type(),
        parent != null ? parent.id() : null,
        node.label(),
        directUs,
        totalUs);
  }

  private TimeSummary summarize(
      EntityKey root,
      String label,
      List<TimeEntry> entries,
      long directTimeUs,
      long totalTimeUs,
      Long tasksTimeUs,
      Long subprojectsTimeUs,
      List<ChildTimeBreakdown> breakdown) {
    var rootEntries = entries.stream().filter(e -> e.entityKey().equals(root)).toList();
    var runningTimer = rootEntries.stream().filter(TimeEntry::isRunning).findFirst().orElse(null);
    long currentSessionUs = runningTimer != null ? runningTimer.elapsedUs(clock.instant()) : 0;

    return new TimeSummary(
        root.type(),
        root.id(),
        label,
        directTimeUs,
        totalTimeUs - directTimeUs,
        totalTimeUs,
        tasksTimeUs,
        subprojectsTimeUs,
        currentSessionUs,
        runningTimer != null,
        runningTimer,
        rootEntries,
        breakdown);
  }

  // Running entries have no duration yet and count as zero
  private static Map<EntityKey, Long> settledDurations(List<TimeEntry> entries) {
    Map<EntityKey, Long> direct = new HashMap<>();
    for (var entry : entries) {
      if (!entry.isRunning() && entry.getDurationUs() != null) {
        direct.merge(entry.entityKey(), entry.getDurationUs(), Long::sum);
      }
    }
    return direct;
  }
}
