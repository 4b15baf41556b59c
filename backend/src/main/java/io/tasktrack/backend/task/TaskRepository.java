package io.tasktrack.backend.task;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, UUID> {

  /**
   * The task and all of its descendants along {@code parent_task_id}, in one round trip. UNION (not
   * UNION ALL) stops the recursion if malformed data ever forms a cycle. Empty if the task does not
   * exist.
   */
  @Query(
      nativeQuery = true,
      value =
          """
          WITH RECURSIVE subtree(id) AS (
            SELECT t.id FROM tasks t WHERE t.id = :rootId
            UNION
            SELECT c.id FROM tasks c JOIN subtree s ON c.parent_task_id = s.id
          )
          SELECT t.* FROM tasks t JOIN subtree s ON t.id = s.id
          """)
  List<Task> findSubtree(@Param("rootId") UUID rootId);

  /**
   * Every task assigned to one of the projects, plus all of their descendants along {@code
   * parent_task_id} even where a descendant belongs to some other project.
   */
  @Query(
      nativeQuery = true,
      value =
          """
          WITH RECURSIVE trees(id) AS (
            SELECT t.id FROM tasks t WHERE t.project_id IN (:projectIds)
            UNION
            SELECT c.id FROM tasks c JOIN trees s ON c.parent_task_id = s.id
          )
          SELECT t.* FROM tasks t JOIN trees s ON t.id = s.id
          """)
  List<Task> findTaskTreesOfProjects(@Param("projectIds") Collection<UUID> projectIds);
}
