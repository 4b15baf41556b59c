package io.tasktrack.backend.project;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

  /** The project and every project nested below it. Empty if the project does not exist. */
  @Query(
      nativeQuery = true,
      value =
          """
          WITH RECURSIVE subtree(id) AS (
            SELECT p.id FROM projects p WHERE p.id = :rootId
            UNION
            SELECT c.id FROM projects c JOIN subtree s ON c.parent_project_id = s.id
          )
          SELECT p.* FROM projects p JOIN subtree s ON p.id = s.id
          """)
  List<Project> findSubtree(@Param("rootId") UUID rootId);
}
