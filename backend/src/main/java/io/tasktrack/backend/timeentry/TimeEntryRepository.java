package io.tasktrack.backend.timeentry;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TimeEntryRepository extends JpaRepository<TimeEntry, UUID> {

  @Query(
      """
      SELECT te FROM TimeEntry te
      WHERE te.entityType = :entityType AND te.entityId = :entityId
      ORDER BY te.startTime DESC, te.createdAt DESC
      """)
  List<TimeEntry> findByEntity(
      @Param("entityType") EntityType entityType, @Param("entityId") UUID entityId);

  /** Bulk fetch used by rollups: every entry owned by any of the given entities. */
  @Query(
      """
      SELECT te FROM TimeEntry te
      WHERE te.entityType = :entityType AND te.entityId IN :entityIds
      ORDER BY te.startTime DESC, te.createdAt DESC
      """)
  List<TimeEntry> findByEntities(
      @Param("entityType") EntityType entityType,
      @Param("entityIds") Collection<UUID> entityIds);

  /**
   * Running entries of one entity. Holds at most one row while the running-entry invariant holds;
   * callers still treat it as a list so leftovers from malformed data get closed too.
   */
  @Query(
      """
      SELECT te FROM TimeEntry te
      WHERE te.entityType = :entityType AND te.entityId = :entityId AND te.running = true
      ORDER BY te.startTime DESC
      """)
  List<TimeEntry> findRunningByEntity(
      @Param("entityType") EntityType entityType, @Param("entityId") UUID entityId);

  @Query("SELECT te FROM TimeEntry te WHERE te.running = true ORDER BY te.startTime DESC")
  List<TimeEntry> findAllRunning();
}
