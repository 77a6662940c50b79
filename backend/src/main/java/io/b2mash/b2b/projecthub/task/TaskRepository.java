package io.b2mash.b2b.projecthub.task;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, UUID>, JpaSpecificationExecutor<Task> {

  /** Per-project, per-status counts. Callers pass project ids that were already tenant-scoped. */
  @Query(
      """
      SELECT t.projectId AS projectId, t.status AS status, COUNT(t) AS total
      FROM Task t
      WHERE t.projectId IN :projectIds
      GROUP BY t.projectId, t.status
      """)
  List<TaskStatusCount> countByProjectAndStatus(@Param("projectIds") Collection<UUID> projectIds);

  interface TaskStatusCount {
    UUID getProjectId();

    TaskStatus getStatus();

    long getTotal();
  }
}
