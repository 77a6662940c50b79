package io.b2mash.b2b.projecthub.comment;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskCommentRepository
    extends JpaRepository<TaskComment, UUID>, JpaSpecificationExecutor<TaskComment> {

  /** Comment counts keyed by task. Callers pass task ids that were already tenant-scoped. */
  @Query(
      """
      SELECT c.taskId AS taskId, COUNT(c) AS total
      FROM TaskComment c
      WHERE c.taskId IN :taskIds
      GROUP BY c.taskId
      """)
  List<CommentCount> countByTask(@Param("taskIds") Collection<UUID> taskIds);

  interface CommentCount {
    UUID getTaskId();

    long getTotal();
  }
}
