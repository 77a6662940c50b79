package io.b2mash.b2b.projecthub.multitenancy;

import io.b2mash.b2b.projecthub.comment.TaskComment;
import io.b2mash.b2b.projecthub.project.Project;
import io.b2mash.b2b.projecthub.task.Task;
import io.b2mash.b2b.projecthub.user.User;
import java.util.Arrays;
import java.util.Optional;

/** Tenant-owned entity types and how each one reaches its organization. */
public enum EntityKind {
  /** {@code projects.organization_id}. */
  PROJECT(Project.class),
  /** {@code tasks.project_id -> projects.organization_id}. */
  TASK(Task.class),
  /** {@code task_comments.task_id -> tasks.project_id -> projects.organization_id}. */
  TASK_COMMENT(TaskComment.class),
  /** {@code users.organization_id}. */
  USER(User.class);

  private final Class<?> entityClass;

  EntityKind(Class<?> entityClass) {
    this.entityClass = entityClass;
  }

  public static Optional<EntityKind> of(Class<?> entityClass) {
    return Arrays.stream(values()).filter(kind -> kind.entityClass == entityClass).findFirst();
  }
}
