package io.b2mash.b2b.projecthub.statistics;

import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import io.b2mash.b2b.projecthub.multitenancy.Tenant;
import io.b2mash.b2b.projecthub.multitenancy.TenantScope;
import io.b2mash.b2b.projecthub.project.Project;
import io.b2mash.b2b.projecthub.project.ProjectProgress;
import io.b2mash.b2b.projecthub.project.ProjectRepository;
import io.b2mash.b2b.projecthub.project.ProjectService;
import io.b2mash.b2b.projecthub.project.ProjectStatus;
import io.b2mash.b2b.projecthub.security.AccessGuard;
import io.b2mash.b2b.projecthub.security.AccessPolicy;
import io.b2mash.b2b.projecthub.task.Task;
import io.b2mash.b2b.projecthub.task.TaskRepository;
import io.b2mash.b2b.projecthub.task.TaskStatus;
import io.b2mash.b2b.projecthub.user.User;
import io.b2mash.b2b.projecthub.user.UserRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Aggregate counts over the current organization's projects and tasks. */
@Service
public class StatisticsService {

  private static final List<ProjectStatus> OVERDUE_PROJECT_STATUSES =
      List.of(ProjectStatus.ACTIVE, ProjectStatus.ON_HOLD);

  private final ProjectRepository projectRepository;
  private final TaskRepository taskRepository;
  private final UserRepository userRepository;
  private final ProjectService projectService;

  public StatisticsService(
      ProjectRepository projectRepository,
      TaskRepository taskRepository,
      UserRepository userRepository,
      ProjectService projectService) {
    this.projectRepository = projectRepository;
    this.taskRepository = taskRepository;
    this.userRepository = userRepository;
    this.projectService = projectService;
  }

  @Transactional(readOnly = true)
  public ProjectStatistics projectStatistics(RequestContext context) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    return projectStatistics(tenant);
  }

  /** Task statistics for the whole organization, or for one of its projects. */
  @Transactional(readOnly = true)
  public TaskStatistics taskStatistics(RequestContext context, UUID projectId) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    if (projectId != null) {
      projectService.findInTenant(tenant, projectId);
    }
    return taskStatistics(tenant, projectId);
  }

  @Transactional(readOnly = true)
  public OrganizationStatistics organizationStatistics(RequestContext context) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    long users = userRepository.count(TenantScope.scopeToTenant(User.class, tenant));
    return new OrganizationStatistics(
        projectStatistics(tenant), taskStatistics(tenant, null), users);
  }

  ProjectStatistics projectStatistics(Tenant tenant) {
    long total = countProjects(tenant, null);
    long completed = countProjects(tenant, projectStatus(ProjectStatus.COMPLETED));
    Specification<Project> overdue =
        (root, query, cb) ->
            cb.and(
                cb.lessThan(root.<LocalDate>get("dueDate"), LocalDate.now()),
                root.get("status").in(OVERDUE_PROJECT_STATUSES));
    return new ProjectStatistics(
        total,
        countProjects(tenant, projectStatus(ProjectStatus.PLANNING)),
        countProjects(tenant, projectStatus(ProjectStatus.ACTIVE)),
        completed,
        countProjects(tenant, projectStatus(ProjectStatus.ON_HOLD)),
        countProjects(tenant, projectStatus(ProjectStatus.CANCELLED)),
        countProjects(tenant, overdue),
        ProjectProgress.percentage(completed, total));
  }

  TaskStatistics taskStatistics(Tenant tenant, UUID projectId) {
    Specification<Task> base =
        projectId == null ? null : (root, query, cb) -> cb.equal(root.get("projectId"), projectId);
    long total = countTasks(tenant, base, null);
    long done = countTasks(tenant, base, taskStatus(TaskStatus.DONE));
    Specification<Task> overdue =
        (root, query, cb) ->
            cb.and(
                cb.lessThan(root.<Instant>get("dueDate"), Instant.now()),
                cb.notEqual(root.get("status"), TaskStatus.DONE));
    return new TaskStatistics(
        total,
        countTasks(tenant, base, taskStatus(TaskStatus.TODO)),
        countTasks(tenant, base, taskStatus(TaskStatus.IN_PROGRESS)),
        done,
        countTasks(tenant, base, overdue),
        ProjectProgress.percentage(done, total),
        averageCompletionHours(tenant, base));
  }

  private Double averageCompletionHours(Tenant tenant, Specification<Task> base) {
    Specification<Task> completed =
        (root, query, cb) ->
            cb.and(
                cb.equal(root.get("status"), TaskStatus.DONE),
                cb.isNotNull(root.get("completedAt")));
    var tasks =
        taskRepository.findAll(TenantScope.scoped(Task.class, tenant, and(base, completed)));
    if (tasks.isEmpty()) {
      return null;
    }
    double hours =
        tasks.stream()
            .mapToLong(t -> Duration.between(t.getCreatedAt(), t.getCompletedAt()).toSeconds())
            .average()
            .orElse(0)
        / 3600.0;
    return BigDecimal.valueOf(hours).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }

  private long countProjects(Tenant tenant, Specification<Project> spec) {
    return projectRepository.count(TenantScope.scoped(Project.class, tenant, spec));
  }

  private long countTasks(Tenant tenant, Specification<Task> base, Specification<Task> spec) {
    return taskRepository.count(TenantScope.scoped(Task.class, tenant, and(base, spec)));
  }

  private static <T> Specification<T> and(Specification<T> left, Specification<T> right) {
    if (left == null) {
      return right;
    }
    return right == null ? left : left.and(right);
  }

  private static Specification<Project> projectStatus(ProjectStatus status) {
    return (root, query, cb) -> cb.equal(root.get("status"), status);
  }

  private static Specification<Task> taskStatus(TaskStatus status) {
    return (root, query, cb) -> cb.equal(root.get("status"), status);
  }
}
