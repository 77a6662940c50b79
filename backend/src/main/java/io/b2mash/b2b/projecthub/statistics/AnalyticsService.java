package io.b2mash.b2b.projecthub.statistics;

import io.b2mash.b2b.projecthub.comment.TaskComment;
import io.b2mash.b2b.projecthub.comment.TaskCommentRepository;
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
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Trend, health and productivity analytics for the current organization. Every read goes through
 * {@link TenantScope}; aggregation happens in memory over the tenant's rows.
 */
@Service
public class AnalyticsService {

  static final int MAX_TREND_DAYS = 365;
  static final int MAX_PRODUCTIVITY_LIMIT = 100;
  static final int RECENT_DAYS = 7;

  private final ProjectRepository projectRepository;
  private final TaskRepository taskRepository;
  private final TaskCommentRepository commentRepository;
  private final UserRepository userRepository;
  private final ProjectService projectService;
  private final StatisticsService statisticsService;
  private final Clock clock;

  @Autowired
  public AnalyticsService(
      ProjectRepository projectRepository,
      TaskRepository taskRepository,
      TaskCommentRepository commentRepository,
      UserRepository userRepository,
      ProjectService projectService,
      StatisticsService statisticsService) {
    this(
        projectRepository,
        taskRepository,
        commentRepository,
        userRepository,
        projectService,
        statisticsService,
        Clock.systemUTC());
  }

  AnalyticsService(
      ProjectRepository projectRepository,
      TaskRepository taskRepository,
      TaskCommentRepository commentRepository,
      UserRepository userRepository,
      ProjectService projectService,
      StatisticsService statisticsService,
      Clock clock) {
    this.projectRepository = projectRepository;
    this.taskRepository = taskRepository;
    this.commentRepository = commentRepository;
    this.userRepository = userRepository;
    this.projectService = projectService;
    this.statisticsService = statisticsService;
    this.clock = clock;
  }

  /**
   * Daily project completion rate from {@code days} ago through today, oldest first. A project
   * counts as completed on a day if it is COMPLETED now and was last updated by the end of that
   * day.
   */
  @Transactional(readOnly = true)
  public List<TrendPoint> projectCompletionTrends(RequestContext context, Integer days) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    return trend(
        clampDays(days),
        projectsOf(tenant),
        Project::getCreatedAt,
        (day, p) ->
            p.getStatus() == ProjectStatus.COMPLETED && !dateOf(p.getUpdatedAt()).isAfter(day));
  }

  /** Daily task completion rate, organization-wide or for one project. */
  @Transactional(readOnly = true)
  public List<TrendPoint> taskCompletionTrends(
      RequestContext context, Integer days, UUID projectId) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    return trend(
        clampDays(days),
        tasksOf(tenant, projectId),
        Task::getCreatedAt,
        (day, t) ->
            t.getStatus() == TaskStatus.DONE
                && t.getCompletedAt() != null
                && !dateOf(t.getCompletedAt()).isAfter(day));
  }

  @Transactional(readOnly = true)
  public double projectHealthScore(RequestContext context, UUID projectId) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    var tasks = tasksOf(tenant, projectId);
    Instant now = clock.instant();
    Instant weekAgo = now.minus(Duration.ofDays(RECENT_DAYS));

    Set<UUID> taskIds = tasks.stream().map(Task::getId).collect(Collectors.toSet());
    long recentComments =
        commentsOf(tenant).stream()
            .filter(c -> taskIds.contains(c.getTaskId()))
            .filter(c -> !c.getCreatedAt().isBefore(weekAgo))
            .count();
    long recentUpdates = tasks.stream().filter(t -> !t.getUpdatedAt().isBefore(weekAgo)).count();

    var input =
        new ProjectHealthInput(
            tasks.size(),
            (int) tasks.stream().filter(t -> t.getStatus() == TaskStatus.DONE).count(),
            (int) tasks.stream().filter(t -> t.getDueDate() != null).count(),
            (int) tasks.stream().filter(AnalyticsService::doneOnTime).count(),
            (int) (recentComments + recentUpdates),
            (int) tasks.stream().filter(t -> t.isOverdue(now)).count());
    return ProjectHealthCalculator.calculate(input);
  }

  /** Members ranked by a weighted productivity score, highest first. */
  @Transactional(readOnly = true)
  public List<UserProductivity> userProductivityMetrics(RequestContext context, Integer limit) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    int size = limit == null ? 10 : Math.max(1, Math.min(limit, MAX_PRODUCTIVITY_LIMIT));
    return productivity(usersOf(tenant), tasksOf(tenant, null), commentsOf(tenant), size);
  }

  /** Task counts per assignee email; unassigned tasks are left out. */
  @Transactional(readOnly = true)
  public List<AssigneeTaskStats> taskDistributionByAssignee(
      RequestContext context, UUID projectId) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    Map<String, List<Task>> byAssignee = new TreeMap<>();
    for (Task task : tasksOf(tenant, projectId)) {
      if (task.getAssigneeEmail() != null && !task.getAssigneeEmail().isBlank()) {
        String email = task.getAssigneeEmail().toLowerCase(Locale.ROOT);
        byAssignee.computeIfAbsent(email, k -> new ArrayList<>()).add(task);
      }
    }
    return byAssignee.entrySet().stream()
        .map(
            e -> {
              var tasks = e.getValue();
              long done = countStatus(tasks, TaskStatus.DONE);
              return new AssigneeTaskStats(
                  e.getKey(),
                  tasks.size(),
                  done,
                  countStatus(tasks, TaskStatus.IN_PROGRESS),
                  countStatus(tasks, TaskStatus.TODO),
                  ProjectProgress.percentage(done, tasks.size()));
            })
        .sorted(Comparator.comparingLong(AssigneeTaskStats::totalTasks).reversed())
        .toList();
  }

  @Transactional(readOnly = true)
  public ComprehensiveAnalytics comprehensiveAnalytics(RequestContext context) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    var projects = projectsOf(tenant);
    var tasks = tasksOf(tenant, null);
    var comments = commentsOf(tenant);
    var users = usersOf(tenant);
    var projectStats = statisticsService.projectStatistics(tenant);
    var taskStats = statisticsService.taskStatistics(tenant, null);

    return new ComprehensiveAnalytics(
        projectStats,
        taskStats,
        productivity(users, tasks, comments, 5),
        collaboration(tasks, comments),
        recentActivity(projects, tasks, comments),
        kpis(projectStats, taskStats, users));
  }

  private <T> List<TrendPoint> trend(
      int days,
      List<T> items,
      Function<T, Instant> createdAt,
      BiPredicate<LocalDate, T> completedBy) {
    LocalDate today = dateOf(clock.instant());
    var points = new ArrayList<TrendPoint>(days + 1);
    for (LocalDate day = today.minusDays(days); !day.isAfter(today); day = day.plusDays(1)) {
      LocalDate current = day;
      var existing =
          items.stream().filter(item -> !dateOf(createdAt.apply(item)).isAfter(current)).toList();
      long done = existing.stream().filter(item -> completedBy.test(current, item)).count();
      points.add(new TrendPoint(current, ProjectProgress.percentage(done, existing.size())));
    }
    return points;
  }

  private List<UserProductivity> productivity(
      List<User> users, List<Task> tasks, List<TaskComment> comments, int limit) {
    Instant weekAgo = clock.instant().minus(Duration.ofDays(RECENT_DAYS));
    var metrics = new ArrayList<UserProductivity>();
    for (User user : users) {
      Predicate<String> isUser = email -> email != null && email.equalsIgnoreCase(user.getEmail());
      var assigned = tasks.stream().filter(t -> isUser.test(t.getAssigneeEmail())).toList();
      var done = assigned.stream().filter(t -> t.getStatus() == TaskStatus.DONE).toList();
      var authored = comments.stream().filter(c -> isUser.test(c.getAuthorEmail())).toList();
      long recent =
          authored.stream().filter(c -> !c.getCreatedAt().isBefore(weekAgo)).count()
              + assigned.stream().filter(t -> !t.getUpdatedAt().isBefore(weekAgo)).count();
      metrics.add(
          new UserProductivity(
              user,
              assigned.size(),
              done.size(),
              ProjectProgress.percentage(done.size(), assigned.size()),
              authored.size(),
              assigned.stream().map(Task::getProjectId).distinct().count(),
              averageCompletionHours(done),
              recent));
    }
    return metrics.stream()
        .sorted(
            Comparator.comparingDouble(AnalyticsService::productivityScore)
                .reversed()
                .thenComparing(m -> m.user().getEmail()))
        .limit(limit)
        .toList();
  }

  private CollaborationMetrics collaboration(List<Task> tasks, List<TaskComment> comments) {
    Instant weekAgo = clock.instant().minus(Duration.ofDays(RECENT_DAYS));
    long recent = comments.stream().filter(c -> !c.getCreatedAt().isBefore(weekAgo)).count();
    long assigned =
        tasks.stream()
            .filter(t -> t.getAssigneeEmail() != null && !t.getAssigneeEmail().isBlank())
            .count();
    double perTask = tasks.isEmpty() ? 0.0 : round((double) comments.size() / tasks.size());
    return new CollaborationMetrics(
        comments.size(),
        recent,
        ProjectProgress.percentage(assigned, tasks.size()),
        perTask,
        recent > comments.size() / 52.0 ? "increasing" : "stable");
  }

  private RecentActivity recentActivity(
      List<Project> projects, List<Task> tasks, List<TaskComment> comments) {
    Instant cutoff = clock.instant().minus(Duration.ofDays(RECENT_DAYS));
    long newProjects = projects.stream().filter(p -> !p.getCreatedAt().isBefore(cutoff)).count();
    long newTasks = tasks.stream().filter(t -> !t.getCreatedAt().isBefore(cutoff)).count();
    long completed =
        tasks.stream()
            .filter(t -> t.getCompletedAt() != null && !t.getCompletedAt().isBefore(cutoff))
            .count();
    long newComments = comments.stream().filter(c -> !c.getCreatedAt().isBefore(cutoff)).count();
    return new RecentActivity(
        RECENT_DAYS,
        newProjects,
        newTasks,
        completed,
        newComments,
        newProjects + newTasks + completed + newComments);
  }

  private static KeyPerformanceIndicators kpis(
      ProjectStatistics projects, TaskStatistics tasks, List<User> users) {
    double overdueProjects =
        ProjectProgress.percentage(
            projects.overdueProjects(), Math.max(projects.totalProjects(), 1));
    double overdueTasks =
        ProjectProgress.percentage(tasks.overdueTasks(), Math.max(tasks.totalTasks(), 1));
    long activeUsers = users.stream().filter(User::isActive).count();
    double score =
        projects.completionRate() * 0.3
            + tasks.completionRate() * 0.4
            + Math.max(0, 100 - overdueTasks) * 0.2
            + Math.min(activeUsers / 10.0, 1.0) * 10;
    return new KeyPerformanceIndicators(
        projects.completionRate(),
        tasks.completionRate(),
        tasks.averageCompletionTime(),
        overdueProjects,
        overdueTasks,
        activeUsers,
        round(Math.min(100.0, score)));
  }

  private static double productivityScore(UserProductivity m) {
    return m.completionRate() * 0.4
        + m.recentActivityCount() * 0.3
        + Math.min(m.totalAssignedTasks() / 10.0, 1.0) * 20
        + Math.min(m.commentsMade() / 5.0, 1.0) * 10;
  }

  private static Double averageCompletionHours(List<Task> done) {
    var durations =
        done.stream()
            .filter(t -> t.getCompletedAt() != null)
            .mapToLong(t -> Duration.between(t.getCreatedAt(), t.getCompletedAt()).toSeconds())
            .summaryStatistics();
    return durations.getCount() == 0 ? null : round(durations.getAverage() / 3600.0);
  }

  private static boolean doneOnTime(Task task) {
    return task.getStatus() == TaskStatus.DONE
        && task.getDueDate() != null
        && task.getCompletedAt() != null
        && !task.getCompletedAt().isAfter(task.getDueDate());
  }

  private static long countStatus(List<Task> tasks, TaskStatus status) {
    return tasks.stream().filter(t -> t.getStatus() == status).count();
  }

  private List<Project> projectsOf(Tenant tenant) {
    return projectRepository.findAll(TenantScope.scopeToTenant(Project.class, tenant));
  }

  private List<Task> tasksOf(Tenant tenant, UUID projectId) {
    if (projectId == null) {
      return taskRepository.findAll(TenantScope.scopeToTenant(Task.class, tenant));
    }
    var project = projectService.findInTenant(tenant, projectId);
    Specification<Task> inProject =
        (root, query, cb) -> cb.equal(root.get("projectId"), project.getId());
    return taskRepository.findAll(TenantScope.scoped(Task.class, tenant, inProject));
  }

  private List<TaskComment> commentsOf(Tenant tenant) {
    return commentRepository.findAll(TenantScope.scopeToTenant(TaskComment.class, tenant));
  }

  private List<User> usersOf(Tenant tenant) {
    return userRepository.findAll(TenantScope.scopeToTenant(User.class, tenant));
  }

  private static int clampDays(Integer days) {
    return days == null ? 30 : Math.max(1, Math.min(days, MAX_TREND_DAYS));
  }

  private static LocalDate dateOf(Instant instant) {
    return LocalDate.ofInstant(instant, ZoneOffset.UTC);
  }

  private static double round(double value) {
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }
}
