package io.b2mash.b2b.projecthub.task;

import io.b2mash.b2b.projecthub.event.TaskAssignedEvent;
import io.b2mash.b2b.projecthub.event.TaskCompletedEvent;
import io.b2mash.b2b.projecthub.exception.ResourceNotFoundException;
import io.b2mash.b2b.projecthub.exception.ValidationFailedException;
import io.b2mash.b2b.projecthub.multitenancy.Principal;
import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import io.b2mash.b2b.projecthub.multitenancy.Tenant;
import io.b2mash.b2b.projecthub.multitenancy.TenantScope;
import io.b2mash.b2b.projecthub.pagination.OffsetPageRequest;
import io.b2mash.b2b.projecthub.pagination.SortOrder;
import io.b2mash.b2b.projecthub.project.ProjectService;
import io.b2mash.b2b.projecthub.security.AccessGuard;
import io.b2mash.b2b.projecthub.security.AccessPolicy;
import io.b2mash.b2b.projecthub.validation.InputValidator;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  /** How far in the past a new task's due date may lie. */
  static final Duration DUE_DATE_GRACE = Duration.ofDays(1);

  private final TaskRepository repository;
  private final ProjectService projectService;
  private final InputValidator inputValidator;
  private final ApplicationEventPublisher eventPublisher;

  public TaskService(
      TaskRepository repository,
      ProjectService projectService,
      InputValidator inputValidator,
      ApplicationEventPublisher eventPublisher) {
    this.repository = repository;
    this.projectService = projectService;
    this.inputValidator = inputValidator;
    this.eventPublisher = eventPublisher;
  }

  @Transactional(readOnly = true)
  public Page<Task> listTasks(
      RequestContext context,
      TaskFilter filter,
      TaskSortField sortBy,
      SortOrder sortOrder,
      Integer first,
      String after) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    var sort =
        Sort.by(
                (sortOrder != null ? sortOrder : SortOrder.DESC).direction(),
                (sortBy != null ? sortBy : TaskSortField.CREATED_AT).property())
            .and(Sort.by("id"));
    var spec =
        TenantScope.scoped(Task.class, tenant, filter != null ? filter.toSpecification() : null);
    return repository.findAll(spec, OffsetPageRequest.of(first, after, sort));
  }

  @Transactional(readOnly = true)
  public List<Task> listTasksOfProject(RequestContext context, UUID projectId) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    Specification<Task> inProject = (root, query, cb) -> cb.equal(root.get("projectId"), projectId);
    return repository.findAll(
        TenantScope.scoped(Task.class, tenant, inProject), Sort.by("createdAt", "id"));
  }

  @Transactional(readOnly = true)
  public Task getTask(RequestContext context, UUID id) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    return findInTenant(tenant, id);
  }

  /** Loads a task of {@code tenant}; tasks of other organizations are not found. */
  @Transactional(readOnly = true)
  public Task findInTenant(Tenant tenant, UUID id) {
    Specification<Task> hasId = (root, query, cb) -> cb.equal(root.get("id"), id);
    return repository
        .findOne(TenantScope.scoped(Task.class, tenant, hasId))
        .orElseThrow(() -> new ResourceNotFoundException("Task", id));
  }

  @Transactional
  public Task createTask(RequestContext context, CreateTaskInput input) {
    var grant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER);
    var tenant = grant.tenant();

    var errors = inputValidator.validate(input);
    if (input.dueDate() != null
        && input.dueDate().toInstant().isBefore(Instant.now().minus(DUE_DATE_GRACE))) {
      errors.add("Task due date cannot be more than 1 day in the past");
    }
    if (!errors.isEmpty()) {
      throw new ValidationFailedException(errors);
    }

    var project = projectService.findInTenant(tenant, input.projectId());
    var task =
        new Task(
            project.getId(),
            input.title().trim(),
            input.description(),
            blankToNull(input.assigneeEmail()),
            input.dueDate() != null ? input.dueDate().toInstant() : null);
    boolean completed = task.changeStatus(input.status());
    task = repository.save(task);
    log.info("Created task {} in project {}", task.getId(), project.getId());

    if (task.getAssigneeEmail() != null) {
      publishAssigned(task, tenant, grant.principal());
    }
    if (completed) {
      publishCompleted(task, tenant, grant.principal());
    }
    return task;
  }

  @Transactional
  public Task updateTask(RequestContext context, UUID id, UpdateTaskInput input) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    var task = findInTenant(tenant, id);
    var principal =
        AccessGuard.require(context, task, AccessPolicy.OBJECT_OWNER_OR_ADMIN).principal();

    var errors = inputValidator.validate(input);
    if (!errors.isEmpty()) {
      throw new ValidationFailedException(errors);
    }

    String previousAssignee = task.getAssigneeEmail();
    task.update(
        input.title() != null ? input.title().trim() : null,
        input.description(),
        input.assigneeEmail() != null ? input.assigneeEmail().trim() : null,
        input.dueDate() != null ? input.dueDate().toInstant() : null);
    boolean completed = task.changeStatus(input.status());
    task = repository.save(task);
    log.info("Updated task {}", task.getId());

    if (task.getAssigneeEmail() != null
        && !task.getAssigneeEmail().equalsIgnoreCase(Objects.toString(previousAssignee, ""))) {
      publishAssigned(task, tenant, principal);
    }
    if (completed) {
      publishCompleted(task, tenant, principal);
    }
    return task;
  }

  @Transactional
  public void deleteTask(RequestContext context, UUID id) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    var task = findInTenant(tenant, id);
    AccessGuard.require(context, task, AccessPolicy.OBJECT_OWNER_OR_ADMIN);
    repository.delete(task);
    log.info("Deleted task {}", id);
  }

  private void publishAssigned(Task task, Tenant tenant, Principal actor) {
    eventPublisher.publishEvent(
        new TaskAssignedEvent(
            task.getId(),
            task.getProjectId(),
            tenant.id(),
            actor.userId(),
            task.getAssigneeEmail(),
            task.getTitle(),
            Instant.now()));
  }

  private void publishCompleted(Task task, Tenant tenant, Principal actor) {
    eventPublisher.publishEvent(
        new TaskCompletedEvent(
            task.getId(),
            task.getProjectId(),
            tenant.id(),
            actor.userId(),
            task.getTitle(),
            Instant.now()));
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
