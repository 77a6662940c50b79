package io.b2mash.b2b.projecthub.project;

import io.b2mash.b2b.projecthub.exception.ResourceNotFoundException;
import io.b2mash.b2b.projecthub.exception.ValidationFailedException;
import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import io.b2mash.b2b.projecthub.multitenancy.Tenant;
import io.b2mash.b2b.projecthub.multitenancy.TenantScope;
import io.b2mash.b2b.projecthub.pagination.OffsetPageRequest;
import io.b2mash.b2b.projecthub.pagination.SortOrder;
import io.b2mash.b2b.projecthub.security.AccessGuard;
import io.b2mash.b2b.projecthub.security.AccessPolicy;
import io.b2mash.b2b.projecthub.task.TaskRepository;
import io.b2mash.b2b.projecthub.task.TaskStatus;
import io.b2mash.b2b.projecthub.validation.InputValidator;
import java.time.LocalDate;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {

  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private final ProjectRepository repository;
  private final TaskRepository taskRepository;
  private final InputValidator inputValidator;

  public ProjectService(
      ProjectRepository repository, TaskRepository taskRepository, InputValidator inputValidator) {
    this.repository = repository;
    this.taskRepository = taskRepository;
    this.inputValidator = inputValidator;
  }

  @Transactional(readOnly = true)
  public Page<Project> listProjects(
      RequestContext context,
      ProjectFilter filter,
      ProjectSortField sortBy,
      SortOrder sortOrder,
      Integer first,
      String after) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    var sort =
        Sort.by(
                (sortOrder != null ? sortOrder : SortOrder.DESC).direction(),
                (sortBy != null ? sortBy : ProjectSortField.CREATED_AT).property())
            .and(Sort.by("id"));
    var spec =
        TenantScope.scoped(
            Project.class, tenant, filter != null ? filter.toSpecification() : null);
    return repository.findAll(spec, OffsetPageRequest.of(first, after, sort));
  }

  @Transactional(readOnly = true)
  public Project getProject(RequestContext context, UUID id) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    return findInTenant(tenant, id);
  }

  /** Loads a project of {@code tenant}; projects of other organizations are not found. */
  @Transactional(readOnly = true)
  public Project findInTenant(Tenant tenant, UUID id) {
    if (id == null) {
      throw new ResourceNotFoundException("Project", null);
    }
    return repository
        .findOne(TenantScope.scoped(Project.class, tenant, hasId(id)))
        .orElseThrow(() -> new ResourceNotFoundException("Project", id));
  }

  @Transactional
  public Project createProject(RequestContext context, CreateProjectInput input) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();

    var errors = inputValidator.validate(input);
    if (input.dueDate() != null && input.dueDate().isBefore(LocalDate.now())) {
      errors.add("Project due date cannot be in the past");
    }
    if (errors.isEmpty()
        && repository.existsByOrganizationIdAndNameIgnoreCase(tenant.id(), input.name().trim())) {
      errors.add("A project with this name already exists in your organization");
    }
    if (!errors.isEmpty()) {
      throw new ValidationFailedException(errors);
    }

    var project =
        new Project(tenant.id(), input.name().trim(), input.description(), input.dueDate());
    if (input.status() != null) {
      project.update(null, null, input.status(), null);
    }
    project = saveUnique(project);
    log.info("Created project {} in organization {}", project.getId(), tenant.id());
    return project;
  }

  @Transactional
  public Project updateProject(RequestContext context, UUID id, UpdateProjectInput input) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_ADMIN).tenant();
    var project = findInTenant(tenant, id);

    var errors = inputValidator.validate(input);
    String name = input.name() != null ? input.name().trim() : null;
    if (errors.isEmpty()
        && name != null
        && repository.existsByOrganizationIdAndNameIgnoreCaseAndIdNot(tenant.id(), name, id)) {
      errors.add("A project with this name already exists in your organization");
    }
    if (!errors.isEmpty()) {
      throw new ValidationFailedException(errors);
    }

    project.update(name, input.description(), input.status(), input.dueDate());
    project = saveUnique(project);
    log.info("Updated project {}", project.getId());
    return project;
  }

  @Transactional
  public void deleteProject(RequestContext context, UUID id) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_ADMIN).tenant();
    var project = findInTenant(tenant, id);
    repository.delete(project);
    log.info("Deleted project {} from organization {}", id, tenant.id());
  }

  /**
   * Task counts for the given projects in one grouped query. The ids must come from a tenant-scoped
   * read.
   */
  @Transactional(readOnly = true)
  public Map<UUID, ProjectProgress> progressOf(Collection<UUID> projectIds) {
    var counts = new HashMap<UUID, Map<TaskStatus, Long>>();
    if (!projectIds.isEmpty()) {
      for (var row : taskRepository.countByProjectAndStatus(projectIds)) {
        counts
            .computeIfAbsent(row.getProjectId(), k -> new EnumMap<>(TaskStatus.class))
            .put(row.getStatus(), row.getTotal());
      }
    }
    var result = new HashMap<UUID, ProjectProgress>();
    for (UUID id : projectIds) {
      var c = counts.getOrDefault(id, Map.of());
      result.put(
          id,
          new ProjectProgress(
              c.getOrDefault(TaskStatus.TODO, 0L),
              c.getOrDefault(TaskStatus.IN_PROGRESS, 0L),
              c.getOrDefault(TaskStatus.DONE, 0L)));
    }
    return result;
  }

  private Project saveUnique(Project project) {
    try {
      return repository.saveAndFlush(project);
    } catch (DataIntegrityViolationException e) {
      throw new ValidationFailedException(
          "A project with this name already exists in your organization");
    }
  }

  private static Specification<Project> hasId(UUID id) {
    return (root, query, cb) -> cb.equal(root.get("id"), id);
  }
}
