package io.b2mash.b2b.projecthub.comment;

import io.b2mash.b2b.projecthub.exception.ResourceNotFoundException;
import io.b2mash.b2b.projecthub.exception.ValidationFailedException;
import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import io.b2mash.b2b.projecthub.multitenancy.Tenant;
import io.b2mash.b2b.projecthub.multitenancy.TenantScope;
import io.b2mash.b2b.projecthub.pagination.OffsetPageRequest;
import io.b2mash.b2b.projecthub.security.AccessGuard;
import io.b2mash.b2b.projecthub.security.AccessPolicy;
import io.b2mash.b2b.projecthub.task.TaskService;
import io.b2mash.b2b.projecthub.validation.ContentRules;
import io.b2mash.b2b.projecthub.validation.InputValidator;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TaskCommentService {

  private static final Logger log = LoggerFactory.getLogger(TaskCommentService.class);

  private final TaskCommentRepository repository;
  private final TaskService taskService;
  private final InputValidator inputValidator;

  public TaskCommentService(
      TaskCommentRepository repository, TaskService taskService, InputValidator inputValidator) {
    this.repository = repository;
    this.taskService = taskService;
    this.inputValidator = inputValidator;
  }

  /** Comments of one task, oldest first. The task must belong to the current tenant. */
  @Transactional(readOnly = true)
  public Page<TaskComment> listComments(
      RequestContext context, UUID taskId, Integer first, String after) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    var task = taskService.findInTenant(tenant, taskId);
    Specification<TaskComment> onTask =
        (root, query, cb) -> cb.equal(root.get("taskId"), task.getId());
    var sort = Sort.by(Sort.Direction.ASC, "createdAt", "id");
    return repository.findAll(
        TenantScope.scoped(TaskComment.class, tenant, onTask),
        OffsetPageRequest.of(first, after, sort));
  }

  /** All comments of one task, oldest first. */
  @Transactional(readOnly = true)
  public List<TaskComment> listCommentsOfTask(RequestContext context, UUID taskId) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    Specification<TaskComment> onTask = (root, query, cb) -> cb.equal(root.get("taskId"), taskId);
    return repository.findAll(
        TenantScope.scoped(TaskComment.class, tenant, onTask),
        Sort.by(Sort.Direction.ASC, "createdAt", "id"));
  }

  @Transactional
  public TaskComment createComment(RequestContext context, CreateTaskCommentInput input) {
    var grant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER);

    var errors = inputValidator.validate(input);
    errors.addAll(ContentRules.checkComment(input.content()));
    if (!errors.isEmpty()) {
      throw new ValidationFailedException(errors);
    }

    var task = taskService.findInTenant(grant.tenant(), input.taskId());
    var comment =
        repository.save(
            new TaskComment(task.getId(), input.content().trim(), grant.principal().email()));
    log.info("Created comment {} on task {}", comment.getId(), task.getId());
    return comment;
  }

  @Transactional
  public TaskComment updateComment(RequestContext context, UUID id, UpdateTaskCommentInput input) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    var comment = findInTenant(tenant, id);
    AccessGuard.require(context, comment, AccessPolicy.OBJECT_OWNER_OR_ADMIN);

    var errors = inputValidator.validate(input);
    errors.addAll(ContentRules.checkComment(input.content()));
    if (!errors.isEmpty()) {
      throw new ValidationFailedException(errors);
    }

    comment.updateContent(input.content().trim());
    comment = repository.save(comment);
    log.info("Updated comment {}", comment.getId());
    return comment;
  }

  @Transactional
  public void deleteComment(RequestContext context, UUID id) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    var comment = findInTenant(tenant, id);
    AccessGuard.require(context, comment, AccessPolicy.OBJECT_OWNER_OR_ADMIN);
    repository.delete(comment);
    log.info("Deleted comment {}", id);
  }

  @Transactional(readOnly = true)
  public TaskComment findInTenant(Tenant tenant, UUID id) {
    Specification<TaskComment> hasId = (root, query, cb) -> cb.equal(root.get("id"), id);
    return repository
        .findOne(TenantScope.scoped(TaskComment.class, tenant, hasId))
        .orElseThrow(() -> new ResourceNotFoundException("Comment", id));
  }

  /** Comment counts for task ids that came from a tenant-scoped read. */
  @Transactional(readOnly = true)
  public Map<UUID, Long> countsOf(Collection<UUID> taskIds) {
    var result = new HashMap<UUID, Long>();
    taskIds.forEach(id -> result.put(id, 0L));
    if (!taskIds.isEmpty()) {
      repository.countByTask(taskIds).forEach(row -> result.put(row.getTaskId(), row.getTotal()));
    }
    return result;
  }
}
