package io.b2mash.b2b.projecthub.multitenancy;

import io.b2mash.b2b.projecthub.project.Project;
import io.b2mash.b2b.projecthub.task.Task;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.domain.Specification;

/**
 * Builds the row filter that restricts a query to one organization's data. Every read of
 * tenant-owned rows goes through {@link #scopeToTenant}. Anything the filter cannot place (an
 * unknown entity type or a missing tenant) matches no rows.
 */
public final class TenantScope {

  private static final Logger log = LoggerFactory.getLogger(TenantScope.class);

  private TenantScope() {}

  public static <T> Specification<T> scopeToTenant(Class<T> entityClass, Tenant tenant) {
    if (tenant == null || tenant.id() == null) {
      return matchNothing();
    }
    var kind = EntityKind.of(entityClass);
    if (kind.isEmpty()) {
      log.warn("No tenant path for entity type {}, matching nothing", entityClass.getName());
      return matchNothing();
    }
    UUID orgId = tenant.id();
    return switch (kind.get()) {
      case PROJECT, USER -> (root, query, cb) -> cb.equal(root.get("organizationId"), orgId);
      case TASK -> (root, query, cb) -> root.get("projectId").in(projectIds(query, cb, orgId));
      case TASK_COMMENT ->
          (root, query, cb) -> root.get("taskId").in(taskIds(query, cb, orgId));
    };
  }

  /** Restricts {@code spec} to the tenant; the tenant predicate is always applied. */
  public static <T> Specification<T> scoped(
      Class<T> entityClass, Tenant tenant, Specification<T> spec) {
    Specification<T> scope = scopeToTenant(entityClass, tenant);
    return spec == null ? scope : scope.and(spec);
  }

  private static <T> Specification<T> matchNothing() {
    return (root, query, cb) -> cb.disjunction();
  }

  private static Subquery<UUID> projectIds(CriteriaQuery<?> query, CriteriaBuilder cb, UUID orgId) {
    Subquery<UUID> sub = query.subquery(UUID.class);
    Root<Project> project = sub.from(Project.class);
    sub.select(project.get("id")).where(cb.equal(project.get("organizationId"), orgId));
    return sub;
  }

  private static Subquery<UUID> taskIds(CriteriaQuery<?> query, CriteriaBuilder cb, UUID orgId) {
    Subquery<UUID> sub = query.subquery(UUID.class);
    Root<Task> task = sub.from(Task.class);
    Predicate inTenant = task.get("projectId").in(projectIds(query, cb, orgId));
    sub.select(task.get("id")).where(inTenant);
    return sub;
  }
}
