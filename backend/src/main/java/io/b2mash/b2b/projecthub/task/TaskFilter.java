package io.b2mash.b2b.projecthub.task;

import jakarta.persistence.criteria.Predicate;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Locale;
import java.util.UUID;
import org.springframework.data.jpa.domain.Specification;

public record TaskFilter(
    TaskStatus status,
    String titleContains,
    String assigneeEmail,
    UUID projectId,
    OffsetDateTime createdAfter,
    OffsetDateTime createdBefore,
    OffsetDateTime dueAfter,
    OffsetDateTime dueBefore) {

  public Specification<Task> toSpecification() {
    return (root, query, cb) -> {
      var predicates = new ArrayList<Predicate>();
      if (status != null) {
        predicates.add(cb.equal(root.get("status"), status));
      }
      if (titleContains != null && !titleContains.isBlank()) {
        String pattern = "%" + titleContains.trim().toLowerCase(Locale.ROOT) + "%";
        predicates.add(cb.like(cb.lower(root.<String>get("title")), pattern));
      }
      if (assigneeEmail != null && !assigneeEmail.isBlank()) {
        String email = assigneeEmail.trim().toLowerCase(Locale.ROOT);
        predicates.add(cb.equal(cb.lower(root.<String>get("assigneeEmail")), email));
      }
      if (projectId != null) {
        predicates.add(cb.equal(root.get("projectId"), projectId));
      }
      if (createdAfter != null) {
        predicates.add(
            cb.greaterThanOrEqualTo(root.<Instant>get("createdAt"), createdAfter.toInstant()));
      }
      if (createdBefore != null) {
        predicates.add(
            cb.lessThanOrEqualTo(root.<Instant>get("createdAt"), createdBefore.toInstant()));
      }
      if (dueAfter != null) {
        predicates.add(cb.greaterThanOrEqualTo(root.<Instant>get("dueDate"), dueAfter.toInstant()));
      }
      if (dueBefore != null) {
        predicates.add(cb.lessThanOrEqualTo(root.<Instant>get("dueDate"), dueBefore.toInstant()));
      }
      return cb.and(predicates.toArray(Predicate[]::new));
    };
  }
}
