package io.b2mash.b2b.projecthub.project;

import jakarta.persistence.criteria.Predicate;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Locale;
import org.springframework.data.jpa.domain.Specification;

public record ProjectFilter(
    ProjectStatus status,
    String nameContains,
    OffsetDateTime createdAfter,
    OffsetDateTime createdBefore,
    LocalDate dueAfter,
    LocalDate dueBefore) {

  public Specification<Project> toSpecification() {
    return (root, query, cb) -> {
      var predicates = new ArrayList<Predicate>();
      if (status != null) {
        predicates.add(cb.equal(root.get("status"), status));
      }
      if (nameContains != null && !nameContains.isBlank()) {
        String pattern = "%" + nameContains.trim().toLowerCase(Locale.ROOT) + "%";
        predicates.add(cb.like(cb.lower(root.<String>get("name")), pattern));
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
        predicates.add(cb.greaterThanOrEqualTo(root.<LocalDate>get("dueDate"), dueAfter));
      }
      if (dueBefore != null) {
        predicates.add(cb.lessThanOrEqualTo(root.<LocalDate>get("dueDate"), dueBefore));
      }
      return cb.and(predicates.toArray(Predicate[]::new));
    };
  }
}
