package io.b2mash.b2b.projecthub.user;

import io.b2mash.b2b.projecthub.exception.ResourceNotFoundException;
import io.b2mash.b2b.projecthub.exception.UnauthenticatedException;
import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import io.b2mash.b2b.projecthub.multitenancy.Tenant;
import io.b2mash.b2b.projecthub.multitenancy.TenantScope;
import io.b2mash.b2b.projecthub.security.AccessGuard;
import io.b2mash.b2b.projecthub.security.AccessPolicy;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class UserService {

  private final UserRepository repository;

  public UserService(UserRepository repository) {
    this.repository = repository;
  }

  @Transactional(readOnly = true)
  public User getCurrentUser(RequestContext context) {
    var principal = AccessGuard.require(context, AccessPolicy.AUTHENTICATED).principal();
    return repository
        .findById(principal.userId())
        .orElseThrow(() -> new UnauthenticatedException("User not found"));
  }

  @Transactional(readOnly = true)
  public List<User> listUsers(RequestContext context) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    return repository.findAll(
        TenantScope.scopeToTenant(User.class, tenant), Sort.by(Sort.Direction.ASC, "email"));
  }

  @Transactional(readOnly = true)
  public User getUser(RequestContext context, UUID id) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    return repository
        .findOne(TenantScope.scoped(User.class, tenant, hasId(id)))
        .orElseThrow(() -> new ResourceNotFoundException("User", id));
  }

  /** Looks up a member of {@code tenant} by email; empty for outsiders and unknown addresses. */
  @Transactional(readOnly = true)
  public Optional<User> findMemberByEmail(Tenant tenant, String email) {
    if (email == null || email.isBlank()) {
      return Optional.empty();
    }
    String normalized = email.trim().toLowerCase(Locale.ROOT);
    Specification<User> byEmail =
        (root, query, cb) -> cb.equal(cb.lower(root.<String>get("email")), normalized);
    return repository.findOne(TenantScope.scoped(User.class, tenant, byEmail));
  }

  private static Specification<User> hasId(UUID id) {
    return (root, query, cb) -> cb.equal(root.get("id"), id);
  }
}
