package io.b2mash.b2b.projecthub.organization;

import io.b2mash.b2b.projecthub.exception.PermissionDeniedException;
import io.b2mash.b2b.projecthub.exception.ResourceNotFoundException;
import io.b2mash.b2b.projecthub.exception.UnauthenticatedException;
import io.b2mash.b2b.projecthub.exception.ValidationFailedException;
import io.b2mash.b2b.projecthub.multitenancy.Principal;
import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import io.b2mash.b2b.projecthub.security.AccessGuard;
import io.b2mash.b2b.projecthub.security.AccessPolicy;
import io.b2mash.b2b.projecthub.user.User;
import io.b2mash.b2b.projecthub.user.UserRepository;
import io.b2mash.b2b.projecthub.validation.InputValidator;
import io.b2mash.b2b.projecthub.validation.SlugGenerator;
import io.b2mash.b2b.projecthub.validation.SlugRules;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class OrganizationService {

  private static final Logger log = LoggerFactory.getLogger(OrganizationService.class);

  private final OrganizationRepository repository;
  private final UserRepository userRepository;
  private final InputValidator inputValidator;
  private final SlugGenerator slugGenerator;

  public OrganizationService(
      OrganizationRepository repository,
      UserRepository userRepository,
      InputValidator inputValidator,
      SlugGenerator slugGenerator) {
    this.repository = repository;
    this.userRepository = userRepository;
    this.inputValidator = inputValidator;
    this.slugGenerator = slugGenerator;
  }

  /** The organization the request acts within. */
  @Transactional(readOnly = true)
  public Organization getCurrentOrganization(RequestContext context) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_MEMBER).tenant();
    return repository
        .findById(tenant.id())
        .orElseThrow(() -> new ResourceNotFoundException("Organization", tenant.id()));
  }

  /**
   * Resolves a user's organization for display. Visible when it is the caller's own organization or
   * the one the request acts within.
   */
  @Transactional(readOnly = true)
  public Organization findVisibleOrganization(RequestContext context, User user) {
    if (user.getOrganizationId() == null) {
      return null;
    }
    Principal principal = context.principal();
    boolean own = user.getId().equals(principal.userId());
    boolean current =
        context.tenant().map(t -> t.id().equals(user.getOrganizationId())).orElse(false);
    if (!own && !current) {
      return null;
    }
    return repository.findById(user.getOrganizationId()).orElse(null);
  }

  /** Creates an organization and makes the caller its admin. */
  @Transactional
  public Organization createOrganization(RequestContext context, CreateOrganizationInput input) {
    var principal = AccessGuard.require(context, AccessPolicy.AUTHENTICATED).principal();
    var user = loadUser(principal);

    var errors = inputValidator.validate(input);
    if (user.getOrganizationId() != null) {
      errors.add("User already belongs to an organization");
    }

    String slug;
    if (input.slug() == null || input.slug().isBlank()) {
      slug = slugGenerator.generateUnique(input.name());
    } else {
      slug = input.slug().trim().toLowerCase(Locale.ROOT);
      var slugErrors = SlugRules.check(slug);
      errors.addAll(slugErrors);
      if (slugErrors.isEmpty() && repository.existsBySlug(slug)) {
        errors.add("Organization slug '" + slug + "' is already taken");
      }
    }
    if (!errors.isEmpty()) {
      throw new ValidationFailedException(errors);
    }

    Organization organization;
    try {
      organization =
          repository.saveAndFlush(
              new Organization(
                  input.name().trim(), slug, input.contactEmail().trim(), input.description()));
    } catch (DataIntegrityViolationException e) {
      throw new ValidationFailedException("Organization slug '" + slug + "' is already taken");
    }
    user.joinOrganization(organization.getId(), true);
    userRepository.save(user);

    log.info(
        "Created organization {} ({}) with admin {}",
        organization.getId(),
        organization.getSlug(),
        user.getId());
    return organization;
  }

  @Transactional
  public Organization updateOrganization(
      RequestContext context, UUID id, UpdateOrganizationInput input) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_ADMIN).tenant();
    if (!tenant.id().equals(id)) {
      throw new PermissionDeniedException("You can only update the current organization");
    }

    var errors = inputValidator.validate(input);
    if (!errors.isEmpty()) {
      throw new ValidationFailedException(errors);
    }

    var organization =
        repository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Organization", id));
    organization.update(
        input.name() != null ? input.name().trim() : null,
        input.contactEmail() != null ? input.contactEmail().trim() : null,
        input.description());
    organization = repository.save(organization);
    log.info("Updated organization {}", organization.getId());
    return organization;
  }

  /** Attaches an existing user that has no organization yet to the current organization. */
  @Transactional
  public User addMember(RequestContext context, String email, boolean admin) {
    var tenant = AccessGuard.require(context, AccessPolicy.TENANT_ADMIN).tenant();
    if (email == null || email.isBlank()) {
      throw new ValidationFailedException("Email is required");
    }
    var user =
        userRepository
            .findByEmailIgnoreCase(email.trim())
            .orElseThrow(() -> new ValidationFailedException("No user found with that email"));
    if (user.getOrganizationId() != null) {
      throw new ValidationFailedException("User already belongs to an organization");
    }
    user.joinOrganization(tenant.id(), admin);
    user = userRepository.save(user);
    log.info("Added user {} to organization {} (admin={})", user.getId(), tenant.id(), admin);
    return user;
  }

  private User loadUser(Principal principal) {
    return userRepository
        .findById(principal.userId())
        .orElseThrow(() -> new UnauthenticatedException("User not found"));
  }
}
