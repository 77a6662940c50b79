package io.b2mash.b2b.projecthub.organization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.projecthub.exception.PermissionDeniedException;
import io.b2mash.b2b.projecthub.exception.ValidationFailedException;
import io.b2mash.b2b.projecthub.multitenancy.Principal;
import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import io.b2mash.b2b.projecthub.multitenancy.Tenant;
import io.b2mash.b2b.projecthub.user.User;
import io.b2mash.b2b.projecthub.user.UserRepository;
import io.b2mash.b2b.projecthub.validation.InputValidator;
import io.b2mash.b2b.projecthub.validation.SlugGenerator;
import java.util.ArrayList;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class OrganizationServiceTest {

  @Mock private OrganizationRepository repository;
  @Mock private UserRepository userRepository;
  @Mock private InputValidator inputValidator;
  @Mock private SlugGenerator slugGenerator;
  @InjectMocks private OrganizationService service;

  private User newcomer;
  private Organization acme;

  @BeforeEach
  void setUp() {
    newcomer = new User("nina@acme.test", "Nina", "North", "hash");
    ReflectionTestUtils.setField(newcomer, "id", UUID.randomUUID());
    acme = new Organization("Acme", "acme", "ops@acme.test", null);
    ReflectionTestUtils.setField(acme, "id", UUID.randomUUID());
  }

  @Test
  void createMakesCallerAdmin() {
    when(userRepository.findById(newcomer.getId())).thenReturn(Optional.of(newcomer));
    when(inputValidator.validate(any())).thenReturn(new ArrayList<>());
    when(slugGenerator.generateUnique("Acme")).thenReturn("acme");
    when(repository.saveAndFlush(any(Organization.class))).thenReturn(acme);

    var created =
        service.createOrganization(
            RequestContext.resolved(Principal.of(newcomer), null),
            new CreateOrganizationInput("Acme", null, "ops@acme.test", null));

    assertThat(created).isSameAs(acme);
    assertThat(newcomer.getOrganizationId()).isEqualTo(acme.getId());
    assertThat(newcomer.isOrganizationAdmin()).isTrue();
    verify(userRepository).save(newcomer);
  }

  @Test
  void createRejectsCallerWithOrganizationAndTakenSlug() {
    newcomer.joinOrganization(UUID.randomUUID(), false);
    when(userRepository.findById(newcomer.getId())).thenReturn(Optional.of(newcomer));
    when(inputValidator.validate(any())).thenReturn(new ArrayList<>());
    when(repository.existsBySlug("acme")).thenReturn(true);

    assertThatThrownBy(
            () ->
                service.createOrganization(
                    RequestContext.resolved(Principal.of(newcomer), null),
                    new CreateOrganizationInput("Acme", " ACME ", "ops@acme.test", null)))
        .isInstanceOf(ValidationFailedException.class)
        .satisfies(
            e ->
                assertThat(((ValidationFailedException) e).getMessages())
                    .containsExactly(
                        "User already belongs to an organization",
                        "Organization slug 'acme' is already taken"));
    verify(repository, never()).saveAndFlush(any());
  }

  @Test
  void adminCannotUpdateOtherOrganization() {
    var admin = new Principal(UUID.randomUUID(), "admin@acme.test", acme.getId(), true, false);
    var context = RequestContext.resolved(admin, Tenant.of(acme));
    var otherId = UUID.randomUUID();
    var input = new UpdateOrganizationInput("Renamed", null, null);

    assertThatThrownBy(() -> service.updateOrganization(context, otherId, input))
        .isInstanceOf(PermissionDeniedException.class);
    verify(repository, never()).save(any());
  }

  @Test
  void addMemberJoinsUserWithoutOrganization() {
    var admin = new Principal(UUID.randomUUID(), "admin@acme.test", acme.getId(), true, false);
    when(userRepository.findByEmailIgnoreCase("nina@acme.test")).thenReturn(Optional.of(newcomer));
    when(userRepository.save(newcomer)).thenReturn(newcomer);

    var member =
        service.addMember(
            RequestContext.resolved(admin, Tenant.of(acme)), " nina@acme.test ", false);

    assertThat(member.getOrganizationId()).isEqualTo(acme.getId());
    assertThat(member.isOrganizationAdmin()).isFalse();
  }

  @Test
  void visibleOrganizationHiddenForForeignUser() {
    var viewer = new User("vic@globex.test", "Vic", "V", "hash");
    ReflectionTestUtils.setField(viewer, "id", UUID.randomUUID());
    var globexId = UUID.randomUUID();
    viewer.joinOrganization(globexId, false);
    newcomer.joinOrganization(acme.getId(), false);
    var context =
        RequestContext.resolved(
            Principal.of(viewer), new Tenant(globexId, "globex", "Globex", true));

    assertThat(service.findVisibleOrganization(context, newcomer)).isNull();
  }
}
