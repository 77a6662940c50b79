package io.b2mash.b2b.projecthub.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.projecthub.event.TaskAssignedEvent;
import io.b2mash.b2b.projecthub.event.TaskCompletedEvent;
import io.b2mash.b2b.projecthub.exception.PermissionDeniedException;
import io.b2mash.b2b.projecthub.exception.ResourceNotFoundException;
import io.b2mash.b2b.projecthub.exception.TenantContextRequiredException;
import io.b2mash.b2b.projecthub.exception.ValidationFailedException;
import io.b2mash.b2b.projecthub.multitenancy.Principal;
import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import io.b2mash.b2b.projecthub.multitenancy.Tenant;
import io.b2mash.b2b.projecthub.project.Project;
import io.b2mash.b2b.projecthub.project.ProjectService;
import io.b2mash.b2b.projecthub.validation.InputValidator;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class TaskServiceTest {

  private static final UUID ORG_ID = UUID.randomUUID();
  private static final Tenant ACME = new Tenant(ORG_ID, "acme", "Acme", true);

  @Mock private TaskRepository repository;
  @Mock private ProjectService projectService;
  @Mock private InputValidator inputValidator;
  @Mock private ApplicationEventPublisher eventPublisher;
  @InjectMocks private TaskService service;

  private final Principal bob =
      new Principal(UUID.randomUUID(), "bob@acme.test", ORG_ID, false, false);
  private final Principal carol =
      new Principal(UUID.randomUUID(), "carol@acme.test", ORG_ID, false, false);
  private final Principal admin =
      new Principal(UUID.randomUUID(), "admin@acme.test", ORG_ID, true, false);

  private Project project;
  private Task task;

  @BeforeEach
  void setUp() {
    project = new Project(ORG_ID, "Website", null, null);
    ReflectionTestUtils.setField(project, "id", UUID.randomUUID());
    task = new Task(project.getId(), "Write copy", null, "bob@acme.test", null);
    ReflectionTestUtils.setField(task, "id", UUID.randomUUID());
  }

  @Test
  void repeatedDonePublishesOneCompletionEvent() {
    stubLookupAndSave();
    var done = new UpdateTaskInput(null, null, TaskStatus.DONE, null, null);
    var context = RequestContext.resolved(bob, ACME);

    service.updateTask(context, task.getId(), done);
    service.updateTask(context, task.getId(), done);

    verify(eventPublisher, times(1)).publishEvent(any(TaskCompletedEvent.class));
    assertThat(task.getStatus()).isEqualTo(TaskStatus.DONE);
  }

  @Test
  void reassignmentPublishesAssignedEvent() {
    stubLookupAndSave();
    var reassign = new UpdateTaskInput(null, null, null, "carol@acme.test", null);

    service.updateTask(RequestContext.resolved(admin, ACME), task.getId(), reassign);

    verify(eventPublisher)
        .publishEvent(
            ArgumentMatchers.<Object>argThat(
                e ->
                    e instanceof TaskAssignedEvent assigned
                        && assigned.assigneeEmail().equals("carol@acme.test")
                        && assigned.organizationId().equals(ORG_ID)));
  }

  @Test
  void sameAssigneePublishesNothing() {
    stubLookupAndSave();
    var sameAssignee = new UpdateTaskInput("Rewrite copy", null, null, "BOB@acme.test", null);

    service.updateTask(RequestContext.resolved(bob, ACME), task.getId(), sameAssignee);

    verifyNoInteractions(eventPublisher);
  }

  @Test
  void nonOwnerMemberCannotUpdate() {
    when(repository.findOne(ArgumentMatchers.<Specification<Task>>any()))
        .thenReturn(Optional.of(task));
    var input = new UpdateTaskInput("Hijack", null, null, null, null);

    assertThatThrownBy(
            () -> service.updateTask(RequestContext.resolved(carol, ACME), task.getId(), input))
        .isInstanceOf(PermissionDeniedException.class);
    verify(repository, never()).save(any());
  }

  @Test
  void taskOutsideTenantIsNotFound() {
    when(repository.findOne(ArgumentMatchers.<Specification<Task>>any()))
        .thenReturn(Optional.empty());
    var id = UUID.randomUUID();

    assertThatThrownBy(() -> service.getTask(RequestContext.resolved(bob, ACME), id))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void createWithoutTenantRequiresContext() {
    var input = new CreateTaskInput(project.getId(), "New task", null, null, null, null);

    assertThatThrownBy(() -> service.createTask(RequestContext.resolved(bob, null), input))
        .isInstanceOf(TenantContextRequiredException.class);
    verifyNoInteractions(repository, projectService);
  }

  @Test
  void createRejectsDueDateBeyondGrace() {
    when(inputValidator.validate(any())).thenReturn(new ArrayList<>());
    var input =
        new CreateTaskInput(
            project.getId(),
            "Late task",
            null,
            null,
            null,
            OffsetDateTime.now(ZoneOffset.UTC).minusDays(2));

    assertThatThrownBy(() -> service.createTask(RequestContext.resolved(bob, ACME), input))
        .isInstanceOf(ValidationFailedException.class)
        .satisfies(
            e ->
                assertThat(((ValidationFailedException) e).getMessages())
                    .containsExactly("Task due date cannot be more than 1 day in the past"));
    verifyNoInteractions(projectService);
  }

  @Test
  void createDoneWithAssigneePublishesBothEvents() {
    when(inputValidator.validate(any())).thenReturn(new ArrayList<>());
    when(projectService.findInTenant(ACME, project.getId())).thenReturn(project);
    when(repository.save(any(Task.class))).thenAnswer(inv -> inv.getArgument(0));
    var input =
        new CreateTaskInput(
            project.getId(), "  Ship it  ", null, TaskStatus.DONE, "carol@acme.test", null);

    var created = service.createTask(RequestContext.resolved(bob, ACME), input);

    assertThat(created.getTitle()).isEqualTo("Ship it");
    assertThat(created.getCompletedAt()).isNotNull();
    verify(eventPublisher).publishEvent(any(TaskAssignedEvent.class));
    verify(eventPublisher).publishEvent(any(TaskCompletedEvent.class));
  }

  private void stubLookupAndSave() {
    when(repository.findOne(ArgumentMatchers.<Specification<Task>>any()))
        .thenReturn(Optional.of(task));
    when(inputValidator.validate(any())).thenReturn(new ArrayList<>());
    when(repository.save(any(Task.class))).thenAnswer(inv -> inv.getArgument(0));
  }
}
