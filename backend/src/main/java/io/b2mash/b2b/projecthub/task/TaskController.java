package io.b2mash.b2b.projecthub.task;

import io.b2mash.b2b.projecthub.comment.TaskComment;
import io.b2mash.b2b.projecthub.comment.TaskCommentService;
import io.b2mash.b2b.projecthub.exception.ValidationFailedException;
import io.b2mash.b2b.projecthub.graphql.DeletePayload;
import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import io.b2mash.b2b.projecthub.pagination.PageResult;
import io.b2mash.b2b.projecthub.pagination.SortOrder;
import io.b2mash.b2b.projecthub.project.Project;
import io.b2mash.b2b.projecthub.project.ProjectService;
import io.b2mash.b2b.projecthub.user.User;
import io.b2mash.b2b.projecthub.user.UserService;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.BatchMapping;
import org.springframework.graphql.data.method.annotation.ContextValue;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.graphql.data.method.annotation.SchemaMapping;
import org.springframework.stereotype.Controller;

@Controller
public class TaskController {

  private final TaskService taskService;
  private final ProjectService projectService;
  private final TaskCommentService commentService;
  private final UserService userService;

  public TaskController(
      TaskService taskService,
      ProjectService projectService,
      TaskCommentService commentService,
      UserService userService) {
    this.taskService = taskService;
    this.projectService = projectService;
    this.commentService = commentService;
    this.userService = userService;
  }

  @QueryMapping
  public PageResult<Task> tasks(
      @Argument TaskFilter filter,
      @Argument TaskSortField sortBy,
      @Argument SortOrder sortOrder,
      @Argument Integer first,
      @Argument String after,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return PageResult.from(taskService.listTasks(context, filter, sortBy, sortOrder, first, after));
  }

  @QueryMapping
  public Task task(
      @Argument UUID id, @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return taskService.getTask(context, id);
  }

  @SchemaMapping(typeName = "Task")
  public Project project(
      Task task, @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return projectService.getProject(context, task.getProjectId());
  }

  @SchemaMapping(typeName = "Task")
  public List<TaskComment> comments(
      Task task, @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return commentService.listCommentsOfTask(context, task.getId());
  }

  @BatchMapping(typeName = "Task")
  public Map<Task, Long> commentCount(List<Task> tasks) {
    var byId = commentService.countsOf(tasks.stream().map(Task::getId).toList());
    return tasks.stream()
        .collect(
            Collectors.toMap(
                Function.identity(), t -> byId.getOrDefault(t.getId(), 0L), (a, b) -> a));
  }

  /** The assignee, when the assignee email belongs to a member of the current organization. */
  @SchemaMapping(typeName = "Task")
  public User assignee(
      Task task, @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return context
        .tenant()
        .flatMap(tenant -> userService.findMemberByEmail(tenant, task.getAssigneeEmail()))
        .orElse(null);
  }

  @SchemaMapping(typeName = "Task", field = "isOverdue")
  public boolean isOverdue(Task task) {
    return task.isOverdue(Instant.now());
  }

  @SchemaMapping(typeName = "Task")
  public Long daysRemaining(Task task) {
    return task.getDueDate() == null
        ? null
        : Duration.between(Instant.now(), task.getDueDate()).toDays();
  }

  @SchemaMapping(typeName = "Task")
  public Long hoursRemaining(Task task) {
    return task.getDueDate() == null
        ? null
        : Duration.between(Instant.now(), task.getDueDate()).toHours();
  }

  @MutationMapping
  public TaskPayload createTask(
      @Argument CreateTaskInput input,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    try {
      return TaskPayload.ok(taskService.createTask(context, input));
    } catch (ValidationFailedException e) {
      return TaskPayload.failed(e.getMessages());
    }
  }

  @MutationMapping
  public TaskPayload updateTask(
      @Argument UUID id,
      @Argument UpdateTaskInput input,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    try {
      return TaskPayload.ok(taskService.updateTask(context, id, input));
    } catch (ValidationFailedException e) {
      return TaskPayload.failed(e.getMessages());
    }
  }

  @MutationMapping
  public DeletePayload deleteTask(
      @Argument UUID id, @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    taskService.deleteTask(context, id);
    return DeletePayload.deleted(id);
  }
}
