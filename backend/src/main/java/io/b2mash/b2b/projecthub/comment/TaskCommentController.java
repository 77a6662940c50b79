package io.b2mash.b2b.projecthub.comment;

import io.b2mash.b2b.projecthub.exception.ValidationFailedException;
import io.b2mash.b2b.projecthub.graphql.DeletePayload;
import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import io.b2mash.b2b.projecthub.pagination.PageResult;
import io.b2mash.b2b.projecthub.task.Task;
import io.b2mash.b2b.projecthub.task.TaskService;
import io.b2mash.b2b.projecthub.user.User;
import io.b2mash.b2b.projecthub.user.UserService;
import java.util.UUID;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.ContextValue;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.graphql.data.method.annotation.SchemaMapping;
import org.springframework.stereotype.Controller;

@Controller
public class TaskCommentController {

  private final TaskCommentService commentService;
  private final TaskService taskService;
  private final UserService userService;

  public TaskCommentController(
      TaskCommentService commentService, TaskService taskService, UserService userService) {
    this.commentService = commentService;
    this.taskService = taskService;
    this.userService = userService;
  }

  @QueryMapping
  public PageResult<TaskComment> taskComments(
      @Argument UUID taskId,
      @Argument Integer first,
      @Argument String after,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return PageResult.from(commentService.listComments(context, taskId, first, after));
  }

  @SchemaMapping(typeName = "TaskComment")
  public Task task(
      TaskComment comment,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return taskService.getTask(context, comment.getTaskId());
  }

  @SchemaMapping(typeName = "TaskComment")
  public User author(
      TaskComment comment,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return context
        .tenant()
        .flatMap(tenant -> userService.findMemberByEmail(tenant, comment.getAuthorEmail()))
        .orElse(null);
  }

  @MutationMapping
  public TaskCommentPayload createTaskComment(
      @Argument CreateTaskCommentInput input,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    try {
      return TaskCommentPayload.ok(commentService.createComment(context, input));
    } catch (ValidationFailedException e) {
      return TaskCommentPayload.failed(e.getMessages());
    }
  }

  @MutationMapping
  public TaskCommentPayload updateTaskComment(
      @Argument UUID id,
      @Argument UpdateTaskCommentInput input,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    try {
      return TaskCommentPayload.ok(commentService.updateComment(context, id, input));
    } catch (ValidationFailedException e) {
      return TaskCommentPayload.failed(e.getMessages());
    }
  }

  @MutationMapping
  public DeletePayload deleteTaskComment(
      @Argument UUID id, @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    commentService.deleteComment(context, id);
    return DeletePayload.deleted(id);
  }
}
