package io.b2mash.b2b.projecthub.project;

import io.b2mash.b2b.projecthub.exception.ValidationFailedException;
import io.b2mash.b2b.projecthub.graphql.DeletePayload;
import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import io.b2mash.b2b.projecthub.pagination.PageResult;
import io.b2mash.b2b.projecthub.pagination.SortOrder;
import io.b2mash.b2b.projecthub.task.Task;
import io.b2mash.b2b.projecthub.task.TaskService;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
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
public class ProjectController {

  private final ProjectService projectService;
  private final TaskService taskService;

  public ProjectController(ProjectService projectService, TaskService taskService) {
    this.projectService = projectService;
    this.taskService = taskService;
  }

  @QueryMapping
  public PageResult<Project> projects(
      @Argument ProjectFilter filter,
      @Argument ProjectSortField sortBy,
      @Argument SortOrder sortOrder,
      @Argument Integer first,
      @Argument String after,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return PageResult.from(
        projectService.listProjects(context, filter, sortBy, sortOrder, first, after));
  }

  @QueryMapping
  public Project project(
      @Argument UUID id, @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return projectService.getProject(context, id);
  }

  @SchemaMapping(typeName = "Project")
  public List<Task> tasks(
      Project project, @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return taskService.listTasksOfProject(context, project.getId());
  }

  /** Task counts for every project in the selection, loaded with one grouped query. */
  @BatchMapping(typeName = "Project")
  public Map<Project, ProjectProgress> progress(List<Project> projects) {
    var byId = projectService.progressOf(projects.stream().map(Project::getId).toList());
    return projects.stream()
        .collect(
            Collectors.toMap(
                Function.identity(),
                p -> byId.getOrDefault(p.getId(), ProjectProgress.EMPTY),
                (a, b) -> a));
  }

  @SchemaMapping(typeName = "Project", field = "isOverdue")
  public boolean isOverdue(Project project) {
    return project.isOverdue(LocalDate.now());
  }

  @SchemaMapping(typeName = "Project")
  public Long daysRemaining(Project project) {
    if (project.getDueDate() == null) {
      return null;
    }
    return ChronoUnit.DAYS.between(LocalDate.now(), project.getDueDate());
  }

  @MutationMapping
  public ProjectPayload createProject(
      @Argument CreateProjectInput input,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    try {
      return ProjectPayload.ok(projectService.createProject(context, input));
    } catch (ValidationFailedException e) {
      return ProjectPayload.failed(e.getMessages());
    }
  }

  @MutationMapping
  public ProjectPayload updateProject(
      @Argument UUID id,
      @Argument UpdateProjectInput input,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    try {
      return ProjectPayload.ok(projectService.updateProject(context, id, input));
    } catch (ValidationFailedException e) {
      return ProjectPayload.failed(e.getMessages());
    }
  }

  @MutationMapping
  public DeletePayload deleteProject(
      @Argument UUID id, @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    projectService.deleteProject(context, id);
    return DeletePayload.deleted(id);
  }
}
