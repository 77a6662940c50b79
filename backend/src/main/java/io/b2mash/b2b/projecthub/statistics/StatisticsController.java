package io.b2mash.b2b.projecthub.statistics;

import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import java.util.UUID;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.ContextValue;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

@Controller
public class StatisticsController {

  private final StatisticsService statisticsService;

  public StatisticsController(StatisticsService statisticsService) {
    this.statisticsService = statisticsService;
  }

  @QueryMapping
  public OrganizationStatistics organizationStatistics(
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return statisticsService.organizationStatistics(context);
  }

  @QueryMapping
  public ProjectStatistics projectStatistics(
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return statisticsService.projectStatistics(context);
  }

  @QueryMapping
  public TaskStatistics taskStatistics(
      @Argument UUID projectId,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return statisticsService.taskStatistics(context, projectId);
  }
}
