package io.b2mash.b2b.projecthub.statistics;

import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import java.util.List;
import java.util.UUID;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.ContextValue;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

@Controller
public class AnalyticsController {

  private final AnalyticsService analyticsService;

  public AnalyticsController(AnalyticsService analyticsService) {
    this.analyticsService = analyticsService;
  }

  @QueryMapping
  public List<TrendPoint> projectCompletionTrends(
      @Argument Integer days,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return analyticsService.projectCompletionTrends(context, days);
  }

  @QueryMapping
  public List<TrendPoint> taskCompletionTrends(
      @Argument Integer days,
      @Argument UUID projectId,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return analyticsService.taskCompletionTrends(context, days, projectId);
  }

  @QueryMapping
  public double projectHealthScore(
      @Argument UUID projectId,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return analyticsService.projectHealthScore(context, projectId);
  }

  @QueryMapping
  public List<UserProductivity> userProductivityMetrics(
      @Argument Integer limit,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return analyticsService.userProductivityMetrics(context, limit);
  }

  @QueryMapping
  public List<AssigneeTaskStats> taskDistributionByAssignee(
      @Argument UUID projectId,
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return analyticsService.taskDistributionByAssignee(context, projectId);
  }

  @QueryMapping
  public ComprehensiveAnalytics comprehensiveAnalytics(
      @ContextValue(name = RequestContext.CONTEXT_KEY) RequestContext context) {
    return analyticsService.comprehensiveAnalytics(context);
  }
}
