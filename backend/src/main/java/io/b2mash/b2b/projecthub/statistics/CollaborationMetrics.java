package io.b2mash.b2b.projecthub.statistics;

/**
 * @param collaborationTrend {@code increasing} when this week's comments exceed a weekly share of
 *     all comments, otherwise {@code stable}
 */
public record CollaborationMetrics(
    long totalComments,
    long recentComments,
    double taskAssignmentRate,
    double averageCommentsPerTask,
    String collaborationTrend) {}
