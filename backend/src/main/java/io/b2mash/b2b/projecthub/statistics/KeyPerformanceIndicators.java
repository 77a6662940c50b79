package io.b2mash.b2b.projecthub.statistics;

public record KeyPerformanceIndicators(
    double projectCompletionRate,
    double taskCompletionRate,
    Double averageTaskCompletionHours,
    double overdueProjectPercentage,
    double overdueTaskPercentage,
    long activeTeamMembers,
    double overallProductivityScore) {}
