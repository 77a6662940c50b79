package io.b2mash.b2b.projecthub.statistics;

import java.util.List;

public record ComprehensiveAnalytics(
    ProjectStatistics projectStatistics,
    TaskStatistics taskStatistics,
    List<UserProductivity> userProductivity,
    CollaborationMetrics collaboration,
    RecentActivity recentActivity,
    KeyPerformanceIndicators performanceIndicators) {}
