package io.b2mash.b2b.projecthub.statistics;

public record ProjectStatistics(
    long totalProjects,
    long planningProjects,
    long activeProjects,
    long completedProjects,
    long onHoldProjects,
    long cancelledProjects,
    long overdueProjects,
    double completionRate) {}
