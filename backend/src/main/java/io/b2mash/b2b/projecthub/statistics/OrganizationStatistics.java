package io.b2mash.b2b.projecthub.statistics;

public record OrganizationStatistics(
    ProjectStatistics projectStats, TaskStatistics taskStats, long userCount) {}
