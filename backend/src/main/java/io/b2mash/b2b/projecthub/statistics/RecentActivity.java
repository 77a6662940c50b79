package io.b2mash.b2b.projecthub.statistics;

public record RecentActivity(
    int periodDays,
    long newProjects,
    long newTasks,
    long tasksCompleted,
    long commentsAdded,
    long totalActivity) {}
