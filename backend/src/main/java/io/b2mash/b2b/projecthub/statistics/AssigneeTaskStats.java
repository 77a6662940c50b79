package io.b2mash.b2b.projecthub.statistics;

public record AssigneeTaskStats(
    String assigneeEmail,
    long totalTasks,
    long completedTasks,
    long inProgressTasks,
    long todoTasks,
    double completionRate) {}
