package io.b2mash.b2b.projecthub.statistics;

/**
 * @param averageCompletionTime mean hours from creation to completion of DONE tasks; null when no
 *     task has been completed
 */
public record TaskStatistics(
    long totalTasks,
    long todoTasks,
    long inProgressTasks,
    long completedTasks,
    long overdueTasks,
    double completionRate,
    Double averageCompletionTime) {}
