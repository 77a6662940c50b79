package io.b2mash.b2b.projecthub.statistics;

/**
 * Input data for the project health calculator.
 *
 * @param totalTasks tasks in the project
 * @param doneTasks tasks with status DONE
 * @param tasksWithDueDate tasks that have a due date, whatever their status
 * @param doneOnTime DONE tasks completed no later than their due date
 * @param recentActivity comments and task updates in the last seven days
 * @param overdueTasks non-DONE tasks past their due date
 */
public record ProjectHealthInput(
    int totalTasks,
    int doneTasks,
    int tasksWithDueDate,
    int doneOnTime,
    int recentActivity,
    int overdueTasks) {}
