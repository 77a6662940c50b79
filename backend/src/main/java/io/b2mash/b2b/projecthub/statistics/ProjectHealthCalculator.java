package io.b2mash.b2b.projecthub.statistics;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Weighted project health score between 0 and 100. Pure utility class with no Spring
 * dependencies.
 *
 * <ol>
 *   <li>Completion: share of DONE tasks, up to 40 points
 *   <li>On-time delivery: share of dated tasks done by their due date, up to 30 points (full marks
 *       when no task has a due date)
 *   <li>Activity: comments and task updates this week, full 20 points at {@value
 *       #ACTIVITY_TARGET_PER_WEEK}
 *   <li>Overdue penalty: share of overdue tasks, up to 10 points deducted
 * </ol>
 *
 * A project without tasks scores 100.
 */
public final class ProjectHealthCalculator {

  static final double COMPLETION_WEIGHT = 40;
  static final double ON_TIME_WEIGHT = 30;
  static final double ACTIVITY_WEIGHT = 20;
  static final double OVERDUE_PENALTY_WEIGHT = 10;
  static final int ACTIVITY_TARGET_PER_WEEK = 10;

  private ProjectHealthCalculator() {}

  public static double calculate(ProjectHealthInput input) {
    if (input.totalTasks() == 0) {
      return 100.0;
    }
    double total = input.totalTasks();

    double completion = input.doneTasks() / total * COMPLETION_WEIGHT;
    double onTime =
        input.tasksWithDueDate() > 0
            ? (double) input.doneOnTime() / input.tasksWithDueDate() * ON_TIME_WEIGHT
            : ON_TIME_WEIGHT;
    double activity =
        Math.min((double) input.recentActivity() / ACTIVITY_TARGET_PER_WEEK, 1.0)
            * ACTIVITY_WEIGHT;
    double overduePenalty = input.overdueTasks() / total * OVERDUE_PENALTY_WEIGHT;

    double score = Math.max(0.0, Math.min(100.0, completion + onTime + activity - overduePenalty));
    return BigDecimal.valueOf(score).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }
}
