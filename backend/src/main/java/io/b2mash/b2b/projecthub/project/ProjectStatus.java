package io.b2mash.b2b.projecthub.project;

/** Project lifecycle status. Any status may move to any other. */
public enum ProjectStatus {
  PLANNING,
  ACTIVE,
  COMPLETED,
  ON_HOLD,
  CANCELLED;

  /** Statuses in which a project with a past due date counts as overdue. */
  public boolean countsTowardsOverdue() {
    return this == ACTIVE || this == ON_HOLD;
  }
}
