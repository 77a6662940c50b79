package io.b2mash.b2b.projecthub.project;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Task counts of one project. */
public record ProjectProgress(long todo, long inProgress, long done) {

  public static final ProjectProgress EMPTY = new ProjectProgress(0, 0, 0);

  public long total() {
    return todo + inProgress + done;
  }

  /** Percentage of DONE tasks, rounded to two decimals; 0 for a project without tasks. */
  public double completionRate() {
    return percentage(done, total());
  }

  public static double percentage(long part, long total) {
    if (total == 0) {
      return 0.0;
    }
    return BigDecimal.valueOf(part * 100.0 / total).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }
}
