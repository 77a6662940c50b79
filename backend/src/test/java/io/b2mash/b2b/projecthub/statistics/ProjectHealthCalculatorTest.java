package io.b2mash.b2b.projecthub.statistics;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ProjectHealthCalculatorTest {

  @Test
  void projectWithoutTasksScoresFull() {
    var input = new ProjectHealthInput(0, 0, 0, 0, 0, 0);
    assertThat(ProjectHealthCalculator.calculate(input)).isEqualTo(100.0);
  }

  @Test
  void completedOnTimeAndBusyProjectScoresFull() {
    var input = new ProjectHealthInput(5, 5, 5, 5, 12, 0);
    assertThat(ProjectHealthCalculator.calculate(input)).isEqualTo(100.0);
  }

  @Test
  void undatedTasksGetFullOnTimeCredit() {
    // 0 done, no due dates, no activity -> only the 30 on-time points
    var input = new ProjectHealthInput(4, 0, 0, 0, 0, 0);
    assertThat(ProjectHealthCalculator.calculate(input)).isEqualTo(30.0);
  }

  @Test
  void weightsAreCombined() {
    // 20 completion + 10 on-time + 2 activity - 2.5 overdue
    var input = new ProjectHealthInput(4, 2, 3, 1, 1, 1);
    assertThat(ProjectHealthCalculator.calculate(input)).isEqualTo(29.5);
  }

  @Test
  void overduePenaltyNeverDropsBelowZero() {
    var input = new ProjectHealthInput(3, 0, 3, 0, 0, 3);
    assertThat(ProjectHealthCalculator.calculate(input)).isZero();
  }
}
