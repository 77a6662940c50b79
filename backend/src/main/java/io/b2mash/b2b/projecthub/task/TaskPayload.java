package io.b2mash.b2b.projecthub.task;

import java.util.List;

public record TaskPayload(Task task, boolean success, List<String> errors) {

  public static TaskPayload ok(Task task) {
    return new TaskPayload(task, true, List.of());
  }

  public static TaskPayload failed(List<String> errors) {
    return new TaskPayload(null, false, errors);
  }
}
