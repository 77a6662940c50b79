package io.b2mash.b2b.projecthub.comment;

import java.util.List;

public record TaskCommentPayload(TaskComment comment, boolean success, List<String> errors) {

  public static TaskCommentPayload ok(TaskComment comment) {
    return new TaskCommentPayload(comment, true, List.of());
  }

  public static TaskCommentPayload failed(List<String> errors) {
    return new TaskCommentPayload(null, false, errors);
  }
}
