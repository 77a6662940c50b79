package io.b2mash.b2b.projecthub.project;

import java.util.List;

public record ProjectPayload(Project project, boolean success, List<String> errors) {

  public static ProjectPayload ok(Project project) {
    return new ProjectPayload(project, true, List.of());
  }

  public static ProjectPayload failed(List<String> errors) {
    return new ProjectPayload(null, false, errors);
  }
}
