package io.b2mash.b2b.projecthub.graphql;

import java.util.List;
import java.util.UUID;

public record DeletePayload(UUID deletedId, boolean success, List<String> errors) {

  public static DeletePayload deleted(UUID id) {
    return new DeletePayload(id, true, List.of());
  }
}
