package io.b2mash.b2b.projecthub.user;

import java.util.List;

public record MemberPayload(User user, boolean success, List<String> errors) {

  public static MemberPayload ok(User user) {
    return new MemberPayload(user, true, List.of());
  }

  public static MemberPayload failed(List<String> errors) {
    return new MemberPayload(null, false, errors);
  }
}
