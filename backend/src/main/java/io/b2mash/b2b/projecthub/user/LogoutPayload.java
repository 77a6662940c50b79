package io.b2mash.b2b.projecthub.user;

public record LogoutPayload(boolean success, String message) {

  static LogoutPayload loggedOut() {
    return new LogoutPayload(true, "Logged out successfully");
  }
}
