package io.b2mash.b2b.projecthub.security;

public enum TokenType {
  ACCESS("access"),
  REFRESH("refresh");

  private final String claimValue;

  TokenType(String claimValue) {
    this.claimValue = claimValue;
  }

  public String claimValue() {
    return claimValue;
  }
}
