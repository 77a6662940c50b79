package io.b2mash.b2b.projecthub.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/** Format and reservation rules for organization slugs. */
public final class SlugRules {

  public static final int MIN_LENGTH = 2;
  public static final int MAX_LENGTH = 50;

  public static final Set<String> RESERVED =
      Set.of(
          "admin", "api", "www", "mail", "ftp", "localhost", "app", "web", "blog", "news",
          "support", "help", "docs", "status");

  private static final Pattern ALLOWED = Pattern.compile("^[a-z0-9-]+$");

  private SlugRules() {}

  public static boolean isReserved(String slug) {
    return slug != null && RESERVED.contains(slug);
  }

  /** Returns the failed rules for {@code slug}; empty when the slug is acceptable. */
  public static List<String> check(String slug) {
    var errors = new ArrayList<String>();
    if (slug == null || slug.isBlank()) {
      errors.add("Organization slug is required");
      return errors;
    }
    if (slug.length() < MIN_LENGTH) {
      errors.add("Organization slug must be at least 2 characters long");
    } else if (slug.length() > MAX_LENGTH) {
      errors.add("Organization slug cannot exceed 50 characters");
    } else if (!ALLOWED.matcher(slug).matches()) {
      errors.add("Organization slug can only contain lowercase letters, numbers, and hyphens");
    } else if (slug.startsWith("-") || slug.endsWith("-")) {
      errors.add("Organization slug cannot start or end with a hyphen");
    } else if (slug.contains("--")) {
      errors.add("Organization slug cannot contain consecutive hyphens");
    }
    if (isReserved(slug)) {
      errors.add("The slug '" + slug + "' is reserved and cannot be used");
    }
    return errors;
  }
}
