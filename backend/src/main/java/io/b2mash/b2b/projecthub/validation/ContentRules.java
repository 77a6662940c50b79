package io.b2mash.b2b.projecthub.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Heuristic spam checks for free-text comment content. */
public final class ContentRules {

  static final int MAX_URLS = 3;

  private static final Pattern REPEATED_CHARACTER = Pattern.compile("(.)\\1{10,}");
  private static final Pattern URL = Pattern.compile("https?://[^\\s]+");

  private ContentRules() {}

  public static List<String> checkComment(String content) {
    var errors = new ArrayList<String>();
    if (content == null || content.isBlank()) {
      return errors;
    }
    if (REPEATED_CHARACTER.matcher(content).find()) {
      errors.add("Comment content appears to contain spam");
    }
    if (countUrls(content) > MAX_URLS) {
      errors.add("Comment contains too many URLs");
    }
    return errors;
  }

  static long countUrls(String content) {
    return URL.matcher(content).results().count();
  }
}
