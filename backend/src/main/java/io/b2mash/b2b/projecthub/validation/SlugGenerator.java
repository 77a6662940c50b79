package io.b2mash.b2b.projecthub.validation;

import io.b2mash.b2b.projecthub.organization.OrganizationRepository;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** Derives a unique, valid organization slug from a display name. */
@Component
public class SlugGenerator {

  private static final String FALLBACK = "org";

  private final OrganizationRepository organizationRepository;

  public SlugGenerator(OrganizationRepository organizationRepository) {
    this.organizationRepository = organizationRepository;
  }

  public String generateUnique(String name) {
    String base = slugify(name, SlugRules.MAX_LENGTH);
    if (base.length() < SlugRules.MIN_LENGTH || SlugRules.isReserved(base)) {
      base = base.isEmpty() ? FALLBACK : base + "-" + FALLBACK;
    }
    String candidate = base;
    int suffix = 2;
    while (organizationRepository.existsBySlug(candidate)) {
      String tail = "-" + suffix++;
      int room = SlugRules.MAX_LENGTH - tail.length();
      String head = base.substring(0, Math.min(base.length(), room));
      candidate = trimHyphens(head) + tail;
    }
    return candidate;
  }

  /** Lowercases, keeps {@code [a-z0-9-]}, collapses hyphen runs and truncates. */
  public static String slugify(String text, int maxLength) {
    if (text == null) {
      return "";
    }
    String slug =
        text.toLowerCase(Locale.ROOT)
            .trim()
            .replaceAll("\\s+", "-")
            .replaceAll("[^a-z0-9-]", "")
            .replaceAll("-+", "-");
    slug = trimHyphens(slug);
    if (slug.length() > maxLength) {
      slug = trimHyphens(slug.substring(0, maxLength));
    }
    return slug;
  }

  private static String trimHyphens(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && value.charAt(start) == '-') {
      start++;
    }
    while (end > start && value.charAt(end - 1) == '-') {
      end--;
    }
    return value.substring(start, end);
  }
}
