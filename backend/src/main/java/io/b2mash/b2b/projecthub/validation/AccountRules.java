package io.b2mash.b2b.projecthub.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Password strength and e-mail domain rules applied at registration. */
public final class AccountRules {

  static final Set<String> BLOCKED_DOMAINS =
      Set.of("10minutemail.com", "guerrillamail.com", "tempmail.org", "mailinator.com");

  private AccountRules() {}

  public static List<String> checkPassword(String password) {
    var errors = new ArrayList<String>();
    if (password == null || password.length() < 8) {
      // length is already reported by the input constraints
      return errors;
    }
    if (password.chars().noneMatch(Character::isLetter)) {
      errors.add("Password must contain at least one letter");
    }
    if (password.chars().noneMatch(Character::isDigit)) {
      errors.add("Password must contain at least one digit");
    }
    return errors;
  }

  public static boolean isBlockedDomain(String email) {
    if (email == null || !email.contains("@")) {
      return false;
    }
    String domain = email.substring(email.lastIndexOf('@') + 1).toLowerCase(Locale.ROOT);
    return BLOCKED_DOMAINS.contains(domain);
  }
}
