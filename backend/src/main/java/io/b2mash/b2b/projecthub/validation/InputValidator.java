package io.b2mash.b2b.projecthub.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Runs Bean Validation over a mutation input and returns the messages, sorted, in a mutable list so
 * that callers can append domain-rule failures to the same batch.
 */
@Component
public class InputValidator {

  private final Validator validator;

  public InputValidator(Validator validator) {
    this.validator = validator;
  }

  public List<String> validate(Object input) {
    var messages =
        validator.validate(input).stream().map(ConstraintViolation::getMessage).sorted().toList();
    return new ArrayList<>(messages);
  }
}
