package io.b2mash.b2b.projecthub.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A batch of input validation messages. */
public class ValidationFailedException extends ErrorResponseException {

  public static final String CODE = "VALIDATION_FAILED";

  private final List<String> messages;

  public ValidationFailedException(List<String> messages) {
    super(HttpStatus.BAD_REQUEST, createProblem(messages), null);
    this.messages = List.copyOf(messages);
  }

  public ValidationFailedException(String message) {
    this(List.of(message));
  }

  public List<String> getMessages() {
    return messages;
  }

  private static ProblemDetail createProblem(List<String> messages) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(String.join("; ", messages));
    problem.setProperty("code", CODE);
    problem.setProperty("messages", List.copyOf(messages));
    return problem;
  }
}
