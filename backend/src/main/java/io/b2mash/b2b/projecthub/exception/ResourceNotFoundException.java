package io.b2mash.b2b.projecthub.exception;

import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised for rows that are absent and for rows hidden by the tenant filter alike, so callers cannot
 * discover another organization's ids.
 */
public class ResourceNotFoundException extends ErrorResponseException {

  public static final String CODE = "NOT_FOUND";

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        HttpStatus.NOT_FOUND,
        createProblem(
            resourceType + " not found",
            "No " + resourceType.toLowerCase(Locale.ROOT) + " found with id " + id),
        null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", CODE);
    return problem;
  }
}
