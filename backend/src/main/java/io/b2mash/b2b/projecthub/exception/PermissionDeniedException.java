package io.b2mash.b2b.projecthub.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class PermissionDeniedException extends ErrorResponseException {

  public static final String CODE = "PERMISSION_DENIED";

  public PermissionDeniedException(String detail) {
    super(HttpStatus.FORBIDDEN, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Permission denied");
    problem.setDetail(detail);
    problem.setProperty("code", CODE);
    return problem;
  }
}
