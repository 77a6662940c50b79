package io.b2mash.b2b.projecthub.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** No usable identity: bad, expired or wrong-type token, unknown user, or an anonymous caller. */
public class UnauthenticatedException extends ErrorResponseException {

  public static final String CODE = "UNAUTHENTICATED";

  public UnauthenticatedException(String detail) {
    super(HttpStatus.UNAUTHORIZED, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Authentication required");
    problem.setDetail(detail);
    problem.setProperty("code", CODE);
    return problem;
  }
}
