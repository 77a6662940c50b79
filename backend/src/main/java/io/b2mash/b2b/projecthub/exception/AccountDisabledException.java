package io.b2mash.b2b.projecthub.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class AccountDisabledException extends ErrorResponseException {

  public static final String CODE = "ACCOUNT_DISABLED";

  public AccountDisabledException() {
    super(HttpStatus.FORBIDDEN, createProblem(), null);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Account disabled");
    problem.setDetail("Account is deactivated");
    problem.setProperty("code", CODE);
    return problem;
  }
}
