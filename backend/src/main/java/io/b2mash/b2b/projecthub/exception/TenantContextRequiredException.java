package io.b2mash.b2b.projecthub.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class TenantContextRequiredException extends ErrorResponseException {

  public static final String CODE = "TENANT_CONTEXT_REQUIRED";

  public TenantContextRequiredException() {
    super(HttpStatus.FORBIDDEN, createProblem(), null);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Organization context required");
    problem.setDetail("Organization context required");
    problem.setProperty("code", CODE);
    return problem;
  }
}
