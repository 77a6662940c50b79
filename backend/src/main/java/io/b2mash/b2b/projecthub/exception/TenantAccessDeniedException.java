package io.b2mash.b2b.projecthub.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The caller selected an organization it does not belong to, or one that does not exist. */
public class TenantAccessDeniedException extends ErrorResponseException {

  public static final String CODE = "TENANT_ACCESS_DENIED";

  public TenantAccessDeniedException(String slug) {
    super(HttpStatus.FORBIDDEN, createProblem(slug), null);
  }

  private static ProblemDetail createProblem(String slug) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Organization access denied");
    problem.setDetail("Access denied to organization '" + slug + "'");
    problem.setProperty("code", CODE);
    return problem;
  }
}
