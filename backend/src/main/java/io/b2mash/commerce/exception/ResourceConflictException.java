package io.b2mash.commerce.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A checkout was refused because it would duplicate something the customer already holds. */
public class ResourceConflictException extends ErrorResponseException {

  private ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, createProblem(title, detail), null);
  }

  /** The customer still has a paid subscription period running. */
  public static ResourceConflictException activeSubscription() {
    return new ResourceConflictException(
        "Active subscription exists",
        "You already have an active subscription; a new one can start once it ends");
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
