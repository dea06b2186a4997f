package io.b2mash.commerce.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when one or more cart lines cannot be priced (unpublished, out of stock, missing from the
 * catalog). Results in HTTP 422 with the full list of reasons so the client can fix every line at
 * once.
 */
public class CartValidationException extends ErrorResponseException {

  private final List<String> reasons;

  public CartValidationException(List<String> reasons) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(reasons), null);
    this.reasons = List.copyOf(reasons);
  }

  public List<String> getReasons() {
    return reasons;
  }

  private static ProblemDetail createProblem(List<String> reasons) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Cart validation failed");
    problem.setDetail("Some items in your cart cannot be purchased.");
    problem.setProperty("reasons", reasons);
    return problem;
  }
}
