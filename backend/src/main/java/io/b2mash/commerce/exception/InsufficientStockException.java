package io.b2mash.commerce.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Stock for a product could not cover an order line when the payment settled. Thrown inside the
 * reconciliation transaction so the whole transition rolls back.
 */
public class InsufficientStockException extends ErrorResponseException {

  public InsufficientStockException(UUID productId, int requested) {
    super(HttpStatus.CONFLICT, createProblem(productId, requested), null);
  }

  private static ProblemDetail createProblem(UUID productId, int requested) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Insufficient stock");
    problem.setDetail(
        "Product " + productId + " does not have " + requested + " units left to fulfil the order");
    problem.setProperty("productId", productId);
    return problem;
  }
}
