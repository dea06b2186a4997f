package io.b2mash.commerce.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Webhook signature could not be verified. Rejected with 400 so the processor re-delivers. */
public class WebhookVerificationException extends ErrorResponseException {

  public WebhookVerificationException(String provider) {
    super(HttpStatus.BAD_REQUEST, createProblem(provider), null);
  }

  private static ProblemDetail createProblem(String provider) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Webhook verification failed");
    problem.setDetail("Signature verification failed for " + provider + " webhook");
    return problem;
  }
}
