package io.b2mash.commerce.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A payment processor call failed (network, timeout, rejected credentials, unexpected response).
 * Maps to 502. {@code retryable} is exposed to clients as a problem property.
 */
public class PaymentProviderException extends ErrorResponseException {

  private final String provider;
  private final boolean retryable;

  public PaymentProviderException(String provider, String detail, boolean retryable) {
    this(provider, detail, retryable, null);
  }

  public PaymentProviderException(
      String provider, String detail, boolean retryable, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, createProblem(provider, detail, retryable), cause);
    this.provider = provider;
    this.retryable = retryable;
  }

  public String getProvider() {
    return provider;
  }

  public boolean isRetryable() {
    return retryable;
  }

  private static ProblemDetail createProblem(String provider, String detail, boolean retryable) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Payment provider error");
    problem.setDetail(detail);
    problem.setProperty("provider", provider);
    problem.setProperty("retryable", retryable);
    return problem;
  }
}
