package io.b2mash.commerce.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A payment, plan or address could not be found by the id or processor reference the caller gave.
 * Also used for payments that exist but belong to someone else, so their existence is not leaked.
 */
public class ResourceNotFoundException extends ErrorResponseException {

  /**
   * @param resourceType entity name in CamelCase, e.g. {@code SubscriptionPlan}
   * @param reference the id or processor reference that was looked up
   */
  public ResourceNotFoundException(String resourceType, Object reference) {
    super(HttpStatus.NOT_FOUND, referenceProblem(resourceType, reference), null);
  }

  public static ResourceNotFoundException withDetail(String title, String detail) {
    return new ResourceNotFoundException(problem(title, detail));
  }

  private ResourceNotFoundException(ProblemDetail problem) {
    super(HttpStatus.NOT_FOUND, problem, null);
  }

  static String displayName(String resourceType) {
    return resourceType.replaceAll("([a-z])([A-Z])", "$1 $2").toLowerCase();
  }

  private static ProblemDetail referenceProblem(String resourceType, Object reference) {
    var name = displayName(resourceType);
    var problem =
        problem(
            Character.toUpperCase(name.charAt(0)) + name.substring(1) + " not found",
            "No " + name + " matches " + reference);
    problem.setProperty("resource", resourceType);
    problem.setProperty("reference", String.valueOf(reference));
    return problem;
  }

  private static ProblemDetail problem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
