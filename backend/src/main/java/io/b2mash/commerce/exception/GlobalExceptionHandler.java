package io.b2mash.commerce.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("Insufficient permissions for this operation");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }

  @ExceptionHandler(PaymentProviderException.class)
  public ResponseEntity<ProblemDetail> handleProviderError(
      PaymentProviderException ex, HttpServletRequest request) {
    log.error(
        "Payment provider {} failed on {} {}: {}",
        ex.getProvider(),
        request.getMethod(),
        request.getRequestURI(),
        ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ex.getBody());
  }

  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Optimistic locking failure: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail("Resource was modified concurrently. Please retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }
}
