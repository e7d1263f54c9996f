package io.b2mash.cleaning.dispatch.exception;

import io.b2mash.cleaning.dispatch.audit.AuditEventBuilder;
import io.b2mash.cleaning.dispatch.audit.AuditService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final AuditService auditService;

  public GlobalExceptionHandler(AuditService auditService) {
    this.auditService = auditService;
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("security.access_denied")
            .entityType("security")
            .entityId(UUID.randomUUID())
            .details(
                Map.of(
                    "path", request.getRequestURI(),
                    "method", request.getMethod(),
                    "reason", "insufficient_role"))
            .build());

    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("Insufficient permissions for this operation");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }

  @ExceptionHandler(StorageUnavailableException.class)
  public ResponseEntity<ProblemDetail> handleStorageUnavailable(
      StorageUnavailableException ex, HttpServletRequest request) {
    log.warn(
        "Storage unavailable: path={}, method={}, cause={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getCause() != null ? ex.getCause().getClass().getSimpleName() : "unknown");
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .header("Retry-After", "1")
        .body(ex.getBody());
  }

  /**
   * Transient storage failures that escape the service layer, typically a transaction that could
   * not be opened before the service method ran.
   */
  @ExceptionHandler({
    TransientDataAccessException.class,
    RecoverableDataAccessException.class,
    DataAccessResourceFailureException.class,
    CannotCreateTransactionException.class
  })
  public ResponseEntity<ProblemDetail> handleTransientStorageFailure(
      RuntimeException ex, HttpServletRequest request) {
    return handleStorageUnavailable(
        new StorageUnavailableException(
            "Request failed due to a temporary storage problem; retry the request", ex),
        request);
  }

  @ExceptionHandler(StorageIntegrityException.class)
  public ResponseEntity<ProblemDetail> handleStorageIntegrity(
      StorageIntegrityException ex, HttpServletRequest request) {
    // Constraint name stays in the log; clients get the generic body
    log.error(
        "Storage integrity violation: path={}, method={}, constraint={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getConstraintName());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ex.getBody());
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
