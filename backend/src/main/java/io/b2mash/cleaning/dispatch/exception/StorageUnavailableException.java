package io.b2mash.cleaning.dispatch.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Transient storage failure (connection loss, lock or statement timeout). Says nothing about slot
 * availability; the caller may retry the same request.
 */
public class StorageUnavailableException extends ErrorResponseException {

  public StorageUnavailableException(String detail, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Storage temporarily unavailable");
    problem.setDetail(detail);
    problem.setProperty("retryable", true);
    return problem;
  }
}
