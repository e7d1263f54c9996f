package io.b2mash.cleaning.dispatch.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * An integrity violation that is not one of the booking slot constraints, e.g. a foreign key to a
 * team deleted mid-request. Never reported to clients as a slot conflict.
 */
public class StorageIntegrityException extends ErrorResponseException {

  private final String constraintName;

  public StorageIntegrityException(String constraintName, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(), cause);
    this.constraintName = constraintName;
  }

  /** Violated constraint as reported by the database, or null when it could not be determined. */
  public String getConstraintName() {
    return constraintName;
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Data integrity violation");
    problem.setDetail("The request could not be stored");
    return problem;
  }
}
