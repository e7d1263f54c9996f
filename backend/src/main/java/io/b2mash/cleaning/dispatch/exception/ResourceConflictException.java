package io.b2mash.cleaning.dispatch.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * 409 for a write that collides with data already stored: a booking slot another booking holds, or
 * a team name already used in the organization. Marked {@code retryable=false}, unlike {@link
 * StorageUnavailableException}; the client has to pick another slot or name.
 */
public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, createProblem(title, detail), null);
  }

  public static ResourceConflictException slotUnavailable(String detail) {
    return new ResourceConflictException("Slot unavailable", detail);
  }

  public static ResourceConflictException duplicateTeamName(String name) {
    return new ResourceConflictException(
        "Duplicate team name", "A team named '" + name + "' already exists");
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("retryable", false);
    return problem;
  }
}
