package io.b2mash.cleaning.dispatch.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A booking or team-schedule request rejected before anything is written: a duration outside the
 * configured bounds, an empty or inverted time window, or a status change the booking lifecycle
 * does not allow. Always 400 and marked {@code retryable=false}; the same request fails again.
 */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), null);
  }

  /** A {@code [start, end)} window whose end is not after its start. */
  public static InvalidStateException invalidRange(String detail) {
    return new InvalidStateException("Invalid date range", detail);
  }

  public static InvalidStateException invalidTransition(Enum<?> from, Enum<?> to) {
    return new InvalidStateException(
        "Invalid status transition", "A " + from + " booking cannot become " + to);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("retryable", false);
    return problem;
  }
}
