package io.b2mash.cleaning.dispatch.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import io.b2mash.cleaning.dispatch.audit.AuditService;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

class GlobalExceptionHandlerTest {

  private final GlobalExceptionHandler handler =
      new GlobalExceptionHandler(mock(AuditService.class));

  @Test
  void staleBookingWriteIsReportedAsConflict() {
    var response =
        handler.handleOptimisticLock(
            new ObjectOptimisticLockingFailureException("Booking", UUID.randomUUID()));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody().getTitle()).isEqualTo("Concurrent modification");
  }

  @Test
  void transactionThatCannotOpenIsReportedAsRetryable() {
    var request = new MockHttpServletRequest("POST", "/api/bookings");

    var response =
        handler.handleTransientStorageFailure(
            new CannotCreateTransactionException("Could not open JPA EntityManager"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getHeaders().getFirst("Retry-After")).isEqualTo("1");
    assertThat(response.getBody().getProperties()).containsEntry("retryable", true);
  }
}
