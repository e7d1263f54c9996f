package io.b2mash.cleaning.dispatch.booking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.cleaning.dispatch.audit.AuditEventRecord;
import io.b2mash.cleaning.dispatch.audit.AuditService;
import io.b2mash.cleaning.dispatch.booking.enforcement.ConflictEnforcementMode;
import io.b2mash.cleaning.dispatch.booking.enforcement.ConflictEnforcementStrategy;
import io.b2mash.cleaning.dispatch.exception.InvalidStateException;
import io.b2mash.cleaning.dispatch.exception.StorageIntegrityException;
import io.b2mash.cleaning.dispatch.exception.StorageUnavailableException;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class BookingWriterTest {

  private static final Instant TEN = Instant.parse("2030-01-07T17:00:00Z");

  @Mock private BookingRepository bookingRepository;
  @Mock private ConflictEnforcementStrategy enforcementStrategy;
  @Mock private AuditService auditService;

  private BookingWriter writer;

  @BeforeEach
  void setUp() {
    var transactionTemplate = new TransactionTemplate(mock(PlatformTransactionManager.class));
    writer =
        new BookingWriter(
            bookingRepository,
            enforcementStrategy,
            new ConflictTranslator(),
            auditService,
            transactionTemplate);
  }

  @Test
  void createInsertsAndAuditsWhenStrategyFindsNoConflict() {
    var candidate = newCandidate();
    var saved = AvailabilityCheckerTest.booking(TEN, 60);
    when(enforcementStrategy.beforeWrite(any(), any()))
        .thenReturn(new Availability(candidate.getTimeRange(), List.of()));
    when(bookingRepository.saveAndFlush(candidate)).thenReturn(saved);

    var result = writer.create(candidate);

    assertThat(result).isEqualTo(new BookingResult.Created(saved));
    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().eventType()).isEqualTo("booking.created");
    assertThat(captor.getValue().entityId()).isEqualTo(saved.getId());
  }

  @Test
  void createReturnsConflictWithoutInsertWhenStrategyFindsOverlap() {
    var candidate = newCandidate();
    var existing = AvailabilityCheckerTest.booking(TEN, 30);
    when(enforcementStrategy.mode()).thenReturn(ConflictEnforcementMode.SERIALIZED_TRANSACTION);
    when(enforcementStrategy.beforeWrite(any(), any()))
        .thenReturn(new Availability(candidate.getTimeRange(), List.of(existing)));

    var result = writer.create(candidate);

    assertThat(result).isEqualTo(BookingResult.SlotConflict.slotUnavailable());
    verify(bookingRepository, never()).saveAndFlush(any());
    verify(auditService, never()).log(any());
  }

  @Test
  void createTranslatesSlotConstraintViolation() {
    var candidate = newCandidate();
    when(enforcementStrategy.beforeWrite(any(), any()))
        .thenReturn(new Availability(candidate.getTimeRange(), List.of()));
    when(bookingRepository.saveAndFlush(candidate))
        .thenThrow(
            new DataIntegrityViolationException(
                "insert failed",
                new SQLException(
                    "duplicate key value violates unique constraint"
                        + " \"uq_bookings_active_team_start\"",
                    "23505")));

    var result = writer.create(candidate);

    assertThat(result).isInstanceOf(BookingResult.SlotConflict.class);
    verify(auditService, never()).log(any());
  }

  @Test
  void createRethrowsUnrelatedIntegrityViolation() {
    var candidate = newCandidate();
    when(enforcementStrategy.beforeWrite(any(), any()))
        .thenReturn(new Availability(candidate.getTimeRange(), List.of()));
    when(bookingRepository.saveAndFlush(candidate))
        .thenThrow(
            new DataIntegrityViolationException(
                "insert failed",
                new SQLException(
                    "insert or update on table \"bookings\" violates foreign key constraint"
                        + " \"bookings_team_id_fkey\"",
                    "23503")));

    assertThatThrownBy(() -> writer.create(candidate))
        .isInstanceOf(StorageIntegrityException.class);
  }

  @Test
  void createReportsTransientFailureAsRetryable() {
    var candidate = newCandidate();
    when(enforcementStrategy.beforeWrite(any(), any()))
        .thenThrow(new QueryTimeoutException("statement timeout"));

    assertThatThrownBy(() -> writer.create(candidate))
        .isInstanceOf(StorageUnavailableException.class)
        .satisfies(
            e ->
                assertThat(((StorageUnavailableException) e).getBody().getProperties())
                    .containsEntry("retryable", true));
  }

  @Test
  void rescheduleRejectsTerminalBooking() {
    var booking = AvailabilityCheckerTest.booking(TEN, 60);
    booking.transitionTo(BookingStatus.CANCELLED);
    when(bookingRepository.findOneByIdAndOrgId(booking.getId(), booking.getOrgId()))
        .thenReturn(Optional.of(booking));

    assertThatThrownBy(
            () -> writer.reschedule(booking.getOrgId(), booking.getId(), TEN.plusSeconds(7200), 60))
        .isInstanceOf(InvalidStateException.class);
    verify(enforcementStrategy, never()).beforeWrite(any(), any());
  }

  @Test
  void rescheduleMovesBookingAndAuditsPreviousInterval() {
    var booking = AvailabilityCheckerTest.booking(TEN, 60);
    var newStart = TEN.plusSeconds(7200);
    when(bookingRepository.findOneByIdAndOrgId(booking.getId(), booking.getOrgId()))
        .thenReturn(Optional.of(booking));
    when(enforcementStrategy.beforeWrite(any(), any()))
        .thenReturn(new Availability(TimeRange.ofMinutes(newStart, 90), List.of()));
    when(bookingRepository.saveAndFlush(booking)).thenReturn(booking);

    var result = writer.reschedule(booking.getOrgId(), booking.getId(), newStart, 90);

    assertThat(result).isInstanceOf(BookingResult.Rescheduled.class);
    assertThat(booking.getStartsAt()).isEqualTo(newStart);
    assertThat(booking.getDurationMinutes()).isEqualTo(90);
    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().eventType()).isEqualTo("booking.rescheduled");
    assertThat(captor.getValue().details()).containsEntry("previous_starts_at", TEN.toString());
  }

  @Test
  void rescheduleRethrowsStaleVersionInsteadOfReportingUnavailable() {
    var booking = AvailabilityCheckerTest.booking(TEN, 60);
    var newStart = TEN.plusSeconds(7200);
    when(bookingRepository.findOneByIdAndOrgId(booking.getId(), booking.getOrgId()))
        .thenReturn(Optional.of(booking));
    when(enforcementStrategy.beforeWrite(any(), any()))
        .thenReturn(new Availability(TimeRange.ofMinutes(newStart, 60), List.of()));
    when(bookingRepository.saveAndFlush(booking))
        .thenThrow(new ObjectOptimisticLockingFailureException(Booking.class, booking.getId()));

    assertThatThrownBy(() -> writer.reschedule(booking.getOrgId(), booking.getId(), newStart, 60))
        .isInstanceOf(ObjectOptimisticLockingFailureException.class);
    verify(auditService, never()).log(any());
  }

  @Test
  void staleVersionIsNotClassifiedAsTransient() {
    var stale = new ObjectOptimisticLockingFailureException(Booking.class, UUID.randomUUID());

    assertThat(TransientStorageErrors.isTransient(stale)).isFalse();
    assertThat(TransientStorageErrors.isTransient(new QueryTimeoutException("timeout"))).isTrue();
  }

  private static Booking newCandidate() {
    return new Booking(
        UUID.randomUUID(), UUID.randomUUID(), TEN, 60, "Client", null, null, null);
  }
}
