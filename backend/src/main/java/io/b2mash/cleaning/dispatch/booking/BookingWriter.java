package io.b2mash.cleaning.dispatch.booking;

import io.b2mash.cleaning.dispatch.audit.AuditEventBuilder;
import io.b2mash.cleaning.dispatch.audit.AuditService;
import io.b2mash.cleaning.dispatch.booking.enforcement.ConflictEnforcementStrategy;
import io.b2mash.cleaning.dispatch.exception.InvalidStateException;
import io.b2mash.cleaning.dispatch.exception.ResourceNotFoundException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * The only path that inserts bookings or moves them in time. Each call is one short transaction:
 * the configured {@link ConflictEnforcementStrategy} runs first, then the row is written and
 * flushed so constraint violations surface inside the call. Violations of the slot constraints
 * come back as {@link BookingResult.SlotConflict}; no raw persistence exception leaves this class.
 *
 * <p>Writes are never retried here. A conflict is final for the request. A reschedule racing a
 * status change on the same booking fails with {@link OptimisticLockingFailureException}, which the
 * API reports as a concurrent modification.
 */
@Component
public class BookingWriter {

  private static final Logger log = LoggerFactory.getLogger(BookingWriter.class);

  private final BookingRepository bookingRepository;
  private final ConflictEnforcementStrategy enforcementStrategy;
  private final ConflictTranslator conflictTranslator;
  private final AuditService auditService;
  private final TransactionTemplate transactionTemplate;

  public BookingWriter(
      BookingRepository bookingRepository,
      ConflictEnforcementStrategy enforcementStrategy,
      ConflictTranslator conflictTranslator,
      AuditService auditService,
      TransactionTemplate transactionTemplate) {
    this.bookingRepository = bookingRepository;
    this.enforcementStrategy = enforcementStrategy;
    this.conflictTranslator = conflictTranslator;
    this.auditService = auditService;
    this.transactionTemplate = transactionTemplate;
  }

  /** Inserts a new PENDING booking. */
  public BookingResult create(Booking candidate) {
    if (candidate.getId() != null || !candidate.isActive()) {
      throw new IllegalArgumentException("Only new active bookings can be created");
    }
    try {
      return transactionTemplate.execute(
          status -> {
            var availability = enforcementStrategy.beforeWrite(candidate, candidate.getTimeRange());
            if (!availability.available()) {
              log.info(
                  "Booking create rejected by {} check: team={}, conflicts={}",
                  enforcementStrategy.mode(),
                  candidate.getTeamId(),
                  availability.conflicts().size());
              return BookingResult.SlotConflict.slotUnavailable();
            }

            var saved = bookingRepository.saveAndFlush(candidate);
            auditService.log(
                AuditEventBuilder.builder()
                    .eventType("booking.created")
                    .entityType("booking")
                    .entityId(saved.getId())
                    .orgId(saved.getOrgId())
                    .details(scheduleDetails(saved))
                    .build());
            log.info(
                "Created booking: id={}, team={}, startsAt={}, durationMinutes={}",
                saved.getId(),
                saved.getTeamId(),
                saved.getStartsAt(),
                saved.getDurationMinutes());
            return new BookingResult.Created(saved);
          });
    } catch (DataIntegrityViolationException ex) {
      return conflictTranslator.translate(ex);
    } catch (RuntimeException ex) {
      if (conflictTranslator.isSlotConflict(ex)) {
        return conflictTranslator.translate(ex);
      }
      if (TransientStorageErrors.isTransient(ex)) {
        log.warn("Transient storage failure creating booking: {}", ex.getMessage());
        throw TransientStorageErrors.unavailable("Booking create", ex);
      }
      throw ex;
    }
  }

  /**
   * Moves an active booking to {@code [startsAt, startsAt + durationMinutes)}. The booking's own
   * current interval never counts as a conflict.
   */
  public BookingResult reschedule(
      UUID orgId, UUID bookingId, Instant startsAt, int durationMinutes) {
    try {
      return transactionTemplate.execute(
          status -> {
            var booking =
                bookingRepository
                    .findOneByIdAndOrgId(bookingId, orgId)
                    .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
            if (booking.getStatus().isTerminal()) {
              throw new InvalidStateException(
                  "Booking not reschedulable",
                  "A " + booking.getStatus() + " booking cannot be rescheduled");
            }

            var previousStart = booking.getStartsAt();
            var previousDuration = booking.getDurationMinutes();
            var requested = TimeRange.ofMinutes(startsAt, durationMinutes);
            var availability = enforcementStrategy.beforeWrite(booking, requested);
            if (!availability.available()) {
              log.info(
                  "Booking reschedule rejected by {} check: id={}, conflicts={}",
                  enforcementStrategy.mode(),
                  bookingId,
                  availability.conflicts().size());
              return BookingResult.SlotConflict.slotUnavailable();
            }

            booking.reschedule(startsAt, durationMinutes);
            var saved = bookingRepository.saveAndFlush(booking);

            var details = scheduleDetails(saved);
            details.put("previous_starts_at", previousStart.toString());
            details.put("previous_duration_minutes", previousDuration);
            auditService.log(
                AuditEventBuilder.builder()
                    .eventType("booking.rescheduled")
                    .entityType("booking")
                    .entityId(saved.getId())
                    .orgId(saved.getOrgId())
                    .details(details)
                    .build());
            log.info(
                "Rescheduled booking: id={}, startsAt={}, durationMinutes={}",
                saved.getId(),
                saved.getStartsAt(),
                saved.getDurationMinutes());
            return new BookingResult.Rescheduled(saved);
          });
    } catch (DataIntegrityViolationException ex) {
      return conflictTranslator.translate(ex);
    } catch (OptimisticLockingFailureException ex) {
      log.info("Booking {} changed concurrently; reschedule rejected", bookingId);
      throw ex;
    } catch (RuntimeException ex) {
      if (conflictTranslator.isSlotConflict(ex)) {
        return conflictTranslator.translate(ex);
      }
      if (TransientStorageErrors.isTransient(ex)) {
        log.warn(
            "Transient storage failure rescheduling booking {}: {}", bookingId, ex.getMessage());
        throw TransientStorageErrors.unavailable("Booking reschedule", ex);
      }
      throw ex;
    }
  }

  private static Map<String, Object> scheduleDetails(Booking booking) {
    var details = new LinkedHashMap<String, Object>();
    details.put("team_id", booking.getTeamId().toString());
    details.put("starts_at", booking.getStartsAt().toString());
    details.put("duration_minutes", booking.getDurationMinutes());
    return details;
  }
}
