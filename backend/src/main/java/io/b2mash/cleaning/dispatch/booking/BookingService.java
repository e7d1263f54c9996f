package io.b2mash.cleaning.dispatch.booking;

import io.b2mash.cleaning.dispatch.audit.AuditEventBuilder;
import io.b2mash.cleaning.dispatch.audit.AuditService;
import io.b2mash.cleaning.dispatch.exception.InvalidStateException;
import io.b2mash.cleaning.dispatch.exception.ResourceNotFoundException;
import io.b2mash.cleaning.dispatch.team.TeamService;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class BookingService {

  private static final Logger log = LoggerFactory.getLogger(BookingService.class);

  private final BookingRepository bookingRepository;
  private final BookingWriter bookingWriter;
  private final AvailabilityChecker availabilityChecker;
  private final TeamService teamService;
  private final AuditService auditService;
  private final BookingProperties bookingProperties;
  private final SlotFinder slotFinder;

  public BookingService(
      BookingRepository bookingRepository,
      BookingWriter bookingWriter,
      AvailabilityChecker availabilityChecker,
      TeamService teamService,
      AuditService auditService,
      BookingProperties bookingProperties,
      SlotFinder slotFinder) {
    this.bookingRepository = bookingRepository;
    this.bookingWriter = bookingWriter;
    this.availabilityChecker = availabilityChecker;
    this.teamService = teamService;
    this.auditService = auditService;
    this.bookingProperties = bookingProperties;
    this.slotFinder = slotFinder;
  }

  /**
   * Creates a booking. The advisory pre-check turns away requests for slots that are already
   * visibly taken; the writer and the database decide everything else.
   */
  public BookingResult createBooking(UUID orgId, NewBooking request) {
    validateDuration(request.durationMinutes());
    requireTeam(orgId, request.teamId());

    var requested = TimeRange.ofMinutes(request.startsAt(), request.durationMinutes());
    var availability = checkAvailability(orgId, request.teamId(), requested);
    if (!availability.available()) {
      log.info(
          "Booking pre-check found {} conflict(s): team={}, startsAt={}",
          availability.conflicts().size(),
          request.teamId(),
          request.startsAt());
      return BookingResult.SlotConflict.slotUnavailable();
    }

    return bookingWriter.create(
        new Booking(
            orgId,
            request.teamId(),
            request.startsAt(),
            request.durationMinutes(),
            request.clientName(),
            request.serviceAddress(),
            request.notes(),
            request.leadId()));
  }

  public BookingResult rescheduleBooking(
      UUID orgId, UUID bookingId, Instant startsAt, int durationMinutes) {
    validateDuration(durationMinutes);
    return bookingWriter.reschedule(orgId, bookingId, startsAt, durationMinutes);
  }

  /** Advisory availability of a team for the requested interval. */
  public Availability availability(UUID orgId, UUID teamId, Instant startsAt, int durationMinutes) {
    validateDuration(durationMinutes);
    requireTeam(orgId, teamId);
    return checkAvailability(orgId, teamId, TimeRange.ofMinutes(startsAt, durationMinutes));
  }

  /**
   * Free start times for a team on a local date, for the requested duration. A booking being
   * rescheduled can pass its own id so its current interval does not block the search.
   */
  public List<Instant> freeSlots(
      UUID orgId, UUID teamId, LocalDate date, int durationMinutes, UUID excludedBookingId) {
    validateDuration(durationMinutes);
    requireTeam(orgId, teamId);
    return readOrUnavailable(
        "Slot search",
        () -> slotFinder.findFreeSlots(orgId, teamId, date, durationMinutes, excludedBookingId));
  }

  @Transactional(readOnly = true)
  public Booking getBooking(UUID orgId, UUID bookingId) {
    return bookingRepository
        .findOneByIdAndOrgId(bookingId, orgId)
        .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
  }

  /** Bookings of a team starting in {@code [from, to)}, in every status, ordered by start. */
  @Transactional(readOnly = true)
  public List<Booking> listBookings(UUID orgId, UUID teamId, Instant from, Instant to) {
    if (!to.isAfter(from)) {
      throw InvalidStateException.invalidRange("'to' must be after 'from'");
    }
    requireTeam(orgId, teamId);
    return bookingRepository.findByTeamInWindow(orgId, teamId, from, to);
  }

  @Transactional
  public Booking confirmBooking(UUID orgId, UUID bookingId) {
    return transition(orgId, bookingId, BookingStatus.CONFIRMED);
  }

  @Transactional
  public Booking cancelBooking(UUID orgId, UUID bookingId) {
    return transition(orgId, bookingId, BookingStatus.CANCELLED);
  }

  @Transactional
  public Booking completeBooking(UUID orgId, UUID bookingId) {
    return transition(orgId, bookingId, BookingStatus.COMPLETED);
  }

  private Booking transition(UUID orgId, UUID bookingId, BookingStatus target) {
    var booking =
        bookingRepository
            .findOneByIdAndOrgId(bookingId, orgId)
            .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    var previous = booking.getStatus();
    if (previous == target) {
      return booking;
    }

    if (!previous.canTransitionTo(target)) {
      throw InvalidStateException.invalidTransition(previous, target);
    }
    booking.transitionTo(target);
    // Flushes here so a concurrent reschedule or transition surfaces as a version conflict
    booking = bookingRepository.saveAndFlush(booking);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("booking.status_changed")
            .entityType("booking")
            .entityId(booking.getId())
            .orgId(orgId)
            .details(Map.of("from", previous.name(), "to", target.name()))
            .build());
    log.info("Booking {} moved from {} to {}", bookingId, previous, target);
    return booking;
  }

  private void requireTeam(UUID orgId, UUID teamId) {
    readOrUnavailable("Team lookup", () -> teamService.requireTeam(orgId, teamId));
  }

  private Availability checkAvailability(UUID orgId, UUID teamId, TimeRange requested) {
    return readOrUnavailable(
        "Availability check", () -> availabilityChecker.check(orgId, teamId, requested));
  }

  private static <T> T readOrUnavailable(String operation, Supplier<T> read) {
    try {
      return read.get();
    } catch (RuntimeException ex) {
      if (TransientStorageErrors.isTransient(ex)) {
        log.warn("Transient storage failure in {}: {}", operation, ex.getMessage());
        throw TransientStorageErrors.unavailable(operation, ex);
      }
      throw ex;
    }
  }

  private void validateDuration(int durationMinutes) {
    if (durationMinutes < 1 || durationMinutes > bookingProperties.maxDurationMinutes()) {
      throw new InvalidStateException(
          "Invalid duration",
          "durationMinutes must be between 1 and " + bookingProperties.maxDurationMinutes());
    }
  }

  /** Fields of a booking request, already bound from the API. */
  public record NewBooking(
      UUID teamId,
      Instant startsAt,
      int durationMinutes,
      String clientName,
      String serviceAddress,
      String notes,
      UUID leadId) {}
}
