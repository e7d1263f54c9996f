package io.b2mash.cleaning.dispatch.booking;

import java.time.Duration;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Reads the active bookings of a team that overlap a requested interval.
 *
 * <p>The answer is advisory: another request may take the slot between this read and the insert.
 * {@link BookingWriter} relies on the database constraints, never on this check alone.
 */
@Component
public class AvailabilityChecker {

  private final BookingRepository bookingRepository;
  private final BookingProperties bookingProperties;

  public AvailabilityChecker(
      BookingRepository bookingRepository, BookingProperties bookingProperties) {
    this.bookingRepository = bookingRepository;
    this.bookingProperties = bookingProperties;
  }

  /**
   * Checks {@code requested} against the team's active bookings, ignoring {@code excludedBookingId}
   * (the booking being rescheduled) when non-null. Joins the caller's transaction if there is one.
   */
  public Availability check(UUID orgId, UUID teamId, TimeRange requested, UUID excludedBookingId) {
    var lookbackStart =
        requested.start().minus(Duration.ofMinutes(bookingProperties.maxDurationMinutes()));
    var conflicts =
        bookingRepository
            .findOverlapCandidates(
                orgId, teamId, BookingStatus.ACTIVE, lookbackStart, requested.end())
            .stream()
            .filter(b -> excludedBookingId == null || !excludedBookingId.equals(b.getId()))
            .filter(b -> b.getTimeRange().overlaps(requested))
            .toList();
    return new Availability(requested, conflicts);
  }

  public Availability check(UUID orgId, UUID teamId, TimeRange requested) {
    return check(orgId, teamId, requested, null);
  }
}
