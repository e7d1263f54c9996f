package io.b2mash.cleaning.dispatch.booking.enforcement;

import io.b2mash.cleaning.dispatch.booking.Availability;
import io.b2mash.cleaning.dispatch.booking.AvailabilityChecker;
import io.b2mash.cleaning.dispatch.booking.Booking;
import io.b2mash.cleaning.dispatch.booking.TimeRange;

/**
 * Re-checks for overlap inside the write transaction without taking any lock. Narrows the race
 * window but does not close it.
 */
public class AdvisoryOnlyStrategy implements ConflictEnforcementStrategy {

  private final AvailabilityChecker availabilityChecker;

  public AdvisoryOnlyStrategy(AvailabilityChecker availabilityChecker) {
    this.availabilityChecker = availabilityChecker;
  }

  @Override
  public ConflictEnforcementMode mode() {
    return ConflictEnforcementMode.ADVISORY_ONLY;
  }

  @Override
  public Availability beforeWrite(Booking booking, TimeRange requested) {
    return availabilityChecker.check(
        booking.getOrgId(), booking.getTeamId(), requested, booking.getId());
  }
}
