package io.b2mash.cleaning.dispatch.booking.enforcement;

import io.b2mash.cleaning.dispatch.booking.Availability;
import io.b2mash.cleaning.dispatch.booking.Booking;
import io.b2mash.cleaning.dispatch.booking.TimeRange;

/**
 * Hook run by the booking writer inside its transaction, immediately before the row is inserted or
 * rescheduled. Lets the same writer run against engines with or without native range exclusion.
 */
public interface ConflictEnforcementStrategy {

  ConflictEnforcementMode mode();

  /**
   * Returns the bookings that block {@code requested} for {@code booking}'s team, or an available
   * result when the insert should proceed and the database has the final word. Must be called inside
   * an open read-write transaction.
   */
  Availability beforeWrite(Booking booking, TimeRange requested);
}
