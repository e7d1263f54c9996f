package io.b2mash.cleaning.dispatch.booking;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Booking lifecycle. {@link #PENDING} and {@link #CONFIRMED} reserve the team's time and take part
 * in conflict checks; {@link #COMPLETED} and {@link #CANCELLED} are terminal and never block a slot.
 *
 * <p>The active set must match the {@code WHERE status IN (...)} predicate of {@code
 * uq_bookings_active_team_start} and {@code ex_bookings_active_team_overlap}.
 */
public enum BookingStatus {
  PENDING,
  CONFIRMED,
  COMPLETED,
  CANCELLED;

  public static final Set<BookingStatus> ACTIVE = EnumSet.of(PENDING, CONFIRMED);

  private static final Map<BookingStatus, Set<BookingStatus>> TRANSITIONS =
      Map.of(
          PENDING, EnumSet.of(CONFIRMED, CANCELLED),
          CONFIRMED, EnumSet.of(COMPLETED, CANCELLED),
          COMPLETED, EnumSet.noneOf(BookingStatus.class),
          CANCELLED, EnumSet.noneOf(BookingStatus.class));

  public boolean isActive() {
    return ACTIVE.contains(this);
  }

  public boolean isTerminal() {
    return TRANSITIONS.get(this).isEmpty();
  }

  /** Same-status transitions are allowed as no-ops. */
  public boolean canTransitionTo(BookingStatus target) {
    return this == target || TRANSITIONS.get(this).contains(target);
  }
}
