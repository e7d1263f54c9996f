package io.b2mash.cleaning.dispatch.booking;

import java.util.List;

/**
 * Advisory answer for a requested interval. {@code conflicts} holds the active bookings that
 * overlap it, ordered by start; empty means the slot looked free when read.
 */
public record Availability(TimeRange requested, List<Booking> conflicts) {

  public Availability {
    conflicts = List.copyOf(conflicts);
  }

  public boolean available() {
    return conflicts.isEmpty();
  }
}
