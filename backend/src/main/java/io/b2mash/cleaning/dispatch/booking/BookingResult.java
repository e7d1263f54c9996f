package io.b2mash.cleaning.dispatch.booking;

/**
 * Outcome of a booking write. A slot conflict is an expected result, not an exception, so both
 * branches are visible in the writer's signature. Unrelated storage failures are still thrown.
 */
public sealed interface BookingResult
    permits BookingResult.Created, BookingResult.Rescheduled, BookingResult.SlotConflict {

  /** Stable message for every slot conflict, whichever check or constraint detected it. */
  String SLOT_UNAVAILABLE = "Requested slot is no longer available";

  /** The booking row was committed and is visible to subsequent reads. */
  record Created(Booking booking) implements BookingResult {}

  /** The booking's new interval was committed. */
  record Rescheduled(Booking booking) implements BookingResult {}

  /**
   * Another active booking occupies part or all of the requested interval. Exact-start duplicates
   * and overlaps are deliberately indistinguishable.
   */
  record SlotConflict(String message) implements BookingResult {

    public static SlotConflict slotUnavailable() {
      return new SlotConflict(SLOT_UNAVAILABLE);
    }
  }
}
