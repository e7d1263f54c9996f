package io.b2mash.cleaning.dispatch.booking.enforcement;

import io.b2mash.cleaning.dispatch.booking.Availability;
import io.b2mash.cleaning.dispatch.booking.Booking;
import io.b2mash.cleaning.dispatch.booking.TimeRange;
import java.util.List;

/** No application work: the unique index and the exclusion constraint decide at insert time. */
public class NativeExclusionConstraintStrategy implements ConflictEnforcementStrategy {

  @Override
  public ConflictEnforcementMode mode() {
    return ConflictEnforcementMode.NATIVE_EXCLUSION_CONSTRAINT;
  }

  @Override
  public Availability beforeWrite(Booking booking, TimeRange requested) {
    return new Availability(requested, List.of());
  }
}
