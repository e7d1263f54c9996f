package io.b2mash.cleaning.dispatch.booking;

import io.b2mash.cleaning.dispatch.booking.enforcement.ConflictEnforcementMode;
import java.time.LocalTime;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Booking configuration.
 *
 * @param conflictEnforcement how overlap prevention is enforced; fixed at startup because it also
 *     selects which migrations run
 * @param maxDurationMinutes upper bound on a single booking; also the lookback window of the
 *     availability query
 * @param slots working-day parameters for slot suggestions
 */
@ConfigurationProperties(prefix = "booking")
public record BookingProperties(
    @DefaultValue("NATIVE_EXCLUSION_CONSTRAINT") ConflictEnforcementMode conflictEnforcement,
    @DefaultValue("1440") int maxDurationMinutes,
    @DefaultValue Slots slots) {

  /**
   * @param zone local time zone of the working day
   * @param workStart first possible start time, unless the team has its own hours for the weekday
   * @param workEnd time by which every slot must end, unless the team has its own hours
   * @param stepMinutes distance between candidate start times
   * @param bufferMinutes travel gap kept free before and after every active booking
   */
  public record Slots(
      @DefaultValue("America/Edmonton") ZoneId zone,
      @DefaultValue("09:00") LocalTime workStart,
      @DefaultValue("18:00") LocalTime workEnd,
      @DefaultValue("30") int stepMinutes,
      @DefaultValue("30") int bufferMinutes) {

    public Slots {
      if (stepMinutes < 1) {
        throw new IllegalArgumentException("booking.slots.step-minutes must be positive");
      }
      if (bufferMinutes < 0) {
        throw new IllegalArgumentException("booking.slots.buffer-minutes must not be negative");
      }
    }
  }
}
