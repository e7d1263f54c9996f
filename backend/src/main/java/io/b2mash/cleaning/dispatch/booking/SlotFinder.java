package io.b2mash.cleaning.dispatch.booking;

import io.b2mash.cleaning.dispatch.team.TeamScheduleService;
import io.b2mash.cleaning.dispatch.team.TeamWorkingHours;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Suggests free start times for a team on a local date. Candidates are spaced {@code
 * booking.slots.step-minutes} apart from the start of the team's working day, and a candidate is
 * offered when the whole interval fits in the working day and overlaps neither a blackout nor an
 * active booking widened by {@code booking.slots.buffer-minutes} on both sides.
 *
 * <p>Suggestions are advisory, like {@link AvailabilityChecker}. The buffer applies to suggestions
 * only; the writer accepts any non-overlapping interval.
 */
@Component
public class SlotFinder {

  private final BookingRepository bookingRepository;
  private final TeamScheduleService scheduleService;
  private final BookingProperties bookingProperties;

  public SlotFinder(
      BookingRepository bookingRepository,
      TeamScheduleService scheduleService,
      BookingProperties bookingProperties) {
    this.bookingRepository = bookingRepository;
    this.scheduleService = scheduleService;
    this.bookingProperties = bookingProperties;
  }

  /**
   * @param excludedBookingId booking whose own interval is ignored, for rescheduling; may be null
   */
  @Transactional(readOnly = true)
  public List<Instant> findFreeSlots(
      UUID orgId, UUID teamId, LocalDate date, int durationMinutes, UUID excludedBookingId) {
    var hours = scheduleService.findWorkingHours(orgId, teamId, date.getDayOfWeek()).orElse(null);
    var window = workingWindow(date, hours);
    if (window == null) {
      return List.of();
    }

    var buffer = Duration.ofMinutes(bookingProperties.slots().bufferMinutes());
    var lookbackStart =
        window
            .start()
            .minus(buffer)
            .minus(Duration.ofMinutes(bookingProperties.maxDurationMinutes()));
    var blocked = new ArrayList<TimeRange>();
    bookingRepository
        .findOverlapCandidates(
            orgId, teamId, BookingStatus.ACTIVE, lookbackStart, window.end().plus(buffer))
        .stream()
        .filter(b -> excludedBookingId == null || !excludedBookingId.equals(b.getId()))
        .map(b -> widen(b.getTimeRange(), buffer))
        .forEach(blocked::add);
    scheduleService.findBlackouts(orgId, teamId, window.start(), window.end()).stream()
        .map(b -> new TimeRange(b.getStartsAt(), b.getEndsAt()))
        .forEach(blocked::add);

    return freeStarts(window, durationMinutes, bookingProperties.slots().stepMinutes(), blocked);
  }

  /**
   * The working day of {@code date} in the configured zone, from the team's hours for that weekday
   * or the configured default when it has none. Null if the day is empty.
   */
  TimeRange workingWindow(LocalDate date, TeamWorkingHours teamHours) {
    var slots = bookingProperties.slots();
    LocalTime startTime = teamHours != null ? teamHours.getStartTime() : slots.workStart();
    LocalTime endTime = teamHours != null ? teamHours.getEndTime() : slots.workEnd();
    Instant start = date.atTime(startTime).atZone(slots.zone()).toInstant();
    Instant end = date.atTime(endTime).atZone(slots.zone()).toInstant();
    return end.isAfter(start) ? new TimeRange(start, end) : null;
  }

  static List<Instant> freeStarts(
      TimeRange window, int durationMinutes, int stepMinutes, List<TimeRange> blocked) {
    var step = Duration.ofMinutes(stepMinutes);
    var result = new ArrayList<Instant>();
    var range = TimeRange.ofMinutes(window.start(), durationMinutes);
    while (window.contains(range)) {
      if (blocked.stream().noneMatch(range::overlaps)) {
        result.add(range.start());
      }
      range = TimeRange.ofMinutes(range.start().plus(step), durationMinutes);
    }
    return result;
  }

  private static TimeRange widen(TimeRange range, Duration buffer) {
    return new TimeRange(range.start().minus(buffer), range.end().plus(buffer));
  }
}
