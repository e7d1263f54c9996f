package io.b2mash.cleaning.dispatch.booking;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** Half-open interval {@code [start, end)}. Touching intervals do not overlap. */
public record TimeRange(Instant start, Instant end) {

  public TimeRange {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (!end.isAfter(start)) {
      throw new IllegalArgumentException("end must be after start: [" + start + ", " + end + ")");
    }
  }

  public static TimeRange ofMinutes(Instant start, int durationMinutes) {
    return new TimeRange(start, start.plus(Duration.ofMinutes(durationMinutes)));
  }

  public boolean overlaps(TimeRange other) {
    return start.isBefore(other.end) && other.start.isBefore(end);
  }

  public boolean contains(TimeRange other) {
    return !other.start.isBefore(start) && !other.end.isAfter(end);
  }
}
