package io.b2mash.cleaning.dispatch.booking.enforcement;

import io.b2mash.cleaning.dispatch.booking.Availability;
import io.b2mash.cleaning.dispatch.booking.AvailabilityChecker;
import io.b2mash.cleaning.dispatch.booking.Booking;
import io.b2mash.cleaning.dispatch.booking.TimeRange;
import io.b2mash.cleaning.dispatch.team.TeamRepository;
import org.springframework.dao.EmptyResultDataAccessException;

/**
 * Serializes writes per team with a row lock on the team, then checks for overlap. The lock is held
 * until the writer's transaction ends, so the check and the insert are atomic with respect to every
 * other writer for the same team. Each statement under READ COMMITTED sees rows committed before it
 * started, so a writer that waited on the lock sees the winner's booking.
 */
public class SerializedTransactionStrategy implements ConflictEnforcementStrategy {

  private final TeamRepository teamRepository;
  private final AvailabilityChecker availabilityChecker;

  public SerializedTransactionStrategy(
      TeamRepository teamRepository, AvailabilityChecker availabilityChecker) {
    this.teamRepository = teamRepository;
    this.availabilityChecker = availabilityChecker;
  }

  @Override
  public ConflictEnforcementMode mode() {
    return ConflictEnforcementMode.SERIALIZED_TRANSACTION;
  }

  @Override
  public Availability beforeWrite(Booking booking, TimeRange requested) {
    teamRepository
        .findByIdAndOrgIdForUpdate(booking.getTeamId(), booking.getOrgId())
        .orElseThrow(() -> new EmptyResultDataAccessException("Team row to lock not found", 1));
    return availabilityChecker.check(
        booking.getOrgId(), booking.getTeamId(), requested, booking.getId());
  }
}
