package io.b2mash.cleaning.dispatch.booking.enforcement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.cleaning.dispatch.booking.Availability;
import io.b2mash.cleaning.dispatch.booking.AvailabilityChecker;
import io.b2mash.cleaning.dispatch.booking.Booking;
import io.b2mash.cleaning.dispatch.booking.BookingProperties;
import io.b2mash.cleaning.dispatch.booking.BookingProperties.Slots;
import io.b2mash.cleaning.dispatch.booking.TimeRange;
import io.b2mash.cleaning.dispatch.team.Team;
import io.b2mash.cleaning.dispatch.team.TeamRepository;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.EmptyResultDataAccessException;

@ExtendWith(MockitoExtension.class)
class ConflictEnforcementStrategyTest {

  private static final UUID ORG_ID = UUID.randomUUID();
  private static final UUID TEAM_ID = UUID.randomUUID();
  private static final Instant TEN = Instant.parse("2030-01-07T17:00:00Z");

  @Mock private TeamRepository teamRepository;
  @Mock private AvailabilityChecker availabilityChecker;

  @Test
  void configSelectsStrategyForMode() {
    var config = new ConflictEnforcementConfig();

    assertThat(
            config.conflictEnforcementStrategy(
                    properties(ConflictEnforcementMode.NATIVE_EXCLUSION_CONSTRAINT),
                    teamRepository,
                    availabilityChecker))
        .isInstanceOf(NativeExclusionConstraintStrategy.class);
    assertThat(
            config.conflictEnforcementStrategy(
                    properties(ConflictEnforcementMode.SERIALIZED_TRANSACTION),
                    teamRepository,
                    availabilityChecker))
        .isInstanceOf(SerializedTransactionStrategy.class);
    assertThat(
            config.conflictEnforcementStrategy(
                    properties(ConflictEnforcementMode.ADVISORY_ONLY),
                    teamRepository,
                    availabilityChecker))
        .isInstanceOf(AdvisoryOnlyStrategy.class);
  }

  @Test
  void nativeStrategyLeavesTheDecisionToTheDatabase() {
    var booking = booking();

    var availability =
        new NativeExclusionConstraintStrategy().beforeWrite(booking, booking.getTimeRange());

    assertThat(availability.available()).isTrue();
    verifyNoInteractions(teamRepository, availabilityChecker);
  }

  @Test
  void serializedStrategyLocksTeamBeforeChecking() {
    var booking = booking();
    var requested = booking.getTimeRange();
    when(teamRepository.findByIdAndOrgIdForUpdate(TEAM_ID, ORG_ID))
        .thenReturn(Optional.of(new Team(ORG_ID, "Locked Crew")));
    when(availabilityChecker.check(ORG_ID, TEAM_ID, requested, null))
        .thenReturn(new Availability(requested, List.of()));

    var availability =
        new SerializedTransactionStrategy(teamRepository, availabilityChecker)
            .beforeWrite(booking, requested);

    assertThat(availability.available()).isTrue();
    var order = inOrder(teamRepository, availabilityChecker);
    order.verify(teamRepository).findByIdAndOrgIdForUpdate(TEAM_ID, ORG_ID);
    order.verify(availabilityChecker).check(ORG_ID, TEAM_ID, requested, null);
  }

  @Test
  void serializedStrategyFailsWhenTeamRowIsGone() {
    var booking = booking();
    when(teamRepository.findByIdAndOrgIdForUpdate(any(), any())).thenReturn(Optional.empty());

    assertThatThrownBy(
            () ->
                new SerializedTransactionStrategy(teamRepository, availabilityChecker)
                    .beforeWrite(booking, booking.getTimeRange()))
        .isInstanceOf(EmptyResultDataAccessException.class);
  }

  @Test
  void advisoryStrategyReportsConflictsWithoutLocking() {
    var booking = booking();
    var requested = TimeRange.ofMinutes(TEN, 30);
    var blocker = new Booking(ORG_ID, TEAM_ID, TEN, 60, null, null, null, null);
    when(availabilityChecker.check(ORG_ID, TEAM_ID, requested, null))
        .thenReturn(new Availability(requested, List.of(blocker)));

    var availability =
        new AdvisoryOnlyStrategy(availabilityChecker).beforeWrite(booking, requested);

    assertThat(availability.available()).isFalse();
    assertThat(availability.conflicts()).containsExactly(blocker);
    verifyNoInteractions(teamRepository);
  }

  private static Booking booking() {
    return new Booking(ORG_ID, TEAM_ID, TEN, 60, "Jane Client", null, null, null);
  }

  private static BookingProperties properties(ConflictEnforcementMode mode) {
    return new BookingProperties(
        mode,
        1440,
        new Slots(ZoneId.of("America/Edmonton"), LocalTime.of(9, 0), LocalTime.of(18, 0), 30, 30));
  }
}
