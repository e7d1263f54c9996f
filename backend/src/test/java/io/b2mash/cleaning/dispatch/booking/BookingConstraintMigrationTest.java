package io.b2mash.cleaning.dispatch.booking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import io.b2mash.cleaning.dispatch.TestcontainersConfiguration;
import io.b2mash.cleaning.dispatch.exception.StorageIntegrityException;
import io.b2mash.cleaning.dispatch.provisioning.OrganizationProvisioningService;
import io.b2mash.cleaning.dispatch.team.TeamService;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

/** Exercises the partial unique index and the exclusion constraint directly with SQL. */
@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class BookingConstraintMigrationTest {

  private static final String ORG_ID = "org_booking_constraint_test";

  @Autowired private JdbcTemplate jdbcTemplate;
  @Autowired private OrganizationProvisioningService provisioningService;
  @Autowired private TeamService teamService;
  @Autowired private ConflictTranslator conflictTranslator;

  private UUID orgId;

  @BeforeAll
  void provisionOrganization() {
    orgId = provisioningService.provision(ORG_ID, "Constraint Test Org").orgId();
  }

  @Test
  void migrationsCreateBothSlotConstraints() {
    Integer indexes =
        jdbcTemplate.queryForObject(
            "SELECT count(*) FROM pg_indexes WHERE tablename = 'bookings' AND indexname = ?",
            Integer.class,
            ConflictTranslator.UNIQUE_ACTIVE_START);
    Integer constraints =
        jdbcTemplate.queryForObject(
            "SELECT count(*) FROM pg_constraint WHERE conname = ? AND contype = 'x'",
            Integer.class,
            ConflictTranslator.EXCLUDE_ACTIVE_OVERLAP);

    assertThat(indexes).isEqualTo(1);
    assertThat(constraints).isEqualTo(1);
  }

  @Test
  void duplicateActiveStartViolatesSlotConstraint() {
    UUID teamId = teamService.createTeam(orgId, "SQL Duplicate Crew").getId();
    insert(teamId, "2030-04-01T17:00:00Z", 60, "PENDING");

    var error =
        catchThrowableOfType(
            DataIntegrityViolationException.class,
            () -> insert(teamId, "2030-04-01T17:00:00Z", 60, "CONFIRMED"));

    var violation = ConflictTranslator.identify(error);
    assertThat(violation.constraintName())
        .isIn(ConflictTranslator.UNIQUE_ACTIVE_START, ConflictTranslator.EXCLUDE_ACTIVE_OVERLAP);
    assertThat(conflictTranslator.translate(error).message())
        .isEqualTo(BookingResult.SLOT_UNAVAILABLE);
  }

  @Test
  void overlappingActiveIntervalViolatesExclusionConstraint() {
    UUID teamId = teamService.createTeam(orgId, "SQL Overlap Crew").getId();
    insert(teamId, "2030-04-02T17:00:00Z", 60, "CONFIRMED");

    var error =
        catchThrowableOfType(
            DataIntegrityViolationException.class,
            () -> insert(teamId, "2030-04-02T17:30:00Z", 60, "PENDING"));

    var violation = ConflictTranslator.identify(error);
    assertThat(violation.sqlState()).isEqualTo(ConflictTranslator.SQLSTATE_EXCLUSION_VIOLATION);
    assertThat(violation.constraintName()).isEqualTo(ConflictTranslator.EXCLUDE_ACTIVE_OVERLAP);
    assertThat(conflictTranslator.isSlotConflict(error)).isTrue();
  }

  @Test
  void touchingIntervalsAreAccepted() {
    UUID teamId = teamService.createTeam(orgId, "SQL Touching Crew").getId();

    insert(teamId, "2030-04-03T17:00:00Z", 60, "PENDING");
    insert(teamId, "2030-04-03T18:00:00Z", 60, "PENDING");

    assertThat(countForTeam(teamId)).isEqualTo(2);
  }

  @Test
  void terminalBookingsNeverBlock() {
    UUID teamId = teamService.createTeam(orgId, "SQL Terminal Crew").getId();
    insert(teamId, "2030-04-04T17:00:00Z", 60, "CANCELLED");
    insert(teamId, "2030-04-04T17:00:00Z", 60, "COMPLETED");
    insert(teamId, "2030-04-04T17:00:00Z", 60, "CANCELLED");

    insert(teamId, "2030-04-04T17:00:00Z", 60, "PENDING");

    assertThat(countForTeam(teamId)).isEqualTo(4);
  }

  @Test
  void cancellingFreesTheSlotForANewRow() {
    UUID teamId = teamService.createTeam(orgId, "SQL Cancel Crew").getId();
    UUID first = insert(teamId, "2030-04-05T17:00:00Z", 60, "CONFIRMED");

    jdbcTemplate.update("UPDATE bookings SET status = 'CANCELLED' WHERE id = ?", first);
    insert(teamId, "2030-04-05T17:15:00Z", 60, "PENDING");

    assertThat(countForTeam(teamId)).isEqualTo(2);
  }

  @Test
  void reactivatingIntoAnOccupiedSlotIsRejected() {
    UUID teamId = teamService.createTeam(orgId, "SQL Reactivate Crew").getId();
    UUID cancelled = insert(teamId, "2030-04-08T17:00:00Z", 60, "CANCELLED");
    insert(teamId, "2030-04-08T17:00:00Z", 60, "PENDING");

    assertThatThrownBy(
            () ->
                jdbcTemplate.update(
                    "UPDATE bookings SET status = 'PENDING' WHERE id = ?", cancelled))
        .isInstanceOf(DataIntegrityViolationException.class)
        .satisfies(e -> assertThat(conflictTranslator.isSlotConflict(e)).isTrue());
  }

  @Test
  void unrelatedIntegrityErrorsAreNotSlotConflicts() {
    UUID missingTeam = UUID.randomUUID();

    var error =
        catchThrowableOfType(
            DataIntegrityViolationException.class,
            () -> insert(missingTeam, "2030-04-09T17:00:00Z", 60, "PENDING"));

    assertThat(conflictTranslator.isSlotConflict(error)).isFalse();
    assertThatThrownBy(() -> conflictTranslator.translate(error))
        .isInstanceOf(StorageIntegrityException.class)
        .satisfies(
            e ->
                assertThat(((StorageIntegrityException) e).getConstraintName())
                    .isEqualTo("bookings_team_id_fkey"));
  }

  @Test
  void nonPositiveDurationIsRejectedByCheckConstraint() {
    UUID teamId = teamService.createTeam(orgId, "SQL Check Crew").getId();

    var error =
        catchThrowableOfType(
            DataIntegrityViolationException.class,
            () -> insert(teamId, "2030-04-10T17:00:00Z", 0, "PENDING"));

    assertThat(ConflictTranslator.identify(error).constraintName())
        .isEqualTo("ck_bookings_duration_positive");
    assertThatThrownBy(() -> conflictTranslator.translate(error))
        .isInstanceOf(StorageIntegrityException.class);
  }

  private UUID insert(UUID teamId, String startsAt, int durationMinutes, String status) {
    UUID id = UUID.randomUUID();
    jdbcTemplate.update(
        """
        INSERT INTO bookings (id, org_id, team_id, starts_at, duration_minutes, status)
        VALUES (?, ?, ?, ?, ?, ?)
        """,
        id,
        orgId,
        teamId,
        OffsetDateTime.ofInstant(Instant.parse(startsAt), ZoneOffset.UTC),
        durationMinutes,
        status);
    return id;
  }

  private int countForTeam(UUID teamId) {
    return jdbcTemplate.queryForObject(
        "SELECT count(*) FROM bookings WHERE team_id = ?", Integer.class, teamId);
  }
}
