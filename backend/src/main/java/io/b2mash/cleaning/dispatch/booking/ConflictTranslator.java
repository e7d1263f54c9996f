package io.b2mash.cleaning.dispatch.booking;

import io.b2mash.cleaning.dispatch.exception.StorageIntegrityException;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps a storage integrity error raised by a booking insert or update to a {@link
 * BookingResult.SlotConflict}, but only when the violated constraint is one of the two slot
 * constraints. Any other violation is rethrown as {@link StorageIntegrityException}.
 *
 * <p>Stateless; translating the same error twice yields an equal result.
 */
@Component
public class ConflictTranslator {

  private static final Logger log = LoggerFactory.getLogger(ConflictTranslator.class);

  public static final String UNIQUE_ACTIVE_START = "uq_bookings_active_team_start";
  public static final String EXCLUDE_ACTIVE_OVERLAP = "ex_bookings_active_team_overlap";

  static final String SQLSTATE_UNIQUE_VIOLATION = "23505";
  static final String SQLSTATE_EXCLUSION_VIOLATION = "23P01";
  static final String SQLSTATE_DEADLOCK_DETECTED = "40P01";

  // Constraint name -> SQLSTATE it raises
  private static final Map<String, String> SLOT_CONSTRAINTS =
      Map.of(
          UNIQUE_ACTIVE_START, SQLSTATE_UNIQUE_VIOLATION,
          EXCLUDE_ACTIVE_OVERLAP, SQLSTATE_EXCLUSION_VIOLATION);

  private static final Pattern CONSTRAINT_IN_MESSAGE = Pattern.compile("constraint \"([^\"]+)\"");

  // Error context PostgreSQL attaches while a writer waits on another writer's overlapping row
  private static final String EXCLUSION_WAIT_CONTEXT = "while checking exclusion constraint";
  private static final String BOOKINGS_RELATION = "relation \"bookings\"";

  /**
   * Translates {@code error} into a slot conflict.
   *
   * <p>Two writers inserting overlapping rows at the same time can wait on each other inside the
   * exclusion check; PostgreSQL then aborts one of them with a deadlock instead of an exclusion
   * violation. Both outcomes mean the same thing and both become a slot conflict.
   *
   * @throws StorageIntegrityException if the error is not a violation of a slot constraint
   */
  public BookingResult.SlotConflict translate(RuntimeException error) {
    if (isExclusionWaitDeadlock(error)) {
      log.info("Concurrent overlapping booking write aborted by deadlock detection");
      return BookingResult.SlotConflict.slotUnavailable();
    }
    var violation = identify(error);
    if (isSlotConstraint(violation)) {
      log.info(
          "Slot constraint rejected booking write: constraint={}, sqlState={}",
          violation.constraintName(),
          violation.sqlState());
      return BookingResult.SlotConflict.slotUnavailable();
    }
    log.error(
        "Unrelated integrity violation on booking write: constraint={}, sqlState={}",
        violation.constraintName(),
        violation.sqlState(),
        error);
    throw new StorageIntegrityException(violation.constraintName(), error);
  }

  /** Whether {@code error} is a violation of one of the two slot constraints. */
  public boolean isSlotConflict(Throwable error) {
    return isExclusionWaitDeadlock(error) || isSlotConstraint(identify(error));
  }

  /** A deadlock raised while waiting inside the bookings exclusion check. */
  static boolean isExclusionWaitDeadlock(Throwable error) {
    Set<Throwable> seen = new HashSet<>();
    Throwable current = error;
    while (current != null && seen.add(current)) {
      if (current instanceof SQLException sql
          && SQLSTATE_DEADLOCK_DETECTED.equals(sql.getSQLState())) {
        String context = null;
        if (sql instanceof PSQLException psql && psql.getServerErrorMessage() != null) {
          context = psql.getServerErrorMessage().getWhere();
        }
        if (context == null) {
          context = sql.getMessage();
        }
        return context != null
            && context.contains(EXCLUSION_WAIT_CONTEXT)
            && context.contains(BOOKINGS_RELATION);
      }
      current = current.getCause();
    }
    return false;
  }

  static boolean isSlotConstraint(ViolatedConstraint violation) {
    if (violation.constraintName() == null) {
      return false;
    }
    String expectedState =
        SLOT_CONSTRAINTS.get(violation.constraintName().toLowerCase(Locale.ROOT));
    if (expectedState == null) {
      return false;
    }
    // Some wrappers lose the SQLSTATE; the constraint name alone is then authoritative.
    return violation.sqlState() == null || expectedState.equals(violation.sqlState());
  }

  /**
   * Finds the SQLSTATE and constraint name in the cause chain. The PostgreSQL server error fields
   * win over anything parsed from messages.
   */
  static ViolatedConstraint identify(Throwable error) {
    String sqlState = null;
    String parsedName = null;
    Set<Throwable> seen = new HashSet<>();
    Throwable current = error;
    while (current != null && seen.add(current)) {
      if (current instanceof PSQLException psql) {
        ServerErrorMessage serverError = psql.getServerErrorMessage();
        if (serverError != null && serverError.getConstraint() != null) {
          return new ViolatedConstraint(psql.getSQLState(), serverError.getConstraint());
        }
      }
      if (current instanceof SQLException sql) {
        if (sqlState == null) {
          sqlState = sql.getSQLState();
        }
        if (sql.getNextException() != null && sql.getNextException() != sql.getCause()) {
          var next = identify(sql.getNextException());
          if (next.constraintName() != null) {
            return next;
          }
        }
      }
      if (parsedName == null && current.getMessage() != null) {
        Matcher matcher = CONSTRAINT_IN_MESSAGE.matcher(current.getMessage());
        if (matcher.find()) {
          parsedName = matcher.group(1);
        }
      }
      current = current.getCause();
    }
    return new ViolatedConstraint(sqlState, parsedName);
  }

  /** What the database reported; either field may be null. */
  record ViolatedConstraint(String sqlState, String constraintName) {}
}
