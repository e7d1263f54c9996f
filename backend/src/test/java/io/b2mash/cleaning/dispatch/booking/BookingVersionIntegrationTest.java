package io.b2mash.cleaning.dispatch.booking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.cleaning.dispatch.TestcontainersConfiguration;
import io.b2mash.cleaning.dispatch.provisioning.OrganizationProvisioningService;
import io.b2mash.cleaning.dispatch.team.TeamService;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * A status change and a reschedule of the same booking, each based on a read taken before the
 * other committed. The later write must fail instead of silently overwriting the earlier one.
 */
@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class BookingVersionIntegrationTest {

  private static final String ORG_ID = "org_booking_version_test";
  private static final Instant START = Instant.parse("2030-04-01T17:00:00Z");

  @Autowired private OrganizationProvisioningService provisioningService;
  @Autowired private TeamService teamService;
  @Autowired private BookingService bookingService;
  @Autowired private BookingWriter bookingWriter;
  @Autowired private BookingRepository bookingRepository;
  @Autowired private PlatformTransactionManager transactionManager;

  private UUID orgId;

  @BeforeAll
  void provisionOrganization() {
    orgId = provisioningService.provision(ORG_ID, "Version Test Org").orgId();
  }

  @Test
  void staleRescheduleDoesNotOverwriteCommittedCancel() throws Exception {
    UUID teamId = teamService.createTeam(orgId, "Cancel Race Crew").getId();
    UUID bookingId = createBooking(teamId);
    var transaction = new TransactionTemplate(transactionManager);

    assertThatThrownBy(
            () ->
                transaction.executeWithoutResult(
                    status -> {
                      // the reschedule below runs on this read, taken while still PENDING
                      var stale = bookingRepository.findOneByIdAndOrgId(bookingId, orgId).get();
                      assertThat(stale.getStatus()).isEqualTo(BookingStatus.PENDING);

                      inOtherThread(() -> bookingService.cancelBooking(orgId, bookingId));

                      bookingWriter.reschedule(orgId, bookingId, START.plusSeconds(4 * 3600), 60);
                    }))
        .isInstanceOf(ObjectOptimisticLockingFailureException.class);

    var stored = bookingService.getBooking(orgId, bookingId);
    assertThat(stored.getStatus()).isEqualTo(BookingStatus.CANCELLED);
    assertThat(stored.getStartsAt()).isEqualTo(START);
    assertThat(stored.getVersion()).isEqualTo(1);
  }

  @Test
  void staleCancelDoesNotOverwriteCommittedReschedule() throws Exception {
    UUID teamId = teamService.createTeam(orgId, "Reschedule Race Crew").getId();
    UUID bookingId = createBooking(teamId);
    Instant moved = START.plusSeconds(4 * 3600);
    var transaction = new TransactionTemplate(transactionManager);

    assertThatThrownBy(
            () ->
                transaction.executeWithoutResult(
                    status -> {
                      bookingRepository.findOneByIdAndOrgId(bookingId, orgId).get();

                      inOtherThread(
                          () -> bookingWriter.reschedule(orgId, bookingId, moved, 60));

                      bookingService.cancelBooking(orgId, bookingId);
                    }))
        .isInstanceOf(ObjectOptimisticLockingFailureException.class);

    var stored = bookingService.getBooking(orgId, bookingId);
    assertThat(stored.getStatus()).isEqualTo(BookingStatus.PENDING);
    assertThat(stored.getStartsAt()).isEqualTo(moved);
  }

  @Test
  void sequentialCancelAfterRescheduleSucceeds() {
    UUID teamId = teamService.createTeam(orgId, "Sequential Crew").getId();
    UUID bookingId = createBooking(teamId);

    var rescheduled = bookingWriter.reschedule(orgId, bookingId, START.plusSeconds(7200), 60);
    var cancelled = bookingService.cancelBooking(orgId, bookingId);

    assertThat(rescheduled).isInstanceOf(BookingResult.Rescheduled.class);
    assertThat(cancelled.getStatus()).isEqualTo(BookingStatus.CANCELLED);
    assertThat(cancelled.getVersion()).isEqualTo(2);
  }

  private UUID createBooking(UUID teamId) {
    var result =
        bookingService.createBooking(
            orgId,
            new BookingService.NewBooking(
                teamId, START, 60, "Version Client", "1 Jasper Ave", null, null));
    return ((BookingResult.Created) result).booking().getId();
  }

  /** Runs {@code write} to commit on another thread and connection, and waits for it. */
  private static void inOtherThread(Runnable write) {
    try {
      CompletableFuture.runAsync(write).get(30, TimeUnit.SECONDS);
    } catch (Exception e) {
      throw new IllegalStateException("Concurrent write failed", e);
    }
  }
}
