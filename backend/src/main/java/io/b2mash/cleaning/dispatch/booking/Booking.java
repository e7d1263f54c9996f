package io.b2mash.cleaning.dispatch.booking;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;

/**
 * A scheduled service visit reserving a team for {@code [startsAt, startsAt + durationMinutes)}.
 *
 * <p>Overlap between active bookings of a team is rejected by the database, not by this class. Use
 * {@link BookingWriter} for every insert or reschedule so constraint violations are translated.
 *
 * <p>Every update is guarded by {@code version}: a write based on a stale read fails with an
 * optimistic locking error instead of overwriting a concurrent status change.
 */
@Entity
@Table(name = "bookings")
public class Booking {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "org_id", nullable = false, updatable = false)
  private UUID orgId;

  @Column(name = "team_id", nullable = false, updatable = false)
  private UUID teamId;

  @Column(name = "starts_at", nullable = false)
  private Instant startsAt;

  @Column(name = "duration_minutes", nullable = false)
  private int durationMinutes;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 32)
  private BookingStatus status;

  @Column(name = "client_name")
  private String clientName;

  @Column(name = "service_address", length = 500)
  private String serviceAddress;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Column(name = "lead_id")
  private UUID leadId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  protected Booking() {}

  public Booking(
      UUID orgId,
      UUID teamId,
      Instant startsAt,
      int durationMinutes,
      String clientName,
      String serviceAddress,
      String notes,
      UUID leadId) {
    this.orgId = orgId;
    this.teamId = teamId;
    this.startsAt = startsAt;
    this.durationMinutes = durationMinutes;
    this.status = BookingStatus.PENDING;
    this.clientName = clientName;
    this.serviceAddress = serviceAddress;
    this.notes = notes;
    this.leadId = leadId;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrgId() {
    return orgId;
  }

  public UUID getTeamId() {
    return teamId;
  }

  public Instant getStartsAt() {
    return startsAt;
  }

  public int getDurationMinutes() {
    return durationMinutes;
  }

  public Instant getEndsAt() {
    return startsAt.plusSeconds(durationMinutes * 60L);
  }

  public TimeRange getTimeRange() {
    return TimeRange.ofMinutes(startsAt, durationMinutes);
  }

  public BookingStatus getStatus() {
    return status;
  }

  public boolean isActive() {
    return status.isActive();
  }

  public String getClientName() {
    return clientName;
  }

  public String getServiceAddress() {
    return serviceAddress;
  }

  public String getNotes() {
    return notes;
  }

  public UUID getLeadId() {
    return leadId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public int getVersion() {
    return version;
  }

  /** Moves the booking to a new interval. Callers must go through the writer. */
  void reschedule(Instant startsAt, int durationMinutes) {
    this.startsAt = startsAt;
    this.durationMinutes = durationMinutes;
    this.updatedAt = Instant.now();
  }

  /**
   * Applies a lifecycle transition.
   *
   * @throws IllegalStateException if the transition is not allowed from the current status
   */
  public void transitionTo(BookingStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new IllegalStateException(
          "Cannot transition booking from " + status + " to " + target);
    }
    if (status != target) {
      this.status = target;
      this.updatedAt = Instant.now();
    }
  }
}
