package io.b2mash.cleaning.dispatch.team;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.UUID;

/** Local working day of a team for one weekday. At most one row per team and weekday. */
@Entity
@Table(name = "team_working_hours")
public class TeamWorkingHours {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "org_id", nullable = false, updatable = false)
  private UUID orgId;

  @Column(name = "team_id", nullable = false, updatable = false)
  private UUID teamId;

  @Column(name = "day_of_week", nullable = false, updatable = false)
  private int dayOfWeek;

  @Column(name = "start_time", nullable = false)
  private LocalTime startTime;

  @Column(name = "end_time", nullable = false)
  private LocalTime endTime;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TeamWorkingHours() {}

  public TeamWorkingHours(
      UUID orgId, UUID teamId, DayOfWeek dayOfWeek, LocalTime startTime, LocalTime endTime) {
    this.orgId = orgId;
    this.teamId = teamId;
    this.dayOfWeek = dayOfWeek.getValue();
    this.startTime = startTime;
    this.endTime = endTime;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateHours(LocalTime startTime, LocalTime endTime) {
    this.startTime = startTime;
    this.endTime = endTime;
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

  public DayOfWeek getDayOfWeek() {
    return DayOfWeek.of(dayOfWeek);
  }

  public LocalTime getStartTime() {
    return startTime;
  }

  public LocalTime getEndTime() {
    return endTime;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
