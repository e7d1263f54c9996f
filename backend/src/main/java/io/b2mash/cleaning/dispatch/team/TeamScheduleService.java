package io.b2mash.cleaning.dispatch.team;

import io.b2mash.cleaning.dispatch.audit.AuditEventBuilder;
import io.b2mash.cleaning.dispatch.audit.AuditService;
import io.b2mash.cleaning.dispatch.exception.InvalidStateException;
import io.b2mash.cleaning.dispatch.exception.ResourceNotFoundException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Working hours and blackouts of a team. Both only shape slot suggestions; they never reject a
 * booking write.
 */
@Service
public class TeamScheduleService {

  private static final Logger log = LoggerFactory.getLogger(TeamScheduleService.class);

  private final TeamService teamService;
  private final TeamWorkingHoursRepository workingHoursRepository;
  private final TeamBlackoutRepository blackoutRepository;
  private final AuditService auditService;

  public TeamScheduleService(
      TeamService teamService,
      TeamWorkingHoursRepository workingHoursRepository,
      TeamBlackoutRepository blackoutRepository,
      AuditService auditService) {
    this.teamService = teamService;
    this.workingHoursRepository = workingHoursRepository;
    this.blackoutRepository = blackoutRepository;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public List<TeamWorkingHours> listWorkingHours(UUID orgId, UUID teamId) {
    teamService.requireTeam(orgId, teamId);
    return workingHoursRepository.findByOrgIdAndTeamIdOrderByDayOfWeekAsc(orgId, teamId);
  }

  /** Working hours of the team for {@code day}, if they differ from the default working day. */
  @Transactional(readOnly = true)
  public Optional<TeamWorkingHours> findWorkingHours(UUID orgId, UUID teamId, DayOfWeek day) {
    return workingHoursRepository.findByOrgIdAndTeamIdAndDayOfWeek(orgId, teamId, day.getValue());
  }

  /** Creates or replaces the team's hours for {@code day}. */
  @Transactional
  public TeamWorkingHours setWorkingHours(
      UUID orgId, UUID teamId, DayOfWeek day, LocalTime startTime, LocalTime endTime) {
    if (!endTime.isAfter(startTime)) {
      throw new InvalidStateException(
          "Invalid working hours", "endTime must be after startTime on the same day");
    }
    teamService.requireTeam(orgId, teamId);

    var hours =
        workingHoursRepository
            .findByOrgIdAndTeamIdAndDayOfWeek(orgId, teamId, day.getValue())
            .map(
                existing -> {
                  existing.updateHours(startTime, endTime);
                  return existing;
                })
            .orElseGet(() -> new TeamWorkingHours(orgId, teamId, day, startTime, endTime));
    hours = workingHoursRepository.save(hours);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("team.working_hours_updated")
            .entityType("team")
            .entityId(teamId)
            .orgId(orgId)
            .details(
                Map.of(
                    "day_of_week", day.name(),
                    "start_time", startTime.toString(),
                    "end_time", endTime.toString()))
            .build());
    log.info("Set working hours: team={}, day={}, {}-{}", teamId, day, startTime, endTime);
    return hours;
  }

  /** Returns {@code day} to the default working day. No-op if the team had no own hours. */
  @Transactional
  public void clearWorkingHours(UUID orgId, UUID teamId, DayOfWeek day) {
    teamService.requireTeam(orgId, teamId);
    workingHoursRepository
        .findByOrgIdAndTeamIdAndDayOfWeek(orgId, teamId, day.getValue())
        .ifPresent(
            hours -> {
              workingHoursRepository.delete(hours);
              auditService.log(
                  AuditEventBuilder.builder()
                      .eventType("team.working_hours_cleared")
                      .entityType("team")
                      .entityId(teamId)
                      .orgId(orgId)
                      .details(Map.of("day_of_week", day.name()))
                      .build());
              log.info("Cleared working hours: team={}, day={}", teamId, day);
            });
  }

  @Transactional(readOnly = true)
  public List<TeamBlackout> listBlackouts(UUID orgId, UUID teamId, Instant from, Instant to) {
    requireOrderedWindow(from, to, "'to' must be after 'from'");
    teamService.requireTeam(orgId, teamId);
    return blackoutRepository.findOverlapping(orgId, teamId, from, to);
  }

  /** Blackouts overlapping {@code [from, to)}, without the team check. For slot search. */
  @Transactional(readOnly = true)
  public List<TeamBlackout> findBlackouts(UUID orgId, UUID teamId, Instant from, Instant to) {
    return blackoutRepository.findOverlapping(orgId, teamId, from, to);
  }

  @Transactional
  public TeamBlackout createBlackout(
      UUID orgId, UUID teamId, Instant startsAt, Instant endsAt, String reason) {
    requireOrderedWindow(startsAt, endsAt, "endsAt must be after startsAt");
    teamService.requireTeam(orgId, teamId);

    var blackout =
        blackoutRepository.save(new TeamBlackout(orgId, teamId, startsAt, endsAt, reason));

    var details = new HashMap<String, Object>();
    details.put("team_id", teamId.toString());
    details.put("starts_at", startsAt.toString());
    details.put("ends_at", endsAt.toString());
    if (reason != null) {
      details.put("reason", reason);
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("team.blackout_created")
            .entityType("team_blackout")
            .entityId(blackout.getId())
            .orgId(orgId)
            .details(details)
            .build());
    log.info(
        "Created blackout: id={}, team={}, [{}, {})", blackout.getId(), teamId, startsAt, endsAt);
    return blackout;
  }

  @Transactional
  public void deleteBlackout(UUID orgId, UUID teamId, UUID blackoutId) {
    var blackout =
        blackoutRepository
            .findOneByIdAndTeam(blackoutId, orgId, teamId)
            .orElseThrow(() -> new ResourceNotFoundException("Blackout", blackoutId));
    blackoutRepository.delete(blackout);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("team.blackout_deleted")
            .entityType("team_blackout")
            .entityId(blackoutId)
            .orgId(orgId)
            .details(Map.of("team_id", teamId.toString()))
            .build());
    log.info("Deleted blackout: id={}, team={}", blackoutId, teamId);
  }

  private static void requireOrderedWindow(Instant start, Instant end, String detail) {
    if (!end.isAfter(start)) {
      throw InvalidStateException.invalidRange(detail);
    }
  }
}
