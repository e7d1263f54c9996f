package io.b2mash.cleaning.dispatch.team;

import io.b2mash.cleaning.dispatch.multitenancy.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TeamScheduleController {

  private final TeamScheduleService scheduleService;

  public TeamScheduleController(TeamScheduleService scheduleService) {
    this.scheduleService = scheduleService;
  }

  @GetMapping("/api/teams/{teamId}/working-hours")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<List<WorkingHoursResponse>> listWorkingHours(@PathVariable UUID teamId) {
    var hours = scheduleService.listWorkingHours(RequestScopes.requireOrgId(), teamId);
    return ResponseEntity.ok(hours.stream().map(WorkingHoursResponse::from).toList());
  }

  @PutMapping("/api/teams/{teamId}/working-hours/{dayOfWeek}")
  @PreAuthorize("hasAnyRole('ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<WorkingHoursResponse> setWorkingHours(
      @PathVariable UUID teamId,
      @PathVariable DayOfWeek dayOfWeek,
      @Valid @RequestBody WorkingHoursRequest request) {
    var hours =
        scheduleService.setWorkingHours(
            RequestScopes.requireOrgId(),
            teamId,
            dayOfWeek,
            request.startTime(),
            request.endTime());
    return ResponseEntity.ok(WorkingHoursResponse.from(hours));
  }

  @DeleteMapping("/api/teams/{teamId}/working-hours/{dayOfWeek}")
  @PreAuthorize("hasAnyRole('ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<Void> clearWorkingHours(
      @PathVariable UUID teamId, @PathVariable DayOfWeek dayOfWeek) {
    scheduleService.clearWorkingHours(RequestScopes.requireOrgId(), teamId, dayOfWeek);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/api/teams/{teamId}/blackouts")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<List<BlackoutResponse>> listBlackouts(
      @PathVariable UUID teamId, @RequestParam Instant from, @RequestParam Instant to) {
    var blackouts =
        scheduleService.listBlackouts(RequestScopes.requireOrgId(), teamId, from, to);
    return ResponseEntity.ok(blackouts.stream().map(BlackoutResponse::from).toList());
  }

  @PostMapping("/api/teams/{teamId}/blackouts")
  @PreAuthorize("hasAnyRole('ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<BlackoutResponse> createBlackout(
      @PathVariable UUID teamId, @Valid @RequestBody CreateBlackoutRequest request) {
    var blackout =
        scheduleService.createBlackout(
            RequestScopes.requireOrgId(),
            teamId,
            request.startsAt(),
            request.endsAt(),
            request.reason());
    return ResponseEntity.created(
            URI.create("/api/teams/" + teamId + "/blackouts/" + blackout.getId()))
        .body(BlackoutResponse.from(blackout));
  }

  @DeleteMapping("/api/teams/{teamId}/blackouts/{blackoutId}")
  @PreAuthorize("hasAnyRole('ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<Void> deleteBlackout(
      @PathVariable UUID teamId, @PathVariable UUID blackoutId) {
    scheduleService.deleteBlackout(RequestScopes.requireOrgId(), teamId, blackoutId);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record WorkingHoursRequest(
      @NotNull(message = "startTime is required") LocalTime startTime,
      @NotNull(message = "endTime is required") LocalTime endTime) {}

  public record WorkingHoursResponse(
      UUID teamId, DayOfWeek dayOfWeek, LocalTime startTime, LocalTime endTime) {

    public static WorkingHoursResponse from(TeamWorkingHours hours) {
      return new WorkingHoursResponse(
          hours.getTeamId(), hours.getDayOfWeek(), hours.getStartTime(), hours.getEndTime());
    }
  }

  public record CreateBlackoutRequest(
      @NotNull(message = "startsAt is required") Instant startsAt,
      @NotNull(message = "endsAt is required") Instant endsAt,
      @Size(max = 255, message = "reason must be at most 255 characters") String reason) {}

  public record BlackoutResponse(
      UUID id, UUID teamId, Instant startsAt, Instant endsAt, String reason) {

    public static BlackoutResponse from(TeamBlackout blackout) {
      return new BlackoutResponse(
          blackout.getId(),
          blackout.getTeamId(),
          blackout.getStartsAt(),
          blackout.getEndsAt(),
          blackout.getReason());
    }
  }
}
