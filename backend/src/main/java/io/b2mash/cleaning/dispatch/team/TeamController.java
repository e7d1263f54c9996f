package io.b2mash.cleaning.dispatch.team;

import io.b2mash.cleaning.dispatch.multitenancy.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TeamController {

  private final TeamService teamService;

  public TeamController(TeamService teamService) {
    this.teamService = teamService;
  }

  @PostMapping("/api/teams")
  @PreAuthorize("hasAnyRole('ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<TeamResponse> createTeam(@Valid @RequestBody CreateTeamRequest request) {
    var team = teamService.createTeam(RequestScopes.requireOrgId(), request.name());
    return ResponseEntity.created(URI.create("/api/teams/" + team.getId()))
        .body(TeamResponse.from(team));
  }

  @GetMapping("/api/teams")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<List<TeamResponse>> listTeams() {
    var teams = teamService.listTeams(RequestScopes.requireOrgId());
    return ResponseEntity.ok(teams.stream().map(TeamResponse::from).toList());
  }

  @GetMapping("/api/teams/{id}")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<TeamResponse> getTeam(@PathVariable UUID id) {
    var team = teamService.requireTeam(RequestScopes.requireOrgId(), id);
    return ResponseEntity.ok(TeamResponse.from(team));
  }

  public record CreateTeamRequest(
      @NotBlank(message = "name is required")
          @Size(max = 100, message = "name must be at most 100 characters")
          String name) {}

  public record TeamResponse(UUID id, String name, Instant createdAt) {

    public static TeamResponse from(Team team) {
      return new TeamResponse(team.getId(), team.getName(), team.getCreatedAt());
    }
  }
}
