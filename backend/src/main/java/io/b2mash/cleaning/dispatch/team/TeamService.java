package io.b2mash.cleaning.dispatch.team;

import io.b2mash.cleaning.dispatch.audit.AuditEventBuilder;
import io.b2mash.cleaning.dispatch.audit.AuditService;
import io.b2mash.cleaning.dispatch.exception.ResourceConflictException;
import io.b2mash.cleaning.dispatch.exception.ResourceNotFoundException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TeamService {

  private static final Logger log = LoggerFactory.getLogger(TeamService.class);

  private final TeamRepository teamRepository;
  private final AuditService auditService;

  public TeamService(TeamRepository teamRepository, AuditService auditService) {
    this.teamRepository = teamRepository;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public List<Team> listTeams(UUID orgId) {
    return teamRepository.findByOrgIdOrderByNameAsc(orgId);
  }

  /** Returns the team if it belongs to {@code orgId}; other organizations' teams are not found. */
  @Transactional(readOnly = true)
  public Team requireTeam(UUID orgId, UUID teamId) {
    return teamRepository
        .findOneByIdAndOrgId(teamId, orgId)
        .orElseThrow(() -> new ResourceNotFoundException("Team", teamId));
  }

  @Transactional
  public Team createTeam(UUID orgId, String name) {
    String trimmed = name.trim();
    if (teamRepository.existsByOrgIdAndName(orgId, trimmed)) {
      throw ResourceConflictException.duplicateTeamName(trimmed);
    }

    Team team;
    try {
      team = teamRepository.saveAndFlush(new Team(orgId, trimmed));
    } catch (DataIntegrityViolationException ex) {
      throw ResourceConflictException.duplicateTeamName(trimmed);
    }

    log.info("Created team: id={}, name={}", team.getId(), team.getName());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("team.created")
            .entityType("team")
            .entityId(team.getId())
            .orgId(orgId)
            .details(Map.of("name", team.getName()))
            .build());

    return team;
  }
}
