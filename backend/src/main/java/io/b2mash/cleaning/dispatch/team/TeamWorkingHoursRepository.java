package io.b2mash.cleaning.dispatch.team;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TeamWorkingHoursRepository extends JpaRepository<TeamWorkingHours, UUID> {

  Optional<TeamWorkingHours> findByOrgIdAndTeamIdAndDayOfWeek(
      UUID orgId, UUID teamId, int dayOfWeek);

  List<TeamWorkingHours> findByOrgIdAndTeamIdOrderByDayOfWeekAsc(UUID orgId, UUID teamId);
}
