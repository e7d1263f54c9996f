package io.b2mash.cleaning.dispatch.team;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TeamBlackoutRepository extends JpaRepository<TeamBlackout, UUID> {

  @Query(
      """
      SELECT b FROM TeamBlackout b
      WHERE b.id = :id AND b.orgId = :orgId AND b.teamId = :teamId
      """)
  Optional<TeamBlackout> findOneByIdAndTeam(
      @Param("id") UUID id, @Param("orgId") UUID orgId, @Param("teamId") UUID teamId);

  /** Blackouts of the team that overlap {@code [from, to)}, ordered by start. */
  @Query(
      """
      SELECT b FROM TeamBlackout b
      WHERE b.orgId = :orgId
        AND b.teamId = :teamId
        AND b.startsAt < :to
        AND b.endsAt > :from
      ORDER BY b.startsAt
      """)
  List<TeamBlackout> findOverlapping(
      @Param("orgId") UUID orgId,
      @Param("teamId") UUID teamId,
      @Param("from") Instant from,
      @Param("to") Instant to);
}
