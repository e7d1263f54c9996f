package io.b2mash.cleaning.dispatch.booking;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BookingRepository extends JpaRepository<Booking, UUID> {

  @Query("SELECT b FROM Booking b WHERE b.id = :id AND b.orgId = :orgId")
  Optional<Booking> findOneByIdAndOrgId(@Param("id") UUID id, @Param("orgId") UUID orgId);

  /**
   * Candidate bookings for an overlap check: every booking of the team in the given statuses whose
   * start lies strictly inside {@code (lookbackStart, rangeEnd)}. The caller filters the result with
   * the exact half-open overlap rule; {@code lookbackStart} must be at least the maximum booking
   * duration before the candidate start.
   */
  @Query(
      """
      SELECT b FROM Booking b
      WHERE b.orgId = :orgId
        AND b.teamId = :teamId
        AND b.status IN :statuses
        AND b.startsAt < :rangeEnd
        AND b.startsAt > :lookbackStart
      ORDER BY b.startsAt
      """)
  List<Booking> findOverlapCandidates(
      @Param("orgId") UUID orgId,
      @Param("teamId") UUID teamId,
      @Param("statuses") Collection<BookingStatus> statuses,
      @Param("lookbackStart") Instant lookbackStart,
      @Param("rangeEnd") Instant rangeEnd);

  @Query(
      """
      SELECT b FROM Booking b
      WHERE b.orgId = :orgId
        AND b.teamId = :teamId
        AND b.startsAt >= :from
        AND b.startsAt < :to
      ORDER BY b.startsAt
      """)
  List<Booking> findByTeamInWindow(
      @Param("orgId") UUID orgId,
      @Param("teamId") UUID teamId,
      @Param("from") Instant from,
      @Param("to") Instant to);

  long countByOrgIdAndTeamId(UUID orgId, UUID teamId);
}
