package io.b2mash.cleaning.dispatch.team;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TeamRepository extends JpaRepository<Team, UUID> {

  @Query("SELECT t FROM Team t WHERE t.id = :id AND t.orgId = :orgId")
  Optional<Team> findOneByIdAndOrgId(@Param("id") UUID id, @Param("orgId") UUID orgId);

  /** Team row lock used to serialize booking writes per team. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM Team t WHERE t.id = :id AND t.orgId = :orgId")
  Optional<Team> findByIdAndOrgIdForUpdate(@Param("id") UUID id, @Param("orgId") UUID orgId);

  List<Team> findByOrgIdOrderByNameAsc(UUID orgId);

  boolean existsByOrgIdAndName(UUID orgId, String name);
}
