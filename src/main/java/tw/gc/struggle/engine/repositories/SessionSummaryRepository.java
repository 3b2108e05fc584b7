package tw.gc.struggle.engine.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.struggle.engine.entities.SessionSummary;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface SessionSummaryRepository extends JpaRepository<SessionSummary, Long> {

    Optional<SessionSummary> findBySessionId(String sessionId);

    long countByTenantIdAndUserId(String tenantId, String userId);

    @Modifying
    @Query("DELETE FROM SessionSummary s WHERE s.tenantId = :tenantId AND s.userId = :userId")
    int deleteByTenantAndUser(@Param("tenantId") String tenantId, @Param("userId") String userId);

    @Modifying
    @Query("DELETE FROM SessionSummary s WHERE s.tenantId = :tenantId AND s.closedAt < :cutoff")
    int deleteClosedBefore(@Param("tenantId") String tenantId, @Param("cutoff") LocalDateTime cutoff);
}
