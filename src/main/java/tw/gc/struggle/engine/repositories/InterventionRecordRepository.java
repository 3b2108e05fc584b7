package tw.gc.struggle.engine.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.struggle.engine.entities.InterventionRecord;
import tw.gc.struggle.engine.enums.InterventionStatus;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface InterventionRecordRepository extends JpaRepository<InterventionRecord, String> {

    List<InterventionRecord> findByTenantIdAndUserIdAndTriggeredAtAfterOrderByTriggeredAtAsc(
            String tenantId, String userId, LocalDateTime since);

    List<InterventionRecord> findByTenantIdAndCourseIdAndTriggeredAtGreaterThanEqual(
            String tenantId, String courseId, LocalDateTime since);

    List<InterventionRecord> findByStatusAndDeliveredAtBefore(InterventionStatus status, LocalDateTime cutoff);

    /**
     * Interventions of a session still waiting for an effectiveness measurement.
     */
    @Query("SELECT i FROM InterventionRecord i WHERE i.sessionId = :sessionId " +
           "AND i.effectivenessScore IS NULL AND i.engagementBefore IS NOT NULL " +
           "AND i.deliveredAt IS NOT NULL AND i.deliveredAt >= :since")
    List<InterventionRecord> findAwaitingEffectiveness(@Param("sessionId") String sessionId,
                                                       @Param("since") LocalDateTime since);

    long countByTenantIdAndUserId(String tenantId, String userId);

    @Modifying
    @Query("UPDATE InterventionRecord i SET i.userId = NULL, i.anonymizedAt = :now " +
           "WHERE i.tenantId = :tenantId AND i.userId = :userId")
    int anonymizeUser(@Param("tenantId") String tenantId, @Param("userId") String userId,
                      @Param("now") LocalDateTime now);

    @Modifying
    @Query("UPDATE InterventionRecord i SET i.userId = NULL, i.anonymizedAt = :now " +
           "WHERE i.tenantId = :tenantId AND i.triggeredAt < :cutoff AND i.userId IS NOT NULL")
    int anonymizeBefore(@Param("tenantId") String tenantId, @Param("cutoff") LocalDateTime cutoff,
                        @Param("now") LocalDateTime now);
}
