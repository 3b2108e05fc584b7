package tw.gc.struggle.engine.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.struggle.engine.entities.StruggleEvent;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface StruggleEventRepository extends JpaRepository<StruggleEvent, Long> {

    Optional<StruggleEvent> findByAssessmentId(String assessmentId);

    long countByTenantIdAndUserId(String tenantId, String userId);

    List<StruggleEvent> findByTenantIdAndCourseIdAndComputedAtGreaterThanEqual(
            String tenantId, String courseId, LocalDateTime since);

    /**
     * Courses with any struggle activity in the window, as {@code [tenantId, courseId]} pairs.
     */
    @Query("SELECT DISTINCT e.tenantId, e.courseId FROM StruggleEvent e " +
           "WHERE e.computedAt >= :since AND e.courseId IS NOT NULL")
    List<Object[]> findActiveCourses(@Param("since") LocalDateTime since);

    @Query("SELECT DISTINCT e.tenantId FROM StruggleEvent e")
    List<String> findDistinctTenantIds();

    @Modifying
    @Query("UPDATE StruggleEvent e SET e.userId = NULL, e.anonymizedAt = :now " +
           "WHERE e.tenantId = :tenantId AND e.userId = :userId")
    int anonymizeUser(@Param("tenantId") String tenantId, @Param("userId") String userId,
                      @Param("now") LocalDateTime now);

    @Modifying
    @Query("UPDATE StruggleEvent e SET e.userId = NULL, e.anonymizedAt = :now " +
           "WHERE e.tenantId = :tenantId AND e.computedAt < :cutoff AND e.userId IS NOT NULL")
    int anonymizeBefore(@Param("tenantId") String tenantId, @Param("cutoff") LocalDateTime cutoff,
                        @Param("now") LocalDateTime now);
}
