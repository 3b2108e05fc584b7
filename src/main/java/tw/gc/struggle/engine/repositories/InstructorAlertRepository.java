package tw.gc.struggle.engine.repositories;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.struggle.engine.entities.InstructorAlert;
import tw.gc.struggle.engine.enums.AlertSeverity;
import tw.gc.struggle.engine.enums.AlertStatus;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface InstructorAlertRepository extends JpaRepository<InstructorAlert, Long> {

    Optional<InstructorAlert> findByOpenKey(String openKey);

    long countByOpenKey(String openKey);

    long countByTenantIdAndStudentId(String tenantId, String studentId);

    @Query("SELECT a FROM InstructorAlert a WHERE " +
           "(:courseId IS NULL OR a.courseId = :courseId) AND " +
           "(:severity IS NULL OR a.severity = :severity) AND " +
           "(:status IS NULL OR a.status = :status)")
    Page<InstructorAlert> findFeed(@Param("courseId") String courseId,
                                   @Param("severity") AlertSeverity severity,
                                   @Param("status") AlertStatus status,
                                   Pageable pageable);

    @Modifying
    @Query("UPDATE InstructorAlert a SET a.status = :dismissed, a.openKey = NULL, a.updatedAt = :now " +
           "WHERE a.tenantId = :tenantId AND a.studentId = :studentId AND a.openKey IS NOT NULL")
    int dismissOpenForStudent(@Param("tenantId") String tenantId, @Param("studentId") String studentId,
                              @Param("dismissed") AlertStatus dismissed, @Param("now") LocalDateTime now);

    @Modifying
    @Query("UPDATE InstructorAlert a SET a.studentId = NULL, a.anonymizedAt = :now " +
           "WHERE a.tenantId = :tenantId AND a.studentId = :studentId")
    int anonymizeStudent(@Param("tenantId") String tenantId, @Param("studentId") String studentId,
                         @Param("now") LocalDateTime now);

    @Modifying
    @Query("UPDATE InstructorAlert a SET a.studentId = NULL, a.anonymizedAt = :now " +
           "WHERE a.tenantId = :tenantId AND a.createdAt < :cutoff AND a.studentId IS NOT NULL " +
           "AND a.openKey IS NULL")
    int anonymizeClosedBefore(@Param("tenantId") String tenantId, @Param("cutoff") LocalDateTime cutoff,
                              @Param("now") LocalDateTime now);
}
