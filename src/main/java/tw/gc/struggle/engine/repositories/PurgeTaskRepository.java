package tw.gc.struggle.engine.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.struggle.engine.entities.PurgeTask;
import tw.gc.struggle.engine.enums.PurgeReason;
import tw.gc.struggle.engine.enums.PurgeTaskStatus;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PurgeTaskRepository extends JpaRepository<PurgeTask, Long> {

    List<PurgeTask> findByStatusInAndNextAttemptAtLessThanEqualOrderByNextAttemptAtAsc(
            Collection<PurgeTaskStatus> statuses, LocalDateTime now);

    List<PurgeTask> findByStatusInAndSlaDeadlineBefore(Collection<PurgeTaskStatus> statuses, LocalDateTime now);

    Optional<PurgeTask> findFirstByTenantIdAndUserIdAndStatusIn(String tenantId, String userId,
                                                            Collection<PurgeTaskStatus> statuses);

    boolean existsByTenantIdAndReasonAndStatusIn(String tenantId, PurgeReason reason,
                                                 Collection<PurgeTaskStatus> statuses);

    List<PurgeTask> findByTenantIdAndUserId(String tenantId, String userId);

    long countByStatus(PurgeTaskStatus status);
}
