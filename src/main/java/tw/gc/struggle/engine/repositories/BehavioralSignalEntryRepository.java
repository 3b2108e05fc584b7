package tw.gc.struggle.engine.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.struggle.engine.entities.BehavioralSignalEntry;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface BehavioralSignalEntryRepository extends JpaRepository<BehavioralSignalEntry, Long> {

    List<BehavioralSignalEntry> findBySessionIdOrderBySignalTimestampAsc(String sessionId);

    long countByTenantIdAndUserId(String tenantId, String userId);

    long countBySessionId(String sessionId);

    @Query("SELECT DISTINCT s.tenantId FROM BehavioralSignalEntry s")
    List<String> findDistinctTenantIds();

    @Modifying
    @Query("DELETE FROM BehavioralSignalEntry s WHERE s.tenantId = :tenantId AND s.userId = :userId")
    int deleteByTenantAndUser(@Param("tenantId") String tenantId, @Param("userId") String userId);

    @Modifying
    @Query("DELETE FROM BehavioralSignalEntry s WHERE s.tenantId = :tenantId AND s.receivedAt < :cutoff")
    int deleteReceivedBefore(@Param("tenantId") String tenantId, @Param("cutoff") LocalDateTime cutoff);
}
