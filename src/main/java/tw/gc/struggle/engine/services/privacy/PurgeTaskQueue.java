package tw.gc.struggle.engine.services.privacy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.struggle.engine.config.EngineProperties;
import tw.gc.struggle.engine.entities.PurgeTask;
import tw.gc.struggle.engine.enums.PurgeReason;
import tw.gc.struggle.engine.enums.PurgeTaskStatus;
import tw.gc.struggle.engine.repositories.PurgeTaskRepository;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.Optional;
import java.util.Set;

/**
 * Enqueues durable purge work. Duplicate requests for a subject that already has an
 * unfinished task are folded into the existing one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PurgeTaskQueue {

    static final Set<PurgeTaskStatus> UNFINISHED = EnumSet.of(PurgeTaskStatus.PENDING, PurgeTaskStatus.FAILED);

    private final PurgeTaskRepository purgeTaskRepository;
    private final EngineProperties properties;
    private final Clock clock;

    public Optional<PurgeTask> enqueueWithdrawal(String tenantId, String userId) {
        return enqueueWithdrawal(tenantId, userId, RevokedScopes.full());
    }

    /**
     * Queue a purge of the data governed by {@code revoked}. A pending task for the same subject
     * absorbs the new scopes instead of a second task being created.
     */
    public Optional<PurgeTask> enqueueWithdrawal(String tenantId, String userId, RevokedScopes revoked) {
        if (!revoked.purgesAnything()) {
            log.debug("Revoked scopes {} govern no stored data for tenant {}", revoked.encode(), tenantId);
            return Optional.empty();
        }
        Optional<PurgeTask> unfinished = purgeTaskRepository
                .findFirstByTenantIdAndUserIdAndStatusIn(tenantId, userId, UNFINISHED);
        if (unfinished.isPresent()) {
            PurgeTask existing = unfinished.get();
            RevokedScopes merged = RevokedScopes.decode(existing.getRevokedScopes()).plus(revoked);
            if (!merged.encode().equals(existing.getRevokedScopes())) {
                existing.setRevokedScopes(merged.encode());
                purgeTaskRepository.save(existing);
            }
            log.debug("Withdrawal purge already queued for tenant {}", tenantId);
            return Optional.empty();
        }
        PurgeTask task = newTask(tenantId, userId, PurgeReason.CONSENT_WITHDRAWAL);
        task.setRevokedScopes(revoked.encode());
        task = purgeTaskRepository.save(task);
        log.info("🧹 Withdrawal purge #{} [{}] queued for tenant {} (SLA {})",
                task.getId(), task.getRevokedScopes(), tenantId, task.getSlaDeadline());
        return Optional.of(task);
    }

    public Optional<PurgeTask> enqueueRetention(String tenantId, String lastError) {
        if (purgeTaskRepository.existsByTenantIdAndReasonAndStatusIn(tenantId, PurgeReason.RETENTION, UNFINISHED)) {
            return Optional.empty();
        }
        PurgeTask task = newTask(tenantId, null, PurgeReason.RETENTION);
        task.setLastError(lastError);
        task = purgeTaskRepository.save(task);
        log.info("🧹 Retention retry task #{} queued for tenant {}", task.getId(), tenantId);
        return Optional.of(task);
    }

    private PurgeTask newTask(String tenantId, String userId, PurgeReason reason) {
        LocalDateTime now = LocalDateTime.now(clock);
        return PurgeTask.builder()
                .tenantId(tenantId)
                .userId(userId)
                .subjectHash(userId == null ? null : subjectHash(tenantId, userId))
                .reason(reason)
                .status(PurgeTaskStatus.PENDING)
                .attempts(0)
                .nextAttemptAt(now)
                .slaDeadline(now.plusHours(properties.getRetention().getPurgeSlaHours()))
                .createdAt(now)
                .build();
    }

    String subjectHash(String tenantId, String userId) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            String material = properties.getRetention().getAnonymizationSalt() + "|" + tenantId + "|" + userId;
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
