package tw.gc.struggle.engine.services.privacy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import tw.gc.struggle.engine.config.EngineProperties;
import tw.gc.struggle.engine.entities.PurgeTask;
import tw.gc.struggle.engine.entities.TenantRetentionPolicy;
import tw.gc.struggle.engine.enums.PurgeTaskStatus;
import tw.gc.struggle.engine.repositories.BehavioralSignalEntryRepository;
import tw.gc.struggle.engine.repositories.PurgeTaskRepository;
import tw.gc.struggle.engine.repositories.StruggleEventRepository;
import tw.gc.struggle.engine.repositories.TenantRetentionPolicyRepository;
import tw.gc.struggle.engine.services.ops.EngineStatusService;
import tw.gc.struggle.engine.services.ops.OperatorAlertService;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Retention / Purge Scheduler
 *
 * - Drains due purge tasks; failures retry with exponential backoff
 * - After max attempts a task is escalated to the operator
 * - Unfinished tasks past their SLA deadline are escalated once
 * - Periodic retention sweep, isolated per tenant
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetentionScheduler {

    private final PurgeTaskRepository purgeTaskRepository;
    private final TenantRetentionPolicyRepository policyRepository;
    private final BehavioralSignalEntryRepository signalRepository;
    private final StruggleEventRepository struggleEventRepository;
    private final PurgeService purgeService;
    private final PurgeTaskQueue purgeTaskQueue;
    private final RetentionPolicyService retentionPolicyService;
    private final OperatorAlertService operatorAlertService;
    private final EngineStatusService statusService;
    private final EngineProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${engine.retention.sweep-fixed-delay-ms:60000}")
    public void sweep() {
        try {
            processDueTasks();
            checkSla();
        } catch (Exception e) {
            log.error("❌ Purge sweep failed", e);
        }
    }

    /**
     * @return number of tasks completed in this pass
     */
    public int processDueTasks() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<PurgeTask> due = purgeTaskRepository
                .findByStatusInAndNextAttemptAtLessThanEqualOrderByNextAttemptAtAsc(PurgeTaskQueue.UNFINISHED, now);
        int completed = 0;
        for (PurgeTask task : due) {
            try {
                purgeService.execute(task);
                completed++;
            } catch (RuntimeException e) {
                recordFailure(task, e);
            }
        }
        return completed;
    }

    void recordFailure(PurgeTask task, RuntimeException error) {
        EngineProperties.Retention config = properties.getRetention();
        LocalDateTime now = LocalDateTime.now(clock);
        int attempts = task.getAttempts() + 1;
        task.setAttempts(attempts);
        task.setLastError(truncate(error.getMessage()));

        if (attempts >= config.getMaxAttempts()) {
            task.setStatus(PurgeTaskStatus.ESCALATED);
            task.setEscalatedAt(now);
            purgeTaskRepository.save(task);
            statusService.recordPurgeEscalated();
            log.error("🚨 Purge #{} for tenant {} failed {} times, escalating: {}",
                    task.getId(), task.getTenantId(), attempts, error.getMessage());
            operatorAlertService.escalate("purge-" + task.getId(),
                    "Purge task #" + task.getId() + " (" + task.getReason() + ", tenant " + task.getTenantId()
                            + ") failed " + attempts + " times: " + error.getMessage());
            return;
        }

        long delaySeconds = config.getBackoffBaseSeconds() * (1L << (attempts - 1));
        task.setStatus(PurgeTaskStatus.FAILED);
        task.setNextAttemptAt(now.plusSeconds(delaySeconds));
        purgeTaskRepository.save(task);
        log.warn("⚠️ Purge #{} attempt {} failed, retrying in {}s: {}", task.getId(), attempts, delaySeconds, error.getMessage());
    }

    /**
     * @return number of tasks newly escalated for an SLA breach
     */
    public int checkSla() {
        LocalDateTime now = LocalDateTime.now(clock);
        int escalated = 0;
        for (PurgeTask task : purgeTaskRepository.findByStatusInAndSlaDeadlineBefore(PurgeTaskQueue.UNFINISHED, now)) {
            if (task.getEscalatedAt() != null) {
                continue;
            }
            task.setEscalatedAt(now);
            purgeTaskRepository.save(task);
            statusService.recordPurgeEscalated();
            escalated++;
            log.error("🚨 Purge #{} for tenant {} missed its SLA deadline {}", task.getId(), task.getTenantId(), task.getSlaDeadline());
            operatorAlertService.escalate("purge-sla-" + task.getId(),
                    "Purge task #" + task.getId() + " (tenant " + task.getTenantId() + ") missed SLA deadline "
                            + task.getSlaDeadline());
        }
        return escalated;
    }

    @Scheduled(cron = "${engine.retention.retention-cron:0 0 * * * *}")
    public void scheduledRetention() {
        try {
            runRetention();
        } catch (Exception e) {
            log.error("❌ Retention sweep failed", e);
        }
    }

    /**
     * @return number of tenants that failed and were queued for retry
     */
    public int runRetention() {
        retentionPolicyService.refresh();
        Set<String> tenants = new TreeSet<>();
        policyRepository.findAll().stream().map(TenantRetentionPolicy::getTenantId).forEach(tenants::add);
        tenants.addAll(signalRepository.findDistinctTenantIds());
        tenants.addAll(struggleEventRepository.findDistinctTenantIds());

        int failed = 0;
        for (String tenantId : tenants) {
            try {
                purgeService.applyRetention(tenantId);
            } catch (RuntimeException e) {
                failed++;
                log.error("❌ Retention failed for tenant {}: {}", tenantId, e.getMessage());
                try {
                    purgeTaskQueue.enqueueRetention(tenantId, truncate(e.getMessage()));
                } catch (RuntimeException queueError) {
                    log.error("❌ Could not queue retention retry for tenant {}: {}", tenantId, queueError.getMessage());
                }
            }
        }
        log.info("🗓️ Retention sweep over {} tenants done ({} failed)", tenants.size(), failed);
        return failed;
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= 500 ? message : message.substring(0, 500);
    }
}
