package tw.gc.struggle.engine.services.privacy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import tw.gc.struggle.engine.entities.PurgeTask;
import tw.gc.struggle.engine.enums.AlertStatus;
import tw.gc.struggle.engine.enums.PurgeReason;
import tw.gc.struggle.engine.enums.PurgeTaskStatus;
import tw.gc.struggle.engine.repositories.BehavioralSignalEntryRepository;
import tw.gc.struggle.engine.repositories.InstructorAlertRepository;
import tw.gc.struggle.engine.repositories.InterventionRecordRepository;
import tw.gc.struggle.engine.repositories.PrivacyConsentRepository;
import tw.gc.struggle.engine.repositories.PurgeTaskRepository;
import tw.gc.struggle.engine.repositories.SessionSummaryRepository;
import tw.gc.struggle.engine.repositories.StruggleEventRepository;
import tw.gc.struggle.engine.services.ops.EngineStatusService;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Executes purge work. Each task, and each tenant's retention pass, commits atomically:
 * either every table is cleaned or nothing is.
 *
 * <p>A withdrawal only touches the data its revoked scopes govern (see {@link RevokedScopes}).
 * Raw signals and session summaries are deleted; struggle events, interventions and alerts lose
 * their learner identity but keep their aggregate values.</p>
 */
@Service
@Slf4j
public class PurgeService {

    private final BehavioralSignalEntryRepository signalRepository;
    private final SessionSummaryRepository sessionSummaryRepository;
    private final StruggleEventRepository struggleEventRepository;
    private final InterventionRecordRepository interventionRepository;
    private final InstructorAlertRepository alertRepository;
    private final PrivacyConsentRepository consentRepository;
    private final PurgeTaskRepository purgeTaskRepository;
    private final RetentionPolicyService retentionPolicyService;
    private final ConsentGate consentGate;
    private final EngineStatusService statusService;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public PurgeService(BehavioralSignalEntryRepository signalRepository,
                        SessionSummaryRepository sessionSummaryRepository,
                        StruggleEventRepository struggleEventRepository,
                        InterventionRecordRepository interventionRepository,
                        InstructorAlertRepository alertRepository,
                        PrivacyConsentRepository consentRepository,
                        PurgeTaskRepository purgeTaskRepository,
                        RetentionPolicyService retentionPolicyService,
                        ConsentGate consentGate,
                        EngineStatusService statusService,
                        Clock clock,
                        PlatformTransactionManager transactionManager) {
        this.signalRepository = signalRepository;
        this.sessionSummaryRepository = sessionSummaryRepository;
        this.struggleEventRepository = struggleEventRepository;
        this.interventionRepository = interventionRepository;
        this.alertRepository = alertRepository;
        this.consentRepository = consentRepository;
        this.purgeTaskRepository = purgeTaskRepository;
        this.retentionPolicyService = retentionPolicyService;
        this.consentGate = consentGate;
        this.statusService = statusService;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Run one queued task to completion. Throws on failure; the caller owns retry bookkeeping.
     */
    public void execute(PurgeTask task) {
        if (task.getReason() == PurgeReason.RETENTION) {
            applyRetention(task.getTenantId());
            LocalDateTime now = LocalDateTime.now(clock);
            transactionTemplate.executeWithoutResult(status -> markDone(task, now));
            return;
        }

        String tenantId = task.getTenantId();
        String userId = task.getUserId();
        if (userId == null) {
            throw new IllegalStateException("Withdrawal purge #" + task.getId() + " has no subject");
        }

        RevokedScopes revoked = RevokedScopes.decode(task.getRevokedScopes());
        PurgeCounts counts = transactionTemplate.execute(status -> {
            LocalDateTime now = LocalDateTime.now(clock);
            int signals = 0;
            int summaries = 0;
            int events = 0;
            int interventions = 0;
            int alerts = 0;
            if (revoked.coversBehavioralData()) {
                signals = signalRepository.deleteByTenantAndUser(tenantId, userId);
                summaries = sessionSummaryRepository.deleteByTenantAndUser(tenantId, userId);
                events = struggleEventRepository.anonymizeUser(tenantId, userId, now);
            }
            if (revoked.coversInterventions()) {
                interventions = interventionRepository.anonymizeUser(tenantId, userId, now);
            }
            if (revoked.coversAlerts()) {
                alertRepository.dismissOpenForStudent(tenantId, userId, AlertStatus.DISMISSED, now);
                alerts = alertRepository.anonymizeStudent(tenantId, userId, now);
            }

            boolean consentRemoved = consentRepository.findByTenantIdAndUserId(tenantId, userId)
                    .map(consent -> consent.isWithdrawn())
                    .orElse(true);
            if (consentRemoved) {
                consentRepository.deleteByTenantAndUser(tenantId, userId);
            }
            markDone(task, now);
            return new PurgeCounts(signals, summaries, events, interventions, alerts);
        });

        consentGate.invalidate(tenantId, userId);
        statusService.recordPurgeCompleted();
        log.info("🧹 Purge #{} [{}] done for tenant {}: {}", task.getId(), revoked.encode(), tenantId, counts);
    }

    /**
     * Delete or anonymize everything of one tenant older than its retention horizon.
     */
    public PurgeCounts applyRetention(String tenantId) {
        LocalDateTime cutoff = retentionPolicyService.cutoff(tenantId);
        PurgeCounts counts = transactionTemplate.execute(status -> {
            LocalDateTime now = LocalDateTime.now(clock);
            int signals = signalRepository.deleteReceivedBefore(tenantId, cutoff);
            int summaries = sessionSummaryRepository.deleteClosedBefore(tenantId, cutoff);
            int events = struggleEventRepository.anonymizeBefore(tenantId, cutoff, now);
            int interventions = interventionRepository.anonymizeBefore(tenantId, cutoff, now);
            int alerts = alertRepository.anonymizeClosedBefore(tenantId, cutoff, now);
            return new PurgeCounts(signals, summaries, events, interventions, alerts);
        });
        if (counts != null && counts.total() > 0) {
            log.info("🗓️ Retention for tenant {} (cutoff {}): {}", tenantId, cutoff, counts);
        }
        return counts;
    }

    private void markDone(PurgeTask task, LocalDateTime now) {
        task.setStatus(PurgeTaskStatus.DONE);
        task.setUserId(null);
        task.setCompletedAt(now);
        task.setLastError(null);
        purgeTaskRepository.save(task);
    }

    public record PurgeCounts(int signals, int summaries, int struggleEvents, int interventions, int alerts) {
        public int total() {
            return signals + summaries + struggleEvents + interventions + alerts;
        }
    }
}
