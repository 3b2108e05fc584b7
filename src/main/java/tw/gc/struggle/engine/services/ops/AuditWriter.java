package tw.gc.struggle.engine.services.ops;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import tw.gc.struggle.engine.entities.BehavioralSignalEntry;
import tw.gc.struggle.engine.entities.SessionSummary;
import tw.gc.struggle.engine.entities.StruggleEvent;
import tw.gc.struggle.engine.enums.ConsentScope;
import tw.gc.struggle.engine.repositories.BehavioralSignalEntryRepository;
import tw.gc.struggle.engine.repositories.InterventionRecordRepository;
import tw.gc.struggle.engine.repositories.SessionSummaryRepository;
import tw.gc.struggle.engine.repositories.StruggleEventRepository;
import tw.gc.struggle.engine.services.ingest.BehavioralSignal;
import tw.gc.struggle.engine.services.privacy.ConsentGate;
import tw.gc.struggle.engine.services.privacy.RetentionPolicyService;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fire-and-forget persistence of audit and training data, off the signal hot path.
 *
 * <p>Writes are retried with bounded exponential backoff. Identifiable rows are only
 * written while the learner's consent still holds at write time, so a withdrawal that
 * races an in-flight write cannot leave a fresh identifiable row behind.</p>
 */
@Service
@Slf4j
public class AuditWriter {

    static final int MAX_ATTEMPTS = 3;
    static final int ESCALATION_FAILURE_STREAK = 10;

    private final BehavioralSignalEntryRepository signalRepository;
    private final StruggleEventRepository struggleEventRepository;
    private final SessionSummaryRepository sessionSummaryRepository;
    private final InterventionRecordRepository interventionRepository;
    private final ConsentGate consentGate;
    private final RetentionPolicyService retentionPolicyService;
    private final EngineStatusService statusService;
    private final OperatorAlertService operatorAlertService;
    private final ExecutorService persistenceExecutor;

    private final AtomicInteger failureStreak = new AtomicInteger();

    public AuditWriter(BehavioralSignalEntryRepository signalRepository,
                       StruggleEventRepository struggleEventRepository,
                       SessionSummaryRepository sessionSummaryRepository,
                       InterventionRecordRepository interventionRepository,
                       ConsentGate consentGate,
                       RetentionPolicyService retentionPolicyService,
                       EngineStatusService statusService,
                       OperatorAlertService operatorAlertService,
                       @Qualifier("persistenceExecutor") ExecutorService persistenceExecutor) {
        this.signalRepository = signalRepository;
        this.struggleEventRepository = struggleEventRepository;
        this.sessionSummaryRepository = sessionSummaryRepository;
        this.interventionRepository = interventionRepository;
        this.consentGate = consentGate;
        this.retentionPolicyService = retentionPolicyService;
        this.statusService = statusService;
        this.operatorAlertService = operatorAlertService;
        this.persistenceExecutor = persistenceExecutor;
    }

    public void recordSignal(BehavioralSignal signal) {
        submit("signal", signal.tenantId(), signal.userId(), () -> {
            LocalDateTime receivedAt = LocalDateTime.ofInstant(signal.receivedAt(), ZoneOffset.UTC);
            signalRepository.save(BehavioralSignalEntry.builder()
                    .tenantId(signal.tenantId())
                    .sessionId(signal.sessionId())
                    .userId(signal.userId())
                    .courseId(signal.courseId())
                    .signalType(signal.type())
                    .durationMs(signal.durationMs())
                    .elementContext(signal.elementContext())
                    .pageContentHash(signal.pageContentHash())
                    .correct(signal.correct())
                    .nonce(signal.nonce())
                    .origin(signal.origin())
                    .signalTimestamp(LocalDateTime.ofInstant(signal.timestamp(), ZoneOffset.UTC))
                    .receivedAt(receivedAt)
                    .purgeAt(retentionPolicyService.purgeAt(signal.tenantId(), receivedAt))
                    .build());
        });
    }

    public void recordStruggleEvent(StruggleEvent event) {
        submit("struggle event", event.getTenantId(), event.getUserId(), () -> {
            if (event.getPurgeAt() == null) {
                event.setPurgeAt(retentionPolicyService.purgeAt(event.getTenantId(), event.getComputedAt()));
            }
            struggleEventRepository.save(event);
        });
    }

    public void recordSessionSummary(SessionSummary summary) {
        submit("session summary", summary.getTenantId(), summary.getUserId(), () -> {
            summary.setPurgeAt(retentionPolicyService.purgeAt(summary.getTenantId(), summary.getClosedAt()));
            sessionSummaryRepository.findBySessionId(summary.getSessionId())
                    .ifPresent(existing -> summary.setId(existing.getId()));
            sessionSummaryRepository.save(summary);
        });
    }

    public void recordEffectiveness(String interventionId, double effectivenessScore) {
        submit("effectiveness", null, null, () ->
                interventionRepository.findById(interventionId).ifPresent(record -> {
                    if (record.getEffectivenessScore() == null) {
                        record.setEffectivenessScore(effectivenessScore);
                        interventionRepository.save(record);
                        log.debug("Effectiveness {} recorded for intervention {}", effectivenessScore, interventionId);
                    }
                }));
    }

    private void submit(String kind, String tenantId, String userId, Runnable write) {
        try {
            persistenceExecutor.execute(() -> writeWithRetry(kind, tenantId, userId, write));
        } catch (RejectedExecutionException e) {
            statusService.recordAuditWriteFailure();
            log.warn("⚠️ Audit executor rejected {} write: {}", kind, e.getMessage());
        }
    }

    void writeWithRetry(String kind, String tenantId, String userId, Runnable write) {
        if (userId != null && !consentGate.isAllowed(tenantId, userId, ConsentScope.BEHAVIORAL_TIMING)) {
            log.debug("Skipping {} write, consent no longer held", kind);
            return;
        }

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                write.run();
                failureStreak.set(0);
                return;
            } catch (DataAccessException e) {
                log.warn("⚠️ {} write attempt {}/{} failed: {}", kind, attempt, MAX_ATTEMPTS, e.getMessage());
                if (attempt < MAX_ATTEMPTS) {
                    try {
                        Thread.sleep(50L * (1L << (attempt - 1)));
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            } catch (RuntimeException e) {
                log.error("❌ {} write failed permanently: {}", kind, e.getMessage(), e);
                break;
            }
        }

        statusService.recordAuditWriteFailure();
        if (failureStreak.incrementAndGet() >= ESCALATION_FAILURE_STREAK) {
            operatorAlertService.escalate("audit-store",
                    "Audit writes failing repeatedly (" + failureStreak.get() + " in a row), last: " + kind);
        }
    }
}
