package tw.gc.struggle.engine.services.ops;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.stereotype.Service;
import tw.gc.struggle.engine.enums.RejectionReason;
import tw.gc.struggle.engine.enums.SuppressionReason;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free engine counters, read by the status endpoint.
 */
@Service
public class EngineStatusService {

    private final AtomicLong signalsAccepted = new AtomicLong();
    private final AtomicLong signalsDropped = new AtomicLong();
    private final Map<RejectionReason, AtomicLong> rejections = new EnumMap<>(RejectionReason.class);
    private final AtomicLong consentStoreFailures = new AtomicLong();
    private final AtomicLong signalsProcessed = new AtomicLong();
    private final AtomicLong assessments = new AtomicLong();
    private final AtomicLong modelErrors = new AtomicLong();
    private final AtomicLong budgetExceeded = new AtomicLong();
    private final AtomicLong interventionsTriggered = new AtomicLong();
    private final Map<SuppressionReason, AtomicLong> suppressions = new EnumMap<>(SuppressionReason.class);
    private final AtomicLong sessionsOpened = new AtomicLong();
    private final AtomicLong sessionsClosed = new AtomicLong();
    private final AtomicLong alertsUpserted = new AtomicLong();
    private final AtomicLong auditWriteFailures = new AtomicLong();
    private final AtomicLong purgesCompleted = new AtomicLong();
    private final AtomicLong purgesEscalated = new AtomicLong();

    public EngineStatusService() {
        for (RejectionReason reason : RejectionReason.values()) {
            rejections.put(reason, new AtomicLong());
        }
        for (SuppressionReason reason : SuppressionReason.values()) {
            suppressions.put(reason, new AtomicLong());
        }
    }

    public void recordAccepted() {
        signalsAccepted.incrementAndGet();
    }

    public void recordDropped() {
        signalsDropped.incrementAndGet();
    }

    public void recordRejected(RejectionReason reason) {
        rejections.get(reason).incrementAndGet();
    }

    public void recordConsentStoreFailure() {
        consentStoreFailures.incrementAndGet();
    }

    public void recordSignalProcessed() {
        signalsProcessed.incrementAndGet();
    }

    public void recordAssessment() {
        assessments.incrementAndGet();
    }

    public void recordModelError() {
        modelErrors.incrementAndGet();
    }

    public void recordBudgetExceeded() {
        budgetExceeded.incrementAndGet();
    }

    public void recordIntervention() {
        interventionsTriggered.incrementAndGet();
    }

    public void recordSuppression(SuppressionReason reason) {
        suppressions.get(reason).incrementAndGet();
    }

    public void recordSessionOpened() {
        sessionsOpened.incrementAndGet();
    }

    public void recordSessionClosed() {
        sessionsClosed.incrementAndGet();
    }

    public void recordAlertUpserted() {
        alertsUpserted.incrementAndGet();
    }

    public void recordAuditWriteFailure() {
        auditWriteFailures.incrementAndGet();
    }

    public void recordPurgeCompleted() {
        purgesCompleted.incrementAndGet();
    }

    public void recordPurgeEscalated() {
        purgesEscalated.incrementAndGet();
    }

    public long getBudgetExceeded() {
        return budgetExceeded.get();
    }

    public long getSuppressions(SuppressionReason reason) {
        return suppressions.get(reason).get();
    }

    public long getRejections(RejectionReason reason) {
        return rejections.get(reason).get();
    }

    public StatusSnapshot snapshot(int activeSessions) {
        Map<String, Long> rejected = new LinkedHashMap<>();
        rejections.forEach((reason, count) -> rejected.put(reason.name(), count.get()));
        Map<String, Long> suppressed = new LinkedHashMap<>();
        suppressions.forEach((reason, count) -> suppressed.put(reason.name(), count.get()));

        return new StatusSnapshot(
                activeSessions,
                sessionsOpened.get(),
                sessionsClosed.get(),
                signalsAccepted.get(),
                signalsDropped.get(),
                rejected,
                signalsProcessed.get(),
                assessments.get(),
                modelErrors.get(),
                budgetExceeded.get(),
                interventionsTriggered.get(),
                suppressed,
                alertsUpserted.get(),
                consentStoreFailures.get(),
                auditWriteFailures.get(),
                purgesCompleted.get(),
                purgesEscalated.get()
        );
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StatusSnapshot {
        private int activeSessions;
        private long sessionsOpened;
        private long sessionsClosed;
        private long signalsAccepted;
        private long signalsDropped;
        private Map<String, Long> signalsRejected;
        private long signalsProcessed;
        private long assessments;
        private long modelErrors;
        private long budgetExceeded;
        private long interventionsTriggered;
        private Map<String, Long> suppressions;
        private long alertsUpserted;
        private long consentStoreFailures;
        private long auditWriteFailures;
        private long purgesCompleted;
        private long purgesEscalated;
    }
}
