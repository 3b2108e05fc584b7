package tw.gc.struggle.engine.services.session;

import tw.gc.struggle.engine.services.ingest.BehavioralSignal;
import tw.gc.struggle.engine.services.scoring.StruggleAssessment;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Mutable state of one session. Only ever touched from its actor's mailbox drain, so it
 * needs no locking.
 */
public class SessionState {

    private final String sessionId;
    private final String tenantId;
    private final String userId;
    private final String courseId;
    private final Instant startedAt;

    private final Deque<BehavioralSignal> window = new ArrayDeque<>();
    private final List<PendingEffectiveness> pendingEffectiveness = new ArrayList<>();

    private Instant lastSignalAt;
    private long signalCount;
    private SessionFeatures features = SessionFeatures.EMPTY;
    private StruggleAssessment lastAssessment;
    private int assessmentCount;
    private String lastPersistedBand;
    private BehavioralSignal lastSignal;

    public SessionState(String sessionId, String tenantId, String userId, String courseId, Instant startedAt) {
        this.sessionId = sessionId;
        this.tenantId = tenantId;
        this.userId = userId;
        this.courseId = courseId;
        this.startedAt = startedAt;
        this.lastSignalAt = startedAt;
    }

    public static SessionState open(BehavioralSignal first) {
        return new SessionState(first.sessionId(), first.tenantId(), first.userId(), first.courseId(), first.receivedAt());
    }

    /**
     * Append in arrival order and evict what falls outside the window by age or count.
     */
    public void append(BehavioralSignal signal, Duration windowSpan, int maxSignals) {
        window.addLast(signal);
        signalCount++;
        lastSignal = signal;
        lastSignalAt = signal.receivedAt();

        Instant horizon = signal.receivedAt().minus(windowSpan);
        while (!window.isEmpty() && window.peekFirst().receivedAt().isBefore(horizon)) {
            window.pollFirst();
        }
        while (window.size() > maxSignals) {
            window.pollFirst();
        }
        for (PendingEffectiveness pending : pendingEffectiveness) {
            pending.signalsSince++;
        }
    }

    public boolean isReadyForScoring(int minSamples, Duration minElapsed) {
        return signalCount >= minSamples
                || !lastSignalAt.isBefore(startedAt.plus(minElapsed));
    }

    public void recordAssessment(StruggleAssessment assessment) {
        lastAssessment = assessment;
        assessmentCount++;
    }

    public void awaitEffectiveness(String interventionId, double engagementBefore, Instant triggeredAt) {
        pendingEffectiveness.add(new PendingEffectiveness(interventionId, engagementBefore, triggeredAt));
    }

    public Collection<BehavioralSignal> window() {
        return Collections.unmodifiableCollection(window);
    }

    public List<PendingEffectiveness> pendingEffectiveness() {
        return pendingEffectiveness;
    }

    public String sessionId() {
        return sessionId;
    }

    public String tenantId() {
        return tenantId;
    }

    public String userId() {
        return userId;
    }

    public String courseId() {
        return courseId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant lastSignalAt() {
        return lastSignalAt;
    }

    public long signalCount() {
        return signalCount;
    }

    public SessionFeatures features() {
        return features;
    }

    public void setFeatures(SessionFeatures features) {
        this.features = features;
    }

    public StruggleAssessment lastAssessment() {
        return lastAssessment;
    }

    public int assessmentCount() {
        return assessmentCount;
    }

    public BehavioralSignal lastSignal() {
        return lastSignal;
    }

    public String lastPersistedBand() {
        return lastPersistedBand;
    }

    public void setLastPersistedBand(String band) {
        this.lastPersistedBand = band;
    }

    /**
     * Intervention whose before/after engagement delta has not been measured yet.
     */
    public static final class PendingEffectiveness {
        private final String interventionId;
        private final double engagementBefore;
        private final Instant triggeredAt;
        private int signalsSince;

        PendingEffectiveness(String interventionId, double engagementBefore, Instant triggeredAt) {
            this.interventionId = interventionId;
            this.engagementBefore = engagementBefore;
            this.triggeredAt = triggeredAt;
        }

        public String interventionId() {
            return interventionId;
        }

        public double engagementBefore() {
            return engagementBefore;
        }

        public Instant triggeredAt() {
            return triggeredAt;
        }

        public int signalsSince() {
            return signalsSince;
        }
    }
}
