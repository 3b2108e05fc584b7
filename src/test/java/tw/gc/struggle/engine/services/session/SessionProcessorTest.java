package tw.gc.struggle.engine.services.session;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tw.gc.struggle.engine.config.EngineProperties;
import tw.gc.struggle.engine.entities.InterventionRecord;
import tw.gc.struggle.engine.entities.SessionSummary;
import tw.gc.struggle.engine.entities.StruggleEvent;
import tw.gc.struggle.engine.enums.InterventionType;
import tw.gc.struggle.engine.enums.SignalType;
import tw.gc.struggle.engine.enums.StruggleFactor;
import tw.gc.struggle.engine.enums.SuppressionReason;
import tw.gc.struggle.engine.enums.Urgency;
import tw.gc.struggle.engine.services.ingest.BehavioralSignal;
import tw.gc.struggle.engine.services.ingest.NonceRegistry;
import tw.gc.struggle.engine.services.ingest.SessionRateLimiter;
import tw.gc.struggle.engine.services.intervention.CommitGuard;
import tw.gc.struggle.engine.services.intervention.InterventionCommand;
import tw.gc.struggle.engine.services.intervention.InterventionDecision;
import tw.gc.struggle.engine.services.intervention.InterventionDecisionEngine;
import tw.gc.struggle.engine.services.ops.AuditWriter;
import tw.gc.struggle.engine.services.ops.EngineStatusService;
import tw.gc.struggle.engine.services.scoring.StruggleScorer;
import tw.gc.struggle.engine.testutil.MutableClock;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static tw.gc.struggle.engine.testutil.SignalFixtures.quiz;
import static tw.gc.struggle.engine.testutil.SignalFixtures.signal;

@ExtendWith(MockitoExtension.class)
class SessionProcessorTest {

    private static final Instant START = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private InterventionDecisionEngine decisionEngine;

    @Mock
    private AuditWriter auditWriter;

    private EngineProperties properties;
    private EngineStatusService statusService;
    private NonceRegistry nonceRegistry;
    private MutableClock clock;
    private ExecutorService decisionExecutor;
    private SessionProcessor processor;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        properties.getSession().setProcessingBudgetMs(2_000);
        statusService = new EngineStatusService();
        clock = new MutableClock(START);
        nonceRegistry = new NonceRegistry(properties, clock);
        decisionExecutor = Executors.newSingleThreadExecutor();
        processor = new SessionProcessor(new SessionFeatureExtractor(properties), new StruggleScorer(properties),
                decisionEngine, auditWriter, nonceRegistry, new SessionRateLimiter(properties, clock),
                statusService, properties, clock, decisionExecutor);
    }

    @AfterEach
    void tearDown() {
        decisionExecutor.shutdownNow();
    }

    private SessionState feed(List<BehavioralSignal> signals) {
        SessionState state = SessionState.open(signals.get(0));
        for (BehavioralSignal signal : signals) {
            clock.set(signal.receivedAt());
            processor.onSignal(state, signal);
        }
        return state;
    }

    private static List<BehavioralSignal> strugglingSession() {
        return List.of(
                signal("session-1", SignalType.IDLE, 40_000, START),
                quiz("session-1", false, START.plusSeconds(10)),
                signal("session-1", SignalType.IDLE, 40_000, START.plusSeconds(20)),
                quiz("session-1", false, START.plusSeconds(30)),
                signal("session-1", SignalType.IDLE, 40_000, START.plusSeconds(40)),
                quiz("session-1", false, START.plusSeconds(50)),
                signal("session-1", SignalType.IDLE, 40_000, START.plusSeconds(60)),
                quiz("session-1", false, START.plusSeconds(70)),
                signal("session-1", SignalType.IDLE, 40_000, START.plusSeconds(80)),
                quiz("session-1", false, START.plusSeconds(90)));
    }

    @Nested
    @DisplayName("Signal processing")
    class OnSignal {

        @Test
        @DisplayName("Nothing is scored before the minimum samples or elapsed time")
        void notReadyYet() {
            SessionState state = feed(List.of(
                    signal("session-1", SignalType.CLICK, 1_000, START),
                    signal("session-1", SignalType.CLICK, 1_000, START.plusSeconds(5))));

            assertThat(state.signalCount()).isEqualTo(2);
            assertThat(state.features().sampleCount()).isEqualTo(2);
            verifyNoInteractions(decisionEngine, auditWriter);
        }

        @Test
        @DisplayName("Idle and error heavy session is persisted as a high risk struggle event")
        void strugglingSessionPersisted() {
            when(decisionEngine.decide(any(), any(), any())).thenReturn(InterventionDecision.suppressed(SuppressionReason.COOLDOWN));
            when(decisionEngine.urgencyFor(anyDouble())).thenReturn(Urgency.HIGH);

            SessionState state = feed(strugglingSession());

            ArgumentCaptor<StruggleEvent> events = ArgumentCaptor.forClass(StruggleEvent.class);
            verify(auditWriter, atLeastOnce()).recordStruggleEvent(events.capture());
            StruggleEvent last = events.getValue();
            assertThat(last.getRiskLevel()).isGreaterThanOrEqualTo(0.6);
            assertThat(last.getContributingFactors())
                    .contains(StruggleFactor.ERROR_RATE.getCode())
                    .contains(StruggleFactor.IDLE_FREQUENCY.getCode());
            assertThat(last.getSuppressionReason()).isEqualTo(SuppressionReason.COOLDOWN);
            assertThat(last.getInterventionId()).isNull();
            assertThat(last.getAssessmentId()).isNotBlank();
            assertThat(state.assessmentCount()).isEqualTo(8);
            assertThat(state.lastPersistedBand()).isEqualTo("HIGH");
        }

        @Test
        @DisplayName("Evaluation over budget is abandoned and counted")
        void budgetExceeded() {
            properties.getSession().setProcessingBudgetMs(50);
            when(decisionEngine.decide(any(), any(), any())).thenAnswer(inv -> {
                Thread.sleep(1_000);
                return InterventionDecision.suppressed(SuppressionReason.COOLDOWN);
            });

            SessionState state = feed(strugglingSession().subList(0, 3));

            assertThat(statusService.getBudgetExceeded()).isEqualTo(1);
            assertThat(state.assessmentCount()).isZero();
            verify(auditWriter, never()).recordStruggleEvent(any());
        }

        @Test
        @DisplayName("Intervention committed before the budget ran out is kept with its struggle event")
        void committedInterventionSurvivesOverrun() {
            properties.getSession().setProcessingBudgetMs(50);
            InterventionRecord record = InterventionRecord.builder().id("iv-late").build();
            InterventionCommand command = new InterventionCommand("iv-late", "session-1",
                    InterventionType.PROACTIVE_CHAT, Urgency.HIGH, "review_mistakes");
            when(decisionEngine.decide(any(), any(), any())).thenAnswer(inv -> {
                CommitGuard guard = inv.getArgument(2);
                assertThat(guard.commit()).isTrue();
                Thread.sleep(300);
                return InterventionDecision.triggered(record, command);
            });
            when(decisionEngine.urgencyFor(anyDouble())).thenReturn(Urgency.HIGH);

            SessionState state = feed(strugglingSession().subList(0, 3));

            assertThat(statusService.getBudgetExceeded()).isEqualTo(1);
            assertThat(state.assessmentCount()).isEqualTo(1);
            ArgumentCaptor<StruggleEvent> event = ArgumentCaptor.forClass(StruggleEvent.class);
            verify(auditWriter).recordStruggleEvent(event.capture());
            assertThat(event.getValue().getInterventionId()).isEqualTo("iv-late");
        }

        @Test
        @DisplayName("Decision still running when the budget runs out cannot commit")
        void abandonedDecisionCannotCommit() throws Exception {
            properties.getSession().setProcessingBudgetMs(50);
            CompletableFuture<Boolean> committed = new CompletableFuture<>();
            when(decisionEngine.decide(any(), any(), any())).thenAnswer(inv -> {
                CommitGuard guard = inv.getArgument(2);
                try {
                    Thread.sleep(300);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                committed.complete(guard.commit());
                return InterventionDecision.suppressed(SuppressionReason.BUDGET_EXCEEDED);
            });

            feed(strugglingSession().subList(0, 3));

            assertThat(committed.get(2, TimeUnit.SECONDS)).isFalse();
            verify(auditWriter, never()).recordStruggleEvent(any());
        }

        @Test
        @DisplayName("Engagement delta is recorded once enough signals follow an intervention")
        void effectivenessMeasured() {
            InterventionRecord record = InterventionRecord.builder()
                    .id("iv-1")
                    .engagementBefore(0.5)
                    .build();
            InterventionCommand command = new InterventionCommand("iv-1", "session-1",
                    InterventionType.PROACTIVE_CHAT, Urgency.HIGH, "review_mistakes");
            when(decisionEngine.decide(any(), any(), any())).thenReturn(
                    InterventionDecision.triggered(record, command),
                    InterventionDecision.suppressed(SuppressionReason.COOLDOWN));
            when(decisionEngine.urgencyFor(anyDouble())).thenReturn(Urgency.HIGH);

            feed(strugglingSession().subList(0, 6));

            verify(auditWriter).recordEffectiveness(eq("iv-1"), anyDouble());
        }
    }

    @Nested
    @DisplayName("Session close")
    class OnClose {

        @Test
        @DisplayName("Closing writes a summary and forgets per-session caches")
        void closeWritesSummary() {
            BehavioralSignal first = signal("session-1", SignalType.CLICK, 1_000, START);
            SessionState state = SessionState.open(first);
            nonceRegistry.register("session-1", first.nonce(), START);
            processor.onSignal(state, first);

            processor.onClose(state, CloseReason.CLOSED);

            ArgumentCaptor<SessionSummary> summary = ArgumentCaptor.forClass(SessionSummary.class);
            verify(auditWriter).recordSessionSummary(summary.capture());
            assertThat(summary.getValue().getCloseReason()).isEqualTo("closed");
            assertThat(summary.getValue().getSignalCount()).isEqualTo(1);
            assertThat(summary.getValue().getLastRiskLevel()).isNull();
            assertThat(nonceRegistry.trackedSessions()).isZero();
        }

        @Test
        @DisplayName("Discarded sessions flush nothing")
        void discardedWritesNothing() {
            BehavioralSignal first = signal("session-1", SignalType.CLICK, 1_000, START);
            SessionState state = SessionState.open(first);
            processor.onSignal(state, first);

            processor.onClose(state, CloseReason.DISCARDED);

            verifyNoInteractions(auditWriter);
        }
    }
}
