package tw.gc.struggle.engine.services.intervention;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import tw.gc.struggle.engine.config.EngineProperties;
import tw.gc.struggle.engine.entities.InterventionRecord;
import tw.gc.struggle.engine.enums.ConsentScope;
import tw.gc.struggle.engine.enums.InterventionType;
import tw.gc.struggle.engine.enums.StruggleFactor;
import tw.gc.struggle.engine.enums.SuppressionReason;
import tw.gc.struggle.engine.enums.Urgency;
import tw.gc.struggle.engine.repositories.InterventionRecordRepository;
import tw.gc.struggle.engine.services.ops.EngineStatusService;
import tw.gc.struggle.engine.services.ops.OperatorAlertService;
import tw.gc.struggle.engine.services.privacy.ConsentGate;
import tw.gc.struggle.engine.services.privacy.RetentionPolicyService;
import tw.gc.struggle.engine.services.scoring.FactorContribution;
import tw.gc.struggle.engine.services.scoring.StruggleAssessment;
import tw.gc.struggle.engine.testutil.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static tw.gc.struggle.engine.testutil.SignalFixtures.features;

@ExtendWith(MockitoExtension.class)
class InterventionDecisionEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private InterventionRecordRepository interventionRepository;

    @Mock
    private ConsentGate consentGate;

    @Mock
    private ChatDeliveryClient chatDeliveryClient;

    @Mock
    private RetentionPolicyService retentionPolicyService;

    @Mock
    private OperatorAlertService operatorAlertService;

    private EngineProperties properties;
    private EngineStatusService statusService;
    private MutableClock clock;
    private InterventionDecisionEngine engine;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        statusService = new EngineStatusService();
        clock = new MutableClock(NOW);
        engine = new InterventionDecisionEngine(interventionRepository, consentGate, chatDeliveryClient,
                retentionPolicyService, statusService, operatorAlertService, properties, clock);
    }

    private static StruggleAssessment assessment(double risk, double confidence) {
        List<FactorContribution> breakdown = List.of(
                new FactorContribution(StruggleFactor.ERROR_RATE, 0.5, 1.0, 0.35, true),
                new FactorContribution(StruggleFactor.IDLE_FREQUENCY, 0.8, 0.8, 0.28, true));
        return new StruggleAssessment("a-1", "session-1", "learner-1", risk, confidence, 9.2,
                List.of(StruggleFactor.ERROR_RATE, StruggleFactor.IDLE_FREQUENCY), breakdown,
                "linear-v1", NOW, NOW.plus(Duration.ofMinutes(30)));
    }

    private static DecisionContext context(String sessionId) {
        return new DecisionContext("tenant-a", "course-101", sessionId, "learner-1", features(0.8, 0.5));
    }

    private void chatConsent(boolean granted) {
        when(consentGate.isAllowed("tenant-a", "learner-1", ConsentScope.CHAT_INTERACTIONS)).thenReturn(granted);
    }

    private void saveSucceeds() {
        when(interventionRepository.save(any(InterventionRecord.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Nested
    @DisplayName("Threshold and consent gates")
    class Gates {

        @Test
        @DisplayName("Risk below threshold is suppressed before consent is consulted")
        void lowRisk() {
            InterventionDecision decision = engine.decide(assessment(0.3, 0.9), context("session-1"));

            assertThat(decision.suppressionReason()).isEqualTo(SuppressionReason.LOW_RISK);
            verifyNoInteractions(consentGate, interventionRepository);
        }

        @Test
        @DisplayName("Confidence below threshold is suppressed")
        void lowConfidence() {
            InterventionDecision decision = engine.decide(assessment(0.9, 0.3), context("session-1"));

            assertThat(decision.suppressionReason()).isEqualTo(SuppressionReason.LOW_CONFIDENCE);
        }

        @Test
        @DisplayName("Chat consent not granted suppresses delivery")
        void noConsent() {
            chatConsent(false);

            InterventionDecision decision = engine.decide(assessment(0.9, 0.9), context("session-1"));

            assertThat(decision.suppressionReason()).isEqualTo(SuppressionReason.NO_CONSENT);
            assertThat(statusService.getSuppressions(SuppressionReason.NO_CONSENT)).isEqualTo(1);
            verifyNoInteractions(interventionRepository, chatDeliveryClient);
        }
    }

    @Nested
    @DisplayName("Triggering")
    class Triggering {

        @Test
        @DisplayName("High risk triggers exactly one high-urgency proactive chat")
        void highRisk_singleProactiveChat() {
            chatConsent(true);
            saveSucceeds();

            InterventionDecision decision = engine.decide(assessment(0.693, 1.0), context("session-1"));

            assertThat(decision.isTriggered()).isTrue();
            ArgumentCaptor<InterventionRecord> saved = ArgumentCaptor.forClass(InterventionRecord.class);
            verify(interventionRepository, times(1)).save(saved.capture());
            InterventionRecord record = saved.getValue();
            assertThat(record.getType()).isEqualTo(InterventionType.PROACTIVE_CHAT);
            assertThat(record.getUrgency()).isEqualTo(Urgency.HIGH);
            assertThat(record.getMessageIntent()).isEqualTo("review_mistakes");
            assertThat(record.getStruggleAssessmentId()).isEqualTo("a-1");
            assertThat(record.getTriggeredAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
            assertThat(record.getEngagementBefore()).isEqualTo(0.6);
            assertThat(decision.command().interventionId()).isEqualTo(record.getId());
            verify(chatDeliveryClient).dispatch(decision.command());
        }

        @Test
        @DisplayName("Medium risk picks the strongest factor's intervention kind")
        void mediumRisk_factorKind() {
            chatConsent(true);
            saveSucceeds();

            InterventionDecision decision = engine.decide(assessment(0.55, 0.9), context("session-1"));

            assertThat(decision.record().getType()).isEqualTo(InterventionType.CONTENT_SUGGESTION);
            assertThat(decision.record().getUrgency()).isEqualTo(Urgency.MEDIUM);
            assertThat(decision.record().getMessageIntent()).isEqualTo("clarify_concept");
        }

        @Test
        @DisplayName("Cooldown moves to the next candidate type, then suppresses")
        void cooldown_fallsThroughCandidates() {
            chatConsent(true);
            saveSucceeds();

            List<InterventionType> types = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                types.add(engine.decide(assessment(0.693, 1.0), context("session-1")).record().getType());
            }
            InterventionDecision fourth = engine.decide(assessment(0.693, 1.0), context("session-1"));

            assertThat(types).containsExactly(InterventionType.PROACTIVE_CHAT,
                    InterventionType.CONTENT_SUGGESTION, InterventionType.BREAK_REMINDER);
            assertThat(fourth.suppressionReason()).isEqualTo(SuppressionReason.COOLDOWN);

            clock.advance(Duration.ofMinutes(31));
            assertThat(engine.decide(assessment(0.693, 1.0), context("session-1")).isTriggered()).isTrue();
        }

        @Test
        @DisplayName("Daily cap holds across the learner's sessions until the rolling day passes")
        void dailyCap() {
            properties.getIntervention().setDailyCap(2);
            properties.getIntervention().setCooldownMinutes(0);
            chatConsent(true);
            saveSucceeds();

            assertThat(engine.decide(assessment(0.9, 0.9), context("session-1")).isTriggered()).isTrue();
            assertThat(engine.decide(assessment(0.9, 0.9), context("session-2")).isTriggered()).isTrue();
            assertThat(engine.decide(assessment(0.9, 0.9), context("session-3")).suppressionReason())
                    .isEqualTo(SuppressionReason.DAILY_CAP);

            clock.advance(Duration.ofHours(24).plusSeconds(1));
            assertThat(engine.decide(assessment(0.9, 0.9), context("session-3")).isTriggered()).isTrue();
        }

        @Test
        @DisplayName("History in the store counts toward the cap")
        void ledgerLoadedFromStore() {
            properties.getIntervention().setDailyCap(2);
            chatConsent(true);
            LocalDateTime earlier = LocalDateTime.ofInstant(NOW.minus(Duration.ofHours(2)), ZoneOffset.UTC);
            when(interventionRepository.findByTenantIdAndUserIdAndTriggeredAtAfterOrderByTriggeredAtAsc(
                    eq("tenant-a"), eq("learner-1"), any())).thenReturn(List.of(
                    InterventionRecord.builder().type(InterventionType.HELP_OFFER).triggeredAt(earlier).build(),
                    InterventionRecord.builder().type(InterventionType.HELP_OFFER).triggeredAt(earlier.plusMinutes(40)).build()));

            InterventionDecision decision = engine.decide(assessment(0.9, 0.9), context("session-1"));

            assertThat(decision.suppressionReason()).isEqualTo(SuppressionReason.DAILY_CAP);
        }

        @Test
        @DisplayName("Concurrent sessions of one learner never exceed the cap")
        void concurrentSessions_capHolds() throws Exception {
            properties.getIntervention().setDailyCap(3);
            properties.getIntervention().setCooldownMinutes(0);
            chatConsent(true);
            saveSucceeds();

            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<InterventionDecision>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                String sessionId = "session-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return engine.decide(assessment(0.9, 0.9), context(sessionId));
                }));
            }
            start.countDown();

            int triggered = 0;
            for (Future<InterventionDecision> future : futures) {
                if (future.get(5, TimeUnit.SECONDS).isTriggered()) {
                    triggered++;
                }
            }
            pool.shutdownNow();

            assertThat(triggered).isEqualTo(3);
            verify(interventionRepository, times(3)).save(any(InterventionRecord.class));
        }
    }

    @Nested
    @DisplayName("Store failures")
    class StoreFailures {

        @Test
        @DisplayName("History unavailable suppresses instead of guessing")
        void historyUnavailable() {
            chatConsent(true);
            when(interventionRepository.findByTenantIdAndUserIdAndTriggeredAtAfterOrderByTriggeredAtAsc(
                    anyString(), anyString(), any())).thenThrow(new DataAccessResourceFailureException("down"));

            InterventionDecision decision = engine.decide(assessment(0.9, 0.9), context("session-1"));

            assertThat(decision.suppressionReason()).isEqualTo(SuppressionReason.STORE_UNAVAILABLE);
            verify(chatDeliveryClient, never()).dispatch(any());
        }

        @Test
        @DisplayName("Failed record write suppresses, escalates and leaves the ledger untouched")
        void writeFails() {
            chatConsent(true);
            when(interventionRepository.save(any(InterventionRecord.class)))
                    .thenThrow(new DataAccessResourceFailureException("down"))
                    .thenAnswer(inv -> inv.getArgument(0));

            InterventionDecision failed = engine.decide(assessment(0.9, 0.9), context("session-1"));
            InterventionDecision retried = engine.decide(assessment(0.9, 0.9), context("session-1"));

            assertThat(failed.suppressionReason()).isEqualTo(SuppressionReason.STORE_UNAVAILABLE);
            verify(operatorAlertService).escalate(eq("intervention-store"), anyString());
            assertThat(retried.isTriggered()).isTrue();
            assertThat(retried.record().getType()).isEqualTo(InterventionType.PROACTIVE_CHAT);
            verify(chatDeliveryClient, times(1)).dispatch(any());
        }
    }

    @Nested
    @DisplayName("Abandoned evaluations")
    class Abandoned {

        @Test
        @DisplayName("Record stored after the caller gave up is removed and never delivered")
        void abandonedDuringWrite() {
            chatConsent(true);
            CommitGuard guard = new CommitGuard();
            when(interventionRepository.save(any(InterventionRecord.class))).thenAnswer(inv -> {
                guard.abandon();
                return inv.getArgument(0);
            });

            InterventionDecision decision = engine.decide(assessment(0.9, 0.9), context("session-1"), guard);

            assertThat(decision.suppressionReason()).isEqualTo(SuppressionReason.BUDGET_EXCEEDED);
            ArgumentCaptor<InterventionRecord> saved = ArgumentCaptor.forClass(InterventionRecord.class);
            verify(interventionRepository).save(saved.capture());
            verify(interventionRepository).deleteById(saved.getValue().getId());
            verify(chatDeliveryClient, never()).dispatch(any());
            assertThat(statusService.snapshot(0).getInterventionsTriggered()).isZero();
        }

        @Test
        @DisplayName("Abandoned decision leaves cooldown and cap untouched")
        void abandonedKeepsLedger() {
            chatConsent(true);
            CommitGuard guard = new CommitGuard();
            when(interventionRepository.save(any(InterventionRecord.class)))
                    .thenAnswer(inv -> {
                        guard.abandon();
                        return inv.getArgument(0);
                    })
                    .thenAnswer(inv -> inv.getArgument(0));

            engine.decide(assessment(0.9, 0.9), context("session-1"), guard);
            InterventionDecision next = engine.decide(assessment(0.9, 0.9), context("session-1"));

            assertThat(next.isTriggered()).isTrue();
            assertThat(next.record().getType()).isEqualTo(InterventionType.PROACTIVE_CHAT);
            verify(chatDeliveryClient, times(1)).dispatch(next.command());
        }

        @Test
        @DisplayName("Decision abandoned before the write stores nothing")
        void abandonedBeforeWrite() {
            chatConsent(true);
            CommitGuard guard = new CommitGuard();
            guard.abandon();

            InterventionDecision decision = engine.decide(assessment(0.9, 0.9), context("session-1"), guard);

            assertThat(decision.suppressionReason()).isEqualTo(SuppressionReason.BUDGET_EXCEEDED);
            verify(interventionRepository, never()).save(any());
        }
    }
}
