package tw.gc.struggle.engine.services.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import tw.gc.struggle.engine.config.EngineProperties;
import tw.gc.struggle.engine.entities.SessionSummary;
import tw.gc.struggle.engine.entities.StruggleEvent;
import tw.gc.struggle.engine.exceptions.ModelException;
import tw.gc.struggle.engine.services.ingest.BehavioralSignal;
import tw.gc.struggle.engine.services.ingest.NonceRegistry;
import tw.gc.struggle.engine.services.ingest.SessionRateLimiter;
import tw.gc.struggle.engine.services.intervention.CommitGuard;
import tw.gc.struggle.engine.services.intervention.DecisionContext;
import tw.gc.struggle.engine.services.intervention.InterventionDecision;
import tw.gc.struggle.engine.services.intervention.InterventionDecisionEngine;
import tw.gc.struggle.engine.services.ops.AuditWriter;
import tw.gc.struggle.engine.services.ops.EngineStatusService;
import tw.gc.struggle.engine.services.scoring.PageContext;
import tw.gc.struggle.engine.services.scoring.StruggleAssessment;
import tw.gc.struggle.engine.services.scoring.StruggleScorer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Iterator;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * What a session actor does with each message. Always called from the owning actor's drain,
 * so the {@link SessionState} argument is never shared.
 *
 * <p>Scoring and the decision run under a wall-clock budget; an overrun abandons the
 * decision and is only counted. A decision that already committed an intervention when the
 * budget ran out is awaited so the intervention is never left without its struggle event.</p>
 */
@Service
@Slf4j
public class SessionProcessor {

    private final SessionFeatureExtractor featureExtractor;
    private final StruggleScorer scorer;
    private final InterventionDecisionEngine decisionEngine;
    private final AuditWriter auditWriter;
    private final NonceRegistry nonceRegistry;
    private final SessionRateLimiter rateLimiter;
    private final EngineStatusService statusService;
    private final EngineProperties properties;
    private final Clock clock;
    private final ExecutorService decisionExecutor;

    public SessionProcessor(SessionFeatureExtractor featureExtractor,
                            StruggleScorer scorer,
                            InterventionDecisionEngine decisionEngine,
                            AuditWriter auditWriter,
                            NonceRegistry nonceRegistry,
                            SessionRateLimiter rateLimiter,
                            EngineStatusService statusService,
                            EngineProperties properties,
                            Clock clock,
                            @Qualifier("decisionExecutor") ExecutorService decisionExecutor) {
        this.featureExtractor = featureExtractor;
        this.scorer = scorer;
        this.decisionEngine = decisionEngine;
        this.auditWriter = auditWriter;
        this.nonceRegistry = nonceRegistry;
        this.rateLimiter = rateLimiter;
        this.statusService = statusService;
        this.properties = properties;
        this.clock = clock;
        this.decisionExecutor = decisionExecutor;
    }

    private record Evaluation(StruggleAssessment assessment, InterventionDecision decision) {
    }

    public void onSignal(SessionState state, BehavioralSignal signal) {
        EngineProperties.Session config = properties.getSession();
        Instant now = clock.instant();

        state.append(signal, Duration.ofMinutes(config.getWindowMinutes()), config.getMaxWindowSignals());
        statusService.recordSignalProcessed();

        try {
            state.setFeatures(featureExtractor.extract(state.window(), state.startedAt(), now, state.features()));
        } catch (RuntimeException e) {
            statusService.recordModelError();
            log.warn("⚠️ Feature recompute failed for session {}, keeping last good features: {}",
                    state.sessionId(), e.getMessage());
        }

        measureEffectiveness(state, now, false);

        if (state.features().sampleCount() == 0
                || !state.isReadyForScoring(config.getMinSamples(), Duration.ofSeconds(config.getMinElapsedSeconds()))) {
            return;
        }
        evaluate(state, signal, now);
    }

    private void evaluate(SessionState state, BehavioralSignal signal, Instant now) {
        SessionFeatures features = state.features();
        PageContext pageContext = new PageContext(signal.pageContentHash(), signal.contentDifficulty());
        DecisionContext context = new DecisionContext(state.tenantId(), state.courseId(), state.sessionId(),
                state.userId(), features);

        CommitGuard guard = new CommitGuard();
        Future<Evaluation> future;
        try {
            future = decisionExecutor.submit(() -> {
                StruggleAssessment assessment = scorer
                        .score(state.sessionId(), state.userId(), features, pageContext, now)
                        .withAssessmentId(UUID.randomUUID().toString());
                return new Evaluation(assessment, decisionEngine.decide(assessment, context, guard));
            });
        } catch (RejectedExecutionException e) {
            log.warn("⚠️ Decision pool saturated, skipping evaluation for session {}", state.sessionId());
            return;
        }

        Evaluation evaluation;
        long budgetMs = properties.getSession().getProcessingBudgetMs();
        try {
            try {
                evaluation = future.get(budgetMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                statusService.recordBudgetExceeded();
                if (guard.abandon()) {
                    future.cancel(true);
                    log.warn("⏱️ Session {} evaluation exceeded {}ms budget, abandoned", state.sessionId(), budgetMs);
                    return;
                }
                // committed interventions are kept with their assessment
                log.warn("⏱️ Session {} evaluation exceeded {}ms budget after committing an intervention",
                        state.sessionId(), budgetMs);
                evaluation = future.get();
            }
        } catch (ExecutionException e) {
            statusService.recordModelError();
            if (e.getCause() instanceof ModelException) {
                log.warn("⚠️ Scoring failed for session {}: {}", state.sessionId(), e.getCause().getMessage());
            } else {
                log.error("❌ Evaluation failed for session {}", state.sessionId(), e.getCause());
            }
            return;
        } catch (InterruptedException e) {
            guard.abandon();
            future.cancel(true);
            Thread.currentThread().interrupt();
            return;
        }

        StruggleAssessment assessment = evaluation.assessment();
        InterventionDecision decision = evaluation.decision();
        state.recordAssessment(assessment);
        statusService.recordAssessment();

        if (decision.isTriggered() && decision.record().getEngagementBefore() != null) {
            state.awaitEffectiveness(decision.record().getId(), decision.record().getEngagementBefore(), now);
        }

        String band = decisionEngine.urgencyFor(assessment.riskLevel()).name();
        boolean notable = assessment.riskLevel() >= properties.getIntervention().getRiskThreshold()
                || decision.isTriggered()
                || !band.equals(state.lastPersistedBand());
        if (notable) {
            state.setLastPersistedBand(band);
            auditWriter.recordStruggleEvent(toEvent(state, assessment, decision, features));
        }
    }

    /**
     * Record the before/after engagement delta once enough follow-up signals arrived, or
     * with what is available when the measurement window or the session ends.
     */
    private void measureEffectiveness(SessionState state, Instant now, boolean closing) {
        if (state.pendingEffectiveness().isEmpty()) {
            return;
        }
        EngineProperties.Intervention config = properties.getIntervention();
        int minSamples = properties.getSession().getMinSamples();
        Duration window = Duration.ofMinutes(config.getEffectivenessWindowMinutes());

        Iterator<SessionState.PendingEffectiveness> it = state.pendingEffectiveness().iterator();
        while (it.hasNext()) {
            SessionState.PendingEffectiveness pending = it.next();
            boolean windowOver = now.isAfter(pending.triggeredAt().plus(window));
            boolean enoughEvidence = pending.signalsSince() >= minSamples;
            if (!enoughEvidence && !windowOver && !closing) {
                continue;
            }
            it.remove();
            if (pending.signalsSince() == 0) {
                continue;
            }
            double delta = state.features().engagement() - pending.engagementBefore();
            auditWriter.recordEffectiveness(pending.interventionId(), Math.round(delta * 10_000) / 10_000.0);
        }
    }

    public void onClose(SessionState state, CloseReason reason) {
        nonceRegistry.forget(state.sessionId());
        rateLimiter.forget(state.sessionId());
        statusService.recordSessionClosed();

        if (!reason.flushesState()) {
            log.info("🗑️ Session {} discarded", state.sessionId());
            return;
        }

        measureEffectiveness(state, clock.instant(), true);

        SessionFeatures features = state.features();
        StruggleAssessment last = state.lastAssessment();
        auditWriter.recordSessionSummary(SessionSummary.builder()
                .tenantId(state.tenantId())
                .sessionId(state.sessionId())
                .userId(state.userId())
                .courseId(state.courseId())
                .startedAt(toLocal(state.startedAt()))
                .lastSignalAt(toLocal(state.lastSignalAt()))
                .closedAt(LocalDateTime.now(clock))
                .closeReason(reason.getCode())
                .signalCount(state.signalCount())
                .assessmentCount(state.assessmentCount())
                .lastRiskLevel(last == null ? null : last.riskLevel())
                .avgResponseTimeMs(features.avgResponseTimeMs())
                .helpRequestRate(features.helpRequestRate())
                .errorRate(features.errorRate())
                .idleCount(features.idleCount())
                .attention(features.attention())
                .fatigue(features.fatigue())
                .cognitiveLoad(features.cognitiveLoad())
                .build());
        log.info("🏁 Session {} {} after {} signals", state.sessionId(), reason.getCode(), state.signalCount());
    }

    private StruggleEvent toEvent(SessionState state, StruggleAssessment assessment,
                                  InterventionDecision decision, SessionFeatures features) {
        return StruggleEvent.builder()
                .assessmentId(assessment.assessmentId())
                .tenantId(state.tenantId())
                .sessionId(state.sessionId())
                .userId(state.userId())
                .courseId(state.courseId())
                .riskLevel(assessment.riskLevel())
                .confidence(assessment.confidence())
                .estimatedTimeToStruggleMinutes(assessment.estimatedTimeToStruggleMinutes())
                .contributingFactors(assessment.factorCodes())
                .modelVersion(assessment.modelVersion())
                .computedAt(toLocal(assessment.computedAt()))
                .validUntil(toLocal(assessment.validUntil()))
                .cognitiveLoad(features.cognitiveLoad())
                .fatigue(features.fatigue())
                .engagement(features.engagement())
                .interventionId(decision.isTriggered() ? decision.record().getId() : null)
                .suppressionReason(decision.suppressionReason())
                .build();
    }

    private static LocalDateTime toLocal(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
