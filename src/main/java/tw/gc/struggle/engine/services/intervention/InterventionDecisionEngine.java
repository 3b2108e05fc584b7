package tw.gc.struggle.engine.services.intervention;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import tw.gc.struggle.engine.config.EngineProperties;
import tw.gc.struggle.engine.entities.InterventionRecord;
import tw.gc.struggle.engine.enums.ConsentScope;
import tw.gc.struggle.engine.enums.InterventionStatus;
import tw.gc.struggle.engine.enums.InterventionType;
import tw.gc.struggle.engine.enums.StruggleFactor;
import tw.gc.struggle.engine.enums.SuppressionReason;
import tw.gc.struggle.engine.enums.Urgency;
import tw.gc.struggle.engine.repositories.InterventionRecordRepository;
import tw.gc.struggle.engine.services.ops.EngineStatusService;
import tw.gc.struggle.engine.services.ops.OperatorAlertService;
import tw.gc.struggle.engine.services.privacy.ConsentGate;
import tw.gc.struggle.engine.services.privacy.RetentionPolicyService;
import tw.gc.struggle.engine.services.scoring.StruggleAssessment;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Intervention Decision Engine
 *
 * Turns an assessment into at most one intervention per call:
 * - Risk and confidence must clear their delivery thresholds
 * - The learner must have granted chat interactions
 * - At most {@code daily-cap} interventions per user in any rolling 24 hours
 * - Same-type interventions at least {@code cooldown-minutes} apart
 *
 * State is per user, not per session. Each user's ledger is only mutated while holding its
 * monitor, and only after the intervention record has been persisted, so concurrent sessions
 * of the same learner can never overshoot the cap or the cooldown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InterventionDecisionEngine {

    private static final Duration DAY = Duration.ofHours(24);

    private final InterventionRecordRepository interventionRepository;
    private final ConsentGate consentGate;
    private final ChatDeliveryClient chatDeliveryClient;
    private final RetentionPolicyService retentionPolicyService;
    private final EngineStatusService statusService;
    private final OperatorAlertService operatorAlertService;
    private final EngineProperties properties;
    private final Clock clock;

    private final Map<String, UserLedger> ledgers = new ConcurrentHashMap<>();

    record Candidate(InterventionType type, Urgency urgency, double contribution, String intent) {
    }

    public InterventionDecision decide(StruggleAssessment assessment, DecisionContext context) {
        return decide(assessment, context, new CommitGuard());
    }

    /**
     * Decide under a budget owned by the caller. The intervention is only handed to delivery,
     * and only counted against the cap and cooldown, if {@code guard} commits after the record
     * is stored; a record stored after the caller gave up is removed again.
     */
    public InterventionDecision decide(StruggleAssessment assessment, DecisionContext context, CommitGuard guard) {
        EngineProperties.Intervention config = properties.getIntervention();

        if (assessment.riskLevel() < config.getRiskThreshold()) {
            return suppress(SuppressionReason.LOW_RISK, context);
        }
        if (assessment.confidence() < config.getConfidenceThreshold()) {
            return suppress(SuppressionReason.LOW_CONFIDENCE, context);
        }
        if (!consentGate.isAllowed(context.tenantId(), context.userId(), ConsentScope.CHAT_INTERACTIONS)) {
            return suppress(SuppressionReason.NO_CONSENT, context);
        }

        Instant now = clock.instant();
        UserLedger ledger;
        try {
            ledger = ledgerFor(context.tenantId(), context.userId(), now);
        } catch (DataAccessException e) {
            log.error("❌ Could not load intervention history for session {}: {}", context.sessionId(), e.getMessage());
            return suppress(SuppressionReason.STORE_UNAVAILABLE, context);
        }

        synchronized (ledger) {
            ledger.prune(now.minus(DAY));
            ledger.touch(now);
            if (ledger.countInWindow() >= config.getDailyCap()) {
                return suppress(SuppressionReason.DAILY_CAP, context);
            }

            Duration cooldown = Duration.ofMinutes(config.getCooldownMinutes());
            Candidate chosen = null;
            for (Candidate candidate : rankCandidates(assessment, context)) {
                if (!ledger.inCooldown(candidate.type(), now, cooldown)) {
                    chosen = candidate;
                    break;
                }
            }
            if (chosen == null) {
                return suppress(SuppressionReason.COOLDOWN, context);
            }

            if (guard.isAbandoned() || Thread.currentThread().isInterrupted()) {
                return suppress(SuppressionReason.BUDGET_EXCEEDED, context);
            }

            InterventionRecord record = buildRecord(assessment, context, chosen, now);
            try {
                record = interventionRepository.save(record);
            } catch (DataAccessException e) {
                if (guard.isAbandoned()) {
                    return suppress(SuppressionReason.BUDGET_EXCEEDED, context);
                }
                log.error("❌ Intervention record not persisted for session {}, suppressing: {}",
                        context.sessionId(), e.getMessage());
                operatorAlertService.escalate("intervention-store", "Intervention writes failing: " + e.getMessage());
                return suppress(SuppressionReason.STORE_UNAVAILABLE, context);
            }
            if (!guard.commit()) {
                discardAbandoned(record);
                return suppress(SuppressionReason.BUDGET_EXCEEDED, context);
            }
            ledger.record(chosen.type(), now);

            InterventionCommand command = new InterventionCommand(record.getId(), record.getSessionId(),
                    record.getType(), record.getUrgency(), record.getMessageIntent());
            statusService.recordIntervention();
            log.info("💬 Intervention {} triggered: {} {} for session {} (risk={}, confidence={})",
                    record.getId(), chosen.urgency(), chosen.type().getCode(), context.sessionId(),
                    assessment.riskLevel(), assessment.confidence());
            chatDeliveryClient.dispatch(command);
            return InterventionDecision.triggered(record, command);
        }
    }

    private void discardAbandoned(InterventionRecord record) {
        // the caller's cancel may have interrupted us; the compensating delete must still run
        boolean interrupted = Thread.interrupted();
        try {
            interventionRepository.deleteById(record.getId());
            log.info("⏱️ Intervention {} stored after its evaluation was abandoned, removed", record.getId());
        } catch (DataAccessException e) {
            log.error("❌ Abandoned intervention {} could not be removed: {}", record.getId(), e.getMessage());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    List<Candidate> rankCandidates(StruggleAssessment assessment, DecisionContext context) {
        EngineProperties.Intervention config = properties.getIntervention();
        Urgency urgency = urgencyFor(assessment.riskLevel());
        StruggleFactor topFactor = assessment.contributingFactors().isEmpty() ? null : assessment.contributingFactors().get(0);

        Map<InterventionType, Candidate> byType = new EnumMap<>(InterventionType.class);
        if (assessment.riskLevel() >= config.getHighUrgencyRisk()) {
            offer(byType, new Candidate(InterventionType.PROACTIVE_CHAT, Urgency.HIGH, assessment.riskLevel(),
                    chatIntent(topFactor)));
        }
        for (StruggleFactor factor : assessment.contributingFactors()) {
            InterventionType type = typeFor(factor);
            String intent = type == InterventionType.PROACTIVE_CHAT ? chatIntent(factor) : type.getDefaultIntent();
            offer(byType, new Candidate(type, urgency, assessment.contributionOf(factor), intent));
        }
        if (context.features() != null && context.features().fatigue() >= config.getFatigueBreakThreshold()) {
            offer(byType, new Candidate(InterventionType.BREAK_REMINDER, urgency,
                    context.features().fatigue() * 0.1, InterventionType.BREAK_REMINDER.getDefaultIntent()));
        }
        if (byType.isEmpty()) {
            offer(byType, new Candidate(InterventionType.PROACTIVE_CHAT, urgency, assessment.riskLevel(),
                    chatIntent(topFactor)));
        }

        List<Candidate> ranked = new ArrayList<>(byType.values());
        ranked.sort(Comparator.comparingInt((Candidate c) -> c.urgency().getRank()).reversed()
                .thenComparing(Comparator.comparingDouble(Candidate::contribution).reversed())
                .thenComparing(c -> c.type().ordinal()));
        return ranked;
    }

    public Urgency urgencyFor(double risk) {
        EngineProperties.Intervention config = properties.getIntervention();
        if (risk >= config.getHighUrgencyRisk()) {
            return Urgency.HIGH;
        }
        if (risk >= config.getMediumUrgencyRisk()) {
            return Urgency.MEDIUM;
        }
        return Urgency.LOW;
    }

    private static void offer(Map<InterventionType, Candidate> byType, Candidate candidate) {
        byType.merge(candidate.type(), candidate, (existing, offered) ->
                offered.urgency().getRank() > existing.urgency().getRank()
                        || (offered.urgency() == existing.urgency() && offered.contribution() > existing.contribution())
                        ? offered : existing);
    }

    private static InterventionType typeFor(StruggleFactor factor) {
        return switch (factor) {
            case HELP_REQUEST_RATE -> InterventionType.HELP_OFFER;
            case ERROR_RATE -> InterventionType.CONTENT_SUGGESTION;
            case IDLE_FREQUENCY -> InterventionType.BREAK_REMINDER;
            case RESPONSE_TIME_VARIABILITY, HOVER_DURATION -> InterventionType.PROACTIVE_CHAT;
        };
    }

    private static String chatIntent(StruggleFactor factor) {
        if (factor == null) {
            return InterventionType.PROACTIVE_CHAT.getDefaultIntent();
        }
        return switch (factor) {
            case IDLE_FREQUENCY -> "re_engage";
            case ERROR_RATE -> "review_mistakes";
            case HELP_REQUEST_RATE -> "offer_help";
            case RESPONSE_TIME_VARIABILITY -> "check_understanding";
            case HOVER_DURATION -> "explain_content";
        };
    }

    private InterventionRecord buildRecord(StruggleAssessment assessment, DecisionContext context,
                                           Candidate chosen, Instant now) {
        LocalDateTime triggeredAt = LocalDateTime.ofInstant(now, ZoneOffset.UTC);
        return InterventionRecord.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(context.tenantId())
                .sessionId(context.sessionId())
                .userId(context.userId())
                .courseId(context.courseId())
                .struggleAssessmentId(assessment.assessmentId())
                .type(chosen.type())
                .urgency(chosen.urgency())
                .messageIntent(chosen.intent())
                .riskLevel(assessment.riskLevel())
                .status(InterventionStatus.TRIGGERED)
                .triggeredAt(triggeredAt)
                .engagementBefore(context.features() == null ? null : context.features().engagement())
                .purgeAt(retentionPolicyService.purgeAt(context.tenantId(), triggeredAt))
                .build();
    }

    private UserLedger ledgerFor(String tenantId, String userId, Instant now) {
        String key = tenantId + "|" + userId;
        UserLedger ledger = ledgers.get(key);
        if (ledger != null) {
            return ledger;
        }
        UserLedger loaded = new UserLedger(now);
        LocalDateTime since = LocalDateTime.ofInstant(now.minus(DAY), ZoneOffset.UTC);
        for (InterventionRecord record : interventionRepository
                .findByTenantIdAndUserIdAndTriggeredAtAfterOrderByTriggeredAtAsc(tenantId, userId, since)) {
            loaded.record(record.getType(), record.getTriggeredAt().toInstant(ZoneOffset.UTC));
        }
        UserLedger raced = ledgers.putIfAbsent(key, loaded);
        return raced != null ? raced : loaded;
    }

    private InterventionDecision suppress(SuppressionReason reason, DecisionContext context) {
        statusService.recordSuppression(reason);
        switch (reason) {
            case LOW_RISK, LOW_CONFIDENCE -> log.debug("Intervention suppressed for session {}: {}", context.sessionId(), reason);
            default -> log.info("🔕 Intervention suppressed for session {}: {}", context.sessionId(), reason);
        }
        return InterventionDecision.suppressed(reason);
    }

    /**
     * Drop a learner's in-memory history, e.g. after consent withdrawal.
     */
    public void forgetUser(String tenantId, String userId) {
        ledgers.remove(tenantId + "|" + userId);
    }

    public int trackedUsers() {
        return ledgers.size();
    }

    @Scheduled(fixedDelayString = "${engine.session.expiry-sweep-ms:60000}")
    public void evictIdleLedgers() {
        Instant cutoff = clock.instant().minus(DAY);
        ledgers.entrySet().removeIf(entry -> {
            UserLedger ledger = entry.getValue();
            synchronized (ledger) {
                return ledger.lastTouched().isBefore(cutoff);
            }
        });
    }
}
