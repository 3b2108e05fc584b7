package tw.gc.struggle.engine.services.alerts;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import tw.gc.struggle.engine.config.EngineProperties;
import tw.gc.struggle.engine.entities.CourseInstructor;
import tw.gc.struggle.engine.entities.InstructorAlert;
import tw.gc.struggle.engine.entities.InterventionRecord;
import tw.gc.struggle.engine.entities.StruggleEvent;
import tw.gc.struggle.engine.enums.AlertSeverity;
import tw.gc.struggle.engine.enums.AlertStatus;
import tw.gc.struggle.engine.enums.AlertType;
import tw.gc.struggle.engine.enums.ConsentScope;
import tw.gc.struggle.engine.enums.StruggleFactor;
import tw.gc.struggle.engine.repositories.CourseInstructorRepository;
import tw.gc.struggle.engine.repositories.InstructorAlertRepository;
import tw.gc.struggle.engine.repositories.InterventionRecordRepository;
import tw.gc.struggle.engine.repositories.StruggleEventRepository;
import tw.gc.struggle.engine.services.ops.EngineStatusService;
import tw.gc.struggle.engine.services.privacy.ConsentGate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Instructor Alert Aggregator
 *
 * Scheduled scan over a trailing window per course:
 * - struggle_risk: a confident, very high risk
 * - repeated_struggle: high risk across several sessions
 * - disengagement: offered help keeps being declined or ignored
 * - cognitive_overload: high cognitive load together with fatigue
 * - cohort_struggle: students without analytics consent, only as a k-anonymous aggregate
 *
 * Upserts by open key, so re-running over the same window never duplicates an open alert.
 * Each course runs in its own time-limited transaction; a failing course does not stop the rest.
 */
@Service
@Slf4j
public class InstructorAlertAggregator {

    private static final Map<StruggleFactor, String> FACTOR_ACTIONS = new EnumMap<>(Map.of(
            StruggleFactor.IDLE_FREQUENCY, "Check in about pacing and suggest short study breaks",
            StruggleFactor.ERROR_RATE, "Review recent quiz mistakes with the student",
            StruggleFactor.HELP_REQUEST_RATE, "Offer office hours or a one-on-one session",
            StruggleFactor.RESPONSE_TIME_VARIABILITY, "Revisit prerequisite concepts for the current module",
            StruggleFactor.HOVER_DURATION, "Provide an alternative explanation of the dense material"));

    private final StruggleEventRepository struggleEventRepository;
    private final InterventionRecordRepository interventionRepository;
    private final InstructorAlertRepository alertRepository;
    private final CourseInstructorRepository courseInstructorRepository;
    private final ConsentGate consentGate;
    private final EngineStatusService statusService;
    private final EngineProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public InstructorAlertAggregator(StruggleEventRepository struggleEventRepository,
                                     InterventionRecordRepository interventionRepository,
                                     InstructorAlertRepository alertRepository,
                                     CourseInstructorRepository courseInstructorRepository,
                                     ConsentGate consentGate,
                                     EngineStatusService statusService,
                                     EngineProperties properties,
                                     ObjectMapper objectMapper,
                                     Clock clock,
                                     PlatformTransactionManager transactionManager) {
        this.struggleEventRepository = struggleEventRepository;
        this.interventionRepository = interventionRepository;
        this.alertRepository = alertRepository;
        this.courseInstructorRepository = courseInstructorRepository;
        this.consentGate = consentGate;
        this.statusService = statusService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(properties.getAlerts().getQueryTimeoutSeconds());
    }

    @Scheduled(fixedDelayString = "${engine.alerts.fixed-delay-ms:900000}", initialDelayString = "${engine.alerts.fixed-delay-ms:900000}")
    public void scheduledRun() {
        try {
            aggregate();
        } catch (Exception e) {
            log.error("❌ Alert aggregation run failed", e);
        }
    }

    /**
     * @return number of alerts created or updated
     */
    public int aggregate() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime since = now.minusHours(properties.getAlerts().getWindowHours());

        int upserted = 0;
        for (Object[] course : struggleEventRepository.findActiveCourses(since)) {
            String tenantId = (String) course[0];
            String courseId = (String) course[1];
            try {
                Integer count = transactionTemplate.execute(status -> aggregateCourse(tenantId, courseId, since, now));
                upserted += count == null ? 0 : count;
            } catch (RuntimeException e) {
                log.error("❌ Alert aggregation failed for course {} (tenant {}): {}", courseId, tenantId, e.getMessage());
            }
        }
        log.info("📋 Alert aggregation done: {} alerts upserted", upserted);
        return upserted;
    }

    int aggregateCourse(String tenantId, String courseId, LocalDateTime since, LocalDateTime now) {
        EngineProperties.Alerts config = properties.getAlerts();
        Map<String, StudentEvidence> students = new LinkedHashMap<>();

        for (StruggleEvent event : struggleEventRepository
                .findByTenantIdAndCourseIdAndComputedAtGreaterThanEqual(tenantId, courseId, since)) {
            if (event.getUserId() == null) {
                continue;
            }
            students.computeIfAbsent(event.getUserId(), StudentEvidence::new)
                    .addEvent(event, config.getRepeatedRiskThreshold(),
                            config.getOverloadCognitiveLoad(), config.getOverloadFatigue());
        }
        for (InterventionRecord record : interventionRepository
                .findByTenantIdAndCourseIdAndTriggeredAtGreaterThanEqual(tenantId, courseId, since)) {
            if (record.getUserId() == null) {
                continue;
            }
            students.computeIfAbsent(record.getUserId(), StudentEvidence::new).addIntervention(record);
        }

        List<AlertCandidate> candidates = new ArrayList<>();
        List<StudentEvidence> cohort = new ArrayList<>();
        for (StudentEvidence evidence : students.values()) {
            List<AlertCandidate> individual = evaluate(evidence);
            if (individual.isEmpty()) {
                continue;
            }
            if (consentGate.isAllowed(tenantId, evidence.studentId(), ConsentScope.ANONYMIZED_ANALYTICS)) {
                candidates.addAll(individual);
            } else {
                cohort.add(evidence);
            }
        }

        if (cohort.size() >= config.getMinCohortSize()) {
            candidates.add(cohortCandidate(cohort));
        } else if (!cohort.isEmpty()) {
            log.debug("Course {}: {} students without analytics consent, below k-anonymity floor", courseId, cohort.size());
        }

        candidates.sort(Comparator.comparingInt((AlertCandidate c) -> c.severity().getRank()).reversed()
                .thenComparing(Comparator.comparingDouble(AlertCandidate::riskScore).reversed()));
        List<AlertCandidate> selected = candidates.subList(0, Math.min(candidates.size(), config.getMaxAlertsPerCourse()));

        String instructorId = courseInstructorRepository
                .findByTenantIdAndCourseIdOrderByPrimaryInstructorDesc(tenantId, courseId).stream()
                .findFirst()
                .map(CourseInstructor::getInstructorId)
                .orElse(null);

        for (AlertCandidate candidate : selected) {
            upsert(tenantId, courseId, instructorId, candidate, since, now);
        }
        return selected.size();
    }

    List<AlertCandidate> evaluate(StudentEvidence evidence) {
        EngineProperties.Alerts config = properties.getAlerts();
        List<AlertCandidate> result = new ArrayList<>();
        List<StruggleFactor> topFactors = evidence.topFactors();

        if (evidence.maxRisk() > config.getStruggleRiskThreshold() && evidence.averageConfidence() > config.getMinConfidence()) {
            AlertSeverity severity = evidence.maxRisk() > config.getCriticalRiskThreshold() ? AlertSeverity.CRITICAL : AlertSeverity.HIGH;
            result.add(candidate(evidence, AlertType.STRUGGLE_RISK, severity, evidence.maxRisk(), topFactors,
                    "High struggle risk (peak %.2f)".formatted(evidence.maxRisk()), null));
        }
        if (evidence.highRiskSessionCount() >= config.getRepeatedCount()) {
            AlertSeverity severity = evidence.highRiskSessionCount() >= config.getRepeatedHighCount()
                    ? AlertSeverity.HIGH : AlertSeverity.MEDIUM;
            result.add(candidate(evidence, AlertType.REPEATED_STRUGGLE, severity, evidence.averageHighRisk(), topFactors,
                    "Struggled in %d separate sessions".formatted(evidence.highRiskSessionCount()), null));
        }
        if (evidence.negativeResponses() >= config.getDisengagementCount()) {
            AlertSeverity severity = evidence.negativeResponses() >= 2 * config.getDisengagementCount()
                    ? AlertSeverity.HIGH : AlertSeverity.MEDIUM;
            result.add(candidate(evidence, AlertType.DISENGAGEMENT, severity, evidence.maxRisk(), topFactors,
                    "Declined or ignored %d offers of help".formatted(evidence.negativeResponses()),
                    "Reach out personally; automated support is being declined"));
        }
        if (evidence.overloadEvents() > 0) {
            AlertSeverity severity = evidence.overloadEvents() >= config.getRepeatedCount() ? AlertSeverity.HIGH : AlertSeverity.MEDIUM;
            result.add(candidate(evidence, AlertType.COGNITIVE_OVERLOAD, severity, evidence.maxRisk(), topFactors,
                    "Sustained high cognitive load with fatigue",
                    "Suggest splitting the workload into shorter sessions"));
        }
        return result;
    }

    private AlertCandidate candidate(StudentEvidence evidence, AlertType type, AlertSeverity severity, double risk,
                                     List<StruggleFactor> topFactors, String headline, String typeAction) {
        List<String> concerns = new ArrayList<>();
        concerns.add(headline);
        topFactors.stream().limit(3).forEach(factor -> concerns.add(factor.getConcern()));

        Set<String> actions = new LinkedHashSet<>();
        if (typeAction != null) {
            actions.add(typeAction);
        }
        topFactors.stream().limit(3).forEach(factor -> actions.add(FACTOR_ACTIONS.get(factor)));
        if (actions.isEmpty()) {
            actions.add("Check in with the student about their progress");
        }
        return new AlertCandidate(evidence.studentId(), type, severity, round(risk), evidence.evidenceCounts(),
                concerns, new ArrayList<>(actions));
    }

    private AlertCandidate cohortCandidate(List<StudentEvidence> cohort) {
        Map<StruggleFactor, Integer> factorTotals = new EnumMap<>(StruggleFactor.class);
        double riskSum = 0;
        int events = 0;
        for (StudentEvidence evidence : cohort) {
            riskSum += evidence.maxRisk();
            events += evidence.eventCount();
            evidence.factorCounts().forEach((factor, count) -> factorTotals.merge(factor, count, Integer::sum));
        }
        List<StruggleFactor> topFactors = factorTotals.entrySet().stream()
                .sorted(Map.Entry.<StruggleFactor, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .map(Map.Entry::getKey)
                .limit(3)
                .toList();

        Map<String, Object> counts = new LinkedHashMap<>();
        counts.put("students", cohort.size());
        counts.put("struggleEvents", events);

        List<String> concerns = new ArrayList<>();
        concerns.add("%d students show signs of struggle".formatted(cohort.size()));
        topFactors.forEach(factor -> concerns.add(factor.getConcern()));

        List<String> actions = new ArrayList<>();
        actions.add("Review this module's material with the whole class");
        topFactors.forEach(factor -> actions.add(FACTOR_ACTIONS.get(factor)));

        AlertSeverity severity = cohort.size() >= 2 * properties.getAlerts().getMinCohortSize()
                ? AlertSeverity.HIGH : AlertSeverity.MEDIUM;
        return new AlertCandidate(null, AlertType.COHORT_STRUGGLE, severity, round(riskSum / cohort.size()),
                counts, concerns, actions);
    }

    private void upsert(String tenantId, String courseId, String instructorId, AlertCandidate candidate,
                        LocalDateTime since, LocalDateTime now) {
        String openKey = InstructorAlert.openKey(tenantId, courseId, candidate.studentId(), candidate.type());
        InstructorAlert alert = alertRepository.findByOpenKey(openKey).orElse(null);
        boolean created = alert == null;
        if (created) {
            alert = InstructorAlert.builder()
                    .tenantId(tenantId)
                    .courseId(courseId)
                    .studentId(candidate.studentId())
                    .alertType(candidate.type())
                    .status(AlertStatus.NEW)
                    .openKey(openKey)
                    .windowStart(since)
                    .createdAt(now)
                    .build();
        } else if (alert.getSeverity() != null && alert.getSeverity().getRank() > candidate.severity().getRank()) {
            // never downgrade an open alert
            candidate = new AlertCandidate(candidate.studentId(), candidate.type(), alert.getSeverity(),
                    candidate.riskScore(), candidate.evidenceCounts(), candidate.specificConcerns(),
                    candidate.recommendedActions());
        }

        alert.setInstructorId(instructorId != null ? instructorId : alert.getInstructorId());
        alert.setSeverity(candidate.severity());
        alert.setRiskScore(candidate.riskScore());
        alert.setEvidenceCounts(toJson(candidate.evidenceCounts()));
        alert.setSpecificConcerns(toJson(candidate.specificConcerns()));
        alert.setRecommendedActions(toJson(candidate.recommendedActions()));
        alert.setWindowEnd(now);
        alert.setUpdatedAt(now);
        if (alert.getActionDeadline() == null && candidate.severity().getRank() >= AlertSeverity.HIGH.getRank()) {
            alert.setActionDeadline(now.plusHours(properties.getAlerts().getActionDeadlineHours()));
        }
        alertRepository.save(alert);
        statusService.recordAlertUpserted();

        if (created) {
            log.info("🔔 New {} {} alert for course {}", candidate.severity().getCode(), candidate.type().getCode(), courseId);
        } else {
            log.debug("Refreshed open {} alert {} for course {}", candidate.type().getCode(), alert.getId(), courseId);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Alert payload not serializable", e);
        }
    }

    private static double round(double value) {
        return Math.round(value * 10_000) / 10_000.0;
    }
}
