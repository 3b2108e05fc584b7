package tw.gc.struggle.engine.services.privacy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import tw.gc.struggle.engine.config.EngineProperties;
import tw.gc.struggle.engine.entities.BehavioralSignalEntry;
import tw.gc.struggle.engine.entities.InstructorAlert;
import tw.gc.struggle.engine.entities.InterventionRecord;
import tw.gc.struggle.engine.entities.PrivacyConsent;
import tw.gc.struggle.engine.entities.PurgeTask;
import tw.gc.struggle.engine.entities.SessionSummary;
import tw.gc.struggle.engine.entities.StruggleEvent;
import tw.gc.struggle.engine.entities.TenantRetentionPolicy;
import tw.gc.struggle.engine.enums.AlertSeverity;
import tw.gc.struggle.engine.enums.AlertStatus;
import tw.gc.struggle.engine.enums.AlertType;
import tw.gc.struggle.engine.enums.ConsentScope;
import tw.gc.struggle.engine.enums.InterventionType;
import tw.gc.struggle.engine.enums.PurgeReason;
import tw.gc.struggle.engine.enums.PurgeTaskStatus;
import tw.gc.struggle.engine.enums.SignalType;
import tw.gc.struggle.engine.enums.Urgency;
import tw.gc.struggle.engine.repositories.BehavioralSignalEntryRepository;
import tw.gc.struggle.engine.repositories.InstructorAlertRepository;
import tw.gc.struggle.engine.repositories.InterventionRecordRepository;
import tw.gc.struggle.engine.repositories.PrivacyConsentRepository;
import tw.gc.struggle.engine.repositories.PurgeTaskRepository;
import tw.gc.struggle.engine.repositories.SessionSummaryRepository;
import tw.gc.struggle.engine.repositories.StruggleEventRepository;
import tw.gc.struggle.engine.repositories.TenantRetentionPolicyRepository;
import tw.gc.struggle.engine.services.ops.EngineStatusService;
import tw.gc.struggle.engine.testutil.MutableClock;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DataJpaTest
@ActiveProfiles("test")
class PurgeServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 10, 0);

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private BehavioralSignalEntryRepository signalRepository;

    @Autowired
    private SessionSummaryRepository sessionSummaryRepository;

    @Autowired
    private StruggleEventRepository struggleEventRepository;

    @Autowired
    private InterventionRecordRepository interventionRepository;

    @Autowired
    private InstructorAlertRepository alertRepository;

    @Autowired
    private PrivacyConsentRepository consentRepository;

    @Autowired
    private PurgeTaskRepository purgeTaskRepository;

    @Autowired
    private TenantRetentionPolicyRepository policyRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private ConsentGate consentGate;
    private EngineStatusService statusService;
    private PurgeService purgeService;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        EngineProperties properties = new EngineProperties();
        consentGate = mock(ConsentGate.class);
        statusService = new EngineStatusService();
        RetentionPolicyService retentionPolicyService = new RetentionPolicyService(policyRepository, properties, clock);
        purgeService = new PurgeService(signalRepository, sessionSummaryRepository, struggleEventRepository,
                interventionRepository, alertRepository, consentRepository, purgeTaskRepository,
                retentionPolicyService, consentGate, statusService, clock, transactionManager);
    }

    private void learnerData(String tenantId, String userId, LocalDateTime at) {
        String sessionId = tenantId + "-" + userId + "-" + at.toLocalDate();
        signalRepository.save(BehavioralSignalEntry.builder()
                .tenantId(tenantId).sessionId(sessionId).userId(userId)
                .signalType(SignalType.CLICK).durationMs(800)
                .signalTimestamp(at).receivedAt(at)
                .build());
        sessionSummaryRepository.save(SessionSummary.builder()
                .tenantId(tenantId).sessionId(sessionId).userId(userId)
                .startedAt(at).closedAt(at.plusMinutes(30))
                .build());
        struggleEventRepository.save(StruggleEvent.builder()
                .assessmentId(UUID.randomUUID().toString())
                .tenantId(tenantId).sessionId(sessionId).userId(userId).courseId("course-101")
                .riskLevel(0.8).confidence(0.9).modelVersion("linear-v1").computedAt(at)
                .build());
        interventionRepository.save(InterventionRecord.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(tenantId).sessionId(sessionId).userId(userId).courseId("course-101")
                .type(InterventionType.PROACTIVE_CHAT).urgency(Urgency.HIGH).triggeredAt(at)
                .build());
        alertRepository.save(InstructorAlert.builder()
                .tenantId(tenantId).courseId("course-101").studentId(userId)
                .alertType(AlertType.STRUGGLE_RISK).severity(AlertSeverity.HIGH).riskScore(0.8)
                .status(AlertStatus.NEW)
                .openKey(InstructorAlert.openKey(tenantId, "course-101", userId, AlertType.STRUGGLE_RISK))
                .createdAt(at)
                .build());
    }

    private PurgeTask withdrawalTask(String tenantId, String userId) {
        return withdrawalTask(tenantId, userId, null);
    }

    private PurgeTask withdrawalTask(String tenantId, String userId, RevokedScopes revoked) {
        return purgeTaskRepository.save(PurgeTask.builder()
                .tenantId(tenantId).userId(userId).reason(PurgeReason.CONSENT_WITHDRAWAL)
                .revokedScopes(revoked == null ? null : revoked.encode())
                .status(PurgeTaskStatus.PENDING).nextAttemptAt(NOW).slaDeadline(NOW.plusHours(24)).createdAt(NOW)
                .build());
    }

    private void flushAndClear() {
        entityManager.flush();
        entityManager.clear();
    }

    @Nested
    @DisplayName("Withdrawal purge")
    class Withdrawal {

        @Test
        @DisplayName("Removes identifiable data of exactly one learner in one tenant")
        void purgesOneSubject() {
            learnerData("tenant-a", "learner-1", NOW.minusDays(1));
            learnerData("tenant-a", "learner-2", NOW.minusDays(1));
            learnerData("tenant-b", "learner-1", NOW.minusDays(1));
            consentRepository.save(PrivacyConsent.builder()
                    .tenantId("tenant-a").userId("learner-1").withdrawnAt(NOW.minusHours(1)).build());
            PurgeTask task = withdrawalTask("tenant-a", "learner-1");
            flushAndClear();

            purgeService.execute(task);
            flushAndClear();

            assertThat(signalRepository.countByTenantIdAndUserId("tenant-a", "learner-1")).isZero();
            assertThat(struggleEventRepository.countByTenantIdAndUserId("tenant-a", "learner-1")).isZero();
            assertThat(alertRepository.countByTenantIdAndStudentId("tenant-a", "learner-1")).isZero();
            assertThat(consentRepository.findByTenantIdAndUserId("tenant-a", "learner-1")).isEmpty();

            assertThat(signalRepository.countByTenantIdAndUserId("tenant-a", "learner-2")).isEqualTo(1);
            assertThat(signalRepository.countByTenantIdAndUserId("tenant-b", "learner-1")).isEqualTo(1);
            assertThat(struggleEventRepository.countByTenantIdAndUserId("tenant-b", "learner-1")).isEqualTo(1);

            assertThat(struggleEventRepository.count()).isEqualTo(3);
            assertThat(sessionSummaryRepository.count()).isEqualTo(2);
            assertThat(interventionRepository.findAll())
                    .filteredOn(record -> record.getUserId() == null)
                    .hasSize(1)
                    .allSatisfy(record -> assertThat(record.getAnonymizedAt()).isEqualTo(NOW));
            assertThat(alertRepository.findAll())
                    .filteredOn(alert -> alert.getStudentId() == null)
                    .singleElement()
                    .satisfies(alert -> {
                        assertThat(alert.getStatus()).isEqualTo(AlertStatus.DISMISSED);
                        assertThat(alert.getOpenKey()).isNull();
                    });

            PurgeTask done = purgeTaskRepository.findById(task.getId()).orElseThrow();
            assertThat(done.getStatus()).isEqualTo(PurgeTaskStatus.DONE);
            assertThat(done.getUserId()).isNull();
            assertThat(done.getCompletedAt()).isEqualTo(NOW);
            assertThat(statusService.snapshot(0).getPurgesCompleted()).isEqualTo(1);
            verify(consentGate).invalidate("tenant-a", "learner-1");
        }

        @Test
        @DisplayName("Revoked behavioral timing removes signal data but keeps intervention identity")
        void behavioralTimingOnly() {
            learnerData("tenant-a", "learner-1", NOW.minusDays(1));
            consentRepository.save(PrivacyConsent.builder()
                    .tenantId("tenant-a").userId("learner-1").chatInteractions(true).build());
            PurgeTask task = withdrawalTask("tenant-a", "learner-1", RevokedScopes.of(ConsentScope.BEHAVIORAL_TIMING));
            flushAndClear();

            purgeService.execute(task);
            flushAndClear();

            assertThat(signalRepository.countByTenantIdAndUserId("tenant-a", "learner-1")).isZero();
            assertThat(struggleEventRepository.countByTenantIdAndUserId("tenant-a", "learner-1")).isZero();
            assertThat(sessionSummaryRepository.count()).isZero();
            assertThat(alertRepository.countByTenantIdAndStudentId("tenant-a", "learner-1")).isZero();
            assertThat(interventionRepository.findAll())
                    .singleElement()
                    .satisfies(record -> assertThat(record.getUserId()).isEqualTo("learner-1"));
            assertThat(consentRepository.findByTenantIdAndUserId("tenant-a", "learner-1")).isPresent();
        }

        @Test
        @DisplayName("Revoked chat interactions only anonymizes interventions")
        void chatInteractionsOnly() {
            learnerData("tenant-a", "learner-1", NOW.minusDays(1));
            consentRepository.save(PrivacyConsent.builder()
                    .tenantId("tenant-a").userId("learner-1").behavioralTiming(true).build());
            PurgeTask task = withdrawalTask("tenant-a", "learner-1", RevokedScopes.of(ConsentScope.CHAT_INTERACTIONS));
            flushAndClear();

            purgeService.execute(task);
            flushAndClear();

            assertThat(signalRepository.countByTenantIdAndUserId("tenant-a", "learner-1")).isEqualTo(1);
            assertThat(struggleEventRepository.countByTenantIdAndUserId("tenant-a", "learner-1")).isEqualTo(1);
            assertThat(alertRepository.countByTenantIdAndStudentId("tenant-a", "learner-1")).isEqualTo(1);
            assertThat(interventionRepository.findAll())
                    .singleElement()
                    .satisfies(record -> assertThat(record.getUserId()).isNull());
            assertThat(purgeTaskRepository.findById(task.getId()).orElseThrow().getStatus())
                    .isEqualTo(PurgeTaskStatus.DONE);
        }

        @Test
        @DisplayName("Partial revocation keeps the consent record")
        void keepsActiveConsent() {
            learnerData("tenant-a", "learner-1", NOW.minusDays(1));
            consentRepository.save(PrivacyConsent.builder()
                    .tenantId("tenant-a").userId("learner-1").behavioralTiming(true).build());
            PurgeTask task = withdrawalTask("tenant-a", "learner-1", RevokedScopes.of(ConsentScope.ANONYMIZED_ANALYTICS));
            flushAndClear();

            purgeService.execute(task);
            flushAndClear();

            assertThat(signalRepository.countByTenantIdAndUserId("tenant-a", "learner-1")).isEqualTo(1);
            assertThat(alertRepository.countByTenantIdAndStudentId("tenant-a", "learner-1")).isZero();
            assertThat(consentRepository.findByTenantIdAndUserId("tenant-a", "learner-1")).isPresent();
        }

        @Test
        @DisplayName("A task without a subject cannot run")
        void missingSubject() {
            PurgeTask task = PurgeTask.builder().id(99L).tenantId("tenant-a")
                    .reason(PurgeReason.CONSENT_WITHDRAWAL).build();

            assertThatThrownBy(() -> purgeService.execute(task)).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Retention")
    class Retention {

        @Test
        @DisplayName("Applies each tenant's own horizon")
        void perTenantHorizon() {
            policyRepository.save(TenantRetentionPolicy.builder().tenantId("tenant-a").retentionDays(30).build());
            learnerData("tenant-a", "learner-1", NOW.minusDays(40));
            learnerData("tenant-a", "learner-2", NOW.minusDays(10));
            learnerData("tenant-b", "learner-1", NOW.minusDays(40));
            flushAndClear();

            PurgeService.PurgeCounts counts = purgeService.applyRetention("tenant-a");
            flushAndClear();

            assertThat(counts.signals()).isEqualTo(1);
            assertThat(counts.summaries()).isEqualTo(1);
            assertThat(counts.struggleEvents()).isEqualTo(1);
            assertThat(counts.interventions()).isEqualTo(1);
            assertThat(counts.alerts()).isZero();
            assertThat(signalRepository.countByTenantIdAndUserId("tenant-a", "learner-2")).isEqualTo(1);
            assertThat(signalRepository.countByTenantIdAndUserId("tenant-b", "learner-1")).isEqualTo(1);
        }

        @Test
        @DisplayName("Retention task is marked done after the sweep")
        void retentionTask() {
            PurgeTask task = purgeTaskRepository.save(PurgeTask.builder()
                    .tenantId("tenant-a").reason(PurgeReason.RETENTION).status(PurgeTaskStatus.FAILED)
                    .attempts(1).nextAttemptAt(NOW).slaDeadline(NOW.plusHours(24)).createdAt(NOW)
                    .build());
            flushAndClear();

            purgeService.execute(task);
            flushAndClear();

            assertThat(purgeTaskRepository.findById(task.getId()).orElseThrow().getStatus())
                    .isEqualTo(PurgeTaskStatus.DONE);
        }
    }
}
