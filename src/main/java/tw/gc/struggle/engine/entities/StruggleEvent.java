package tw.gc.struggle.engine.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.struggle.engine.enums.SuppressionReason;

import java.time.LocalDateTime;

/**
 * Persisted struggle assessment together with what the decision engine did about it.
 * Feeds the instructor alert aggregator and model recalibration.
 */
@Entity
@Table(name = "struggle_events", indexes = {
    @Index(name = "idx_struggle_course_time", columnList = "tenant_id, course_id, computed_at"),
    @Index(name = "idx_struggle_tenant_user", columnList = "tenant_id, user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StruggleEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "assessment_id", nullable = false, unique = true, length = 36)
    private String assessmentId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "session_id", nullable = false, length = 128)
    private String sessionId;

    @Column(name = "user_id", length = 128)
    private String userId;

    @Column(name = "course_id", length = 64)
    private String courseId;

    @Column(name = "risk_level", nullable = false)
    private double riskLevel;

    @Column(nullable = false)
    private double confidence;

    @Column(name = "time_to_struggle_minutes")
    private Double estimatedTimeToStruggleMinutes;

    @Column(name = "contributing_factors", length = 255)
    private String contributingFactors; // comma separated factor codes

    @Column(name = "model_version", nullable = false, length = 32)
    private String modelVersion;

    @Column(name = "computed_at", nullable = false)
    private LocalDateTime computedAt;

    @Column(name = "valid_until")
    private LocalDateTime validUntil;

    @Column(name = "cognitive_load")
    private Double cognitiveLoad;

    private Double fatigue;

    private Double engagement;

    @Column(name = "intervention_id", length = 36)
    private String interventionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "suppression_reason", length = 32)
    private SuppressionReason suppressionReason;

    @Column(name = "purge_at")
    private LocalDateTime purgeAt;

    @Column(name = "anonymized_at")
    private LocalDateTime anonymizedAt;
}
