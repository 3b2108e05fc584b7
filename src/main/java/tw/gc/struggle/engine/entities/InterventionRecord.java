package tw.gc.struggle.engine.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.struggle.engine.enums.InterventionStatus;
import tw.gc.struggle.engine.enums.InterventionType;
import tw.gc.struggle.engine.enums.Urgency;
import tw.gc.struggle.engine.enums.UserResponse;

import java.time.LocalDateTime;

/**
 * A proactive intervention decided by the engine. Created synchronously before delivery
 * hand-off, then updated by delivery and response callbacks keyed by {@link #id}.
 */
@Entity
@Table(name = "proactive_interventions", indexes = {
    @Index(name = "idx_interventions_user_time", columnList = "tenant_id, user_id, triggered_at"),
    @Index(name = "idx_interventions_course_time", columnList = "tenant_id, course_id, triggered_at"),
    @Index(name = "idx_interventions_status", columnList = "status, delivered_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterventionRecord {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "session_id", nullable = false, length = 128)
    private String sessionId;

    @Column(name = "user_id", length = 128)
    private String userId;

    @Column(name = "course_id", length = 64)
    private String courseId;

    @Column(name = "struggle_assessment_id", length = 36)
    private String struggleAssessmentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "intervention_type", nullable = false, length = 32)
    private InterventionType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Urgency urgency;

    @Column(name = "message_intent", length = 64)
    private String messageIntent;

    @Column(name = "risk_level")
    private Double riskLevel;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private InterventionStatus status = InterventionStatus.TRIGGERED;

    @Column(name = "triggered_at", nullable = false)
    private LocalDateTime triggeredAt;

    @Column(name = "delivered_at")
    private LocalDateTime deliveredAt;

    @Column(name = "responded_at")
    private LocalDateTime respondedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "user_response", length = 16)
    private UserResponse userResponse;

    @Column(name = "engagement_before")
    private Double engagementBefore;

    @Column(name = "effectiveness_score")
    private Double effectivenessScore;

    @Column(name = "purge_at")
    private LocalDateTime purgeAt;

    @Column(name = "anonymized_at")
    private LocalDateTime anonymizedAt;
}
