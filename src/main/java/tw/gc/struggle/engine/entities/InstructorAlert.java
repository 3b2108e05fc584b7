package tw.gc.struggle.engine.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.struggle.engine.enums.AlertSeverity;
import tw.gc.struggle.engine.enums.AlertStatus;
import tw.gc.struggle.engine.enums.AlertType;

import java.time.LocalDateTime;

/**
 * Early-warning alert for an instructor.
 *
 * <p>{@code openKey} is {@code tenantId|courseId|studentId|alertType} while the alert is open and
 * null once it is resolved or dismissed; the unique constraint on it is what keeps
 * aggregation idempotent.</p>
 */
@Entity
@Table(name = "instructor_alerts", indexes = {
    @Index(name = "idx_alerts_course_status", columnList = "course_id, status"),
    @Index(name = "idx_alerts_tenant_student", columnList = "tenant_id, student_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstructorAlert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "course_id", nullable = false, length = 64)
    private String courseId;

    @Column(name = "instructor_id", length = 128)
    private String instructorId;

    @Column(name = "student_id", length = 128)
    private String studentId; // null for cohort alerts and after anonymization

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_type", nullable = false, length = 32)
    private AlertType alertType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertSeverity severity;

    @Column(name = "risk_score")
    private double riskScore;

    @Column(name = "evidence_counts", columnDefinition = "TEXT")
    private String evidenceCounts; // JSON object

    @Column(name = "specific_concerns", columnDefinition = "TEXT")
    private String specificConcerns; // JSON array

    @Column(name = "recommended_actions", columnDefinition = "TEXT")
    private String recommendedActions; // JSON array

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private AlertStatus status = AlertStatus.NEW;

    @Column(name = "open_key", unique = true, length = 320)
    private String openKey;

    @Column(name = "window_start")
    private LocalDateTime windowStart;

    @Column(name = "window_end")
    private LocalDateTime windowEnd;

    @Column(name = "action_deadline")
    private LocalDateTime actionDeadline;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "acknowledged_at")
    private LocalDateTime acknowledgedAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "anonymized_at")
    private LocalDateTime anonymizedAt;

    public static String openKey(String tenantId, String courseId, String studentId, AlertType type) {
        return tenantId + "|" + courseId + "|" + (studentId == null ? "*" : studentId) + "|" + type.getCode();
    }
}
