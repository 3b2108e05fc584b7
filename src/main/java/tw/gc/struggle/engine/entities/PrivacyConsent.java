package tw.gc.struggle.engine.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.struggle.engine.enums.CollectionLevel;
import tw.gc.struggle.engine.enums.ConsentScope;

import java.time.LocalDateTime;

/**
 * Per-tenant, per-user consent record. The write path belongs to the consent UI; the engine
 * reads it on every signal and every intervention.
 */
@Entity
@Table(name = "privacy_consent", uniqueConstraints = {
    @UniqueConstraint(name = "uk_consent_tenant_user", columnNames = {"tenant_id", "user_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrivacyConsent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "behavioral_timing", nullable = false)
    private boolean behavioralTiming;

    @Column(name = "assessment_patterns", nullable = false)
    private boolean assessmentPatterns;

    @Column(name = "chat_interactions", nullable = false)
    private boolean chatInteractions;

    @Column(name = "cross_course_correlation", nullable = false)
    private boolean crossCourseCorrelation;

    @Column(name = "anonymized_analytics", nullable = false)
    private boolean anonymizedAnalytics;

    @Enumerated(EnumType.STRING)
    @Column(name = "collection_level", nullable = false, length = 16)
    @Builder.Default
    private CollectionLevel collectionLevel = CollectionLevel.STANDARD;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "withdrawn_at")
    private LocalDateTime withdrawnAt;

    public boolean isGranted(ConsentScope scope) {
        return switch (scope) {
            case BEHAVIORAL_TIMING -> behavioralTiming;
            case ASSESSMENT_PATTERNS -> assessmentPatterns;
            case CHAT_INTERACTIONS -> chatInteractions;
            case CROSS_COURSE_CORRELATION -> crossCourseCorrelation;
            case ANONYMIZED_ANALYTICS -> anonymizedAnalytics;
            case ALL -> behavioralTiming && assessmentPatterns && chatInteractions
                    && crossCourseCorrelation && anonymizedAnalytics;
        };
    }

    public void setGranted(ConsentScope scope, boolean granted) {
        switch (scope) {
            case BEHAVIORAL_TIMING -> behavioralTiming = granted;
            case ASSESSMENT_PATTERNS -> assessmentPatterns = granted;
            case CHAT_INTERACTIONS -> chatInteractions = granted;
            case CROSS_COURSE_CORRELATION -> crossCourseCorrelation = granted;
            case ANONYMIZED_ANALYTICS -> anonymizedAnalytics = granted;
            case ALL -> {
                behavioralTiming = granted;
                assessmentPatterns = granted;
                chatInteractions = granted;
                crossCourseCorrelation = granted;
                anonymizedAnalytics = granted;
            }
        }
    }

    public boolean isWithdrawn() {
        return withdrawnAt != null;
    }
}
