package tw.gc.struggle.engine.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Final state of a session actor, flushed when the session is closed or idle-expires.
 * Live session state is never persisted.
 */
@Entity
@Table(name = "session_states", indexes = {
    @Index(name = "idx_session_states_tenant_user", columnList = "tenant_id, user_id"),
    @Index(name = "idx_session_states_closed", columnList = "tenant_id, closed_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummary {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "session_id", nullable = false, unique = true, length = 128)
    private String sessionId;

    @Column(name = "user_id", length = 128)
    private String userId;

    @Column(name = "course_id", length = 64)
    private String courseId;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "last_signal_at")
    private LocalDateTime lastSignalAt;

    @Column(name = "closed_at", nullable = false)
    private LocalDateTime closedAt;

    @Column(name = "close_reason", length = 20)
    private String closeReason; // closed, expired

    @Column(name = "signal_count")
    private long signalCount;

    @Column(name = "assessment_count")
    private int assessmentCount;

    @Column(name = "last_risk_level")
    private Double lastRiskLevel;

    @Column(name = "avg_response_time_ms")
    private Double avgResponseTimeMs;

    @Column(name = "help_request_rate")
    private Double helpRequestRate;

    @Column(name = "error_rate")
    private Double errorRate;

    @Column(name = "idle_count")
    private Integer idleCount;

    private Double attention;

    private Double fatigue;

    @Column(name = "cognitive_load")
    private Double cognitiveLoad;

    @Column(name = "purge_at")
    private LocalDateTime purgeAt;
}
