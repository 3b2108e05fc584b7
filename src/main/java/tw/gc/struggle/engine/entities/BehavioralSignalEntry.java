package tw.gc.struggle.engine.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.struggle.engine.enums.SignalType;

import java.time.LocalDateTime;

/**
 * Audit copy of an accepted behavioral signal, written off the hot path.
 * Content fields are already minimised to the learner's collection level.
 */
@Entity
@Table(name = "behavioral_signals", indexes = {
    @Index(name = "idx_signals_tenant_user", columnList = "tenant_id, user_id"),
    @Index(name = "idx_signals_session", columnList = "session_id"),
    @Index(name = "idx_signals_received", columnList = "tenant_id, received_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BehavioralSignalEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "session_id", nullable = false, length = 128)
    private String sessionId;

    @Column(name = "user_id", length = 128)
    private String userId;

    @Column(name = "course_id", length = 64)
    private String courseId;

    @Enumerated(EnumType.STRING)
    @Column(name = "signal_type", nullable = false, length = 32)
    private SignalType signalType;

    @Column(name = "duration_ms", nullable = false)
    private long durationMs;

    @Column(name = "element_context", length = 2000)
    private String elementContext;

    @Column(name = "page_content_hash", length = 128)
    private String pageContentHash;

    @Column(name = "correct")
    private Boolean correct;

    @Column(length = 128)
    private String nonce;

    @Column(length = 255)
    private String origin;

    @Column(name = "signal_timestamp", nullable = false)
    private LocalDateTime signalTimestamp;

    @Column(name = "received_at", nullable = false)
    private LocalDateTime receivedAt;

    @Column(name = "purge_at")
    private LocalDateTime purgeAt;

    @Column(name = "anonymized_at")
    private LocalDateTime anonymizedAt;
}
