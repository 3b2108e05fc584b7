package tw.gc.struggle.engine.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.struggle.engine.enums.PurgeReason;
import tw.gc.struggle.engine.enums.PurgeTaskStatus;

import java.time.LocalDateTime;

/**
 * Durable purge work item. {@code userId} is cleared when the task completes so the ledger
 * itself holds no identifiable data; {@code subjectHash} remains for audit.
 */
@Entity
@Table(name = "purge_tasks", indexes = {
    @Index(name = "idx_purge_tasks_due", columnList = "status, next_attempt_at"),
    @Index(name = "idx_purge_tasks_subject", columnList = "tenant_id, user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PurgeTask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "user_id", length = 128)
    private String userId; // null for tenant-wide retention tasks and after completion

    @Column(name = "subject_hash", length = 64)
    private String subjectHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 24)
    private PurgeReason reason;

    @Column(name = "revoked_scopes", length = 200)
    private String revokedScopes; // comma-separated scope codes; null means a full withdrawal

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private PurgeTaskStatus status = PurgeTaskStatus.PENDING;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "next_attempt_at", nullable = false)
    private LocalDateTime nextAttemptAt;

    @Column(name = "sla_deadline", nullable = false)
    private LocalDateTime slaDeadline;

    @Column(name = "last_error", length = 500)
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "escalated_at")
    private LocalDateTime escalatedAt;
}
