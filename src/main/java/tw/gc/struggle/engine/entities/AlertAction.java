package tw.gc.struggle.engine.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.struggle.engine.enums.AlertStatus;

import java.time.LocalDateTime;

/**
 * Audit trail of instructor actions on alerts.
 */
@Entity
@Table(name = "alert_actions", indexes = {
    @Index(name = "idx_alert_actions_alert", columnList = "alert_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertAction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "alert_id", nullable = false)
    private Long alertId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "instructor_id", length = 128)
    private String instructorId;

    @Column(nullable = false, length = 20)
    private String action; // acknowledge, start, resolve, dismiss

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", length = 16)
    private AlertStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", length = 16)
    private AlertStatus toStatus;

    @Column(length = 1000)
    private String note;

    @Column(name = "acted_at", nullable = false)
    private LocalDateTime actedAt;
}
