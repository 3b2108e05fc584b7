package tw.gc.struggle.engine.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "tenant_retention_policies")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantRetentionPolicy {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, unique = true, length = 64)
    private String tenantId;

    @Column(name = "retention_days", nullable = false)
    private int retentionDays;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
