package tw.gc.struggle.engine.services.alerts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.struggle.engine.enums.AlertSeverity;
import tw.gc.struggle.engine.enums.AlertStatus;
import tw.gc.struggle.engine.enums.AlertType;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Alert as returned by the instructor feed, with its JSON columns expanded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertView {
    private Long id;
    private String courseId;
    private String instructorId;
    private String studentId;
    private AlertType alertType;
    private AlertSeverity severity;
    private double riskScore;
    private AlertStatus status;
    private Map<String, Object> evidenceCounts;
    private List<String> specificConcerns;
    private List<String> recommendedActions;
    private LocalDateTime windowStart;
    private LocalDateTime windowEnd;
    private LocalDateTime actionDeadline;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
