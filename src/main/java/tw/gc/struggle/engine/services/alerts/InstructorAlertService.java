package tw.gc.struggle.engine.services.alerts;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.struggle.engine.entities.AlertAction;
import tw.gc.struggle.engine.entities.InstructorAlert;
import tw.gc.struggle.engine.enums.AlertActionType;
import tw.gc.struggle.engine.enums.AlertSeverity;
import tw.gc.struggle.engine.enums.AlertStatus;
import tw.gc.struggle.engine.exceptions.IllegalTransitionException;
import tw.gc.struggle.engine.exceptions.NotFoundException;
import tw.gc.struggle.engine.repositories.AlertActionRepository;
import tw.gc.struggle.engine.repositories.InstructorAlertRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Instructor-facing alert feed and the acknowledge / start / resolve / dismiss workflow.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InstructorAlertService {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

    private final InstructorAlertRepository alertRepository;
    private final AlertActionRepository actionRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Page<AlertView> feed(String courseId, AlertSeverity severity, AlertStatus status, Pageable pageable) {
        return alertRepository.findFeed(courseId, severity, status, pageable).map(this::toView);
    }

    @Transactional
    public AlertView act(Long alertId, AlertActionType action, String instructorId, String note) {
        InstructorAlert alert = alertRepository.findById(alertId)
                .orElseThrow(() -> new NotFoundException("Alert not found: " + alertId));

        AlertStatus from = alert.getStatus();
        AlertStatus to = action.getTargetStatus();
        if (!from.canTransitionTo(to)) {
            throw new IllegalTransitionException("Alert " + alertId + " cannot go from " + from.getCode() + " to " + to.getCode());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        alert.setStatus(to);
        alert.setUpdatedAt(now);
        if (to == AlertStatus.ACKNOWLEDGED && alert.getAcknowledgedAt() == null) {
            alert.setAcknowledgedAt(now);
        }
        if (!to.isOpen()) {
            alert.setOpenKey(null);
            alert.setResolvedAt(now);
        }
        alertRepository.save(alert);

        actionRepository.save(AlertAction.builder()
                .alertId(alert.getId())
                .tenantId(alert.getTenantId())
                .instructorId(instructorId)
                .action(action.getCode())
                .fromStatus(from)
                .toStatus(to)
                .note(note)
                .actedAt(now)
                .build());

        log.info("✅ Alert {} {} -> {} by {}", alertId, from.getCode(), to.getCode(), instructorId);
        return toView(alert);
    }

    AlertView toView(InstructorAlert alert) {
        return AlertView.builder()
                .id(alert.getId())
                .courseId(alert.getCourseId())
                .instructorId(alert.getInstructorId())
                .studentId(alert.getStudentId())
                .alertType(alert.getAlertType())
                .severity(alert.getSeverity())
                .riskScore(alert.getRiskScore())
                .status(alert.getStatus())
                .evidenceCounts(parse(alert.getEvidenceCounts(), MAP_TYPE, Map.of()))
                .specificConcerns(parse(alert.getSpecificConcerns(), LIST_TYPE, List.of()))
                .recommendedActions(parse(alert.getRecommendedActions(), LIST_TYPE, List.of()))
                .windowStart(alert.getWindowStart())
                .windowEnd(alert.getWindowEnd())
                .actionDeadline(alert.getActionDeadline())
                .createdAt(alert.getCreatedAt())
                .updatedAt(alert.getUpdatedAt())
                .build();
    }

    private <T> T parse(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Unreadable alert payload: {}", e.getOriginalMessage());
            return fallback;
        }
    }
}
