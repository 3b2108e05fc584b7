package tw.gc.struggle.engine.controllers;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tw.gc.struggle.engine.enums.AlertActionType;
import tw.gc.struggle.engine.enums.AlertSeverity;
import tw.gc.struggle.engine.enums.AlertStatus;
import tw.gc.struggle.engine.exceptions.IllegalTransitionException;
import tw.gc.struggle.engine.exceptions.NotFoundException;
import tw.gc.struggle.engine.services.alerts.AlertView;
import tw.gc.struggle.engine.services.alerts.InstructorAlertService;

import java.util.Map;

/**
 * Instructor dashboard API: paginated alert feed and alert workflow actions.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
@Slf4j
public class AlertController {

    private static final int MAX_PAGE_SIZE = 100;

    private final InstructorAlertService alertService;

    @GetMapping
    public ResponseEntity<?> feed(@RequestParam(required = false) String courseId,
                                  @RequestParam(required = false) String severity,
                                  @RequestParam(required = false) String status,
                                  @RequestParam(defaultValue = "0") int page,
                                  @RequestParam(defaultValue = "20") int size) {
        try {
            AlertSeverity severityFilter = severity == null ? null : AlertSeverity.fromCode(severity);
            AlertStatus statusFilter = status == null ? null : AlertStatus.fromCode(status);
            PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
                    Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")));
            Page<AlertView> alerts = alertService.feed(courseId, severityFilter, statusFilter, pageable);
            return ResponseEntity.ok(alerts);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("status", "error", "message", e.getMessage()));
        }
    }

    @PostMapping("/{id}/{action}")
    public ResponseEntity<?> act(@PathVariable Long id, @PathVariable String action,
                                 @RequestBody(required = false) ActionRequest request) {
        AlertActionType type = AlertActionType.fromStringIgnoreCase(action);
        if (type == null) {
            return ResponseEntity.badRequest().body(Map.of("status", "error", "message", "Unknown action: " + action));
        }
        ActionRequest body = request != null ? request : new ActionRequest();
        try {
            return ResponseEntity.ok(alertService.act(id, type, body.getInstructorId(), body.getNote()));
        } catch (NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("status", "error", "message", e.getMessage()));
        } catch (IllegalTransitionException e) {
            log.warn("⚠️ Rejected alert action: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("status", "error", "message", e.getMessage()));
        }
    }

    @Data
    @NoArgsConstructor
    public static class ActionRequest {
        private String instructorId;
        private String note;
    }
}
