package tw.gc.struggle.engine.controllers;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tw.gc.struggle.engine.entities.PrivacyConsent;
import tw.gc.struggle.engine.entities.TenantRetentionPolicy;
import tw.gc.struggle.engine.enums.CollectionLevel;
import tw.gc.struggle.engine.enums.ConsentScope;
import tw.gc.struggle.engine.services.privacy.ConsentService;
import tw.gc.struggle.engine.services.privacy.RetentionPolicyService;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Consent-UI write path: change events, full record upserts and tenant retention policy.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ConsentController {

    private final ConsentService consentService;
    private final RetentionPolicyService retentionPolicyService;

    @PostMapping("/consent/webhook")
    public ResponseEntity<Map<String, String>> webhook(@RequestBody ConsentChangeRequest request) {
        if (isBlank(request.getTenantId()) || isBlank(request.getUserId()) || isBlank(request.getScope())) {
            return badRequest("tenantId, userId and scope are required");
        }
        boolean granted;
        if ("granted".equalsIgnoreCase(request.getAction())) {
            granted = true;
        } else if ("withdrawn".equalsIgnoreCase(request.getAction())) {
            granted = false;
        } else {
            return badRequest("action must be granted or withdrawn");
        }
        try {
            ConsentScope scope = ConsentScope.fromCode(request.getScope());
            consentService.handleWebhook(request.getTenantId(), request.getUserId(), scope, granted);
            return ResponseEntity.ok(Map.of("status", "success"));
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }
    }

    @PutMapping("/consent")
    public ResponseEntity<?> upsert(@RequestBody ConsentRecordRequest request) {
        if (isBlank(request.getTenantId()) || isBlank(request.getUserId())) {
            return badRequest("tenantId and userId are required");
        }
        try {
            PrivacyConsent incoming = PrivacyConsent.builder()
                    .tenantId(request.getTenantId())
                    .userId(request.getUserId())
                    .behavioralTiming(request.isBehavioralTiming())
                    .assessmentPatterns(request.isAssessmentPatterns())
                    .chatInteractions(request.isChatInteractions())
                    .crossCourseCorrelation(request.isCrossCourseCorrelation())
                    .anonymizedAnalytics(request.isAnonymizedAnalytics())
                    .collectionLevel(request.getCollectionLevel() == null
                            ? CollectionLevel.STANDARD : CollectionLevel.fromCode(request.getCollectionLevel()))
                    .withdrawnAt(request.isWithdrawn() ? LocalDateTime.now() : null)
                    .build();
            return ResponseEntity.ok(consentService.upsert(incoming));
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }
    }

    @PutMapping("/retention-policies/{tenantId}")
    public ResponseEntity<?> updateRetention(@PathVariable String tenantId, @RequestBody RetentionRequest request) {
        try {
            TenantRetentionPolicy policy = retentionPolicyService.updatePolicy(tenantId, request.getRetentionDays());
            return ResponseEntity.ok(policy);
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("status", "error", "message", message));
    }

    @Data
    @NoArgsConstructor
    public static class ConsentChangeRequest {
        private String tenantId;
        private String userId;
        private String scope;
        private String action;
    }

    @Data
    @NoArgsConstructor
    public static class ConsentRecordRequest {
        private String tenantId;
        private String userId;
        private boolean behavioralTiming;
        private boolean assessmentPatterns;
        private boolean chatInteractions;
        private boolean crossCourseCorrelation;
        private boolean anonymizedAnalytics;
        private String collectionLevel;
        private boolean withdrawn;
    }

    @Data
    @NoArgsConstructor
    public static class RetentionRequest {
        private int retentionDays;
    }
}
