package tw.gc.struggle.engine.controllers;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tw.gc.struggle.engine.entities.InterventionRecord;
import tw.gc.struggle.engine.enums.UserResponse;
import tw.gc.struggle.engine.exceptions.IllegalTransitionException;
import tw.gc.struggle.engine.exceptions.NotFoundException;
import tw.gc.struggle.engine.services.intervention.InterventionResponseService;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Completion callbacks from the chat delivery collaborator.
 */
@RestController
@RequestMapping("/api/interventions")
@RequiredArgsConstructor
@Slf4j
public class InterventionController {

    private final InterventionResponseService responseService;

    @PostMapping("/{id}/delivered")
    public ResponseEntity<Map<String, Object>> delivered(@PathVariable String id) {
        try {
            return ResponseEntity.ok(view(responseService.markDelivered(id)));
        } catch (NotFoundException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @PostMapping("/{id}/response")
    public ResponseEntity<Map<String, Object>> respond(@PathVariable String id, @RequestBody ResponseRequest request) {
        UserResponse response;
        try {
            response = UserResponse.fromCode(request.getResponse());
        } catch (IllegalArgumentException | NullPointerException e) {
            return error(HttpStatus.BAD_REQUEST, "Unknown response: " + request.getResponse());
        }
        try {
            return ResponseEntity.ok(view(responseService.recordResponse(id, response)));
        } catch (NotFoundException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalTransitionException e) {
            return error(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    private static Map<String, Object> view(InterventionRecord record) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("interventionId", record.getId());
        body.put("status", record.getStatus());
        body.put("userResponse", record.getUserResponse());
        body.put("deliveredAt", record.getDeliveredAt());
        body.put("respondedAt", record.getRespondedAt());
        return body;
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("status", "error", "message", message));
    }

    @Data
    @NoArgsConstructor
    public static class ResponseRequest {
        private String response;
    }
}
