package tw.gc.struggle.engine.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tw.gc.struggle.engine.services.session.SessionActorRegistry;

import java.util.Map;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final SessionActorRegistry sessionRegistry;

    @PostMapping("/{sessionId}/close")
    public ResponseEntity<Map<String, String>> close(@PathVariable String sessionId) {
        if (!sessionRegistry.close(sessionId)) {
            return ResponseEntity.status(404).body(Map.of(
                    "status", "error",
                    "message", "No active session " + sessionId
            ));
        }
        return ResponseEntity.ok(Map.of("status", "closed", "sessionId", sessionId));
    }
}
