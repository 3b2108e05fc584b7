package tw.gc.struggle.engine.controllers;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tw.gc.struggle.engine.services.ops.EngineStatusService;
import tw.gc.struggle.engine.services.session.SessionActorRegistry;

@RestController
@RequestMapping("/api/engine")
@RequiredArgsConstructor
public class EngineStatusController {

    private final EngineStatusService statusService;
    private final SessionActorRegistry sessionRegistry;

    @GetMapping("/status")
    public EngineStatusService.StatusSnapshot status() {
        return statusService.snapshot(sessionRegistry.activeSessions());
    }
}
