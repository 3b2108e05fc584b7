package tw.gc.struggle.engine.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tw.gc.struggle.engine.services.ingest.IngestResult;
import tw.gc.struggle.engine.services.ingest.RawSignalPayload;
import tw.gc.struggle.engine.services.ingest.SignalIngestor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for behavioral signals posted by the embedded LMS client.
 */
@RestController
@RequestMapping("/api/signals")
@RequiredArgsConstructor
@Slf4j
public class SignalController {

    private final SignalIngestor signalIngestor;

    @PostMapping
    public ResponseEntity<Map<String, String>> submit(@RequestBody RawSignalPayload payload,
                                                      @RequestHeader(value = "Origin", required = false) String origin) {
        IngestResult result = signalIngestor.ingest(payload, origin);

        Map<String, String> body = new LinkedHashMap<>();
        // dropped signals are indistinguishable from accepted ones to the client
        body.put("status", result.isRejected() ? "rejected" : "accepted");
        if (result.isRejected()) {
            body.put("reason", result.reason().name());
            if (result.detail() != null) {
                body.put("detail", result.detail());
            }
        }
        return ResponseEntity.status(result.httpStatus()).body(body);
    }
}
