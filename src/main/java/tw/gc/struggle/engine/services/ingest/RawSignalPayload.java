package tw.gc.struggle.engine.services.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Signal as posted by the LMS page instrumentation, before any validation.
 * Everything is nullable here; {@link SignalIngestor} decides what is acceptable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawSignalPayload {
    private String sessionId;
    private String userId;
    private String tenantId;
    private String courseId;
    private String type;
    private Long durationMs;
    private String elementContext;
    private String pageContentHash;
    private Double contentDifficulty;   // optional, 0..1 from content analysis
    private Boolean correct;            // quiz_interaction only
    private Long timestamp;             // epoch millis
    private String nonce;
    private String signature;           // hex HMAC-SHA256 over sessionId|timestamp|nonce
}
