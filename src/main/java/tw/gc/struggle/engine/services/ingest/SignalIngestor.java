package tw.gc.struggle.engine.services.ingest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tw.gc.struggle.engine.config.EngineProperties;
import tw.gc.struggle.engine.enums.CollectionLevel;
import tw.gc.struggle.engine.enums.ConsentScope;
import tw.gc.struggle.engine.enums.RejectionReason;
import tw.gc.struggle.engine.enums.SignalType;
import tw.gc.struggle.engine.exceptions.ValidationException;
import tw.gc.struggle.engine.services.ops.AuditWriter;
import tw.gc.struggle.engine.services.ops.EngineStatusService;
import tw.gc.struggle.engine.services.privacy.ConsentDecision;
import tw.gc.struggle.engine.services.privacy.ConsentGate;
import tw.gc.struggle.engine.services.privacy.DataMinimizer;
import tw.gc.struggle.engine.services.session.SessionActorRegistry;

import java.time.Clock;
import java.time.Instant;

/**
 * Validates, authenticates and normalises inbound signals, then hands them to the
 * owning session actor.
 *
 * <p>Checks run in a fixed order: schema, origin, signature, freshness and replay, consent,
 * rate limit. Nothing here throws to the caller; every outcome is an {@link IngestResult}.
 * Rejections go to the {@code SECURITY_AUDIT} log and are never retried.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignalIngestor {

    private static final Logger SECURITY_AUDIT = LoggerFactory.getLogger("SECURITY_AUDIT");

    private static final int MAX_ID_LENGTH = 128;
    private static final int MAX_NONCE_LENGTH = 128;

    private final OriginPolicy originPolicy;
    private final HmacVerifier hmacVerifier;
    private final NonceRegistry nonceRegistry;
    private final SessionRateLimiter rateLimiter;
    private final ConsentGate consentGate;
    private final DataMinimizer dataMinimizer;
    private final SessionActorRegistry actorRegistry;
    private final AuditWriter auditWriter;
    private final EngineStatusService statusService;
    private final EngineProperties properties;
    private final Clock clock;

    public IngestResult ingest(RawSignalPayload payload, String origin) {
        try {
            return doIngest(payload, origin);
        } catch (ValidationException e) {
            return reject(e.getReason(), e.getMessage(), payload, origin);
        } catch (RuntimeException e) {
            // The learner's page must never see an engine failure
            log.error("❌ Unexpected ingest failure, dropping signal: {}", e.getMessage(), e);
            statusService.recordDropped();
            return IngestResult.dropped("internal error");
        }
    }

    private IngestResult doIngest(RawSignalPayload payload, String origin) {
        Instant now = clock.instant();
        SignalType type = validateSchema(payload, now);

        if (!originPolicy.isAllowed(origin)) {
            throw new ValidationException(RejectionReason.INVALID_ORIGIN, "origin not allow-listed: " + origin);
        }

        if (!hmacVerifier.verify(payload.getSessionId(), payload.getTimestamp(), payload.getNonce(), payload.getSignature())) {
            throw new ValidationException(RejectionReason.INVALID_SIGNATURE, "signature mismatch");
        }

        Instant signalTime = Instant.ofEpochMilli(payload.getTimestamp());
        if (signalTime.isBefore(now.minusSeconds(properties.getIngest().getMaxNonceAgeSeconds()))) {
            throw new ValidationException(RejectionReason.REPLAYED_NONCE, "nonce expired");
        }
        if (!nonceRegistry.register(payload.getSessionId(), payload.getNonce(), signalTime)) {
            throw new ValidationException(RejectionReason.REPLAYED_NONCE, "nonce already used");
        }

        ConsentDecision consent = consentGate.check(payload.getTenantId(), payload.getUserId(), ConsentScope.BEHAVIORAL_TIMING);
        if (consent.denied()) {
            throw new ValidationException(RejectionReason.CONSENT_DENIED, "behavioral timing consent: " + consent.denialReason());
        }

        if (!rateLimiter.tryAcquire(payload.getSessionId())) {
            statusService.recordDropped();
            log.debug("Rate limit exceeded for session {}, dropping", payload.getSessionId());
            return IngestResult.dropped("rate limited");
        }

        BehavioralSignal signal = normalize(payload, type, signalTime, origin, consent.collectionLevel(), now);

        switch (actorRegistry.submit(signal)) {
            case ACCEPTED -> {
                statusService.recordAccepted();
                auditWriter.recordSignal(signal);
                log.debug("Signal {} accepted for session {}", type.getCode(), signal.sessionId());
                return IngestResult.accepted();
            }
            case OWNER_MISMATCH -> throw new ValidationException(RejectionReason.SCHEMA_VIOLATION,
                    "session belongs to a different learner");
            default -> {
                statusService.recordDropped();
                log.warn("⚠️ Session actors unavailable, dropping signal for session {}", signal.sessionId());
                return IngestResult.dropped("engine unavailable");
            }
        }
    }

    private SignalType validateSchema(RawSignalPayload payload, Instant now) {
        if (payload == null) {
            throw schema("empty payload");
        }
        requireId(payload.getSessionId(), "sessionId");
        requireId(payload.getUserId(), "userId");
        requireId(payload.getTenantId(), "tenantId");
        requireId(payload.getCourseId(), "courseId");

        SignalType type = SignalType.fromStringIgnoreCase(payload.getType());
        if (type == null) {
            throw schema("unknown signal type: " + payload.getType());
        }
        Long duration = payload.getDurationMs();
        if (duration == null || duration < 0 || duration > BehavioralSignal.MAX_DURATION_MS) {
            throw schema("durationMs must be within 0.." + BehavioralSignal.MAX_DURATION_MS);
        }
        if (payload.getTimestamp() == null) {
            throw schema("timestamp is required");
        }
        if (Instant.ofEpochMilli(payload.getTimestamp()).isAfter(now.plusSeconds(properties.getIngest().getMaxClockSkewSeconds()))) {
            throw schema("timestamp is in the future");
        }
        if (isBlank(payload.getNonce()) || payload.getNonce().length() > MAX_NONCE_LENGTH) {
            throw schema("nonce is required");
        }
        if (isBlank(payload.getSignature())) {
            throw schema("signature is required");
        }
        Double difficulty = payload.getContentDifficulty();
        if (difficulty != null && (difficulty.isNaN() || difficulty < 0 || difficulty > 1)) {
            throw schema("contentDifficulty must be within 0..1");
        }
        if (payload.getCorrect() != null && type != SignalType.QUIZ_INTERACTION) {
            throw schema("correct is only valid on quiz_interaction");
        }
        return type;
    }

    private BehavioralSignal normalize(RawSignalPayload payload, SignalType type, Instant signalTime,
                                       String origin, CollectionLevel level, Instant now) {
        return new BehavioralSignal(
                payload.getSessionId(),
                payload.getUserId(),
                payload.getTenantId(),
                payload.getCourseId(),
                type,
                payload.getDurationMs(),
                dataMinimizer.elementContext(payload.getElementContext(), level),
                dataMinimizer.pageContentHash(payload.getPageContentHash(), level),
                payload.getContentDifficulty(),
                payload.getCorrect(),
                signalTime,
                payload.getNonce(),
                origin,
                now);
    }

    private IngestResult reject(RejectionReason reason, String detail, RawSignalPayload payload, String origin) {
        statusService.recordRejected(reason);
        String sessionId = payload == null ? null : payload.getSessionId();
        SECURITY_AUDIT.warn("🚫 Signal rejected reason={} session={} origin={} detail={}", reason, sessionId, origin, detail);
        return IngestResult.rejected(reason, detail);
    }

    private static void requireId(String value, String field) {
        if (isBlank(value) || value.length() > MAX_ID_LENGTH) {
            throw schema(field + " is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static ValidationException schema(String detail) {
        return new ValidationException(RejectionReason.SCHEMA_VIOLATION, detail);
    }
}
