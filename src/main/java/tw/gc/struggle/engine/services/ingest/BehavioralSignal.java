package tw.gc.struggle.engine.services.ingest;

import tw.gc.struggle.engine.enums.SignalType;

import java.time.Instant;

/**
 * Canonical, validated signal. Content fields are already minimised to the learner's
 * collection level.
 */
public record BehavioralSignal(
        String sessionId,
        String userId,
        String tenantId,
        String courseId,
        SignalType type,
        long durationMs,
        String elementContext,
        String pageContentHash,
        Double contentDifficulty,
        Boolean correct,
        Instant timestamp,
        String nonce,
        String origin,
        Instant receivedAt
) {
    public static final long MAX_DURATION_MS = 300_000;

    public BehavioralSignal {
        if (durationMs < 0 || durationMs > MAX_DURATION_MS) {
            throw new IllegalArgumentException("durationMs out of range: " + durationMs);
        }
    }

    /** Wrong answer on a quiz interaction. */
    public boolean isError() {
        return type == SignalType.QUIZ_INTERACTION && Boolean.FALSE.equals(correct);
    }
}
