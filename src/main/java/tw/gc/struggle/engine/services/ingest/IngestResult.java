package tw.gc.struggle.engine.services.ingest;

import org.springframework.http.HttpStatus;
import tw.gc.struggle.engine.enums.RejectionReason;

/**
 * Outcome of one submission. Dropped (rate-limited) signals answer like accepted ones.
 */
public record IngestResult(Outcome outcome, RejectionReason reason, String detail) {

    public enum Outcome {
        ACCEPTED, DROPPED, REJECTED
    }

    public static IngestResult accepted() {
        return new IngestResult(Outcome.ACCEPTED, null, null);
    }

    public static IngestResult dropped(String detail) {
        return new IngestResult(Outcome.DROPPED, null, detail);
    }

    public static IngestResult rejected(RejectionReason reason, String detail) {
        return new IngestResult(Outcome.REJECTED, reason, detail);
    }

    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }

    public boolean isRejected() {
        return outcome == Outcome.REJECTED;
    }

    public HttpStatus httpStatus() {
        if (outcome != Outcome.REJECTED) {
            return HttpStatus.ACCEPTED;
        }
        return switch (reason) {
            case SCHEMA_VIOLATION -> HttpStatus.BAD_REQUEST;
            case INVALID_ORIGIN, INVALID_SIGNATURE, CONSENT_DENIED -> HttpStatus.FORBIDDEN;
            case REPLAYED_NONCE -> HttpStatus.CONFLICT;
        };
    }
}
