package tw.gc.struggle.engine.enums;

/**
 * Top-level error taxonomy used for logging and for the ingest response body.
 */
public enum ErrorCategory {
    VALIDATION,
    CONSENT,
    TRANSIENT_STORE,
    MODEL,
    RATE_LIMIT
}
