package tw.gc.struggle.engine.enums;

/**
 * Typed reasons a submitted signal is refused. None of them is retried: they are client
 * bugs or attacks, not transient failures.
 */
public enum RejectionReason {
    SCHEMA_VIOLATION(ErrorCategory.VALIDATION),
    INVALID_ORIGIN(ErrorCategory.VALIDATION),
    INVALID_SIGNATURE(ErrorCategory.VALIDATION),
    REPLAYED_NONCE(ErrorCategory.VALIDATION),
    CONSENT_DENIED(ErrorCategory.CONSENT);

    private final ErrorCategory category;

    RejectionReason(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
