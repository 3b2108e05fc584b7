package tw.gc.struggle.engine.enums;

/**
 * Purge task ledger states. {@code FAILED} tasks are retried with backoff until the
 * attempt budget is spent, then {@code ESCALATED} to an operator.
 */
public enum PurgeTaskStatus {
    PENDING,
    FAILED,
    DONE,
    ESCALATED
}
