package tw.gc.struggle.engine.enums;

/**
 * Why the decision engine did not fire an intervention for an assessment.
 * Suppression is a normal outcome, not an error.
 */
public enum SuppressionReason {
    LOW_RISK,
    LOW_CONFIDENCE,
    DAILY_CAP,
    COOLDOWN,
    NO_CONSENT,
    STORE_UNAVAILABLE,
    BUDGET_EXCEEDED
}
