package tw.gc.struggle.engine.enums;

public enum PurgeReason {
    /** Consent withdrawn: purge every identifiable record of one user. */
    CONSENT_WITHDRAWAL,
    /** Tenant retention horizon passed: delete or anonymize aged rows of one tenant. */
    RETENTION
}
