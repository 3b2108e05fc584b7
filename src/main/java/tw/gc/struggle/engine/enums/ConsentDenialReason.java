package tw.gc.struggle.engine.enums;

public enum ConsentDenialReason {
    NO_RECORD,
    SCOPE_NOT_GRANTED,
    WITHDRAWN,
    STORE_UNAVAILABLE
}
