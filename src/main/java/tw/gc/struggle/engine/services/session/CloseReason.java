package tw.gc.struggle.engine.services.session;

/**
 * Why a session actor stopped. {@link #DISCARDED} sessions flush nothing.
 */
public enum CloseReason {
    CLOSED("closed"),
    EXPIRED("expired"),
    SHUTDOWN("shutdown"),
    DISCARDED("discarded");

    private final String code;

    CloseReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean flushesState() {
        return this != DISCARDED;
    }
}
