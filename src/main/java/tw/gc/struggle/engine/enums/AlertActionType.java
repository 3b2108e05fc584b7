package tw.gc.struggle.engine.enums;

/**
 * Instructor actions on an alert and the status each one moves it to.
 */
public enum AlertActionType {
    ACKNOWLEDGE("acknowledge", AlertStatus.ACKNOWLEDGED),
    START("start", AlertStatus.IN_PROGRESS),
    RESOLVE("resolve", AlertStatus.RESOLVED),
    DISMISS("dismiss", AlertStatus.DISMISSED);

    private final String code;
    private final AlertStatus targetStatus;

    AlertActionType(String code, AlertStatus targetStatus) {
        this.code = code;
        this.targetStatus = targetStatus;
    }

    public String getCode() {
        return code;
    }

    public AlertStatus getTargetStatus() {
        return targetStatus;
    }

    public static AlertActionType fromStringIgnoreCase(String value) {
        if (value == null) return null;
        for (AlertActionType type : values()) {
            if (type.code.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
