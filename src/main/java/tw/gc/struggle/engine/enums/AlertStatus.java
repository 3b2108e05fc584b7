package tw.gc.struggle.engine.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Instructor-facing alert lifecycle. {@code resolved} and {@code dismissed} are terminal.
 */
public enum AlertStatus {
    NEW("new"),
    ACKNOWLEDGED("acknowledged"),
    IN_PROGRESS("in_progress"),
    RESOLVED("resolved"),
    DISMISSED("dismissed");

    private final String code;

    AlertStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isOpen() {
        return this == NEW || this == ACKNOWLEDGED || this == IN_PROGRESS;
    }

    public boolean canTransitionTo(AlertStatus target) {
        return switch (this) {
            case NEW -> target != NEW;
            case ACKNOWLEDGED -> target == IN_PROGRESS || target == RESOLVED || target == DISMISSED;
            case IN_PROGRESS -> target == RESOLVED || target == DISMISSED;
            case RESOLVED, DISMISSED -> false;
        };
    }

    @JsonCreator
    public static AlertStatus fromCode(String code) {
        for (AlertStatus value : values()) {
            if (value.code.equalsIgnoreCase(code) || value.name().equalsIgnoreCase(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown AlertStatus: " + code);
    }
}
