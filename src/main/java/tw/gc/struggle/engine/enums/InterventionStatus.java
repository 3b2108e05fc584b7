package tw.gc.struggle.engine.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a proactive intervention: triggered, then delivered, then responded.
 */
public enum InterventionStatus {
    TRIGGERED("triggered"),
    DELIVERED("delivered"),
    RESPONDED("responded");

    private final String code;

    InterventionStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static InterventionStatus fromCode(String code) {
        for (InterventionStatus value : values()) {
            if (value.code.equalsIgnoreCase(code) || value.name().equalsIgnoreCase(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown InterventionStatus: " + code);
    }
}
