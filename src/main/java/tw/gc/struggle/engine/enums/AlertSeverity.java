package tw.gc.struggle.engine.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Alert severity. Higher {@link #getRank()} wins when alerts are ranked for a course.
 */
public enum AlertSeverity {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3),
    CRITICAL("critical", 4);

    private final String code;
    private final int rank;

    AlertSeverity(String code, int rank) {
        this.code = code;
        this.rank = rank;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getRank() {
        return rank;
    }

    @JsonCreator
    public static AlertSeverity fromCode(String code) {
        for (AlertSeverity value : values()) {
            if (value.code.equalsIgnoreCase(code) || value.name().equalsIgnoreCase(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown alert severity: " + code);
    }
}
