package tw.gc.struggle.engine.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Intervention urgency. Higher {@link #getRank()} wins when candidates compete.
 */
public enum Urgency {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3);

    private final String code;
    private final int rank;

    Urgency(String code, int rank) {
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
    public static Urgency fromCode(String code) {
        for (Urgency value : values()) {
            if (value.code.equalsIgnoreCase(code) || value.name().equalsIgnoreCase(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown urgency: " + code);
    }
}
