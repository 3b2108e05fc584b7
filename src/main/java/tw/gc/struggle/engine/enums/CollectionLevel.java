package tw.gc.struggle.engine.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How much contextual detail a learner allows the engine to keep with each signal.
 */
public enum CollectionLevel {
    MINIMAL("minimal"),
    STANDARD("standard"),
    COMPREHENSIVE("comprehensive");

    private final String code;

    CollectionLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static CollectionLevel fromCode(String code) {
        for (CollectionLevel value : values()) {
            if (value.code.equalsIgnoreCase(code) || value.name().equalsIgnoreCase(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown CollectionLevel: " + code);
    }
}
