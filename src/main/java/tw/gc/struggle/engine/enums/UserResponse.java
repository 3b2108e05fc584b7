package tw.gc.struggle.engine.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal learner responses to a delivered intervention.
 */
public enum UserResponse {
    ACCEPTED("accepted"),
    DISMISSED("dismissed"),
    IGNORED("ignored"),
    TIMEOUT("timeout");

    private final String code;

    UserResponse(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static UserResponse fromCode(String code) {
        for (UserResponse value : values()) {
            if (value.code.equalsIgnoreCase(code) || value.name().equalsIgnoreCase(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown UserResponse: " + code);
    }
}
