package tw.gc.struggle.engine.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Behavioral signal categories captured by the LMS page instrumentation.
 */
public enum SignalType {
    HOVER("hover"),
    SCROLL("scroll"),
    IDLE("idle"),
    CLICK("click"),
    HELP_REQUEST("help_request"),
    QUIZ_INTERACTION("quiz_interaction"),
    PAGE_LEAVE("page_leave"),
    FOCUS_CHANGE("focus_change");

    private final String code;

    SignalType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Response-time bearing interactions: the learner acted on something.
     */
    public boolean isResponse() {
        return this == CLICK || this == QUIZ_INTERACTION;
    }

    /**
     * Signals that indicate the learner moved attention away from the task.
     */
    public boolean isTaskSwitch() {
        return this == FOCUS_CHANGE || this == PAGE_LEAVE;
    }

    @JsonCreator
    public static SignalType fromCode(String code) {
        SignalType type = fromStringIgnoreCase(code);
        if (type == null) {
            throw new IllegalArgumentException("Unknown signal type: " + code);
        }
        return type;
    }

    public static SignalType fromStringIgnoreCase(String value) {
        if (value == null) return null;
        for (SignalType type : values()) {
            if (type.code.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
