package tw.gc.struggle.engine.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Independently revocable permissions held on a consent record.
 * {@link #ALL} only appears on consent-change events and means a full withdrawal or grant.
 */
public enum ConsentScope {
    BEHAVIORAL_TIMING("behavioralTiming"),
    ASSESSMENT_PATTERNS("assessmentPatterns"),
    CHAT_INTERACTIONS("chatInteractions"),
    CROSS_COURSE_CORRELATION("crossCourseCorrelation"),
    ANONYMIZED_ANALYTICS("anonymizedAnalytics"),
    ALL("all");

    private final String code;

    ConsentScope(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ConsentScope fromCode(String code) {
        for (ConsentScope value : values()) {
            if (value.code.equalsIgnoreCase(code)
                    || value.name().equalsIgnoreCase(code)
                    || value.name().replace("_", "").equalsIgnoreCase(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown consent scope: " + code);
    }
}
