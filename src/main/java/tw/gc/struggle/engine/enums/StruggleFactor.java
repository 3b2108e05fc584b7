package tw.gc.struggle.engine.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named inputs of the struggle model. The code is what appears in
 * {@code contributingFactors} and in instructor-facing concerns.
 */
public enum StruggleFactor {
    IDLE_FREQUENCY("idle_frequency", "Frequent long idle periods"),
    ERROR_RATE("error_rate", "Elevated quiz error rate"),
    HELP_REQUEST_RATE("help_request_rate", "Repeated help requests"),
    RESPONSE_TIME_VARIABILITY("response_time_variability", "Inconsistent response times"),
    HOVER_DURATION("hover_duration", "Prolonged hovering over content");

    private final String code;
    private final String concern;

    StruggleFactor(String code, String concern) {
        this.code = code;
        this.concern = concern;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getConcern() {
        return concern;
    }

    public static StruggleFactor fromCode(String code) {
        for (StruggleFactor factor : values()) {
            if (factor.code.equalsIgnoreCase(code)) {
                return factor;
            }
        }
        throw new IllegalArgumentException("Unknown struggle factor: " + code);
    }
}
