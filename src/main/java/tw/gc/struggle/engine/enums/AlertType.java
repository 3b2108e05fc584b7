package tw.gc.struggle.engine.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Early-warning categories raised to instructors.
 */
public enum AlertType {
    /** Single student with a high, confident struggle risk in the window. */
    STRUGGLE_RISK("struggle_risk"),
    /** Single student who kept crossing the risk threshold. */
    REPEATED_STRUGGLE("repeated_struggle"),
    /** Single student who keeps dismissing or ignoring offered help. */
    DISENGAGEMENT("disengagement"),
    /** Single student with sustained high cognitive load and fatigue. */
    COGNITIVE_OVERLOAD("cognitive_overload"),
    /** Course-level, k-anonymous aggregate for students without analytics consent. */
    COHORT_STRUGGLE("cohort_struggle");

    private final String code;

    AlertType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isIndividual() {
        return this != COHORT_STRUGGLE;
    }

    @JsonCreator
    public static AlertType fromCode(String code) {
        for (AlertType value : values()) {
            if (value.code.equalsIgnoreCase(code) || value.name().equalsIgnoreCase(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown alert type: " + code);
    }
}
