package tw.gc.struggle.engine.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of proactive support the engine may decide to offer. The engine never renders the
 * text itself; {@link #getDefaultIntent()} tells the authoring collaborator what to write.
 */
public enum InterventionType {
    PROACTIVE_CHAT("proactive_chat", "check_in"),
    CONTENT_SUGGESTION("content_suggestion", "clarify_concept"),
    BREAK_REMINDER("break_reminder", "offer_break"),
    HELP_OFFER("help_offer", "offer_help");

    private final String code;
    private final String defaultIntent;

    InterventionType(String code, String defaultIntent) {
        this.code = code;
        this.defaultIntent = defaultIntent;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDefaultIntent() {
        return defaultIntent;
    }

    @JsonCreator
    public static InterventionType fromCode(String code) {
        for (InterventionType value : values()) {
            if (value.code.equalsIgnoreCase(code) || value.name().equalsIgnoreCase(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown intervention type: " + code);
    }
}
