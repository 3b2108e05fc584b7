package tw.gc.struggle.engine.services.intervention;

import tw.gc.struggle.engine.entities.InterventionRecord;
import tw.gc.struggle.engine.enums.SuppressionReason;

/**
 * Either a triggered intervention (persisted record plus delivery command) or a suppression
 * with its reason.
 */
public record InterventionDecision(InterventionRecord record, InterventionCommand command,
                                   SuppressionReason suppressionReason) {

    public static InterventionDecision triggered(InterventionRecord record, InterventionCommand command) {
        return new InterventionDecision(record, command, null);
    }

    public static InterventionDecision suppressed(SuppressionReason reason) {
        return new InterventionDecision(null, null, reason);
    }

    public boolean isTriggered() {
        return record != null;
    }
}
