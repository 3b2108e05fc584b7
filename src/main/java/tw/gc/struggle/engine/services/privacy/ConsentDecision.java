package tw.gc.struggle.engine.services.privacy;

import tw.gc.struggle.engine.enums.CollectionLevel;
import tw.gc.struggle.engine.enums.ConsentDenialReason;

/**
 * Outcome of a consent check: allowed (with the learner's collection level) or denied with a reason.
 */
public record ConsentDecision(boolean allowed, ConsentDenialReason denialReason, CollectionLevel collectionLevel) {

    public static ConsentDecision allowed(CollectionLevel collectionLevel) {
        return new ConsentDecision(true, null, collectionLevel);
    }

    public static ConsentDecision denied(ConsentDenialReason reason) {
        return new ConsentDecision(false, reason, null);
    }

    public boolean denied() {
        return !allowed;
    }
}
