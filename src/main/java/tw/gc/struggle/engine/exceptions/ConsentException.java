package tw.gc.struggle.engine.exceptions;

import tw.gc.struggle.engine.enums.ConsentDenialReason;
import tw.gc.struggle.engine.enums.ErrorCategory;

public class ConsentException extends EngineException {

    private final ConsentDenialReason reason;

    public ConsentException(ConsentDenialReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ConsentDenialReason getReason() {
        return reason;
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.CONSENT;
    }
}
