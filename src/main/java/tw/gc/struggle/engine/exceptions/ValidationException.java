package tw.gc.struggle.engine.exceptions;

import tw.gc.struggle.engine.enums.ErrorCategory;
import tw.gc.struggle.engine.enums.RejectionReason;

/**
 * Malformed, forged or replayed input. Never retried.
 */
public class ValidationException extends EngineException {

    private final RejectionReason reason;

    public ValidationException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.VALIDATION;
    }
}
