package tw.gc.struggle.engine.exceptions;

import tw.gc.struggle.engine.enums.ErrorCategory;

/**
 * A callback or instructor action that does not fit the record's current state.
 */
public class IllegalTransitionException extends EngineException {

    public IllegalTransitionException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.VALIDATION;
    }
}
