package tw.gc.struggle.engine.exceptions;

import tw.gc.struggle.engine.enums.ErrorCategory;

/**
 * Persistence failure or timeout that may succeed on retry.
 */
public class TransientStoreException extends EngineException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.TRANSIENT_STORE;
    }
}
