package tw.gc.struggle.engine.exceptions;

import tw.gc.struggle.engine.enums.ErrorCategory;

/**
 * Root of the engine's failure taxonomy. Unchecked: callers on the hot path convert these
 * into typed results instead of letting them escape.
 */
public abstract class EngineException extends RuntimeException {

    protected EngineException(String message) {
        super(message);
    }

    protected EngineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCategory getCategory();
}
