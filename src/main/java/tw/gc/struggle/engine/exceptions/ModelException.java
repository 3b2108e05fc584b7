package tw.gc.struggle.engine.exceptions;

import tw.gc.struggle.engine.enums.ErrorCategory;

/**
 * Feature extraction or scoring failed on malformed input. Contained to one session.
 */
public class ModelException extends EngineException {

    public ModelException(String message) {
        super(message);
    }

    public ModelException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.MODEL;
    }
}
