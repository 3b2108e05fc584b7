package tw.gc.struggle.engine.exceptions;

import tw.gc.struggle.engine.enums.ErrorCategory;

public class NotFoundException extends EngineException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.VALIDATION;
    }
}
