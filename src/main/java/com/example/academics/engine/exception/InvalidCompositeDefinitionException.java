package com.example.academics.engine.exception;

/**
 * Composite subject with no components, non-positive weights, or weights that do not sum to 1.0.
 */
public class InvalidCompositeDefinitionException extends AcademicsException {

    public InvalidCompositeDefinitionException(String message) {
        super("INVALID_COMPOSITE", message);
    }
}
