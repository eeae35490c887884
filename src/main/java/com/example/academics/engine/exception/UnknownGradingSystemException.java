package com.example.academics.engine.exception;

/**
 * Requested grading system code is not registered.
 */
public class UnknownGradingSystemException extends AcademicsException {

    public UnknownGradingSystemException(String message) {
        super("UNKNOWN_SYSTEM", message);
    }
}
