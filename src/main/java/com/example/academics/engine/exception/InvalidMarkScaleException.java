package com.example.academics.engine.exception;

/**
 * Raw mark recorded against a maximum that is zero or negative.
 */
public class InvalidMarkScaleException extends AcademicsException {

    public InvalidMarkScaleException(String message) {
        super("INVALID_MARK_SCALE", message);
    }
}
