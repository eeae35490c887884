package com.example.academics.engine.exception;

/**
 * Percentage handed to the grading vocabulary lies outside [0, 100] or is not a number.
 */
public class InvalidPercentageException extends AcademicsException {

    public InvalidPercentageException(String message) {
        super("INVALID_PERCENTAGE", message);
    }
}
