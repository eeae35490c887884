package com.example.academics.engine.exception;

/**
 * Raw score below zero or above its maximum.
 */
public class InvalidRawMarkException extends AcademicsException {

    public InvalidRawMarkException(String message) {
        super("INVALID_RAW_MARK", message);
    }
}
