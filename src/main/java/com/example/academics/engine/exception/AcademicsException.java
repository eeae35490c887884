package com.example.academics.engine.exception;

/**
 * Base exception for every invariant the academics engine checks.
 * Carries a stable error code so callers can branch without parsing messages.
 */
public class AcademicsException extends RuntimeException {

    private final String errorCode;

    public AcademicsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AcademicsException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
