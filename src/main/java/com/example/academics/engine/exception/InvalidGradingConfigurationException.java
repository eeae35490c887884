package com.example.academics.engine.exception;

/**
 * Grade band table that leaves part of [0, 100] uncovered or repeats a label or bound.
 */
public class InvalidGradingConfigurationException extends AcademicsException {

    public InvalidGradingConfigurationException(String message) {
        super("INVALID_GRADING_CONFIG", message);
    }
}
