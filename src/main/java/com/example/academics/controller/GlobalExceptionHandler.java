package com.example.academics.controller;

import com.example.academics.dto.ApiError;
import com.example.academics.engine.exception.AcademicsException;
import com.example.academics.engine.exception.InvalidCompositeDefinitionException;
import com.example.academics.engine.exception.InvalidGradingConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps engine and request errors to {@code {code, message}} bodies.
 * <p>
 * Broken catalog or grading configuration is answered with 422: the request was fine, the
 * data it refers to is not. Everything else the engine rejects is a 400.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AcademicsException.class)
    public ResponseEntity<ApiError> handleAcademicsException(AcademicsException e) {
        log.warn("Rejected: [{}] {}", e.getErrorCode(), e.getMessage());
        HttpStatus status = e instanceof InvalidCompositeDefinitionException
                || e instanceof InvalidGradingConfigurationException
                ? HttpStatus.UNPROCESSABLE_ENTITY
                : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(new ApiError(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiError handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Bad request: {}", e.getMessage());
        return new ApiError("BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiError handleMalformedRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return new ApiError("BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ApiError handleNoResourceFound(NoResourceFoundException e) {
        log.debug("No resource: {}", e.getResourcePath());
        return new ApiError("NOT_FOUND", "Not found");
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ApiError handleGenericException(Exception e) {
        log.error("Unhandled error", e);
        return new ApiError("SYSTEM_ERROR", "Internal error");
    }
}
