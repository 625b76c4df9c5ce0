package com.fooddash.common.exception;

/**
 * Exception thrown when a caller lacks the role required for an operation
 * HTTP Status: 403 Forbidden (set in GlobalExceptionHandler)
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
