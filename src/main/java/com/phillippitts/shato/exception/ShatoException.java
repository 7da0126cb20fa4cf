package com.phillippitts.shato.exception;

/**
 * Base exception for all application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class ShatoException extends RuntimeException {

    public ShatoException(String message) {
        super(message);
    }

    public ShatoException(String message, Throwable cause) {
        super(message, cause);
    }
}
