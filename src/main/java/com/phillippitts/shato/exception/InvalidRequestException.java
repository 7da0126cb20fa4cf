package com.phillippitts.shato.exception;

/**
 * Thrown when an inbound request is missing required input (e.g. blank {@code user_input}).
 */
public class InvalidRequestException extends ShatoException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
