package com.phillippitts.shato.exception;

/**
 * Thrown when the thread handling a request is interrupted while routing it.
 * No further state transitions are taken once this is raised.
 */
public class RequestCancelledException extends ShatoException {

    private final String correlationId;

    public RequestCancelledException(String correlationId, String message) {
        super(message);
        this.correlationId = correlationId;
    }

    public RequestCancelledException(String correlationId, String message, Throwable cause) {
        super(message, cause);
        this.correlationId = correlationId;
    }

    public String getCorrelationId() {
        return correlationId;
    }
}
