package com.phillippitts.shato.exception;

/**
 * Thrown when a collaborator (generation model or robot validator) cannot be reached,
 * answers with a non-success status, or does not answer within its timeout.
 *
 * <p>Fatal for the current request and never counted against the command retry budget.
 */
public class UpstreamUnavailableException extends ShatoException {

    private final String service;

    public UpstreamUnavailableException(String service, String message) {
        super(message + " (service: " + service + ")");
        this.service = service;
    }

    public UpstreamUnavailableException(String service, String message, Throwable cause) {
        super(message + " (service: " + service + ")", cause);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
