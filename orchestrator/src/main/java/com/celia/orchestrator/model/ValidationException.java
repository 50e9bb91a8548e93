package com.celia.orchestrator.model;

/**
 * Thrown when caller input is malformed (empty task, oversized message,
 * temperature out of range...). Raised before any work begins and never retried.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
