package org.example.lingua.service.resilience;

/**
 * Backend output that parsed but did not have the expected shape.
 */
public class ResponseValidationException extends RuntimeException {

    public ResponseValidationException(String message) {
        super(message);
    }
}
