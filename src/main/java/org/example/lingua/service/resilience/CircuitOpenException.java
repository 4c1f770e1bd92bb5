package org.example.lingua.service.resilience;

/**
 * Thrown when a call is rejected because the circuit is open.
 */
public class CircuitOpenException extends RuntimeException {

    public CircuitOpenException(String message) {
        super(message);
    }
}
