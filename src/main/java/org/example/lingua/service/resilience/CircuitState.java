package org.example.lingua.service.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
