package org.example.lingua.service.resilience;

public enum GenerationErrorKind {
    VALIDATION_ERROR,
    JSON_PARSE_ERROR,
    RATE_LIMIT_ERROR,
    TIMEOUT_ERROR,
    NETWORK_ERROR,
    AUTHENTICATION_ERROR,
    CIRCUIT_BREAKER_OPEN,
    UNKNOWN_ERROR
}
