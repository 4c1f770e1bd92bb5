package org.example.lingua.service.resilience;

/**
 * A generation call that failed after all retry attempts.
 */
public class GenerationException extends RuntimeException {

    private final GenerationErrorKind kind;

    public GenerationException(String message, GenerationErrorKind kind, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public GenerationErrorKind getKind() {
        return kind;
    }
}
