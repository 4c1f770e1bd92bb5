package org.example.lingua.service.llm;

/**
 * Exception thrown when a provider call fails. Carries the HTTP status of the
 * backend response when there was one.
 */
public class LlmProviderException extends RuntimeException {

    private final Integer statusCode;

    public LlmProviderException(String message) {
        this(message, null, null);
    }

    public LlmProviderException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public LlmProviderException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
