package org.example.lingua.service.resilience;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.example.lingua.service.llm.LlmProviderException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps failures from a generation attempt onto {@link GenerationErrorKind}.
 * Exception types are checked first, then the HTTP status carried by
 * {@link LlmProviderException}, then keywords in the message chain.
 */
public final class GenerationErrorClassifier {

    private GenerationErrorClassifier() {
    }

    public static GenerationErrorKind classify(Throwable error) {
        Throwable root = unwrap(error);
        if (root == null) {
            return GenerationErrorKind.UNKNOWN_ERROR;
        }

        for (Throwable current = root; current != null; current = nextCause(current)) {
            GenerationErrorKind byType = classifyByType(current);
            if (byType != null) {
                return byType;
            }
        }

        for (Throwable current = root; current != null; current = nextCause(current)) {
            if (current instanceof LlmProviderException providerError && providerError.getStatusCode() != null) {
                GenerationErrorKind byStatus = classifyByStatus(providerError.getStatusCode());
                if (byStatus != null) {
                    return byStatus;
                }
            }
        }

        for (Throwable current = root; current != null; current = nextCause(current)) {
            GenerationErrorKind byMessage = classifyByMessage(current.getMessage());
            if (byMessage != null) {
                return byMessage;
            }
        }
        return GenerationErrorKind.UNKNOWN_ERROR;
    }

    private static GenerationErrorKind classifyByType(Throwable error) {
        if (error instanceof CircuitOpenException) {
            return GenerationErrorKind.CIRCUIT_BREAKER_OPEN;
        }
        if (error instanceof ResponseValidationException) {
            return GenerationErrorKind.VALIDATION_ERROR;
        }
        if (error instanceof JsonProcessingException) {
            return GenerationErrorKind.JSON_PARSE_ERROR;
        }
        if (error instanceof TimeoutException || error instanceof SocketTimeoutException) {
            return GenerationErrorKind.TIMEOUT_ERROR;
        }
        if (error instanceof ConnectException || error instanceof UnknownHostException) {
            return GenerationErrorKind.NETWORK_ERROR;
        }
        return null;
    }

    private static GenerationErrorKind classifyByStatus(int status) {
        if (status == 429) {
            return GenerationErrorKind.RATE_LIMIT_ERROR;
        }
        if (status == 401 || status == 403) {
            return GenerationErrorKind.AUTHENTICATION_ERROR;
        }
        if (status == 408 || status == 504) {
            return GenerationErrorKind.TIMEOUT_ERROR;
        }
        return null;
    }

    private static GenerationErrorKind classifyByMessage(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("circuit breaker is open")) {
            return GenerationErrorKind.CIRCUIT_BREAKER_OPEN;
        }
        if (lower.contains("validation")) {
            return GenerationErrorKind.VALIDATION_ERROR;
        }
        if (lower.contains("json")) {
            return GenerationErrorKind.JSON_PARSE_ERROR;
        }
        if (lower.contains("rate limit") || lower.contains("quota") || lower.contains("too many requests")) {
            return GenerationErrorKind.RATE_LIMIT_ERROR;
        }
        if (lower.contains("timeout") || lower.contains("timed out")) {
            return GenerationErrorKind.TIMEOUT_ERROR;
        }
        if (lower.contains("network") || lower.contains("connection") || lower.contains("fetch")) {
            return GenerationErrorKind.NETWORK_ERROR;
        }
        if (lower.contains("api key") || lower.contains("unauthorized") || lower.contains("authentication")) {
            return GenerationErrorKind.AUTHENTICATION_ERROR;
        }
        return null;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static Throwable nextCause(Throwable error) {
        Throwable cause = error.getCause();
        return cause == error ? null : cause;
    }
}
