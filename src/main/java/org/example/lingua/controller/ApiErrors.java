package org.example.lingua.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.lingua.config.RequestCorrelation;
import org.example.lingua.model.ApiError;
import org.example.lingua.service.resilience.GenerationErrorKind;
import org.example.lingua.service.resilience.GenerationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Locale;

final class ApiErrors {

    private ApiErrors() {
    }

    static ResponseEntity<Object> of(HttpStatus status, String message, HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(new ApiError(message, RequestCorrelation.resolveRequestId(request)));
    }

    static ResponseEntity<Object> generationFailed(GenerationException e, HttpServletRequest request) {
        HttpStatus status = e.getKind() == GenerationErrorKind.CIRCUIT_BREAKER_OPEN
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.BAD_GATEWAY;
        return of(status, "Generation failed (" + e.getKind().name().toLowerCase(Locale.ROOT) + ")", request);
    }
}
