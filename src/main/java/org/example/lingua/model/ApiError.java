package org.example.lingua.model;

public record ApiError(String error, String requestId) {
}
