package org.example.lingua.model;

public record AnswerSubmission(String questionId, String answer) {
}
