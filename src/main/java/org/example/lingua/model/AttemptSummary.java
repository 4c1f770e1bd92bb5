package org.example.lingua.model;

import java.time.LocalDateTime;

public record AttemptSummary(
        String id,
        String quizId,
        double score,
        int correctAnswers,
        int totalQuestions,
        boolean completed,
        LocalDateTime createdAt
) {
}
