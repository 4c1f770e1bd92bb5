package org.example.lingua.model;

import org.example.lingua.entity.Difficulty;

import java.time.LocalDateTime;

public record QuizOverview(
        String id,
        String title,
        String description,
        Difficulty difficulty,
        int questionCount,
        int storedQuestions,
        LocalDateTime createdAt,
        AttemptSummary lastAttempt
) {
}
