package org.example.lingua.model;

import org.example.lingua.entity.WordStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public record ProgressSummary(
        Summary summary,
        List<DailyStats> learningStats,
        List<WordProgressView> wordProgress,
        List<AttemptSummary> recentAttempts
) {
    public record Summary(
            int totalWords,
            int masteredWords,
            int needsReview,
            int currentStreak,
            int maxWordStreak,
            long totalQuizzesTaken,
            double avgScore
    ) {
    }

    public record DailyStats(
            LocalDate date,
            int quizzesTaken,
            int wordsReviewed,
            int totalQuestions,
            int correctAnswers
    ) {
    }

    public record WordProgressView(
            String wordId,
            String word,
            String translation,
            double mastery,
            WordStatus status,
            int reviewCount,
            int streak,
            LocalDateTime lastReviewed,
            LocalDateTime nextReview
    ) {
    }
}
