package org.example.lingua.model;

import org.example.lingua.entity.Difficulty;

import java.time.LocalDateTime;
import java.util.List;

public record QuizResults(
        String quizId,
        String title,
        Difficulty difficulty,
        List<AttemptResult> attempts
) {
    public record AttemptResult(
            AttemptSummary attempt,
            List<AnsweredQuestion> answers
    ) {
    }

    public record AnsweredQuestion(
            String questionId,
            String question,
            String answer,
            boolean correct,
            String correctAnswer,
            LocalDateTime answeredAt
    ) {
    }
}
