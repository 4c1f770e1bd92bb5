package org.example.lingua.model;

import java.util.List;

public record ScoredAttempt(
        String id,
        String quizId,
        double score,
        boolean completed,
        int correctAnswers,
        int totalQuestions,
        int wordsUpdated,
        List<AnswerResult> answers
) {
    public record AnswerResult(
            String questionId,
            String answer,
            boolean correct,
            String wordId
    ) {
    }
}
