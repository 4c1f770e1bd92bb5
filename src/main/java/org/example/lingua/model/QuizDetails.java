package org.example.lingua.model;

import org.example.lingua.entity.Difficulty;
import org.example.lingua.entity.QuestionType;

import java.time.LocalDateTime;
import java.util.List;

public record QuizDetails(
        String id,
        String title,
        String description,
        Difficulty difficulty,
        int questionCount,
        String vocabularyListId,
        LocalDateTime createdAt,
        List<Question> questions
) {
    /**
     * A question as shown to the learner; the correct answer is withheld.
     */
    public record Question(
            String id,
            String question,
            QuestionType type,
            List<String> options,
            String context,
            Difficulty difficulty,
            String wordId
    ) {
    }
}
