package org.example.lingua.service.generation;

import org.example.lingua.entity.Difficulty;
import org.example.lingua.entity.QuestionType;

import java.util.List;

public record GeneratedQuestion(
        String question,
        QuestionType type,
        String correctAnswer,
        List<String> options,
        String context,
        Difficulty difficulty,
        String wordId
) {
}
