package org.example.lingua.model;

import org.example.lingua.entity.Difficulty;

import java.time.LocalDateTime;
import java.util.List;

public record Recommendations(
        List<String> focusAreas,
        List<RecommendedWord> recommendedWords,
        String studyPlan,
        int estimatedTime,
        AdaptiveDifficulty adaptiveDifficulty
) {
    public record RecommendedWord(
            String id,
            String word,
            String translation,
            Difficulty difficulty
    ) {
    }

    public record AdaptiveDifficulty(
            Difficulty recommendedDifficulty,
            double confidence,
            LocalDateTime nextReviewDate
    ) {
    }
}
