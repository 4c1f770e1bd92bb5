package org.example.lingua.model;

import org.example.lingua.entity.Difficulty;

/**
 * Optional knobs for quiz generation; null fields take their defaults.
 */
public record QuizGenerationOptions(Integer questionCount, Difficulty difficulty) {
}
