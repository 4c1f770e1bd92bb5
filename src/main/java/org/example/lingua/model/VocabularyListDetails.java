package org.example.lingua.model;

import org.example.lingua.entity.Difficulty;

import java.util.List;

public record VocabularyListDetails(
        String id,
        String name,
        String description,
        String targetLanguage,
        String nativeLanguage,
        List<Word> words
) {
    public record Word(
            String id,
            String word,
            String translation,
            String partOfSpeech,
            Difficulty difficulty
    ) {
    }
}
