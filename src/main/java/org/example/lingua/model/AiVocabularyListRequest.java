package org.example.lingua.model;

public record AiVocabularyListRequest(
        String name,
        String description,
        String targetLanguage,
        String nativeLanguage,
        String prompt,
        Integer wordCount
) {
}
