package org.example.lingua.service.generation;

/**
 * A word as embedded in generation prompts.
 */
public record VocabularyWord(String id, String word, String translation, String partOfSpeech) {
}
