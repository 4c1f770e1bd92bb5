package org.example.lingua.service.generation;

import org.example.lingua.entity.Difficulty;

public record VocabularyEntry(String word, String translation, String partOfSpeech, Difficulty difficulty) {
}
