package org.example.lingua.service.generation;

import java.util.List;

public record ContextualSentences(String wordId, List<String> sentences) {
}
