package org.example.lingua.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum QuestionType {
    MULTIPLE_CHOICE,
    FILL_BLANK,
    SENTENCE_COMPLETION;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<QuestionType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (QuestionType type : values()) {
            if (type.wireValue().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static QuestionType fromWire(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown question type: " + value));
    }
}
