package org.example.lingua.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Difficulty {
    EASY,
    MEDIUM,
    HARD;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Difficulty> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (Difficulty difficulty : values()) {
            if (difficulty.wireValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(difficulty);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Difficulty fromWire(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown difficulty: " + value));
    }
}
