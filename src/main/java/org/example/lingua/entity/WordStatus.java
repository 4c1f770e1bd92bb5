package org.example.lingua.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum WordStatus {
    NOT_STARTED,
    LEARNING,
    MASTERED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WordStatus forMastery(double mastery) {
        return mastery < 1.0 ? LEARNING : MASTERED;
    }
}
