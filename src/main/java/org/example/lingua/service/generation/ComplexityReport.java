package org.example.lingua.service.generation;

import org.example.lingua.entity.Difficulty;

import java.util.List;

public record ComplexityReport(Difficulty complexity, double score, List<String> suggestions) {

    public static ComplexityReport fallback() {
        return new ComplexityReport(Difficulty.MEDIUM, 0.5, List.of("Unable to analyze complexity"));
    }
}
