package org.example.lingua.model;

/**
 * Per-word answer counts from one quiz submission.
 */
public record WordTally(int correct, int total) {

    public double averageCorrectness() {
        return total > 0 ? (double) correct / total : 0.0;
    }
}
