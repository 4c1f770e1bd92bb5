package org.example.lingua.service.llm;

/**
 * Options for generation requests.
 */
public record LlmOptions(
    double temperature,
    Double topP,        // nullable
    Integer maxTokens   // nullable
) {
    public static LlmOptions withTemperature(double temp) {
        return new LlmOptions(temp, null, null);
    }

    public static LlmOptions full(double temp, double topP, int maxTokens) {
        return new LlmOptions(temp, topP, maxTokens);
    }
}
