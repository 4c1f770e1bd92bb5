package org.example.lingua.service.llm;

/**
 * Abstraction for generative text backends (Gemini, Ollama).
 */
public interface LlmProvider {

    /**
     * Generate a response from the backend.
     *
     * @param prompt the prompt to send
     * @param options generation options (temperature, etc.)
     * @return the generated text response
     * @throws LlmProviderException when the backend call fails
     */
    String generate(String prompt, LlmOptions options);

    /**
     * Check if this provider is available and properly configured.
     *
     * @return true if the provider can accept requests
     */
    boolean isAvailable();

    /**
     * Get the name of this provider for logging.
     *
     * @return provider name (e.g., "gemini", "ollama")
     */
    String getProviderName();
}
