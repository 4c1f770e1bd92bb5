package org.example.lingua.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.lingua.service.llm.GeminiLlmProvider;
import org.example.lingua.service.llm.LlmProvider;
import org.example.lingua.service.llm.OllamaLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the generation backend.
 */
@Configuration
public class LlmProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfig.class);

    @Value("${ai.generation.provider:gemini}")
    private String provider;

    @Value("${ai.generation.timeout-seconds:60}")
    private int timeoutSeconds;

    @Value("${ai.generation.gemini.base-url:https://generativelanguage.googleapis.com}")
    private String geminiBaseUrl;

    @Value("${ai.generation.gemini.api-key:}")
    private String geminiApiKey;

    @Value("${ai.generation.gemini.model:gemini-2.0-flash}")
    private String geminiModel;

    @Value("${ai.generation.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${ai.generation.ollama.model:llama3.1:latest}")
    private String ollamaModel;

    @Bean
    public LlmProvider generationLlmProvider(ObjectMapper objectMapper) {
        log.info("Configuring generation provider: {}", provider);
        return switch (provider.toLowerCase()) {
            case "ollama" -> new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds, objectMapper);
            case "gemini" -> {
                if (geminiApiKey == null || geminiApiKey.isBlank()) {
                    log.warn("Gemini API key not configured, generation calls will fail until ai.generation.gemini.api-key is set");
                }
                yield new GeminiLlmProvider(geminiBaseUrl, geminiApiKey, geminiModel, timeoutSeconds, objectMapper);
            }
            default -> {
                log.warn("Unknown provider type '{}', falling back to Ollama", provider);
                yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds, objectMapper);
            }
        };
    }
}
