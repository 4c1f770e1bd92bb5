package org.example.lingua.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Provider backed by a local Ollama server ({@code /api/generate}). Only reported as
 * available when the configured model has been pulled.
 */
public class OllamaLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaLlmProvider.class);

    private static final Duration AVAILABILITY_TIMEOUT = Duration.ofSeconds(2);

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper;

    public OllamaLlmProvider(String baseUrl, String model, int timeoutSeconds, ObjectMapper objectMapper) {
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .build();
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
        this.objectMapper = objectMapper;
        log.info("Ollama provider initialized: baseUrl={}, model={}", baseUrl, model);
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", model);
        payload.put("prompt", prompt);
        payload.put("stream", false);
        ObjectNode sampling = payload.putObject("options");
        sampling.put("temperature", options.temperature());
        if (options.topP() != null) {
            sampling.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            sampling.put("num_predict", options.maxTokens());
        }

        try {
            String body = webClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
            return extractText(objectMapper.readTree(body));

        } catch (WebClientResponseException e) {
            log.error("Ollama API error for model {}: {} - {}", model, e.getStatusCode(), e.getResponseBodyAsString());
            throw new LlmProviderException("Ollama API error: " + e.getStatusCode(), e.getStatusCode().value(), e);
        } catch (LlmProviderException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to generate response from Ollama model {}", model, e);
            throw new LlmProviderException("Failed to generate response from Ollama", e);
        }
    }

    /**
     * Pulls the completion out of a non-streaming {@code /api/generate} body. Ollama
     * reports model failures as an {@code error} field, sometimes with a 200 status.
     *
     * @throws LlmProviderException when the body carries an error or no completion
     */
    static String extractText(JsonNode body) {
        if (body == null) {
            throw new LlmProviderException("Empty response from Ollama");
        }
        JsonNode error = body.get("error");
        if (error != null && error.isTextual()) {
            throw new LlmProviderException("Ollama error: " + error.asText());
        }
        JsonNode text = body.get("response");
        if (text == null || !text.isTextual()) {
            throw new LlmProviderException("Invalid response format from Ollama");
        }
        return text.asText();
    }

    /**
     * Whether a {@code /api/tags} listing contains the model. A model configured
     * without a tag matches its {@code :latest} variant.
     */
    static boolean hasModel(JsonNode tags, String model) {
        if (tags == null || model == null) {
            return false;
        }
        String wanted = model.contains(":") ? model : model + ":latest";
        for (JsonNode entry : tags.path("models")) {
            String name = entry.path("name").asText("");
            if (name.equals(model) || name.equals(wanted)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean isAvailable() {
        try {
            String tags = webClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(AVAILABILITY_TIMEOUT);
            boolean available = hasModel(objectMapper.readTree(tags), model);
            if (!available) {
                log.debug("Ollama reachable but model {} is not pulled", model);
            }
            return available;
        } catch (Exception e) {
            log.debug("Ollama not available: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getProviderName() {
        return "ollama";
    }
}
