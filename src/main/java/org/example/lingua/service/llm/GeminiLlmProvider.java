package org.example.lingua.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Provider backed by the Gemini {@code generateContent} REST API.
 */
public class GeminiLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(GeminiLlmProvider.class);

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper;

    public GeminiLlmProvider(String baseUrl, String apiKey, String model, int timeoutSeconds, ObjectMapper objectMapper) {
        this.apiKey = apiKey;
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
        this.objectMapper = objectMapper;
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("x-goog-api-key", apiKey == null ? "" : apiKey)
                .build();
        log.info("Gemini provider initialized: model={}", model);
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode contents = payload.putArray("contents");
        ObjectNode user = contents.addObject();
        user.put("role", "user");
        user.putArray("parts").addObject().put("text", prompt);

        ObjectNode generationConfig = payload.putObject("generationConfig");
        generationConfig.put("temperature", options.temperature());
        if (options.topP() != null) {
            generationConfig.put("topP", options.topP());
        }
        if (options.maxTokens() != null) {
            generationConfig.put("maxOutputTokens", options.maxTokens());
        }

        try {
            String response = webClient.post()
                    .uri("/v1beta/models/{model}:generateContent", model)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            String text = extractText(objectMapper.readTree(response));
            if (text == null) {
                throw new LlmProviderException("Invalid response format from Gemini API");
            }
            return text;

        } catch (WebClientResponseException e) {
            log.error("Gemini API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new LlmProviderException("Gemini API error: " + e.getStatusCode(), e.getStatusCode().value(), e);
        } catch (LlmProviderException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to generate response from Gemini", e);
            throw new LlmProviderException("Failed to generate response from Gemini", e);
        }
    }

    /**
     * Concatenates the text parts of the first candidate, or returns null when the
     * response carries none.
     */
    static String extractText(JsonNode response) {
        if (response == null) {
            return null;
        }
        JsonNode parts = response.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        boolean found = false;
        for (JsonNode part : parts) {
            JsonNode value = part.get("text");
            if (value != null && value.isTextual()) {
                text.append(value.asText());
                found = true;
            }
        }
        return found ? text.toString() : null;
    }

    @Override
    public boolean isAvailable() {
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("Gemini not available: API key not configured");
            return false;
        }
        return true;
    }

    @Override
    public String getProviderName() {
        return "gemini";
    }
}
