package org.example.lingua.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.lingua.config.RequestCorrelation;
import org.example.lingua.model.AiVocabularyListRequest;
import org.example.lingua.service.VocabularyAiService;
import org.example.lingua.service.resilience.GenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/vocabulary")
public class VocabularyAiController {

    private static final Logger log = LoggerFactory.getLogger(VocabularyAiController.class);

    private final VocabularyAiService vocabularyAiService;

    public VocabularyAiController(VocabularyAiService vocabularyAiService) {
        this.vocabularyAiService = vocabularyAiService;
    }

    @PostMapping("/{listId}/sentences")
    public ResponseEntity<Object> generateSentences(
            @RequestHeader(RequestCorrelation.USER_HEADER_NAME) String userId,
            @PathVariable String listId,
            HttpServletRequest request) {
        try {
            return vocabularyAiService.generateSentences(listId, userId)
                    .<ResponseEntity<Object>>map(ResponseEntity::ok)
                    .orElseGet(() -> ApiErrors.of(HttpStatus.NOT_FOUND, "Vocabulary list not found", request));
        } catch (IllegalStateException e) {
            return ApiErrors.of(HttpStatus.BAD_REQUEST, e.getMessage(), request);
        } catch (GenerationException e) {
            log.error("Sentence generation failed for list {} ({})", listId, e.getKind(), e);
            return ApiErrors.generationFailed(e, request);
        }
    }

    @PostMapping("/generate-ai-list")
    public ResponseEntity<Object> generateAiList(
            @RequestHeader(RequestCorrelation.USER_HEADER_NAME) String userId,
            @RequestBody AiVocabularyListRequest body,
            HttpServletRequest request) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(vocabularyAiService.generateAiList(body, userId));
        } catch (IllegalArgumentException e) {
            return ApiErrors.of(HttpStatus.BAD_REQUEST, e.getMessage(), request);
        }
    }

    @PostMapping("/analyze-complexity")
    public ResponseEntity<Object> analyzeComplexity(
            @RequestBody ComplexityRequest body,
            HttpServletRequest request) {
        if (body == null) {
            return ApiErrors.of(HttpStatus.BAD_REQUEST, "request body is required", request);
        }
        try {
            return ResponseEntity.ok(vocabularyAiService.analyzeComplexity(body.text(), body.targetLanguage()));
        } catch (IllegalArgumentException e) {
            return ApiErrors.of(HttpStatus.BAD_REQUEST, e.getMessage(), request);
        }
    }

    public record ComplexityRequest(String text, String targetLanguage) {
    }
}
