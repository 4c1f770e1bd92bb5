package org.example.lingua.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.lingua.config.RequestCorrelation;
import org.example.lingua.entity.Difficulty;
import org.example.lingua.model.AnswerSubmission;
import org.example.lingua.model.QuizGenerationOptions;
import org.example.lingua.model.QuizOverview;
import org.example.lingua.service.QuizGenerationService;
import org.example.lingua.service.QuizQuestionNotFoundException;
import org.example.lingua.service.QuizScoringService;
import org.example.lingua.service.resilience.GenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/quizzes")
public class QuizController {

    private static final Logger log = LoggerFactory.getLogger(QuizController.class);

    private final QuizGenerationService quizGenerationService;
    private final QuizScoringService quizScoringService;

    public QuizController(QuizGenerationService quizGenerationService, QuizScoringService quizScoringService) {
        this.quizGenerationService = quizGenerationService;
        this.quizScoringService = quizScoringService;
    }

    @PostMapping("/generate")
    public ResponseEntity<Object> generateQuiz(
            @RequestHeader(RequestCorrelation.USER_HEADER_NAME) String userId,
            @RequestBody GenerateQuizRequest body,
            HttpServletRequest request) {
        if (body == null || body.vocabularyListId() == null || body.vocabularyListId().isBlank()) {
            return ApiErrors.of(HttpStatus.BAD_REQUEST, "vocabularyListId is required", request);
        }
        Difficulty difficulty = null;
        if (body.difficulty() != null) {
            difficulty = Difficulty.parse(body.difficulty()).orElse(null);
            if (difficulty == null) {
                return ApiErrors.of(HttpStatus.BAD_REQUEST, "difficulty must be easy, medium or hard", request);
            }
        }

        try {
            return quizGenerationService.generateQuiz(
                            body.vocabularyListId(),
                            new QuizGenerationOptions(body.questionCount(), difficulty),
                            userId)
                    .<ResponseEntity<Object>>map(quiz -> ResponseEntity.status(HttpStatus.CREATED).body(quiz))
                    .orElseGet(() -> ApiErrors.of(HttpStatus.NOT_FOUND, "Vocabulary list not found", request));
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ApiErrors.of(HttpStatus.BAD_REQUEST, e.getMessage(), request);
        } catch (GenerationException e) {
            log.error("Quiz generation failed for list {} ({})", body.vocabularyListId(), e.getKind(), e);
            return ApiErrors.generationFailed(e, request);
        }
    }

    @GetMapping
    public List<QuizOverview> getUserQuizzes(@RequestHeader(RequestCorrelation.USER_HEADER_NAME) String userId) {
        return quizGenerationService.getUserQuizzes(userId);
    }

    @GetMapping("/{quizId}")
    public ResponseEntity<Object> getQuiz(
            @RequestHeader(RequestCorrelation.USER_HEADER_NAME) String userId,
            @PathVariable String quizId,
            HttpServletRequest request) {
        return quizGenerationService.getQuiz(quizId, userId)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ApiErrors.of(HttpStatus.NOT_FOUND, "Quiz not found", request));
    }

    @PostMapping("/{quizId}/submit")
    public ResponseEntity<Object> submitAnswers(
            @RequestHeader(RequestCorrelation.USER_HEADER_NAME) String userId,
            @PathVariable String quizId,
            @RequestBody SubmitAnswersRequest body,
            HttpServletRequest request) {
        if (body == null || body.answers() == null) {
            return ApiErrors.of(HttpStatus.BAD_REQUEST, "answers are required", request);
        }
        try {
            return quizScoringService.submitQuizAnswers(quizId, body.answers(), userId)
                    .<ResponseEntity<Object>>map(ResponseEntity::ok)
                    .orElseGet(() -> ApiErrors.of(HttpStatus.NOT_FOUND, "Quiz not found", request));
        } catch (QuizQuestionNotFoundException e) {
            log.warn("Submission for quiz {} referenced unknown question {}", quizId, e.getQuestionId());
            return ApiErrors.of(HttpStatus.NOT_FOUND, e.getMessage(), request);
        } catch (IllegalArgumentException e) {
            return ApiErrors.of(HttpStatus.BAD_REQUEST, e.getMessage(), request);
        }
    }

    @GetMapping("/{quizId}/results")
    public ResponseEntity<Object> getResults(
            @RequestHeader(RequestCorrelation.USER_HEADER_NAME) String userId,
            @PathVariable String quizId,
            HttpServletRequest request) {
        return quizGenerationService.getQuizResults(quizId, userId)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ApiErrors.of(HttpStatus.NOT_FOUND, "Quiz not found", request));
    }

    public record GenerateQuizRequest(String vocabularyListId, Integer questionCount, String difficulty) {
    }

    public record SubmitAnswersRequest(List<AnswerSubmission> answers) {
    }
}
