package org.example.lingua.service;

import org.example.lingua.entity.EntityIds;
import org.example.lingua.entity.QuizAnswerEntity;
import org.example.lingua.entity.QuizAttemptEntity;
import org.example.lingua.entity.QuizEntity;
import org.example.lingua.entity.QuizQuestionEntity;
import org.example.lingua.model.AnswerSubmission;
import org.example.lingua.model.ScoredAttempt;
import org.example.lingua.model.WordTally;
import org.example.lingua.repository.QuizAnswerRepository;
import org.example.lingua.repository.QuizAttemptRepository;
import org.example.lingua.repository.QuizQuestionRepository;
import org.example.lingua.repository.QuizRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class QuizScoringService {

    private static final Logger log = LoggerFactory.getLogger(QuizScoringService.class);

    private final QuizRepository quizRepository;
    private final QuizQuestionRepository quizQuestionRepository;
    private final QuizAttemptRepository quizAttemptRepository;
    private final QuizAnswerRepository quizAnswerRepository;
    private final MasteryService masteryService;
    private final LearningStatsService learningStatsService;
    private final Clock clock;

    // Self-injection so saveAttempt runs through the transactional proxy
    private QuizScoringService self;

    public QuizScoringService(
            QuizRepository quizRepository,
            QuizQuestionRepository quizQuestionRepository,
            QuizAttemptRepository quizAttemptRepository,
            QuizAnswerRepository quizAnswerRepository,
            MasteryService masteryService,
            LearningStatsService learningStatsService,
            Clock clock) {
        this.quizRepository = quizRepository;
        this.quizQuestionRepository = quizQuestionRepository;
        this.quizAttemptRepository = quizAttemptRepository;
        this.quizAnswerRepository = quizAnswerRepository;
        this.masteryService = masteryService;
        this.learningStatsService = learningStatsService;
        this.clock = clock;
    }

    @Autowired
    @Lazy
    public void setSelf(QuizScoringService self) {
        this.self = self;
    }

    /**
     * Scores a submission, updates word mastery and records the attempt.
     * <p>
     * No transaction spans the call: mastery updates run on their own threads and
     * connections, so only the attempt write is transactional.
     *
     * @return empty when the quiz does not exist or belongs to another user
     * @throws QuizQuestionNotFoundException if an answer references a question outside the quiz
     */
    public Optional<ScoredAttempt> submitQuizAnswers(String quizId, List<AnswerSubmission> answers, String userId) {
        if (!EntityIds.isValid(quizId)) {
            return Optional.empty();
        }
        if (answers == null) {
            throw new IllegalArgumentException("answers are required");
        }
        Optional<QuizEntity> quiz = quizRepository.findByIdAndUserId(quizId, userId);
        if (quiz.isEmpty()) {
            return Optional.empty();
        }

        List<QuizQuestionEntity> questions = quizQuestionRepository.findByQuizIdOrderByCreatedAtAsc(quizId);
        Map<String, QuizQuestionEntity> questionsById = questions.stream()
                .collect(Collectors.toMap(QuizQuestionEntity::getId, Function.identity(), (a, b) -> a));

        int correctAnswers = 0;
        List<ScoredAttempt.AnswerResult> results = new ArrayList<>();
        Map<String, WordTally> tallies = new LinkedHashMap<>();
        for (AnswerSubmission submission : answers) {
            QuizQuestionEntity question = submission == null ? null : questionsById.get(submission.questionId());
            if (question == null) {
                throw new QuizQuestionNotFoundException(submission == null ? null : submission.questionId());
            }
            String answer = submission.answer() == null ? "" : submission.answer();
            boolean correct = isCorrect(answer, question.getCorrectAnswer());
            if (correct) {
                correctAnswers++;
            }
            results.add(new ScoredAttempt.AnswerResult(question.getId(), answer, correct, question.getWordId()));

            String wordId = question.getWordId();
            if (EntityIds.isValid(wordId)) {
                WordTally previous = tallies.getOrDefault(wordId, new WordTally(0, 0));
                tallies.put(wordId, new WordTally(previous.correct() + (correct ? 1 : 0), previous.total() + 1));
            } else if (wordId != null) {
                log.warn("Question {} carries malformed word id {}, no mastery update", question.getId(), wordId);
            }
        }

        int wordsUpdated = masteryService.applyQuizResults(userId, tallies);

        int totalQuestions = questions.size();
        double score = totalQuestions > 0 ? (double) correctAnswers / totalQuestions : 0.0;

        QuizAttemptEntity savedAttempt = self.saveAttempt(quizId, userId, score, correctAnswers, totalQuestions, results);

        recordDailyStats(userId, tallies.size(), totalQuestions, correctAnswers);

        log.info("Quiz {} scored for user {}: {}/{} correct, {} words updated",
                quizId, userId, correctAnswers, totalQuestions, wordsUpdated);
        return Optional.of(new ScoredAttempt(
                savedAttempt.getId(),
                quizId,
                score,
                true,
                correctAnswers,
                totalQuestions,
                wordsUpdated,
                results
        ));
    }

    /**
     * Stores an attempt together with its answers.
     */
    @Transactional
    public QuizAttemptEntity saveAttempt(
            String quizId,
            String userId,
            double score,
            int correctAnswers,
            int totalQuestions,
            List<ScoredAttempt.AnswerResult> results) {
        QuizAttemptEntity attempt = new QuizAttemptEntity();
        attempt.setQuizId(quizId);
        attempt.setUserId(userId);
        attempt.setScore(score);
        attempt.setCorrectAnswers(correctAnswers);
        attempt.setTotalQuestions(totalQuestions);
        attempt.setCompleted(true);
        attempt.setCreatedAt(LocalDateTime.now(clock));
        QuizAttemptEntity savedAttempt = quizAttemptRepository.save(attempt);

        List<QuizAnswerEntity> answerEntities = results.stream()
                .map(result -> {
                    QuizAnswerEntity entity = new QuizAnswerEntity(
                            savedAttempt, result.questionId(), result.answer(), result.correct());
                    entity.setUserId(userId);
                    entity.setCreatedAt(savedAttempt.getCreatedAt());
                    return entity;
                })
                .toList();
        quizAnswerRepository.saveAll(answerEntities);
        return savedAttempt;
    }

    static boolean isCorrect(String answer, String correctAnswer) {
        if (answer == null || correctAnswer == null) {
            return false;
        }
        return normalize(answer).equals(normalize(correctAnswer));
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private void recordDailyStats(String userId, int wordsReviewed, int totalQuestions, int correctAnswers) {
        try {
            learningStatsService.recordActivity(userId, 1, wordsReviewed, totalQuestions, correctAnswers);
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent first activity of the day for user {}, retrying stats update", userId);
            learningStatsService.recordActivity(userId, 1, wordsReviewed, totalQuestions, correctAnswers);
        }
    }
}
