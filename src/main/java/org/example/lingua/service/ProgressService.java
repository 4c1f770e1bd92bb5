package org.example.lingua.service;

import org.example.lingua.entity.Difficulty;
import org.example.lingua.entity.EntityIds;
import org.example.lingua.entity.LearningStatsEntity;
import org.example.lingua.entity.QuizAttemptEntity;
import org.example.lingua.entity.WordEntity;
import org.example.lingua.entity.WordProgressEntity;
import org.example.lingua.model.AttemptSummary;
import org.example.lingua.model.ProgressSummary;
import org.example.lingua.model.Recommendations;
import org.example.lingua.repository.LearningStatsRepository;
import org.example.lingua.repository.QuizAnswerRepository;
import org.example.lingua.repository.QuizAttemptRepository;
import org.example.lingua.repository.WordProgressRepository;
import org.example.lingua.repository.WordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Dashboard statistics and study recommendations.
 */
@Service
public class ProgressService {

    private static final Logger log = LoggerFactory.getLogger(ProgressService.class);

    static final double WEAK_WORD_MASTERY = 0.6;
    static final double PRACTICE_SCORE_THRESHOLD = 0.7;
    static final double DEFAULT_RECENT_SCORE = 0.5;
    static final int CONSISTENCY_STREAK = 2;
    static final int MINUTES_PER_FOCUS_AREA = 15;
    // Streak length treated as full success when estimating difficulty.
    private static final int FULL_STREAK = 5;
    private static final int MAX_REVIEW_SPACING_DAYS = 30;

    private final WordProgressRepository wordProgressRepository;
    private final WordRepository wordRepository;
    private final QuizAttemptRepository quizAttemptRepository;
    private final QuizAnswerRepository quizAnswerRepository;
    private final LearningStatsRepository learningStatsRepository;
    private final StreakCalculator streakCalculator;
    private final Clock clock;

    public ProgressService(
            WordProgressRepository wordProgressRepository,
            WordRepository wordRepository,
            QuizAttemptRepository quizAttemptRepository,
            QuizAnswerRepository quizAnswerRepository,
            LearningStatsRepository learningStatsRepository,
            StreakCalculator streakCalculator,
            Clock clock) {
        this.wordProgressRepository = wordProgressRepository;
        this.wordRepository = wordRepository;
        this.quizAttemptRepository = quizAttemptRepository;
        this.quizAnswerRepository = quizAnswerRepository;
        this.learningStatsRepository = learningStatsRepository;
        this.streakCalculator = streakCalculator;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public ProgressSummary getProgressSummary(String userId) {
        List<LearningStatsEntity> learningStats = learningStatsRepository.findTop30ByUserIdOrderByStatDateDesc(userId);
        List<WordProgressEntity> wordProgress = wordProgressRepository.findWithWordByUserIdOrderByLastReviewedDesc(userId);
        List<QuizAttemptEntity> recentAttempts = quizAttemptRepository.findTop10ByUserIdOrderByCreatedAtDesc(userId);
        long totalQuizzesTaken = quizAttemptRepository.countByUserId(userId);

        int masteredWords = 0;
        int needsReview = 0;
        int maxWordStreak = 0;
        for (WordProgressEntity progress : wordProgress) {
            if (progress.getMastery() >= 1.0) {
                masteredWords++;
            } else {
                needsReview++;
            }
            maxWordStreak = Math.max(maxWordStreak, progress.getStreak());
        }
        double avgScore = recentAttempts.stream()
                .mapToDouble(QuizAttemptEntity::getScore)
                .average()
                .orElse(0.0);

        ProgressSummary.Summary summary = new ProgressSummary.Summary(
                wordProgress.size(),
                masteredWords,
                needsReview,
                calculateStreak(userId),
                maxWordStreak,
                totalQuizzesTaken,
                avgScore
        );

        return new ProgressSummary(
                summary,
                learningStats.stream()
                        .map(stats -> new ProgressSummary.DailyStats(
                                stats.getStatDate(),
                                stats.getQuizzesTaken(),
                                stats.getWordsReviewed(),
                                stats.getTotalQuestions(),
                                stats.getCorrectAnswers()
                        ))
                        .toList(),
                wordProgress.stream().map(this::toView).toList(),
                recentAttempts.stream().map(QuizGenerationService::toSummary).toList()
        );
    }

    /**
     * Current daily learning streak in UTC days, from the last year of activity.
     */
    @Transactional(readOnly = true)
    public int calculateStreak(String userId) {
        List<LocalDate> activityDates = learningStatsRepository.findTop365ByUserIdOrderByStatDateDesc(userId).stream()
                .map(LearningStatsEntity::getStatDate)
                .toList();
        return streakCalculator.calculateStreak(activityDates, LocalDate.now(clock));
    }

    /**
     * Never fails: any unexpected error yields a generic practice recommendation.
     * Not transactional; each repository read runs in its own transaction.
     */
    public Recommendations getRecommendations(String userId) {
        try {
            return buildRecommendations(userId);
        } catch (RuntimeException e) {
            log.error("Failed to build recommendations for user {}", userId, e);
            return new Recommendations(
                    List.of("general_practice"),
                    List.of(),
                    "Continue with regular study routine",
                    20,
                    defaultAdaptiveDifficulty()
            );
        }
    }

    private Recommendations buildRecommendations(String userId) {
        List<WordProgressEntity> progress = wordProgressRepository.findByUserId(userId);

        List<String> attemptIds = quizAttemptRepository.findTop20ByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(QuizAttemptEntity::getId)
                .toList();
        double avgRecentScore = attemptIds.isEmpty()
                ? DEFAULT_RECENT_SCORE
                : quizAnswerRepository.findByAttemptIdIn(attemptIds).stream()
                        .mapToDouble(answer -> answer.isCorrect() ? 1.0 : 0.0)
                        .average()
                        .orElse(DEFAULT_RECENT_SCORE);

        List<String> weakWordIds = progress.stream()
                .filter(p -> p.getMastery() < WEAK_WORD_MASTERY)
                .map(p -> p.getWord().getId())
                .toList();

        List<String> focusAreas = new ArrayList<>();
        if (!weakWordIds.isEmpty()) {
            focusAreas.add("vocabulary_review");
        }
        if (avgRecentScore < PRACTICE_SCORE_THRESHOLD) {
            focusAreas.add("practice_questions");
        }
        if (progress.stream().anyMatch(p -> p.getStreak() < CONSISTENCY_STREAK)) {
            focusAreas.add("consistency_building");
        }

        String studyPlan = focusAreas.contains("vocabulary_review")
                ? "Focus on reviewing difficult words with contextual examples"
                : "Continue with regular practice and introduce new vocabulary";

        List<String> validIds = weakWordIds.stream().filter(EntityIds::isValid).toList();
        List<Recommendations.RecommendedWord> recommendedWords = validIds.isEmpty()
                ? List.of()
                : wordRepository.findAllById(validIds).stream()
                        .map(this::toRecommendedWord)
                        .toList();

        return new Recommendations(
                List.copyOf(focusAreas),
                recommendedWords,
                studyPlan,
                focusAreas.size() * MINUTES_PER_FOCUS_AREA,
                calculateAdaptiveDifficulty(progress)
        );
    }

    Recommendations.AdaptiveDifficulty calculateAdaptiveDifficulty(List<WordProgressEntity> progress) {
        if (progress.isEmpty()) {
            return defaultAdaptiveDifficulty();
        }
        double avgMastery = progress.stream().mapToDouble(WordProgressEntity::getMastery).average().orElse(0.0);
        double successRate = progress.stream().mapToInt(WordProgressEntity::getStreak).sum()
                / (double) (progress.size() * FULL_STREAK);
        double avgReviewCount = progress.stream().mapToInt(WordProgressEntity::getReviewCount).average().orElse(0.0);

        Difficulty difficulty;
        double confidence;
        if (avgMastery >= 0.8 && successRate >= 0.8) {
            difficulty = Difficulty.HARD;
            confidence = 0.9;
        } else if (avgMastery >= 0.6 && successRate >= 0.6) {
            difficulty = Difficulty.MEDIUM;
            confidence = 0.7;
        } else {
            difficulty = Difficulty.EASY;
            confidence = 0.8;
        }

        double spacingDays = Math.min(Math.pow(2, avgReviewCount), MAX_REVIEW_SPACING_DAYS);
        long spacingMinutes = Math.round(spacingDays * 24 * 60);
        return new Recommendations.AdaptiveDifficulty(
                difficulty,
                confidence,
                LocalDateTime.now(clock).plusMinutes(spacingMinutes)
        );
    }

    private Recommendations.AdaptiveDifficulty defaultAdaptiveDifficulty() {
        return new Recommendations.AdaptiveDifficulty(Difficulty.MEDIUM, 0.5, LocalDateTime.now(clock).plusDays(1));
    }

    private ProgressSummary.WordProgressView toView(WordProgressEntity progress) {
        WordEntity word = progress.getWord();
        return new ProgressSummary.WordProgressView(
                word.getId(),
                word.getWord(),
                word.getTranslation(),
                progress.getMastery(),
                progress.getStatus(),
                progress.getReviewCount(),
                progress.getStreak(),
                progress.getLastReviewed(),
                progress.getNextReview()
        );
    }

    private Recommendations.RecommendedWord toRecommendedWord(WordEntity word) {
        return new Recommendations.RecommendedWord(
                word.getId(),
                word.getWord(),
                word.getTranslation(),
                word.getDifficulty()
        );
    }
}
