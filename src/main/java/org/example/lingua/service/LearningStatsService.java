package org.example.lingua.service;

import org.example.lingua.entity.LearningStatsEntity;
import org.example.lingua.repository.LearningStatsRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Maintains the per-user daily activity counters.
 */
@Service
public class LearningStatsService {

    private final LearningStatsRepository learningStatsRepository;
    private final Clock clock;

    public LearningStatsService(LearningStatsRepository learningStatsRepository, Clock clock) {
        this.learningStatsRepository = learningStatsRepository;
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Adds to today's counters, creating the row on the day's first activity.
     * Runs in its own transaction; a concurrent first insert surfaces as
     * {@link org.springframework.dao.DataIntegrityViolationException} and the call can
     * simply be repeated.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordActivity(String userId, int quizzesTaken, int wordsReviewed, int totalQuestions, int correctAnswers) {
        LocalDate day = today();
        LocalDateTime now = LocalDateTime.now(clock);
        int updated = learningStatsRepository.incrementCounters(
                userId, day, quizzesTaken, wordsReviewed, totalQuestions, correctAnswers, now);
        if (updated > 0) {
            return;
        }

        LearningStatsEntity stats = new LearningStatsEntity(userId, day);
        stats.setQuizzesTaken(quizzesTaken);
        stats.setWordsReviewed(wordsReviewed);
        stats.setTotalQuestions(totalQuestions);
        stats.setCorrectAnswers(correctAnswers);
        stats.setCreatedAt(now);
        stats.setUpdatedAt(now);
        learningStatsRepository.saveAndFlush(stats);
    }
}
