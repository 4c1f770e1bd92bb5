package org.example.lingua.service;

import org.example.lingua.entity.EntityIds;
import org.example.lingua.entity.WordEntity;
import org.example.lingua.entity.WordProgressEntity;
import org.example.lingua.entity.WordStatus;
import org.example.lingua.model.WordTally;
import org.example.lingua.repository.WordProgressRepository;
import org.example.lingua.repository.WordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Turns per-word quiz tallies into mastery, streak and review schedule updates.
 * <p>
 * Words of one submission are updated concurrently on the mastery executor with no
 * transaction spanning the batch. Updates to the same (user, word) pair are serialized
 * through a striped lock; an insert that loses a race against another insert is
 * retried as an update.
 */
@Service
public class MasteryService {

    private static final Logger log = LoggerFactory.getLogger(MasteryService.class);

    static final double CORRECT_THRESHOLD = 0.5;
    static final double MASTERY_GAIN = 0.05;
    static final double MASTERY_PENALTY = 0.2;
    private static final int LOCK_STRIPES = 64;
    private static final int MAX_UPSERT_ATTEMPTS = 2;

    private final WordRepository wordRepository;
    private final WordProgressRepository wordProgressRepository;
    private final ExecutorService executor;
    private final Clock clock;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public MasteryService(
            WordRepository wordRepository,
            WordProgressRepository wordProgressRepository,
            @Qualifier("masteryUpdateExecutor") ExecutorService executor,
            Clock clock) {
        this.wordRepository = wordRepository;
        this.wordProgressRepository = wordProgressRepository;
        this.executor = executor;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    /**
     * Applies one submission's tallies and waits for every word to finish.
     *
     * @return number of words whose progress was written
     */
    public int applyQuizResults(String userId, Map<String, WordTally> tallies) {
        if (tallies == null || tallies.isEmpty()) {
            return 0;
        }

        List<CompletableFuture<Boolean>> updates = new ArrayList<>();
        for (Map.Entry<String, WordTally> entry : tallies.entrySet()) {
            String wordId = entry.getKey();
            if (!EntityIds.isValid(wordId)) {
                log.warn("Skipping progress update for malformed word id: {}", wordId);
                continue;
            }
            WordTally tally = entry.getValue();
            updates.add(CompletableFuture.supplyAsync(() -> updateWord(userId, wordId, tally), executor));
        }

        try {
            CompletableFuture.allOf(updates.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw e;
        }
        return (int) updates.stream().filter(CompletableFuture::join).count();
    }

    private boolean updateWord(String userId, String wordId, WordTally tally) {
        synchronized (lockFor(userId, wordId)) {
            Optional<WordEntity> word = wordRepository.findById(wordId);
            if (word.isEmpty()) {
                log.warn("Skipping progress update for non-existent word: {}", wordId);
                return false;
            }

            for (int attempt = 1; ; attempt++) {
                try {
                    upsert(userId, word.get(), tally);
                    return true;
                } catch (DataIntegrityViolationException e) {
                    if (attempt >= MAX_UPSERT_ATTEMPTS) {
                        throw e;
                    }
                    log.debug("Concurrent progress insert for user {} word {}, retrying as update", userId, wordId);
                }
            }
        }
    }

    private void upsert(String userId, WordEntity word, WordTally tally) {
        LocalDateTime now = LocalDateTime.now(clock);
        double average = tally.averageCorrectness();
        boolean correct = average >= CORRECT_THRESHOLD;

        WordProgressEntity progress = wordProgressRepository.findByUserIdAndWordId(userId, word.getId())
                .orElse(null);
        double mastery;
        if (progress != null) {
            progress.setReviewCount(progress.getReviewCount() + tally.total());
            progress.setStreak(correct ? progress.getStreak() + 1 : 0);
            mastery = nextMastery(progress.getMastery(), average);
        } else {
            progress = new WordProgressEntity(userId, word);
            progress.setReviewCount(tally.total());
            progress.setStreak(correct ? 1 : 0);
            mastery = roundMastery(average);
        }

        progress.setMastery(mastery);
        progress.setStatus(WordStatus.forMastery(mastery));
        progress.setLastReviewed(now);
        progress.setNextReview(now.plusDays(reviewIntervalDays(mastery)));
        progress.setUpdatedAt(now);
        wordProgressRepository.saveAndFlush(progress);
    }

    private Object lockFor(String userId, String wordId) {
        int hash = (userId + ":" + wordId).hashCode();
        return locks[Math.floorMod(hash, LOCK_STRIPES)];
    }

    static double nextMastery(double current, double averageCorrectness) {
        double next = averageCorrectness > CORRECT_THRESHOLD
                ? Math.min(1.0, current + MASTERY_GAIN)
                : Math.max(0.0, current - MASTERY_PENALTY);
        return roundMastery(next);
    }

    static double roundMastery(double mastery) {
        double rounded = Math.round(mastery * 100.0) / 100.0;
        return Math.max(0.0, Math.min(1.0, rounded));
    }

    // Caps at one day for any mastery >= 1/7.
    static int reviewIntervalDays(double mastery) {
        return Math.min(1, (int) Math.floor(mastery * 7));
    }
}
