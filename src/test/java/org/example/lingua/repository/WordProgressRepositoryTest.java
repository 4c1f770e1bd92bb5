package org.example.lingua.repository;

import org.example.lingua.entity.VocabularyListEntity;
import org.example.lingua.entity.WordEntity;
import org.example.lingua.entity.WordProgressEntity;
import org.example.lingua.entity.WordStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
class WordProgressRepositoryTest {

    @Autowired
    private VocabularyListRepository vocabularyListRepository;

    @Autowired
    private WordRepository wordRepository;

    @Autowired
    private WordProgressRepository wordProgressRepository;

    @Test
    void findWithWord_ordersByLastReviewedAndScopesToUser() {
        VocabularyListEntity list = vocabularyListRepository.save(
                new VocabularyListEntity("Animals", "es", "en", "learner-1"));
        WordEntity gato = wordRepository.save(new WordEntity(list, "gato", "cat"));
        WordEntity perro = wordRepository.save(new WordEntity(list, "perro", "dog"));
        wordProgressRepository.saveAndFlush(progress("learner-1", gato, LocalDateTime.of(2026, 3, 1, 10, 0)));
        wordProgressRepository.saveAndFlush(progress("learner-1", perro, LocalDateTime.of(2026, 3, 5, 10, 0)));
        wordProgressRepository.saveAndFlush(progress("learner-2", gato, LocalDateTime.of(2026, 3, 9, 10, 0)));

        List<WordProgressEntity> progress = wordProgressRepository.findWithWordByUserIdOrderByLastReviewedDesc("learner-1");

        assertEquals(2, progress.size());
        assertEquals("perro", progress.get(0).getWord().getWord());
        assertEquals("gato", progress.get(1).getWord().getWord());
        assertTrue(wordProgressRepository.findByUserIdAndWordId("learner-2", gato.getId()).isPresent());
        assertTrue(wordProgressRepository.findByUserIdAndWordId("learner-2", perro.getId()).isEmpty());
    }

    @Test
    void uniqueConstraint_rejectsDuplicateUserWordPair() {
        VocabularyListEntity list = vocabularyListRepository.save(
                new VocabularyListEntity("Animals", "es", "en", "learner-1"));
        WordEntity gato = wordRepository.save(new WordEntity(list, "gato", "cat"));
        wordProgressRepository.saveAndFlush(progress("learner-1", gato, LocalDateTime.of(2026, 3, 1, 10, 0)));

        assertThrows(DataIntegrityViolationException.class, () -> wordProgressRepository.saveAndFlush(
                progress("learner-1", gato, LocalDateTime.of(2026, 3, 2, 10, 0))));
    }

    private static WordProgressEntity progress(String userId, WordEntity word, LocalDateTime lastReviewed) {
        WordProgressEntity progress = new WordProgressEntity(userId, word);
        progress.setMastery(0.5);
        progress.setStatus(WordStatus.LEARNING);
        progress.setReviewCount(1);
        progress.setLastReviewed(lastReviewed);
        return progress;
    }
}
