package org.example.lingua.service;

import org.example.lingua.entity.LearningStatsEntity;
import org.example.lingua.repository.LearningStatsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LearningStatsServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T23:30:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);
    private static final LocalDateTime NOW_LOCAL = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private LearningStatsRepository learningStatsRepository;

    private LearningStatsService service;

    @BeforeEach
    void setUp() {
        service = new LearningStatsService(learningStatsRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void recordActivity_incrementsExistingDay() {
        when(learningStatsRepository.incrementCounters("learner-1", TODAY, 1, 3, 5, 4, NOW_LOCAL)).thenReturn(1);

        service.recordActivity("learner-1", 1, 3, 5, 4);

        verify(learningStatsRepository, never()).saveAndFlush(any(LearningStatsEntity.class));
    }

    @Test
    void recordActivity_insertsFirstActivityOfTheDay() {
        when(learningStatsRepository.incrementCounters("learner-1", TODAY, 1, 3, 5, 4, NOW_LOCAL)).thenReturn(0);

        service.recordActivity("learner-1", 1, 3, 5, 4);

        ArgumentCaptor<LearningStatsEntity> captor = ArgumentCaptor.forClass(LearningStatsEntity.class);
        verify(learningStatsRepository).saveAndFlush(captor.capture());
        LearningStatsEntity saved = captor.getValue();
        assertEquals("learner-1", saved.getUserId());
        assertEquals(TODAY, saved.getStatDate());
        assertEquals(1, saved.getQuizzesTaken());
        assertEquals(3, saved.getWordsReviewed());
        assertEquals(5, saved.getTotalQuestions());
        assertEquals(4, saved.getCorrectAnswers());
    }

    @Test
    void today_usesUtcCalendarDay() {
        assertEquals(TODAY, service.today());
    }
}
